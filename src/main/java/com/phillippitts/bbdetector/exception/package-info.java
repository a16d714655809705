/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.bbdetector.exception.BbDetectorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.bbdetector.exception.UnknownFieldException} - Thrown when a
 *       caller names a session field that does not exist</li>
 *   <li>{@link com.phillippitts.bbdetector.exception.TemplateLoadException} - Thrown when the
 *       reference template image cannot be read</li>
 *   <li>{@link com.phillippitts.bbdetector.exception.SyncProtocolException} - Thrown when an
 *       inbound sync message is malformed (caught inside the sync client)</li>
 * </ul>
 *
 * <p>Transient I/O problems (capture failures, dropped connections) are deliberately not part
 * of this hierarchy: they are logged and retried where they happen and never escape.
 *
 * @see com.phillippitts.bbdetector.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.bbdetector.exception;
