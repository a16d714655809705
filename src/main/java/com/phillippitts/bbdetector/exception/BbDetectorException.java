package com.phillippitts.bbdetector.exception;

/**
 * Base exception for all bb-detector application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class BbDetectorException extends RuntimeException {

    public BbDetectorException(String message) {
        super(message);
    }

    public BbDetectorException(String message, Throwable cause) {
        super(message, cause);
    }

    public BbDetectorException(Throwable cause) {
        super(cause);
    }
}
