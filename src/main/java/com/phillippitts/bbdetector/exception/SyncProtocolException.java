package com.phillippitts.bbdetector.exception;

/**
 * Thrown when an inbound sync message cannot be parsed or has the wrong shape.
 * The sync client discards the offending message and keeps the connection open.
 */
public class SyncProtocolException extends BbDetectorException {

    public SyncProtocolException(String message) {
        super(message);
    }

    public SyncProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
