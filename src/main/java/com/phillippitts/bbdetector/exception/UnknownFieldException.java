package com.phillippitts.bbdetector.exception;

/**
 * Thrown when a caller reads or writes a session field that does not exist.
 * This always indicates a caller bug, never a runtime condition.
 */
public class UnknownFieldException extends BbDetectorException {

    private final String fieldName;

    public UnknownFieldException(String fieldName) {
        super("Unknown session field: " + fieldName);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
