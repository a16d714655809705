package com.phillippitts.bbdetector.exception;

/**
 * Thrown when a reference template image cannot be read or decoded.
 */
public class TemplateLoadException extends BbDetectorException {

    private final String location;

    public TemplateLoadException(String location, String reason) {
        super("Cannot load template from " + location + ": " + reason);
        this.location = location;
    }

    public TemplateLoadException(String location, Throwable cause) {
        super("Cannot load template from " + location + ": " + cause.getMessage(), cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
