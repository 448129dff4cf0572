package com.phillippitts.callscribe.exception;

/**
 * Thrown when application properties are missing, malformed or unsafe.
 * Raised during context startup so the process never runs half-configured.
 */
public class InvalidConfigurationException extends CallScribeException {

    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
