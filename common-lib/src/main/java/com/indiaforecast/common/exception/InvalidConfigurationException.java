package com.indiaforecast.common.exception;

/** Raised while binding configuration; fatal at startup. */
public class InvalidConfigurationException extends RuntimeException {
    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
