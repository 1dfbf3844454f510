package com.criteria.exception;

/**
 * Exception thrown when a rule document is malformed or cannot be read.
 */
public class ConfigurationException extends CriteriaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
