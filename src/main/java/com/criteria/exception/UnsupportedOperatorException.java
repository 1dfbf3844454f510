package com.criteria.exception;

/**
 * Exception thrown when an operator has no evaluation or rendering rule.
 */
public class UnsupportedOperatorException extends CriteriaException {

    public UnsupportedOperatorException(String message) {
        super(message);
    }

    public UnsupportedOperatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
