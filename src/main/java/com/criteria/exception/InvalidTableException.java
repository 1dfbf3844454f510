package com.criteria.exception;

/**
 * Exception thrown when the target table name is missing or blank.
 */
public class InvalidTableException extends SqlCompilationException {

    public InvalidTableException(String message) {
        super(message);
    }

    public InvalidTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
