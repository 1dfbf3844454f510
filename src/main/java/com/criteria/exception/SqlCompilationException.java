package com.criteria.exception;

/**
 * Exception thrown when criteria cannot be compiled into a SQL query.
 */
public class SqlCompilationException extends CriteriaException {

    public SqlCompilationException(String message) {
        super(message);
    }

    public SqlCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
