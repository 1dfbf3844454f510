package com.criteria.exception;

/**
 * Exception thrown when a rule names an operator token outside the fixed token table.
 * No partial criteria is returned.
 */
public class UnknownOperatorTokenException extends CriteriaException {

    public UnknownOperatorTokenException(String message) {
        super(message);
    }

    public UnknownOperatorTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
