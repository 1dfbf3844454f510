package com.criteria.exception;

/**
 * Exception thrown when the evaluator compares values of incompatible kinds,
 * e.g. a string field against a numeric bound.
 */
public class TypeMismatchException extends CriteriaException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
