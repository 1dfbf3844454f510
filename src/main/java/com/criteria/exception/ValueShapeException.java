package com.criteria.exception;

/**
 * Exception thrown when a filter value does not have the shape its operator expects,
 * e.g. BETWEEN given a scalar instead of a pair.
 */
public class ValueShapeException extends CriteriaException {

    public ValueShapeException(String message) {
        super(message);
    }

    public ValueShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
