package com.criteria.exception;

/**
 * Base exception for criteria building, evaluation and compilation.
 */
public class CriteriaException extends RuntimeException {

    public CriteriaException(String message) {
        super(message);
    }

    public CriteriaException(String message, Throwable cause) {
        super(message, cause);
    }
}
