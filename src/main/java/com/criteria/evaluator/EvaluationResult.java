package com.criteria.evaluator;

import java.util.List;

/**
 * Outcome of validating a record against criteria.
 *
 * @param valid    Whether the record satisfies the criteria
 * @param messages Messages of the filters that made the record invalid; empty when valid
 */
public record EvaluationResult(boolean valid, List<String> messages) {

    private static final EvaluationResult VALID = new EvaluationResult(true, List.of());

    public EvaluationResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static EvaluationResult success() {
        return VALID;
    }

    public static EvaluationResult invalid(List<String> messages) {
        return new EvaluationResult(false, messages);
    }
}
