package com.criteria.filter;

import com.criteria.exception.UnknownOperatorTokenException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalog of comparison and pattern operators.
 * <p>
 * Several operators render to the same SQL keyword (CONTAINS, STARTS_WITH, ENDS_WITH and LIKE
 * all use {@code LIKE}), so backends always switch on the constant, never on rendered text.
 */
public enum FilterOperator {
    // Comparison
    EQUAL("eq", ValueArity.SCALAR),
    NOT_EQUAL("ne", ValueArity.SCALAR),
    GREATER("gt", ValueArity.SCALAR),
    GREATER_OR_EQUAL("ge", ValueArity.SCALAR),
    LESS("lt", ValueArity.SCALAR),
    LESS_OR_EQUAL("le", ValueArity.SCALAR),

    // Pattern
    LIKE("like", ValueArity.SCALAR),
    NOT_LIKE("not_like", ValueArity.SCALAR),
    CONTAINS("contains", ValueArity.SCALAR),
    NOT_CONTAINS("not_contains", ValueArity.SCALAR),
    STARTS_WITH("starts_with", ValueArity.SCALAR),
    NOT_STARTS_WITH("not_starts_with", ValueArity.SCALAR),
    ENDS_WITH("ends_with", ValueArity.SCALAR),
    NOT_ENDS_WITH("not_ends_with", ValueArity.SCALAR),

    // Collection
    IN("in", ValueArity.SEQUENCE),
    NOT_IN("not_in", ValueArity.SEQUENCE),

    // Existence
    IS_NULL("is_null", ValueArity.NONE),
    IS_NOT_NULL("is_not_null", ValueArity.NONE),

    // Range
    BETWEEN("between", ValueArity.PAIR),
    NOT_BETWEEN("not_between", ValueArity.PAIR);

    private static final Map<String, FilterOperator> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FilterOperator::token, Function.identity()));

    private final String token;
    private final ValueArity arity;

    FilterOperator(String token, ValueArity arity) {
        this.token = token;
        this.arity = arity;
    }

    /**
     * Rule token for this operator (e.g. {@code "ge"} for GREATER_OR_EQUAL).
     */
    public String token() {
        return token;
    }

    /**
     * Value shape this operator expects.
     */
    public ValueArity arity() {
        return arity;
    }

    /**
     * Look up an operator by its rule token.
     *
     * @param token Rule token, matched case-sensitively
     * @return Matching operator
     * @throws UnknownOperatorTokenException if the token is not in the table
     */
    public static FilterOperator fromToken(String token) {
        FilterOperator operator = token == null ? null : BY_TOKEN.get(token);
        if (operator == null) {
            throw new UnknownOperatorTokenException("Unknown operator: " + token);
        }
        return operator;
    }
}
