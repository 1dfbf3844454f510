package com.criteria.filter;

/**
 * Value shape an operator expects from its filter.
 */
public enum ValueArity {
    /**
     * No value (IS_NULL, IS_NOT_NULL). Any supplied value is ignored.
     */
    NONE,

    /**
     * A single scalar: string, number, boolean or other comparable.
     */
    SCALAR,

    /**
     * An ordered pair {@code [lower, upper]}.
     */
    PAIR,

    /**
     * A sequence of candidate values.
     */
    SEQUENCE
}
