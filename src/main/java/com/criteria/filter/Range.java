package com.criteria.filter;

/**
 * Ordered pair value for BETWEEN and NOT_BETWEEN.
 *
 * @param lower Inclusive lower bound
 * @param upper Inclusive upper bound
 */
public record Range(Object lower, Object upper) {

    public static Range of(Object lower, Object upper) {
        return new Range(lower, upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
