package com.criteria.filter;

import com.criteria.exception.ValueShapeException;

import java.util.List;

/**
 * Value-shape checks shared by the evaluator and the SQL compiler.
 * A mismatch raises {@link ValueShapeException}; values are never coerced.
 */
public final class FilterValues {

    private FilterValues() {
    }

    /**
     * Check that the filter value fits its operator's arity.
     */
    public static void check(Filter filter) {
        switch (filter.operator().arity()) {
            case NONE -> {
            }
            case SCALAR -> scalar(filter);
            case PAIR -> pair(filter);
            case SEQUENCE -> sequence(filter);
        }
    }

    /**
     * Scalar value of a single-value filter.
     */
    public static Object scalar(Filter filter) {
        Object value = filter.value();
        if (value == null) {
            throw shapeError(filter, "a non-null value (use IS_NULL to match missing values)");
        }
        if (value instanceof List<?> || value instanceof Range) {
            throw shapeError(filter, "a single value, got " + value);
        }
        return value;
    }

    /**
     * Bounds of a BETWEEN/NOT_BETWEEN filter, given as a {@link Range} or a 2-element sequence.
     */
    public static Range pair(Filter filter) {
        Object value = filter.value();
        Range range = null;
        if (value instanceof Range r) {
            range = r;
        } else if (value instanceof List<?> list && list.size() == 2) {
            range = Range.of(list.get(0), list.get(1));
        }
        if (range == null || range.lower() == null || range.upper() == null) {
            throw shapeError(filter, "a 2-element list/tuple of non-null bounds, got " + value);
        }
        return range;
    }

    /**
     * Candidate values of an IN/NOT_IN filter.
     */
    public static List<?> sequence(Filter filter) {
        if (filter.value() instanceof List<?> list) {
            return list;
        }
        throw shapeError(filter, "a sequence of values, got " + filter.value());
    }

    private static ValueShapeException shapeError(Filter filter, String expected) {
        return new ValueShapeException(filter.operator() + " operator on '" + filter.field()
                + "' requires " + expected);
    }
}
