package com.criteria.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * One leaf condition: field, operator and value.
 * <p>
 * Collections, object arrays and {@code int[]}/{@code long[]}/{@code double[]} values are copied
 * into an unmodifiable list, so a filter never changes after construction. Whether the value
 * shape fits the operator is checked by the backends through {@link FilterValues}.
 *
 * @param field    Logical field name
 * @param operator Comparison operator
 * @param value    Scalar, {@link Range}, sequence, or null for IS_NULL/IS_NOT_NULL
 * @param message  Optional human-readable message reported when the filter fails validation
 */
public record Filter(String field, FilterOperator operator, Object value, String message) {

    public Filter {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Filter field cannot be blank");
        }
        Objects.requireNonNull(operator, "Filter operator cannot be null");
        value = normalize(value);
    }

    public Filter(String field, FilterOperator operator, Object value) {
        this(field, operator, value, null);
    }

    /**
     * Copy of this filter carrying a validation message.
     */
    public Filter withMessage(String message) {
        return new Filter(field, operator, value, message);
    }

    public static Filter equal(String field, Object value) {
        return new Filter(field, FilterOperator.EQUAL, value);
    }

    public static Filter notEqual(String field, Object value) {
        return new Filter(field, FilterOperator.NOT_EQUAL, value);
    }

    public static Filter greater(String field, Object value) {
        return new Filter(field, FilterOperator.GREATER, value);
    }

    public static Filter less(String field, Object value) {
        return new Filter(field, FilterOperator.LESS, value);
    }

    public static Filter like(String field, String pattern) {
        return new Filter(field, FilterOperator.LIKE, pattern);
    }

    public static Filter contains(String field, Object value) {
        return new Filter(field, FilterOperator.CONTAINS, value);
    }

    public static Filter in(String field, List<?> values) {
        return new Filter(field, FilterOperator.IN, values);
    }

    public static Filter between(String field, Object lower, Object upper) {
        return new Filter(field, FilterOperator.BETWEEN, Range.of(lower, upper));
    }

    public static Filter isNull(String field) {
        return new Filter(field, FilterOperator.IS_NULL, null);
    }

    public static Filter isNotNull(String field) {
        return new Filter(field, FilterOperator.IS_NOT_NULL, null);
    }

    private static Object normalize(Object value) {
        if (value instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        if (value instanceof Object[] array) {
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(array)));
        }
        if (value instanceof int[] array) {
            return IntStream.of(array).boxed().toList();
        }
        if (value instanceof long[] array) {
            return LongStream.of(array).boxed().toList();
        }
        if (value instanceof double[] array) {
            return DoubleStream.of(array).boxed().toList();
        }
        return value;
    }

    @Override
    public String toString() {
        if (operator.arity() == ValueArity.NONE) {
            return field + " " + operator;
        }
        return field + " " + operator + " " + value;
    }
}
