package com.criteria.evaluator;

import com.criteria.exception.TypeMismatchException;
import com.criteria.filter.Filter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Equality and ordering between record values and filter values.
 * Numbers compare by numeric value across boxed types; other values compare only with
 * values of the same kind.
 */
final class ValueComparator {

    private ValueComparator() {
    }

    /**
     * Equality test. Values of different kinds are simply unequal.
     */
    static boolean isEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return compareNumbers(a, e) == 0;
        }
        if (actual instanceof CharSequence && expected instanceof CharSequence) {
            return actual.toString().equals(expected.toString());
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Ordering test.
     *
     * @throws TypeMismatchException when the two values have no common ordering
     */
    @SuppressWarnings("unchecked")
    static int compare(Object actual, Object expected, Filter filter) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return compareNumbers(a, e);
        }
        if (actual instanceof CharSequence && expected instanceof CharSequence) {
            return actual.toString().compareTo(expected.toString());
        }
        if (actual instanceof Comparable<?> && sameKind(actual, expected)) {
            Comparable<Object> comparable = (Comparable<Object>) actual;
            return comparable.compareTo(expected);
        }
        throw new TypeMismatchException("Cannot compare " + typeName(actual) + " value of '"
                + filter.field() + "' with " + typeName(expected) + " under " + filter.operator());
    }

    private static boolean sameKind(Object actual, Object expected) {
        return actual.getClass().isInstance(expected) || expected.getClass().isInstance(actual);
    }

    private static int compareNumbers(Number a, Number b) {
        BigDecimal left = toBigDecimal(a);
        BigDecimal right = toBigDecimal(b);
        if (left == null || right == null) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return left.compareTo(right);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal d) {
            return d;
        }
        if (number instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
