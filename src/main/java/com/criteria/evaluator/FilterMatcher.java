package com.criteria.evaluator;

import com.criteria.exception.TypeMismatchException;
import com.criteria.filter.Filter;
import com.criteria.filter.FilterValues;
import com.criteria.filter.Range;
import com.criteria.filter.ValueArity;

import java.util.Collection;

/**
 * Per-operator semantics of a single filter against one record value.
 * <p>
 * IS_NULL and IS_NOT_NULL are the only operators that can hold on a missing value;
 * every other operator is false when the value is missing.
 */
final class FilterMatcher {

    private FilterMatcher() {
    }

    /**
     * Test a filter against a resolved value.
     *
     * @param filter Filter to apply
     * @param actual Record value, or null when the field is missing
     * @return true if the filter holds
     */
    static boolean matches(Filter filter, Object actual) {
        FilterValues.check(filter);
        if (actual == null && filter.operator().arity() != ValueArity.NONE) {
            return false;
        }

        return switch (filter.operator()) {
            case IS_NULL -> actual == null;
            case IS_NOT_NULL -> actual != null;

            case EQUAL -> ValueComparator.isEqual(actual, filter.value());
            case NOT_EQUAL -> !ValueComparator.isEqual(actual, filter.value());
            case GREATER -> ValueComparator.compare(actual, filter.value(), filter) > 0;
            case GREATER_OR_EQUAL -> ValueComparator.compare(actual, filter.value(), filter) >= 0;
            case LESS -> ValueComparator.compare(actual, filter.value(), filter) < 0;
            case LESS_OR_EQUAL -> ValueComparator.compare(actual, filter.value(), filter) <= 0;

            case LIKE -> like(filter, actual);
            case NOT_LIKE -> !like(filter, actual);
            case CONTAINS -> contains(filter, actual);
            case NOT_CONTAINS -> !contains(filter, actual);
            case STARTS_WITH -> text(filter, actual).startsWith(pattern(filter));
            case NOT_STARTS_WITH -> !text(filter, actual).startsWith(pattern(filter));
            case ENDS_WITH -> text(filter, actual).endsWith(pattern(filter));
            case NOT_ENDS_WITH -> !text(filter, actual).endsWith(pattern(filter));

            case IN -> in(filter, actual);
            case NOT_IN -> !in(filter, actual);

            case BETWEEN -> between(filter, actual);
            case NOT_BETWEEN -> !between(filter, actual);
        };
    }

    private static boolean like(Filter filter, Object actual) {
        return LikePattern.compile(pattern(filter)).matches(text(filter, actual));
    }

    private static boolean contains(Filter filter, Object actual) {
        if (actual instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (ValueComparator.isEqual(element, filter.value())) {
                    return true;
                }
            }
            return false;
        }
        return text(filter, actual).contains(pattern(filter));
    }

    private static boolean in(Filter filter, Object actual) {
        for (Object candidate : FilterValues.sequence(filter)) {
            if (ValueComparator.isEqual(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean between(Filter filter, Object actual) {
        Range range = FilterValues.pair(filter);
        return ValueComparator.compare(actual, range.lower(), filter) >= 0
                && ValueComparator.compare(actual, range.upper(), filter) <= 0;
    }

    private static String text(Filter filter, Object actual) {
        if (actual instanceof CharSequence sequence) {
            return sequence.toString();
        }
        throw new TypeMismatchException(filter.operator() + " operator on '" + filter.field()
                + "' requires a text value, got " + actual.getClass().getSimpleName());
    }

    private static String pattern(Filter filter) {
        if (filter.value() instanceof CharSequence sequence) {
            return sequence.toString();
        }
        throw new TypeMismatchException(filter.operator() + " operator on '" + filter.field()
                + "' requires a text pattern, got " + filter.value().getClass().getSimpleName());
    }
}
