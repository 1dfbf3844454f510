package com.criteria.descriptor;

import com.criteria.filter.FilterOperator;

/**
 * One comparison with the field already resolved to its physical column.
 *
 * @param field    Column name
 * @param operator Operator
 * @param value    Filter value as given (scalar, range, sequence or null)
 */
public record ComparisonDescriptor(String field, FilterOperator operator, Object value) implements ConditionDescriptor {
}
