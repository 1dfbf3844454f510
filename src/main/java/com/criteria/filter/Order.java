package com.criteria.filter;

import java.util.Objects;

/**
 * One sort directive.
 *
 * @param field     Logical field name
 * @param direction Sort direction
 */
public record Order(String field, OrderDirection direction) {

    public Order {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Order field cannot be blank");
        }
        Objects.requireNonNull(direction, "Order direction cannot be null");
    }

    public static Order asc(String field) {
        return new Order(field, OrderDirection.ASC);
    }

    public static Order desc(String field) {
        return new Order(field, OrderDirection.DESC);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
