package com.criteria.core;

import com.criteria.filter.Filter;
import com.criteria.filter.Order;

import java.util.List;

/**
 * Leaf node holding filters and orders directly.
 * Filters are implicitly ANDed; orders are listed primary key first.
 */
public record LeafCriteria(List<Filter> filters, List<Order> orders) implements Criteria {

    static final LeafCriteria EMPTY = new LeafCriteria(List.of(), List.of());

    public LeafCriteria {
        filters = filters == null ? List.of() : List.copyOf(filters);
        orders = orders == null ? List.of() : List.copyOf(orders);
    }

    @Override
    public <R> R accept(CriteriaVisitor<R> visitor) {
        return visitor.visitLeaf(this);
    }

    @Override
    public String toString() {
        return "Criteria(filters=" + filters + ", orders=" + orders + ")";
    }
}
