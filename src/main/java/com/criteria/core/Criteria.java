package com.criteria.core;

import com.criteria.filter.Filter;
import com.criteria.filter.Order;

import java.util.List;

/**
 * Immutable boolean expression over filters and orders.
 * <p>
 * Exactly four node kinds exist: {@link LeafCriteria}, {@link AndCriteria}, {@link OrCriteria}
 * and {@link NotCriteria}. Backends walk the tree through {@link CriteriaVisitor}.
 * Combinators always build new nodes and never simplify, so the tree mirrors the calls
 * that produced it and any sub-tree can be reused in several combinations.
 */
public sealed interface Criteria permits LeafCriteria, AndCriteria, OrCriteria, NotCriteria {

    /**
     * All filters of the leaf descendants, depth-first, left to right.
     */
    List<Filter> filters();

    /**
     * All orders of the leaf descendants, depth-first, left to right.
     */
    List<Order> orders();

    <R> R accept(CriteriaVisitor<R> visitor);

    default boolean hasFilters() {
        return !filters().isEmpty();
    }

    default boolean hasOrders() {
        return !orders().isEmpty();
    }

    default Criteria and(Criteria other) {
        return new AndCriteria(this, other);
    }

    default Criteria or(Criteria other) {
        return new OrCriteria(this, other);
    }

    default Criteria not() {
        return new NotCriteria(this);
    }

    static LeafCriteria leaf(List<Filter> filters, List<Order> orders) {
        return new LeafCriteria(filters, orders);
    }

    static LeafCriteria leaf(List<Filter> filters) {
        return new LeafCriteria(filters, List.of());
    }

    static LeafCriteria of(Filter... filters) {
        return new LeafCriteria(List.of(filters), List.of());
    }

    static LeafCriteria empty() {
        return LeafCriteria.EMPTY;
    }
}
