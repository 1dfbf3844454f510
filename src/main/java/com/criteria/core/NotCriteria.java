package com.criteria.core;

import com.criteria.filter.Filter;
import com.criteria.filter.Order;

import java.util.List;
import java.util.Objects;

/**
 * Logical negation of the nested criteria. Orders pass through unchanged.
 */
public final class NotCriteria implements Criteria {

    private final Criteria criteria;

    public NotCriteria(Criteria criteria) {
        this.criteria = Objects.requireNonNull(criteria, "Negated criteria cannot be null");
    }

    public Criteria criteria() {
        return criteria;
    }

    @Override
    public List<Filter> filters() {
        return CriteriaFlattener.filters(this);
    }

    @Override
    public List<Order> orders() {
        return CriteriaFlattener.orders(this);
    }

    @Override
    public boolean hasFilters() {
        return criteria.hasFilters();
    }

    @Override
    public boolean hasOrders() {
        return criteria.hasOrders();
    }

    @Override
    public <R> R accept(CriteriaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotCriteria other)) return false;
        return criteria.equals(other.criteria);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NotCriteria.class, criteria);
    }

    @Override
    public String toString() {
        return "NOT(" + criteria + ")";
    }
}
