package com.criteria.core;

import com.criteria.filter.Filter;
import com.criteria.filter.Order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Logical OR of two criteria. The left side renders and numbers its parameters first.
 */
public final class OrCriteria implements Criteria {

    private final Criteria left;
    private final Criteria right;
    private final boolean hasFilters;
    private final boolean hasOrders;

    public OrCriteria(Criteria left, Criteria right) {
        this.left = Objects.requireNonNull(left, "Left criteria cannot be null");
        this.right = Objects.requireNonNull(right, "Right criteria cannot be null");
        this.hasFilters = left.hasFilters() || right.hasFilters();
        this.hasOrders = left.hasOrders() || right.hasOrders();
    }

    public Criteria left() {
        return left;
    }

    public Criteria right() {
        return right;
    }

    /**
     * Operands of this node and of the OR nodes along its left spine, left to right.
     * {@code ((a OR b) OR c)} yields {@code [a, b, c]}; a nested OR on the right
     * side stays a single operand. Backends iterate over these instead of recursing, so long
     * {@code .or(...)} chains do not grow the call stack.
     */
    public List<Criteria> operands() {
        Deque<Criteria> operands = new ArrayDeque<>();
        Criteria current = this;
        while (current instanceof OrCriteria node) {
            operands.addFirst(node.right);
            current = node.left;
        }
        operands.addFirst(current);
        return new ArrayList<>(operands);
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
        return hasFilters;
    }

    @Override
    public boolean hasOrders() {
        return hasOrders;
    }

    @Override
    public <R> R accept(CriteriaVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrCriteria other)) return false;
        return operands().equals(other.operands());
    }

    @Override
    public int hashCode() {
        return Objects.hash(OrCriteria.class, operands());
    }

    @Override
    public String toString() {
        List<Criteria> operands = operands();
        StringBuilder text = new StringBuilder("OR(".repeat(operands.size() - 1));
        text.append(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            text.append(", ").append(operands.get(i)).append(')');
        }
        return text.toString();
    }
}
