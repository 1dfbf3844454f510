package com.criteria.core;

import com.criteria.filter.Filter;
import com.criteria.filter.Order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Collects the filters or orders of a tree depth-first, left to right.
 * Walks with an explicit stack so long combinator chains do not grow the call stack.
 */
final class CriteriaFlattener {

    private CriteriaFlattener() {
    }

    static List<Filter> filters(Criteria root) {
        return collect(root, Criteria::hasFilters, LeafCriteria::filters);
    }

    static List<Order> orders(Criteria root) {
        return collect(root, Criteria::hasOrders, LeafCriteria::orders);
    }

    private static <T> List<T> collect(Criteria root, Predicate<Criteria> holdsAny,
                                       Function<LeafCriteria, List<T>> extractor) {
        List<T> collected = new ArrayList<>();
        Deque<Criteria> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            Criteria node = pending.pop();
            if (!holdsAny.test(node)) {
                continue;
            }
            if (node instanceof LeafCriteria leaf) {
                collected.addAll(extractor.apply(leaf));
            } else if (node instanceof AndCriteria and) {
                pending.push(and.right());
                pending.push(and.left());
            } else if (node instanceof OrCriteria or) {
                pending.push(or.right());
                pending.push(or.left());
            } else if (node instanceof NotCriteria not) {
                pending.push(not.criteria());
            }
        }
        return List.copyOf(collected);
    }
}
