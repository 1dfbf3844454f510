package com.criteria.descriptor;

import java.util.List;

/**
 * Negation of the conjunction of the wrapped conditions.
 *
 * @param conditions Negated conditions
 */
public record NegationDescriptor(List<ConditionDescriptor> conditions) implements ConditionDescriptor {

    public NegationDescriptor {
        conditions = List.copyOf(conditions);
    }
}
