package com.criteria.descriptor;

import java.util.List;

/**
 * AND/OR over its conditions, left side first.
 *
 * @param type       Junction type
 * @param conditions Joined conditions
 */
public record JunctionDescriptor(Type type, List<ConditionDescriptor> conditions) implements ConditionDescriptor {

    public JunctionDescriptor {
        conditions = List.copyOf(conditions);
    }

    public enum Type {
        AND,
        OR
    }
}
