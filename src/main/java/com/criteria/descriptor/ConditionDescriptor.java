package com.criteria.descriptor;

/**
 * Backend-neutral condition handed to ORM or query-builder adapters.
 */
public sealed interface ConditionDescriptor permits ComparisonDescriptor, JunctionDescriptor, NegationDescriptor {
}
