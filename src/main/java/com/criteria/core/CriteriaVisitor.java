package com.criteria.core;

/**
 * Visitor over the four criteria node kinds.
 * Every backend implements all four methods, so a new node kind fails to compile
 * until each backend handles it.
 *
 * @param <R> Result type
 */
public interface CriteriaVisitor<R> {

    R visitLeaf(LeafCriteria leaf);

    R visitAnd(AndCriteria and);

    R visitOr(OrCriteria or);

    R visitNot(NotCriteria not);
}
