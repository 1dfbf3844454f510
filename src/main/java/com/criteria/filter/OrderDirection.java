package com.criteria.filter;

/**
 * Sort direction for an order directive.
 */
public enum OrderDirection {
    ASC,
    DESC
}
