package com.criteria.config;

import com.criteria.core.Criteria;
import com.criteria.core.LeafCriteria;
import com.criteria.exception.ConfigurationException;
import com.criteria.exception.UnknownOperatorTokenException;
import com.criteria.filter.Filter;
import com.criteria.filter.FilterOperator;
import com.criteria.filter.Order;
import com.criteria.filter.OrderDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a leaf criteria from declarative rule data.
 * <p>
 * Accepted shapes:
 * <pre>
 * age:   { operator: ge, value: 18, message: "Must be an adult" }
 * email: { operator: is_not_null }
 * </pre>
 * or the same field mapping under a {@code filters} key, optionally next to an {@code orders}
 * section:
 * <pre>
 * filters:
 *   name: { operator: starts_with, value: "J" }
 *   age:
 *     - { operator: ge, value: 18 }
 *     - { operator: lt, value: 65 }
 * orders:
 *   name: ASC
 *   age: DESC
 * </pre>
 * Operator tokens map one-to-one onto {@link FilterOperator}; an unknown token fails the whole
 * document.
 */
public class RuleParser {

    private static final Logger log = LoggerFactory.getLogger(RuleParser.class);

    static final String FILTERS_KEY = "filters";
    static final String ORDERS_KEY = "orders";

    private static final String OPERATOR_KEY = "operator";
    private static final String VALUE_KEY = "value";
    private static final String MESSAGE_KEY = "message";
    private static final Set<String> DEFINITION_KEYS = Set.of(OPERATOR_KEY, VALUE_KEY, MESSAGE_KEY);

    /**
     * Parse rule data into a leaf criteria.
     *
     * @param ruleData Field mapping, or a document with {@code filters}/{@code orders} sections
     * @return Leaf criteria, filters and orders in document order
     * @throws UnknownOperatorTokenException if an operator token is not recognized
     * @throws ConfigurationException        if the document is malformed
     */
    public LeafCriteria parse(Map<?, ?> ruleData) {
        if (ruleData == null) {
            throw new ConfigurationException("Rule data cannot be null");
        }

        Map<?, ?> filterSection = ruleData;
        Object orderSection = null;
        if (isDocument(ruleData)) {
            filterSection = section(ruleData.get(FILTERS_KEY));
            orderSection = ruleData.get(ORDERS_KEY);
        }

        List<Filter> filters = new ArrayList<>();
        for (Map.Entry<?, ?> entry : filterSection.entrySet()) {
            parseField(String.valueOf(entry.getKey()), entry.getValue(), filters);
        }
        List<Order> orders = parseOrders(orderSection);

        log.debug("Parsed rule data into {} filter(s) and {} order(s)", filters.size(), orders.size());
        return Criteria.leaf(filters, orders);
    }

    /**
     * A document has only {@code filters}/{@code orders} keys, and neither of them holds a
     * filter definition. Anything else is a bare field mapping, so fields may still be named
     * {@code filters} or {@code orders}.
     */
    private static boolean isDocument(Map<?, ?> ruleData) {
        if (ruleData.isEmpty()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : ruleData.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!FILTERS_KEY.equals(key) && !ORDERS_KEY.equals(key)) {
                return false;
            }
            if (isDefinition(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDefinition(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(OPERATOR_KEY);
        }
        if (value instanceof List<?> list) {
            return list.stream().anyMatch(RuleParser::isDefinition);
        }
        return false;
    }

    private static Map<?, ?> section(Object filters) {
        if (filters == null) {
            return Map.of();
        }
        if (filters instanceof Map<?, ?> map) {
            return map;
        }
        throw new ConfigurationException("Filters section must be a mapping of fields, got: " + filters);
    }

    private void parseField(String field, Object definition, List<Filter> filters) {
        if (definition instanceof List<?> definitions) {
            for (Object item : definitions) {
                filters.add(parseFilter(field, item));
            }
            return;
        }
        filters.add(parseFilter(field, definition));
    }

    private Filter parseFilter(String field, Object definition) {
        if (field == null || field.isBlank()) {
            throw new ConfigurationException("Rule field name cannot be blank");
        }
        if (!(definition instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Rule for field '" + field
                    + "' must be a mapping with an operator, got: " + definition);
        }

        Object token = map.get(OPERATOR_KEY);
        if (token == null) {
            throw new ConfigurationException("Rule for field '" + field + "' requires an operator");
        }
        FilterOperator operator = FilterOperator.fromToken(token.toString());

        for (Object key : map.keySet()) {
            if (!DEFINITION_KEYS.contains(String.valueOf(key))) {
                log.warn("Ignoring unknown key '{}' in rule for field '{}'", key, field);
            }
        }

        Object message = map.get(MESSAGE_KEY);
        return new Filter(field, operator, map.get(VALUE_KEY), message == null ? null : message.toString());
    }

    private List<Order> parseOrders(Object section) {
        if (section == null) {
            return List.of();
        }

        List<Order> orders = new ArrayList<>();
        if (section instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                orders.add(new Order(String.valueOf(entry.getKey()), parseDirection(entry.getValue())));
            }
        } else if (section instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> orderMap) || orderMap.get("field") == null) {
                    throw new ConfigurationException("Order entry must be a mapping with a field, got: " + item);
                }
                orders.add(new Order(orderMap.get("field").toString(), parseDirection(orderMap.get("direction"))));
            }
        } else {
            throw new ConfigurationException("Orders must be a mapping or a list, got: " + section);
        }
        return orders;
    }

    private OrderDirection parseDirection(Object direction) {
        if (direction == null) {
            return OrderDirection.ASC;
        }
        try {
            return OrderDirection.valueOf(direction.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown order direction: " + direction, e);
        }
    }
}
