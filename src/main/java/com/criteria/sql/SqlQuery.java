package com.criteria.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled query: SQL text with named placeholders and their values.
 *
 * @param sql        Query text, e.g. {@code SELECT * FROM user WHERE name = :parameter_0;}
 * @param parameters Placeholder name (without the colon) to value, in allocation order
 */
public record SqlQuery(String sql, Map<String, Object> parameters) {

    public SqlQuery {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
