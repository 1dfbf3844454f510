package com.criteria.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Allocates {@code parameter_<n>} placeholders for one compilation.
 * The counter only advances when a value is actually bound, so placeholders are gapless.
 */
final class ParameterAccumulator {

    static final String PARAMETER_PREFIX = "parameter_";

    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private int counter;

    /**
     * Bind a value to the next placeholder.
     *
     * @return Placeholder text, e.g. {@code :parameter_3}
     */
    String bind(Object value) {
        String name = PARAMETER_PREFIX + counter++;
        parameters.put(name, value);
        return ":" + name;
    }

    int size() {
        return counter;
    }

    Map<String, Object> parameters() {
        return Collections.unmodifiableMap(parameters);
    }
}
