package com.criteria.variable;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves a filter field against an in-memory record.
 */
public interface FieldResolver {

    /**
     * Resolve a field.
     *
     * @param field  Field name (e.g., "age", "address.city")
     * @param record Record holding field values
     * @return Resolved value, or empty when the field is absent or null
     */
    Optional<Object> resolve(String field, Map<String, ?> record);
}
