package com.criteria.variable;

import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of FieldResolver.
 * Looks the field up as a key first; a dotted field that is not a key walks nested maps.
 * Absent and null values both resolve to empty.
 */
public class DefaultFieldResolver implements FieldResolver {

    private static final char PATH_SEPARATOR = '.';

    @Override
    public Optional<Object> resolve(String field, Map<String, ?> record) {
        if (field == null || field.isEmpty() || record == null) {
            return Optional.empty();
        }

        if (record.containsKey(field)) {
            return Optional.ofNullable(record.get(field));
        }
        if (field.indexOf(PATH_SEPARATOR) < 0) {
            return Optional.empty();
        }
        return resolvePath(field, record);
    }

    private Optional<Object> resolvePath(String field, Map<String, ?> record) {
        Object current = record;
        int start = 0;
        while (start <= field.length()) {
            int end = field.indexOf(PATH_SEPARATOR, start);
            String segment = end < 0 ? field.substring(start) : field.substring(start, end);

            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
            if (end < 0) {
                break;
            }
            start = end + 1;
        }
        return Optional.of(current);
    }
}
