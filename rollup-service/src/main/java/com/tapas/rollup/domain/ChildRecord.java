package com.tapas.rollup.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A child record under consideration for rollup. Field names are matched case-insensitively.
 */
public record ChildRecord(String id, String type, Map<String, Object> fields) {

    public ChildRecord {
        Objects.requireNonNull(type, "type");
        var copy = new TreeMap<String, Object>(String.CASE_INSENSITIVE_ORDER);
        if (fields != null) {
            copy.putAll(fields);
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
