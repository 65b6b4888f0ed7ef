package com.tapas.rollup.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parent record carrying only aggregated fields. A record with a {@code null} id stands
 * for children that have no related parent.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ParentRecord {

    private final String type;
    private final String id;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public ParentRecord(String type, String id) {
        this.type = type;
        this.id = id;
    }

    public ParentRecord(String type, String id, Map<String, ?> fields) {
        this(type, id);
        this.fields.putAll(fields);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public ParentRecord put(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    public Key key() {
        return new Key(type, id);
    }

    public ParentRecord copy() {
        return new ParentRecord(type, id, fields);
    }

    /**
     * Copies the named fields present on {@code other} onto this record, leaving all other fields alone.
     */
    public void copyFields(ParentRecord other, Collection<String> names) {
        for (String name : names) {
            if (other.fields.containsKey(name)) {
                fields.put(name, other.fields.get(name));
            }
        }
    }

    public record Key(String type, String id) {
    }
}
