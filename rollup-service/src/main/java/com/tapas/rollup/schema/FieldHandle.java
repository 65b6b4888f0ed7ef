package com.tapas.rollup.schema;

/**
 * Resolved handle for a field on an entity type.
 */
public record FieldHandle(EntityType owner, String name, String column) {

    public String qualifiedName() {
        return owner.name() + "." + name;
    }
}
