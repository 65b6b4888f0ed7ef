package com.tapas.rollup.schema;

import java.util.Optional;

/**
 * Resolves entity type and field names to typed handles. An empty result means the
 * name is unknown; callers decide whether that is fatal.
 */
public interface SchemaResolver {

    Optional<EntityType> resolveType(String typeName);

    Optional<FieldHandle> resolveField(EntityType type, String fieldName);
}
