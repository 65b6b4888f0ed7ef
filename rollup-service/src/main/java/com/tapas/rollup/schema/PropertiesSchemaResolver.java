package com.tapas.rollup.schema;

import com.tapas.rollup.config.RollupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Schema catalogue read from {@code rollup.schema.entities.*}. Names are matched
 * case-insensitively and handles carry the configured spelling.
 */
public class PropertiesSchemaResolver implements SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(PropertiesSchemaResolver.class);

    private final Map<String, EntityType> types = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Map<String, FieldHandle>> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public PropertiesSchemaResolver(RollupProperties.Schema schema) {
        schema.getEntities().forEach((name, entity) -> {
            String table = entity.getTable() != null ? entity.getTable() : name;
            var type = new EntityType(name, table, entity.getIdColumn());
            types.put(name, type);

            var byName = new TreeMap<String, FieldHandle>(String.CASE_INSENSITIVE_ORDER);
            entity.getFields().forEach((field, column) ->
                    byName.put(field, new FieldHandle(type, field, column == null || column.isBlank() ? field : column)));
            fields.put(name, byName);
        });
        log.info("Loaded schema catalogue with {} entity types", types.size());
    }

    @Override
    public Optional<EntityType> resolveType(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(typeName.trim()));
    }

    @Override
    public Optional<FieldHandle> resolveField(EntityType type, String fieldName) {
        if (type == null || fieldName == null) {
            return Optional.empty();
        }
        var byName = fields.get(type.name());
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(fieldName.trim()));
    }
}
