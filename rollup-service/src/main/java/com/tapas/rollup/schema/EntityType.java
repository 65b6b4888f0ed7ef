package com.tapas.rollup.schema;

/**
 * Resolved handle for an entity type: its canonical name and the table backing it.
 */
public record EntityType(String name, String table, String idColumn) {
}
