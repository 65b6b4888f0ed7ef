package com.tapas.rollup.service;

import com.tapas.rollup.schema.FieldHandle;

/**
 * One aggregate inside a context: {@code target = operation(source)}.
 */
public record FieldMapping(
        FieldHandle target,
        FieldHandle source,
        AggregateOperation operation,
        String delimiter) {

    public static final String DEFAULT_DELIMITER = ",";

    public FieldMapping {
        if (delimiter == null) {
            delimiter = DEFAULT_DELIMITER;
        }
    }
}
