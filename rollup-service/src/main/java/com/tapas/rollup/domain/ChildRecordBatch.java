package com.tapas.rollup.domain;

import java.util.List;
import java.util.Map;

/**
 * Child records of one type, with their previous versions keyed by record id when the
 * batch comes from an update.
 */
public record ChildRecordBatch(
        String type,
        List<ChildRecord> records,
        Map<String, ChildRecord> previous) {

    public ChildRecordBatch {
        records = records == null ? List.of() : List.copyOf(records);
        previous = previous == null ? Map.of() : Map.copyOf(previous);
    }

    public ChildRecord previousVersion(String id) {
        return id == null ? null : previous.get(id);
    }
}
