package com.tapas.rollup.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One change event delivered for a batch of child records.
 * {@code oldRecords} holds the previous versions for updates and deletes.
 */
public record ChildChangeBatch(
        TriggerPhase phase,
        TriggerOperation operation,
        String childType,
        List<ChildRecord> newRecords,
        List<ChildRecord> oldRecords) {

    public ChildChangeBatch {
        newRecords = newRecords == null ? List.of() : List.copyOf(newRecords);
        oldRecords = oldRecords == null ? List.of() : List.copyOf(oldRecords);
    }

    public boolean isBefore() {
        return phase == TriggerPhase.BEFORE;
    }

    public boolean isUpdate() {
        return operation == TriggerOperation.UPDATE;
    }

    public boolean isDelete() {
        return operation == TriggerOperation.DELETE;
    }

    /**
     * Records the rollup is computed over: the previous versions on delete, the new ones otherwise.
     */
    public List<ChildRecord> effectiveRecords() {
        return isDelete() ? oldRecords : newRecords;
    }

    public ChildRecordBatch toRecordBatch() {
        Map<String, ChildRecord> previous = new LinkedHashMap<>();
        for (ChildRecord old : oldRecords) {
            if (old.id() != null) {
                previous.put(old.id(), old);
            }
        }
        return new ChildRecordBatch(childType, effectiveRecords(), previous);
    }
}
