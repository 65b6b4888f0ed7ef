package com.tapas.rollup.dto;

import com.tapas.rollup.domain.ChildChangeBatch;
import com.tapas.rollup.domain.TriggerOperation;
import com.tapas.rollup.domain.TriggerPhase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Event payload consumed from the child record changes Kafka topic.
 * {@code previousRecords} carries the prior versions for updates and deletes.
 */
public record ChildChangeEventPayload(
        @NotBlank String childType,
        TriggerPhase phase,
        @NotNull TriggerOperation operation,
        List<@NotNull @Valid ChildRecordPayload> records,
        List<@NotNull @Valid ChildRecordPayload> previousRecords) {

    public ChildChangeBatch toBatch() {
        return new ChildChangeBatch(
                phase != null ? phase : TriggerPhase.AFTER,
                operation,
                childType,
                records == null ? List.of() : records.stream().map(r -> r.toChildRecord(childType)).toList(),
                previousRecords == null ? List.of() : previousRecords.stream().map(r -> r.toChildRecord(childType)).toList());
    }
}
