package com.tapas.rollup.api;

import com.tapas.rollup.dto.ChildRecordPayload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RecalculateRequest(
        @NotBlank String childType,
        @NotNull List<@NotNull @Valid ChildRecordPayload> records
) {}
