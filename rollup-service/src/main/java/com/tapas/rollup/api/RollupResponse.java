package com.tapas.rollup.api;

import com.tapas.rollup.dto.ParentRecordDto;
import com.tapas.rollup.service.RollupResult;

import java.util.List;

public record RollupResponse(
        int contexts,
        boolean persisted,
        List<ParentRecordDto> parents
) {
    public static RollupResponse from(RollupResult result, boolean persisted) {
        return new RollupResponse(
                result.contexts().size(),
                persisted && !result.isEmpty(),
                result.parents().stream().map(ParentRecordDto::from).toList()
        );
    }
}
