package com.tapas.rollup.dto;

import com.tapas.rollup.domain.ChildRecord;

import java.util.Map;

public record ChildRecordPayload(
        String id,
        Map<String, Object> fields) {

    public ChildRecord toChildRecord(String type) {
        return new ChildRecord(id, type, fields);
    }
}
