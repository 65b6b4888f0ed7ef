package com.tapas.rollup.dto;

import com.tapas.rollup.domain.ParentRecord;

import java.util.Map;

public record ParentRecordDto(
        String type,
        String id,
        Map<String, Object> fields) {

    public static ParentRecordDto from(ParentRecord record) {
        return new ParentRecordDto(record.getType(), record.getId(), record.getFields());
    }
}
