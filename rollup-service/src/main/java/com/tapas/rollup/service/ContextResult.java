package com.tapas.rollup.service;

import com.tapas.rollup.domain.ParentRecord;

import java.util.List;

/**
 * Partial parent records produced by the aggregation engine for one context.
 */
public record ContextResult(AggregationContext context, List<ParentRecord> records) {

    public ContextResult {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
