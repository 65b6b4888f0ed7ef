package com.tapas.rollup.service;

import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.domain.ParentRecord;

import java.util.List;

/**
 * Computes parent-level aggregates for one context.
 * <p>
 * Returns one record per distinct parent referenced by a qualifying child in {@code children},
 * carrying exactly the context's target fields. A record with a {@code null} id means the
 * child has no related parent and is skipped by the consumer.
 */
public interface AggregationEngine {

    List<ParentRecord> compute(AggregationContext context, List<ChildRecord> children);
}
