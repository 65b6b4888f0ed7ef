package com.tapas.rollup.service;

import com.tapas.rollup.domain.ChildChangeBatch;
import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.domain.ParentRecord;
import com.tapas.rollup.domain.RollupDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for rollup recalculation. Looks up definitions for the changed child type,
 * groups them into aggregation contexts, runs the aggregation engine per context and merges
 * the results. Returned parent records are not persisted; that is up to the caller.
 */
@Service
public class RollupService {

    private static final Logger log = LoggerFactory.getLogger(RollupService.class);

    private final RollupDefinitionLookup definitionLookup;
    private final RollupChangeDetector changeDetector;
    private final RollupContextGrouper contextGrouper;
    private final AggregationEngine aggregationEngine;
    private final RollupResultMerger resultMerger;

    public RollupService(
            RollupDefinitionLookup definitionLookup,
            RollupChangeDetector changeDetector,
            RollupContextGrouper contextGrouper,
            AggregationEngine aggregationEngine,
            RollupResultMerger resultMerger) {
        this.definitionLookup = definitionLookup;
        this.changeDetector = changeDetector;
        this.contextGrouper = contextGrouper;
        this.aggregationEngine = aggregationEngine;
        this.resultMerger = resultMerger;
    }

    /**
     * Recalculates rollups affected by a change event. No-op in the before phase.
     */
    public RollupResult rollupOnChange(ChildChangeBatch batch) {
        if (batch.isBefore()) {
            return RollupResult.empty();
        }

        List<ChildRecord> records = batch.effectiveRecords();
        if (records.isEmpty()) {
            return RollupResult.empty();
        }

        String childType = batch.childType() != null ? batch.childType() : records.get(0).type();
        List<RollupDefinition> definitions = definitionLookup.definitionsFor(childType);
        if (definitions.isEmpty()) {
            log.debug("No rollup definitions for {}", childType);
            return RollupResult.empty();
        }

        if (batch.isUpdate()) {
            definitions = changeDetector.affectedDefinitions(definitions, batch.toRecordBatch(), true);
            if (definitions.isEmpty()) {
                return RollupResult.empty();
            }
        }

        return rollup(Map.of(childType, definitions), Map.of(childType, records));
    }

    /**
     * Recalculates every rollup defined for the given child records, without change detection.
     * Records of several child types are grouped by type.
     */
    public RollupResult rollupExplicit(List<ChildRecord> childRecords) {
        if (childRecords.isEmpty()) {
            return RollupResult.empty();
        }

        var recordsByType = new LinkedHashMap<String, List<ChildRecord>>();
        for (ChildRecord record : childRecords) {
            recordsByType.computeIfAbsent(record.type(), t -> new ArrayList<>()).add(record);
        }

        var definitionsByType = new LinkedHashMap<String, List<RollupDefinition>>();
        recordsByType.keySet().forEach(type -> {
            List<RollupDefinition> definitions = definitionLookup.definitionsFor(type);
            if (!definitions.isEmpty()) {
                definitionsByType.put(type, definitions);
            }
        });

        if (definitionsByType.isEmpty()) {
            return RollupResult.empty();
        }
        return rollup(definitionsByType, recordsByType);
    }

    private RollupResult rollup(Map<String, List<RollupDefinition>> definitionsByType,
                                Map<String, List<ChildRecord>> recordsByType) {
        // group everything first so configuration errors surface before any aggregation runs
        var work = new ArrayList<Map.Entry<AggregationContext, List<ChildRecord>>>();
        definitionsByType.forEach((type, definitions) -> {
            List<ChildRecord> children = recordsByType.get(type);
            contextGrouper.group(definitions, type).values()
                    .forEach(context -> work.add(Map.entry(context, children)));
        });

        var results = new ArrayList<ContextResult>(work.size());
        for (var entry : work) {
            AggregationContext context = entry.getKey();
            List<ParentRecord> records = aggregationEngine.compute(context, entry.getValue());
            log.debug("{} produced {} parent records", context, records.size());
            results.add(new ContextResult(context, records));
        }

        List<ParentRecord> parents = resultMerger.merge(results);
        log.info("Rollup recalculated {} contexts into {} parent records", results.size(), parents.size());

        return new RollupResult(parents, results.stream().map(r -> r.context().key()).toList());
    }
}
