package com.tapas.rollup.service;

import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.domain.ChildRecordBatch;
import com.tapas.rollup.domain.RollupDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Narrows rollup definitions to those whose aggregated field changed value in an update batch.
 */
@Component
public class RollupChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(RollupChangeDetector.class);

    /**
     * @param definitions candidate definitions for the batch's child type
     * @param batch       new versions of the child records plus previous versions by id
     * @param isUpdate    whether the batch comes from an update; inserts and deletes affect every definition
     * @return the definitions to recalculate, empty when nothing aggregated changed
     * @throws InvalidRollupDefinitionException if an update is checked against a definition with no aggregated field
     */
    public List<RollupDefinition> affectedDefinitions(List<RollupDefinition> definitions,
                                                      ChildRecordBatch batch,
                                                      boolean isUpdate) {
        if (!isUpdate) {
            return definitions;
        }

        Set<String> unresolved = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (RollupDefinition definition : definitions) {
            if (definition.getFieldToAggregate() == null) {
                throw new InvalidRollupDefinitionException(
                        "Rollup '" + definition.getName() + "' has no field to aggregate");
            }
            unresolved.add(definition.getFieldToAggregate());
        }

        Set<String> changed = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (ChildRecord record : batch.records()) {
            if (unresolved.isEmpty()) {
                break;
            }
            // no previous version: every field still unresolved counts as changed
            ChildRecord previous = batch.previousVersion(record.id());
            for (Iterator<String> it = unresolved.iterator(); it.hasNext(); ) {
                String field = it.next();
                if (previous == null || !sameValue(record.get(field), previous.get(field))) {
                    changed.add(field);
                    it.remove();
                }
            }
        }

        if (changed.isEmpty()) {
            log.debug("No aggregated field changed across {} {} records", batch.records().size(), batch.type());
            return List.of();
        }

        log.debug("Changed aggregated fields on {}: {}", batch.type(), changed);
        return definitions.stream()
                .filter(d -> changed.contains(d.getFieldToAggregate()))
                .toList();
    }

    static boolean sameValue(Object current, Object previous) {
        if (current instanceof Number a && previous instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException e) {
                // NaN and infinities
                return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
            }
        }
        return Objects.equals(current, previous);
    }
}
