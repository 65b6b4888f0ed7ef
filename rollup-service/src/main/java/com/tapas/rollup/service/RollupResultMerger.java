package com.tapas.rollup.service;

import com.tapas.rollup.domain.ParentRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Folds per-context partial parent records into one record per parent. A later context only
 * writes its own target fields onto a parent an earlier context already produced.
 */
@Component
public class RollupResultMerger {

    public List<ParentRecord> merge(List<ContextResult> results) {
        var merged = new LinkedHashMap<ParentRecord.Key, ParentRecord>();

        for (ContextResult result : results) {
            Set<String> targetFields = result.context().targetFieldNames();
            for (ParentRecord record : result.records()) {
                if (record.getId() == null) {
                    continue; // no related parent
                }
                ParentRecord existing = merged.get(record.key());
                if (existing == null) {
                    merged.put(record.key(), record.copy());
                } else {
                    existing.copyFields(record, targetFields);
                }
            }
        }

        return new ArrayList<>(merged.values());
    }
}
