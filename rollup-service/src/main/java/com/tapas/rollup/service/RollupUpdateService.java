package com.tapas.rollup.service;

import com.tapas.rollup.domain.ChildChangeBatch;
import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.repository.ParentRecordWriter;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs rollup recalculation and commits the resulting parent records in the same transaction.
 */
@Service
@Slf4j
public class RollupUpdateService {

    private final RollupService rollupService;
    private final ParentRecordWriter parentRecordWriter;

    public RollupUpdateService(RollupService rollupService, ParentRecordWriter parentRecordWriter) {
        this.rollupService = rollupService;
        this.parentRecordWriter = parentRecordWriter;
    }

    @Transactional
    public int applyChanges(List<ChildChangeBatch> batches, boolean persist) {
        int parents = 0;
        for (ChildChangeBatch batch : batches) {
            RollupResult result = rollupService.rollupOnChange(batch);
            if (result.isEmpty()) {
                continue;
            }
            parents += persist ? parentRecordWriter.write(result.parents()) : result.parents().size();
        }
        log.info("Applied {} change batches, {} parent records updated (persist={})", batches.size(), parents, persist);
        return parents;
    }

    @Transactional
    public RollupResult recalculate(List<ChildRecord> records, boolean persist) {
        RollupResult result = rollupService.rollupExplicit(records);
        if (persist && !result.isEmpty()) {
            parentRecordWriter.write(result.parents());
        }
        return result;
    }
}
