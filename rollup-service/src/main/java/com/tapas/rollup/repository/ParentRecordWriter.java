package com.tapas.rollup.repository;

import com.tapas.rollup.domain.ParentRecord;
import com.tapas.rollup.schema.EntityType;
import com.tapas.rollup.schema.FieldHandle;
import com.tapas.rollup.schema.SchemaResolver;
import com.tapas.rollup.service.InvalidRollupDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes merged parent records back to their tables. Records with the same parent type and
 * field set share one batched {@code UPDATE}. Returns the number of parent rows updated;
 * records whose parent row is missing are logged and not counted.
 */
@Repository
public class ParentRecordWriter {

    private static final Logger logger = LoggerFactory.getLogger(ParentRecordWriter.class);

    private final JdbcTemplate jdbcTemplate;
    private final SchemaResolver schemaResolver;

    public ParentRecordWriter(JdbcTemplate jdbcTemplate, SchemaResolver schemaResolver) {
        this.jdbcTemplate = jdbcTemplate;
        this.schemaResolver = schemaResolver;
    }

    public int write(Collection<ParentRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        var groups = new LinkedHashMap<UpdateShape, List<ParentRecord>>();
        for (ParentRecord record : records) {
            if (record.getId() == null || record.getFields().isEmpty()) {
                continue;
            }
            var shape = new UpdateShape(record.getType(), List.copyOf(record.getFields().keySet()));
            groups.computeIfAbsent(shape, s -> new ArrayList<>()).add(record);
        }

        int written = 0;
        for (Map.Entry<UpdateShape, List<ParentRecord>> group : groups.entrySet()) {
            UpdateShape shape = group.getKey();
            List<ParentRecord> batch = group.getValue();
            String sql = buildUpdate(shape);
            logger.debug("Updating {} {} records: {}", batch.size(), shape.type(), sql);

            int[][] counts = jdbcTemplate.batchUpdate(sql, batch, batch.size(), (ps, item) -> {
                int index = 1;
                for (String field : shape.fields()) {
                    ps.setObject(index++, item.get(field));
                }
                ps.setObject(index, item.getId());
            });
            written += countUpdated(batch, counts);
        }

        logger.info("Wrote {} parent records", written);
        return written;
    }

    private int countUpdated(List<ParentRecord> batch, int[][] counts) {
        int updated = 0;
        int position = 0;
        for (int[] chunk : counts) {
            for (int count : chunk) {
                ParentRecord record = batch.get(position++);
                if (count == 0) {
                    logger.warn("No {} row with id {}; rollup values not written", record.getType(), record.getId());
                } else {
                    // drivers may report success without a row count
                    updated += count == Statement.SUCCESS_NO_INFO ? 1 : count;
                }
            }
        }
        return updated;
    }

    String buildUpdate(UpdateShape shape) {
        EntityType type = schemaResolver.resolveType(shape.type())
                .orElseThrow(() -> new InvalidRollupDefinitionException("Unknown parent type '" + shape.type() + "'"));

        var assignments = new ArrayList<String>(shape.fields().size());
        for (String field : shape.fields()) {
            FieldHandle handle = schemaResolver.resolveField(type, field)
                    .orElseThrow(() -> new InvalidRollupDefinitionException(
                            "Unknown field '" + field + "' on " + type.name()));
            assignments.add(handle.column() + " = ?");
        }
        return "UPDATE " + type.table() + " SET " + String.join(", ", assignments)
                + " WHERE " + type.idColumn() + " = ?";
    }

    record UpdateShape(String type, List<String> fields) {
    }
}
