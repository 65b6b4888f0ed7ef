package com.tapas.rollup.repository;

import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.domain.ParentRecord;
import com.tapas.rollup.service.AggregationContext;
import com.tapas.rollup.service.AggregationEngine;
import com.tapas.rollup.service.FieldMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregation engine that recomputes each context over the stored child table with one
 * grouped query per context, restricted to the parents referenced by the batch.
 * <p>
 * Relationship criteria are appended as raw SQL; they come from administrator-maintained
 * rollup definitions, never from change events.
 */
@Repository
public class JdbcAggregationEngine implements AggregationEngine {

    private static final Logger logger = LoggerFactory.getLogger(JdbcAggregationEngine.class);

    private static final String PARENT_ID_ALIAS = "parent_id";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAggregationEngine(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ParentRecord> compute(AggregationContext context, List<ChildRecord> children) {
        Set<String> parentIds = new LinkedHashSet<>();
        for (ChildRecord child : children) {
            Object parentId = child.get(context.relationshipField().name());
            if (parentId != null) {
                parentIds.add(parentId.toString());
            }
        }
        if (parentIds.isEmpty()) {
            return List.of();
        }

        String sql = buildQuery(context, parentIds.size());
        logger.debug("Aggregating {} parents for {}: {}", parentIds.size(), context.key(), sql);

        Map<String, Object[]> rows = jdbcTemplate.query(sql, rs -> {
            var byParent = new HashMap<String, Object[]>();
            int width = context.mappings().size();
            while (rs.next()) {
                var values = new Object[width];
                for (int i = 0; i < width; i++) {
                    values[i] = rs.getObject("agg_" + i);
                }
                byParent.put(rs.getString(PARENT_ID_ALIAS), values);
            }
            return byParent;
        }, parentIds.toArray());

        final Map<String, Object[]> aggregates = rows != null ? rows : Collections.emptyMap();

        var records = new ArrayList<ParentRecord>(parentIds.size());
        for (String parentId : parentIds) {
            var record = new ParentRecord(context.parentType().name(), parentId);
            Object[] values = aggregates.get(parentId);
            for (int i = 0; i < context.mappings().size(); i++) {
                FieldMapping mapping = context.mappings().get(i);
                Object value = values != null ? values[i] : null;
                record.put(mapping.target().name(), value != null ? value : mapping.operation().emptyValue());
            }
            records.add(record);
        }
        return records;
    }

    static String buildQuery(AggregationContext context, int parentCount) {
        String relationshipColumn = context.relationshipField().column();

        var select = new StringBuilder("SELECT ")
                .append(relationshipColumn).append(" AS ").append(PARENT_ID_ALIAS);
        for (int i = 0; i < context.mappings().size(); i++) {
            select.append(", ").append(aggregateExpression(context, context.mappings().get(i)))
                    .append(" AS agg_").append(i);
        }

        String placeholders = String.join(",", Collections.nCopies(parentCount, "?"));
        select.append(" FROM ").append(context.childType().table())
                .append(" WHERE ").append(relationshipColumn).append(" IN (").append(placeholders).append(")");
        if (context.relationshipCriteria() != null) {
            select.append(" AND (").append(context.relationshipCriteria()).append(")");
        }
        select.append(" GROUP BY ").append(relationshipColumn);
        return select.toString();
    }

    private static String aggregateExpression(AggregationContext context, FieldMapping mapping) {
        String column = mapping.source().column();
        String idColumn = context.childType().idColumn();
        return switch (mapping.operation()) {
            case SUM -> "SUM(" + column + ")";
            case COUNT -> "COUNT(" + column + ")";
            case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
            case MIN -> "MIN(" + column + ")";
            case MAX -> "MAX(" + column + ")";
            case AVG -> "AVG(" + column + ")";
            case CONCATENATE -> "STRING_AGG(CAST(" + column + " AS VARCHAR), " + quote(mapping.delimiter())
                    + " ORDER BY " + column + ")";
            case CONCATENATE_DISTINCT -> "STRING_AGG(DISTINCT CAST(" + column + " AS VARCHAR), "
                    + quote(mapping.delimiter()) + ")";
            case FIRST -> "(ARRAY_AGG(" + column + " ORDER BY " + idColumn + " ASC))[1]";
            case LAST -> "(ARRAY_AGG(" + column + " ORDER BY " + idColumn + " DESC))[1]";
        };
    }

    private static String quote(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }
}
