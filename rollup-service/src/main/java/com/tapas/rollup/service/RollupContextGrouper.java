package com.tapas.rollup.service;

import com.tapas.rollup.domain.RollupDefinition;
import com.tapas.rollup.schema.EntityType;
import com.tapas.rollup.schema.FieldHandle;
import com.tapas.rollup.schema.SchemaResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups rollup definitions by (parent type, relationship field, relationship criteria) so
 * that each group is answered by a single aggregation over one filtered child set.
 */
@Component
public class RollupContextGrouper {

    private static final Logger log = LoggerFactory.getLogger(RollupContextGrouper.class);

    private final SchemaResolver schemaResolver;

    public RollupContextGrouper(SchemaResolver schemaResolver) {
        this.schemaResolver = schemaResolver;
    }

    /**
     * Builds one context per distinct grouping key, in the order keys are first seen.
     *
     * @throws UnknownParentTypeException       if a parent type does not resolve
     * @throws InvalidRollupDefinitionException if the child type or any referenced field does not resolve
     * @throws UnrecognizedOperationException   if an operation label has no engine mapping
     */
    public Map<ContextKey, AggregationContext> group(List<RollupDefinition> definitions, String childTypeName) {
        if (definitions.isEmpty()) {
            return Map.of();
        }

        EntityType childType = schemaResolver.resolveType(childTypeName)
                .orElseThrow(() -> new InvalidRollupDefinitionException(
                        "Unknown child type '" + childTypeName + "'"));

        var builders = new LinkedHashMap<ContextKey, AggregationContext.Builder>();
        for (RollupDefinition definition : definitions) {
            EntityType parentType = schemaResolver.resolveType(definition.getParentObject())
                    .orElseThrow(() -> new UnknownParentTypeException(
                            definition.getName(), definition.getParentObject()));

            FieldHandle relationship = requireField(definition, childType, definition.getRelationshipField());
            FieldHandle source = requireField(definition, childType, definition.getFieldToAggregate());
            FieldHandle target = requireField(definition, parentType, definition.getAggregateResultField());
            AggregateOperation operation = AggregateOperation.fromLabel(definition.getAggregateOperation());

            var key = ContextKey.of(parentType.name(), relationship.name(), definition.getRelationshipCriteria());
            builders.computeIfAbsent(key, k -> AggregationContext.builder(k, parentType, childType, relationship))
                    .add(new FieldMapping(target, source, operation, definition.getConcatenateDelimiter()));
        }

        var contexts = new LinkedHashMap<ContextKey, AggregationContext>();
        builders.forEach((key, builder) -> contexts.put(key, builder.build()));

        log.debug("Grouped {} {} definitions into {} contexts", definitions.size(), childType.name(), contexts.size());
        return Collections.unmodifiableMap(contexts);
    }

    private FieldHandle requireField(RollupDefinition definition, EntityType type, String fieldName) {
        return schemaResolver.resolveField(type, fieldName)
                .orElseThrow(() -> new InvalidRollupDefinitionException(
                        "Rollup '" + definition.getName() + "' references unknown field '"
                                + fieldName + "' on " + type.name()));
    }
}
