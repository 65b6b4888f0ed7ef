package com.tapas.rollup.api;

import com.tapas.rollup.domain.RollupDefinition;

public record RollupDefinitionResponse(
        Long id,
        String name,
        String parentObject,
        String childObject,
        String relationshipField,
        String relationshipCriteria,
        String fieldToAggregate,
        String aggregateResultField,
        String aggregateOperation
) {
    public static RollupDefinitionResponse from(RollupDefinition definition) {
        return new RollupDefinitionResponse(
                definition.getId(),
                definition.getName(),
                definition.getParentObject(),
                definition.getChildObject(),
                definition.getRelationshipField(),
                definition.getRelationshipCriteria(),
                definition.getFieldToAggregate(),
                definition.getAggregateResultField(),
                definition.getAggregateOperation()
        );
    }
}
