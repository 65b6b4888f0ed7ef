package com.tapas.rollup.service;

/**
 * Grouping key shared by all definitions that can be answered by one filtered child query.
 */
public record ContextKey(String parentType, String relationshipField, String relationshipCriteria) {

    public static ContextKey of(String parentType, String relationshipField, String relationshipCriteria) {
        String criteria = relationshipCriteria == null || relationshipCriteria.isBlank()
                ? null
                : relationshipCriteria.trim();
        return new ContextKey(parentType, relationshipField, criteria);
    }
}
