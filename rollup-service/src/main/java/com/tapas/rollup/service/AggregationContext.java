package com.tapas.rollup.service;

import com.tapas.rollup.schema.EntityType;
import com.tapas.rollup.schema.FieldHandle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One grouped aggregation: a parent type, a relationship field on the child, an optional
 * relationship filter, and the ordered field mappings computed together.
 * Lives for a single recalculation.
 */
public final class AggregationContext {

    private final ContextKey key;
    private final EntityType parentType;
    private final EntityType childType;
    private final FieldHandle relationshipField;
    private final List<FieldMapping> mappings;

    private AggregationContext(Builder builder) {
        this.key = builder.key;
        this.parentType = builder.parentType;
        this.childType = builder.childType;
        this.relationshipField = builder.relationshipField;
        this.mappings = List.copyOf(builder.mappings);
    }

    public ContextKey key() {
        return key;
    }

    public EntityType parentType() {
        return parentType;
    }

    public EntityType childType() {
        return childType;
    }

    public FieldHandle relationshipField() {
        return relationshipField;
    }

    public String relationshipCriteria() {
        return key.relationshipCriteria();
    }

    public List<FieldMapping> mappings() {
        return mappings;
    }

    public Set<String> targetFieldNames() {
        var names = new LinkedHashSet<String>();
        for (FieldMapping mapping : mappings) {
            names.add(mapping.target().name());
        }
        return names;
    }

    @Override
    public String toString() {
        return "AggregationContext[" + key + ", " + mappings.size() + " mappings]";
    }

    public static Builder builder(ContextKey key, EntityType parentType, EntityType childType,
                                  FieldHandle relationshipField) {
        return new Builder(key, parentType, childType, relationshipField);
    }

    public static final class Builder {
        private final ContextKey key;
        private final EntityType parentType;
        private final EntityType childType;
        private final FieldHandle relationshipField;
        private final List<FieldMapping> mappings = new ArrayList<>();

        private Builder(ContextKey key, EntityType parentType, EntityType childType,
                        FieldHandle relationshipField) {
            this.key = key;
            this.parentType = parentType;
            this.childType = childType;
            this.relationshipField = relationshipField;
        }

        public Builder add(FieldMapping mapping) {
            mappings.add(mapping);
            return this;
        }

        public AggregationContext build() {
            return new AggregationContext(this);
        }
    }
}
