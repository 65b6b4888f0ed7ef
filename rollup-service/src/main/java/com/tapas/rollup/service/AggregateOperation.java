package com.tapas.rollup.service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate operations understood by the aggregation engine, keyed by the label stored
 * on rollup definitions.
 */
public enum AggregateOperation {
    SUM("Sum"),
    COUNT("Count"),
    COUNT_DISTINCT("Count Distinct"),
    MIN("Min"),
    MAX("Max"),
    AVG("Avg"),
    CONCATENATE("Concatenate"),
    CONCATENATE_DISTINCT("Concatenate Distinct"),
    FIRST("First"),
    LAST("Last");

    private static final Map<String, AggregateOperation> BY_LABEL = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        for (AggregateOperation op : values()) {
            BY_LABEL.put(op.label, op);
        }
    }

    private final String label;

    AggregateOperation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isConcatenation() {
        return this == CONCATENATE || this == CONCATENATE_DISTINCT;
    }

    /**
     * Value of this aggregate over zero qualifying children.
     */
    public Object emptyValue() {
        return switch (this) {
            case SUM, COUNT, COUNT_DISTINCT -> 0L;
            default -> null;
        };
    }

    public static AggregateOperation fromLabel(String label) {
        AggregateOperation op = label == null ? null : BY_LABEL.get(label.trim());
        if (op == null) {
            throw new UnrecognizedOperationException(label);
        }
        return op;
    }
}
