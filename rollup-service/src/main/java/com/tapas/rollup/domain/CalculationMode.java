package com.tapas.rollup.domain;

/**
 * When a rollup definition is recalculated. Only {@link #REALTIME} definitions take part
 * in change-driven recalculation.
 */
public enum CalculationMode {
    REALTIME,
    SCHEDULED,
    DEVELOPER
}
