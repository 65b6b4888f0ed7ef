package com.tapas.rollup.service;

/**
 * A rollup definition cannot be applied as configured. Aborts the whole recalculation.
 */
public class RollupConfigurationException extends RuntimeException {

    public RollupConfigurationException(String message) {
        super(message);
    }
}
