package com.tapas.rollup.service;

/**
 * A relationship, aggregated or result field (or the child type itself) does not resolve.
 */
public class InvalidRollupDefinitionException extends RollupConfigurationException {

    public InvalidRollupDefinitionException(String message) {
        super(message);
    }
}
