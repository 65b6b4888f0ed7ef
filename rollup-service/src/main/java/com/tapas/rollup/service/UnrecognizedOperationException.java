package com.tapas.rollup.service;

public class UnrecognizedOperationException extends RollupConfigurationException {

    public UnrecognizedOperationException(String label) {
        super("Unrecognized aggregate operation '" + label + "'");
    }
}
