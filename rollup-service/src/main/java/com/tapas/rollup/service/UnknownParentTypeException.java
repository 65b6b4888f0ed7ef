package com.tapas.rollup.service;

public class UnknownParentTypeException extends RollupConfigurationException {

    public UnknownParentTypeException(String definitionName, String parentType) {
        super("Rollup '" + definitionName + "' references unknown parent type '" + parentType + "'");
    }
}
