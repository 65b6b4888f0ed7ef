package com.tapas.rollup.service;

import com.tapas.rollup.domain.RollupDefinition;

import java.util.List;

/**
 * Source of rollup definitions. Implementations return only active definitions that are
 * recalculated in real time for the given child type.
 */
public interface RollupDefinitionLookup {

    List<RollupDefinition> definitionsFor(String childType);
}
