package com.tapas.rollup.repository;

import com.tapas.rollup.domain.CalculationMode;
import com.tapas.rollup.domain.RollupDefinition;
import com.tapas.rollup.service.RollupDefinitionLookup;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
public class JpaRollupDefinitionLookup implements RollupDefinitionLookup {

    private final RollupDefinitionRepository repository;

    public JpaRollupDefinitionLookup(RollupDefinitionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RollupDefinition> definitionsFor(String childType) {
        if (childType == null || childType.isBlank()) {
            return List.of();
        }
        return repository.findActive(childType.trim(), CalculationMode.REALTIME);
    }
}
