package com.tapas.rollup.repository;

import com.tapas.rollup.domain.CalculationMode;
import com.tapas.rollup.domain.RollupDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RollupDefinitionRepository extends JpaRepository<RollupDefinition, Long> {

    @Query("""
            SELECT d FROM RollupDefinition d
            WHERE lower(d.childObject) = lower(:childObject)
              AND d.active = true
              AND d.calculationMode = :mode
            ORDER BY d.id
            """)
    List<RollupDefinition> findActive(
            @Param("childObject") String childObject,
            @Param("mode") CalculationMode mode);
}
