package com.tapas.rollup.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Declarative rule describing one aggregation from a child field to a parent field
 * through a relationship field on the child.
 */
@Getter
@Setter
@Entity
@Table(name = "rollup_definitions", schema = "rollup")
public class RollupDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "parent_object", nullable = false)
    private String parentObject;

    @Column(name = "child_object", nullable = false)
    private String childObject;

    @Column(name = "relationship_field", nullable = false)
    private String relationshipField;

    @Column(name = "relationship_criteria")
    private String relationshipCriteria;

    @Column(name = "field_to_aggregate", nullable = false)
    private String fieldToAggregate;

    @Column(name = "aggregate_result_field", nullable = false)
    private String aggregateResultField;

    @Column(name = "aggregate_operation", nullable = false)
    private String aggregateOperation; // display label, e.g. "Sum"

    @Column(name = "concatenate_delimiter")
    private String concatenateDelimiter;

    @Enumerated(EnumType.STRING)
    @Column(name = "calculation_mode", nullable = false)
    private CalculationMode calculationMode = CalculationMode.REALTIME;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Override
    public String toString() {
        return "RollupDefinition[" + name + ": " + parentObject + "." + aggregateResultField
                + " = " + aggregateOperation + "(" + childObject + "." + fieldToAggregate + ")]";
    }
}
