package com.tapas.rollup.service;

import com.tapas.rollup.domain.RollupDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tapas.rollup.RollupFixtures.definition;
import static com.tapas.rollup.RollupFixtures.opportunityCount;
import static com.tapas.rollup.RollupFixtures.revenueSum;
import static com.tapas.rollup.RollupFixtures.salesSchemaResolver;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RollupContextGrouperTest {

    private final RollupContextGrouper grouper = new RollupContextGrouper(salesSchemaResolver());

    @Test
    void sameParentRelationshipAndCriteria_shareOneContext() {
        var contexts = grouper.group(List.of(revenueSum(), opportunityCount()), "Opportunity");

        assertThat(contexts).hasSize(1);
        AggregationContext context = contexts.values().iterator().next();
        assertThat(context.key()).isEqualTo(new ContextKey("Account", "AccountId", null));
        assertThat(context.parentType().table()).isEqualTo("crm.accounts");
        assertThat(context.childType().name()).isEqualTo("Opportunity");
        assertThat(context.mappings())
                .extracting(m -> m.target().name(), m -> m.source().name(), FieldMapping::operation)
                .containsExactly(
                        tuple("AnnualRevenue", "Amount", AggregateOperation.SUM),
                        tuple("NumberOfOpportunities", "Amount", AggregateOperation.COUNT));
    }

    @Test
    void differentCriteria_produceSeparateContextsInOrder() {
        RollupDefinition won = definition("Won", "Account", "Opportunity", "AccountId", "Amount", "LargestDeal", "Max");
        won.setRelationshipCriteria("stage_name = 'Closed Won'");

        var contexts = grouper.group(List.of(revenueSum(), won, opportunityCount()), "Opportunity");

        assertThat(contexts.keySet()).containsExactly(
                new ContextKey("Account", "AccountId", null),
                new ContextKey("Account", "AccountId", "stage_name = 'Closed Won'"));
        assertThat(contexts.values()).extracting(c -> c.mappings().size()).containsExactly(2, 1);
    }

    @Test
    void blankCriteriaAndNameCasing_normaliseToTheSameKey() {
        RollupDefinition lowerCase = definition("Count", "account", "opportunity", "accountid", "amount",
                "numberofopportunities", "count");
        lowerCase.setRelationshipCriteria("  ");

        var contexts = grouper.group(List.of(revenueSum(), lowerCase), "OPPORTUNITY");

        assertThat(contexts).hasSize(1);
        assertThat(contexts.values().iterator().next().targetFieldNames())
                .containsExactly("AnnualRevenue", "NumberOfOpportunities");
    }

    @Test
    void concatenateDelimiter_isCarriedOnTheMapping() {
        RollupDefinition names = definition("Names", "Account", "Opportunity", "AccountId", "Name",
                "OpportunityNames", "Concatenate");
        names.setConcatenateDelimiter("; ");

        FieldMapping mapping = grouper.group(List.of(names), "Opportunity").values().iterator().next().mappings().get(0);

        assertThat(mapping.delimiter()).isEqualTo("; ");
    }

    @Test
    void unknownParentType_throws() {
        var definition = definition("Bad", "Contract", "Opportunity", "AccountId", "Amount", "AnnualRevenue", "Sum");

        assertThatThrownBy(() -> grouper.group(List.of(revenueSum(), definition), "Opportunity"))
                .isInstanceOf(UnknownParentTypeException.class)
                .hasMessageContaining("Contract");
    }

    @Test
    void unresolvableFields_throwInvalidDefinition() {
        var badRelationship = definition("Bad", "Account", "Opportunity", "OwnerId", "Amount", "AnnualRevenue", "Sum");
        var badSource = definition("Bad", "Account", "Opportunity", "AccountId", "Probability", "AnnualRevenue", "Sum");
        var badTarget = definition("Bad", "Account", "Opportunity", "AccountId", "Amount", "Rating", "Sum");

        for (RollupDefinition definition : List.of(badRelationship, badSource, badTarget)) {
            assertThatThrownBy(() -> grouper.group(List.of(definition), "Opportunity"))
                    .isInstanceOf(InvalidRollupDefinitionException.class);
        }
    }

    @Test
    void unknownChildType_throwsInvalidDefinition() {
        assertThatThrownBy(() -> grouper.group(List.of(revenueSum()), "Lead"))
                .isInstanceOf(InvalidRollupDefinitionException.class)
                .hasMessageContaining("Lead");
    }

    @Test
    void unrecognizedOperation_throws() {
        var definition = definition("Bad", "Account", "Opportunity", "AccountId", "Amount", "AnnualRevenue", "Median");

        assertThatThrownBy(() -> grouper.group(List.of(definition), "Opportunity"))
                .isInstanceOf(UnrecognizedOperationException.class);
    }

    @Test
    void result_isUnmodifiable() {
        var contexts = grouper.group(List.of(revenueSum()), "Opportunity");

        assertThatThrownBy(contexts::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void noDefinitions_noContexts() {
        assertThat(grouper.group(List.of(), "Unknown")).isEmpty();
    }
}
