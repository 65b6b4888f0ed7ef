package com.tapas.rollup.api;

import com.tapas.rollup.domain.ChildRecord;
import com.tapas.rollup.domain.ParentRecord;
import com.tapas.rollup.service.ContextKey;
import com.tapas.rollup.service.InvalidRollupDefinitionException;
import com.tapas.rollup.service.RollupDefinitionLookup;
import com.tapas.rollup.service.RollupResult;
import com.tapas.rollup.service.RollupUpdateService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.tapas.rollup.RollupFixtures.revenueSum;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RollupController.class)
class RollupControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RollupUpdateService updateService;

    @MockBean
    private RollupDefinitionLookup definitionLookup;

    @Captor
    private ArgumentCaptor<List<ChildRecord>> records;

    @Test
    void recalculate_returnsMergedParents() throws Exception {
        var parent = new ParentRecord("Account", "A1", Map.of("AnnualRevenue", new BigDecimal("250")));
        when(updateService.recalculate(anyList(), eq(false)))
                .thenReturn(new RollupResult(List.of(parent), List.of(new ContextKey("Account", "AccountId", null))));

        mockMvc.perform(post("/api/rollups/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"childType": "Opportunity",
                                 "records": [
                                   {"id": "O1", "fields": {"AccountId": "A1", "Amount": 100}},
                                   {"id": "O2", "fields": {"AccountId": "A1", "Amount": 150}}
                                 ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contexts").value(1))
                .andExpect(jsonPath("$.persisted").value(false))
                .andExpect(jsonPath("$.parents[0].id").value("A1"))
                .andExpect(jsonPath("$.parents[0].fields.AnnualRevenue").value(250));

        verify(updateService).recalculate(records.capture(), eq(false));
        assertThat(records.getValue()).extracting(ChildRecord::type).containsOnly("Opportunity");
        assertThat(records.getValue()).extracting(ChildRecord::id).containsExactly("O1", "O2");
    }

    @Test
    void recalculate_missingChildType_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rollups/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void recalculate_nullRecord_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rollups/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childType\": \"Opportunity\", \"records\": [null]}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(updateService);
    }

    @Test
    void recalculate_misconfiguredRollup_isUnprocessable() throws Exception {
        when(updateService.recalculate(anyList(), anyBoolean()))
                .thenThrow(new InvalidRollupDefinitionException("Rollup 'Revenue' references unknown field 'Probability' on Opportunity"));

        mockMvc.perform(post("/api/rollups/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childType\": \"Opportunity\", \"records\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("InvalidRollupDefinitionException"))
                .andExpect(jsonPath("$.detail").value("Rollup 'Revenue' references unknown field 'Probability' on Opportunity"));
    }

    @Test
    void applyChange_reportsUpdatedParents() throws Exception {
        when(updateService.applyChanges(anyList(), eq(true))).thenReturn(3);

        mockMvc.perform(post("/api/rollups/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"childType": "Opportunity", "phase": "AFTER", "operation": "DELETE",
                                 "previousRecords": [{"id": "O1", "fields": {"AccountId": "A1"}}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parentsUpdated").value(3));
    }

    @Test
    void applyChange_missingChildType_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rollups/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"phase": "AFTER", "operation": "INSERT",
                                 "records": [{"id": "O1", "fields": {"AccountId": "A1", "Amount": 100}}]}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(updateService);
    }

    @Test
    void applyChange_missingOperation_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rollups/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"childType": "Opportunity", "phase": "AFTER",
                                 "records": [{"id": "O1", "fields": {"AccountId": "A1", "Amount": 100}}]}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(updateService);
    }

    @Test
    void applyChange_nullPreviousRecord_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rollups/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"childType": "Opportunity", "operation": "DELETE", "previousRecords": [null]}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(updateService);
    }

    @Test
    void definitions_listsActiveDefinitions() throws Exception {
        var definition = revenueSum();
        definition.setId(7L);
        when(definitionLookup.definitionsFor("Opportunity")).thenReturn(List.of(definition));

        mockMvc.perform(get("/api/rollups/definitions").param("childObject", "Opportunity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(7))
                .andExpect(jsonPath("$[0].aggregateResultField").value("AnnualRevenue"))
                .andExpect(jsonPath("$[0].aggregateOperation").value("Sum"));
    }
}
