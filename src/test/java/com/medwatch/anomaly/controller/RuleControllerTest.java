package com.medwatch.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.exception.InvalidRuleException;
import com.medwatch.anomaly.exception.RuleNotFoundException;
import com.medwatch.anomaly.model.RuleDefinition;
import com.medwatch.anomaly.model.RuleStats;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.service.RuleService;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RuleService ruleService;

    @Test
    void listRules_success() throws Exception {
        when(ruleService.getAllRules()).thenReturn(List.of(
                TestDataFactory.createRuleStats("complete-stockout", "Complete Stock Out", true)));

        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].ruleId").value("complete-stockout"))
                .andExpect(jsonPath("$[0].severity").value("critical"));
    }

    @Test
    void getRule_notFound() throws Exception {
        when(ruleService.getRule("MISSING")).thenThrow(new RuleNotFoundException("MISSING"));

        mockMvc.perform(get("/api/v1/rules/MISSING"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Rule not found: MISSING"));
    }

    @Test
    void createRule_success() throws Exception {
        RuleDefinition definition = RuleDefinition.builder()
                .id("R-NEW")
                .name("Low insulin")
                .severity(Severity.HIGH)
                .expression("medicineName == 'Insulin' && currentStock < 20")
                .build();
        when(ruleService.createRule(any(RuleDefinition.class)))
                .thenReturn(TestDataFactory.createRuleStats("R-NEW", "Low insulin", true));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(definition)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ruleId").value("R-NEW"));
    }

    @Test
    void createRule_badRequest_missingName() throws Exception {
        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"expression\":\"currentStock == 0\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("name is required"));
        verifyNoInteractions(ruleService);
    }

    @Test
    void createRule_malformedExpression_returns400() throws Exception {
        when(ruleService.createRule(any(RuleDefinition.class)))
                .thenThrow(new InvalidRuleException("Unexpected end of expression"));

        mockMvc.perform(post("/api/v1/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Broken\",\"expression\":\"currentStock <\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Rule"));
    }

    @Test
    void enableAndDisable() throws Exception {
        when(ruleService.enableRule("R1")).thenReturn(TestDataFactory.createRuleStats("R1", "Rule", true));
        when(ruleService.disableRule("R1")).thenReturn(TestDataFactory.createRuleStats("R1", "Rule", false));

        mockMvc.perform(post("/api/v1/rules/R1/enable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));
        mockMvc.perform(post("/api/v1/rules/R1/disable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void deleteRule_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/rules/R1"))
                .andExpect(status().isNoContent());
        verify(ruleService).deleteRule("R1");
    }

    @Test
    void deleteRule_notFound() throws Exception {
        doThrow(new RuleNotFoundException("MISSING")).when(ruleService).deleteRule("MISSING");

        mockMvc.perform(delete("/api/v1/rules/MISSING"))
                .andExpect(status().isNotFound());
    }
}
