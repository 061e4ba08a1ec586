package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.RuleDefinition;
import com.medwatch.anomaly.model.RuleStats;
import com.medwatch.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage detection rules (create, enable/disable, delete) and view rule statistics")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all rules with statistics",
            description = "Executions, matches, average execution time and success rate per rule.")
    @GetMapping
    public ResponseEntity<List<RuleStats>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<RuleStats> getRule(
            @Parameter(description = "Rule ID", example = "complete-stockout")
            @PathVariable String ruleId) {
        return ResponseEntity.ok(ruleService.getRule(ruleId));
    }

    @Operation(summary = "Create a rule",
            description = "Registers a declarative rule given as an expression or a structured condition tree.")
    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody RuleDefinition definition) {
        if (definition.getName() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.createRule(definition));
    }

    @Operation(summary = "Enable a rule")
    @PostMapping("/{ruleId}/enable")
    public ResponseEntity<RuleStats> enableRule(
            @Parameter(description = "Rule ID", example = "price-volatility-alert")
            @PathVariable String ruleId) {
        return ResponseEntity.ok(ruleService.enableRule(ruleId));
    }

    @Operation(summary = "Disable a rule", description = "Disabled rules are skipped without touching their statistics.")
    @PostMapping("/{ruleId}/disable")
    public ResponseEntity<RuleStats> disableRule(
            @Parameter(description = "Rule ID", example = "price-volatility-alert")
            @PathVariable String ruleId) {
        return ResponseEntity.ok(ruleService.disableRule(ruleId));
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "below-cost-pricing")
            @PathVariable String ruleId) {
        ruleService.deleteRule(ruleId);
        return ResponseEntity.noContent().build();
    }
}
