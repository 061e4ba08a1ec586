package com.medwatch.anomaly.service;

import com.medwatch.anomaly.engine.rules.DetectionRule;
import com.medwatch.anomaly.engine.rules.RuleEngine;
import com.medwatch.anomaly.engine.rules.TemplateAction;
import com.medwatch.anomaly.engine.rules.condition.ExpressionCondition;
import com.medwatch.anomaly.engine.rules.condition.RuleCondition;
import com.medwatch.anomaly.exception.InvalidRuleException;
import com.medwatch.anomaly.exception.RuleNotFoundException;
import com.medwatch.anomaly.model.RuleDefinition;
import com.medwatch.anomaly.model.RuleStats;
import com.medwatch.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service layer for run-time rule management on top of the {@link RuleEngine} registry.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleEngine ruleEngine;

    public RuleService(RuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    public List<RuleStats> getAllRules() {
        return new ArrayList<>(ruleEngine.getRuleStats().values());
    }

    public RuleStats getRule(String ruleId) {
        RuleStats stats = ruleEngine.getRuleStats().get(ruleId);
        if (stats == null) {
            throw new RuleNotFoundException(ruleId);
        }
        return stats;
    }

    /**
     * Register a declarative rule. Its action reports an anomaly of the rule's category and
     * severity with the rendered message.
     *
     * @throws InvalidRuleException if the definition is incomplete or the condition is malformed
     */
    public RuleStats createRule(RuleDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            definition.setId(UUID.randomUUID().toString());
        }
        RuleCondition condition = definition.getCondition();
        if (condition == null) {
            if (definition.getExpression() == null || definition.getExpression().isBlank()) {
                throw new InvalidRuleException("Rule " + definition.getId() + " needs a condition or an expression");
            }
            condition = new ExpressionCondition(definition.getExpression());
        }
        String category = definition.getCategory() != null ? definition.getCategory() : "custom";
        Severity severity = definition.getSeverity() != null ? definition.getSeverity() : Severity.MEDIUM;
        String message = definition.getMessage() != null ? definition.getMessage() : definition.getName();

        DetectionRule rule = DetectionRule.builder()
                .id(definition.getId())
                .name(definition.getName())
                .description(definition.getDescription())
                .category(category)
                .severity(severity)
                .condition(condition)
                .action(new TemplateAction(category, severity, message, definition.getDescription()))
                .enabled(definition.isEnabled())
                .build();

        ruleEngine.addRule(rule);
        log.info("Created rule {} ({}, severity={})", rule.getId(), rule.getName(), severity.label());
        return getRule(rule.getId());
    }

    public RuleStats enableRule(String ruleId) {
        if (!ruleEngine.enableRule(ruleId)) {
            throw new RuleNotFoundException(ruleId);
        }
        return getRule(ruleId);
    }

    public RuleStats disableRule(String ruleId) {
        if (!ruleEngine.disableRule(ruleId)) {
            throw new RuleNotFoundException(ruleId);
        }
        return getRule(ruleId);
    }

    public void deleteRule(String ruleId) {
        if (!ruleEngine.removeRule(ruleId)) {
            throw new RuleNotFoundException(ruleId);
        }
    }
}
