package com.medwatch.anomaly.service;

import com.medwatch.anomaly.engine.rules.RuleEngine;
import com.medwatch.anomaly.engine.rules.sets.ShortageRuleSet;
import com.medwatch.anomaly.exception.InvalidRuleException;
import com.medwatch.anomaly.exception.RuleNotFoundException;
import com.medwatch.anomaly.model.*;
import com.medwatch.anomaly.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleServiceTest {

    private RuleEngine engine;
    private RuleService service;

    @BeforeEach
    void setUp() {
        engine = new RuleEngine(List.of(new ShortageRuleSet()), Tracer.NOOP,
                TestDataFactory.metrics(), TestDataFactory.fixedClock());
        service = new RuleService(engine);
    }

    private static RuleDefinition definition(String id, String expression) {
        return RuleDefinition.builder()
                .id(id)
                .name("Low stock " + id)
                .category("shortage")
                .severity(Severity.HIGH)
                .expression(expression)
                .message("{medicineName} low at {location}")
                .build();
    }

    @Test
    void getAllRules_listsBuiltInRules() {
        assertThat(service.getAllRules()).extracting(RuleStats::getRuleId)
                .contains("complete-stockout", "critical-stock-depletion");
    }

    @Test
    void getRule_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> service.getRule("nope")).isInstanceOf(RuleNotFoundException.class);
    }

    @Test
    void createRule_registersExpressionRuleThatMatches() {
        RuleStats created = service.createRule(definition("custom-low", "currentStock < 100 && location == \"Delhi\""));

        assertThat(created.getRuleId()).isEqualTo("custom-low");
        assertThat(created.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(created.isEnabled()).isTrue();

        DataPoint dp = TestDataFactory.createHealthyDataPoint("DP-1", "Insulin", "Delhi").toBuilder()
                .currentStock(80.0)
                .build();
        List<RuleMatch> matches = engine.evaluate(TestDataFactory.enrich(dp));

        assertThat(matches).extracting(RuleMatch::getRuleId).containsExactly("custom-low");
        AnomalyDetails anomaly = matches.get(0).getAnomaly();
        assertThat(anomaly.getType()).isEqualTo("shortage");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getMessage()).isEqualTo("Insulin low at Delhi");
    }

    @Test
    void createRule_appliesDefaults() {
        RuleDefinition def = RuleDefinition.builder()
                .name("Empty shelf")
                .expression("currentStock == 0")
                .build();

        RuleStats created = service.createRule(def);

        assertThat(created.getRuleId()).isNotBlank();
        assertThat(created.getCategory()).isEqualTo("custom");
        assertThat(created.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void createRule_withoutConditionOrExpression_isRejected() {
        RuleDefinition def = RuleDefinition.builder().id("R-1").name("Nothing").build();

        assertThatThrownBy(() -> service.createRule(def))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("needs a condition or an expression");
    }

    @Test
    void createRule_malformedExpression_isRejected() {
        assertThatThrownBy(() -> service.createRule(definition("R-BAD", "currentStock < ")))
                .isInstanceOf(InvalidRuleException.class);
        assertThatThrownBy(() -> service.getRule("R-BAD")).isInstanceOf(RuleNotFoundException.class);
    }

    @Test
    void enableAndDisable_toggleRule() {
        assertThat(service.disableRule("complete-stockout").isEnabled()).isFalse();

        List<RuleMatch> matches = engine.evaluate(
                TestDataFactory.enrich(TestDataFactory.createStockoutDataPoint("DP-1")));
        assertThat(matches).isEmpty();

        assertThat(service.enableRule("complete-stockout").isEnabled()).isTrue();
    }

    @Test
    void unknownRule_operationsThrowNotFound() {
        assertThatThrownBy(() -> service.enableRule("nope")).isInstanceOf(RuleNotFoundException.class);
        assertThatThrownBy(() -> service.disableRule("nope")).isInstanceOf(RuleNotFoundException.class);
        assertThatThrownBy(() -> service.deleteRule("nope")).isInstanceOf(RuleNotFoundException.class);
    }

    @Test
    void deleteRule_removesFromRegistry() {
        service.deleteRule("complete-stockout");

        assertThatThrownBy(() -> service.getRule("complete-stockout")).isInstanceOf(RuleNotFoundException.class);
    }
}
