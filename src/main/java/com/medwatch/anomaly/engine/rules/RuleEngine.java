package com.medwatch.anomaly.engine.rules;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.exception.InvalidRuleException;
import com.medwatch.anomaly.exception.RuleEvaluationException;
import com.medwatch.anomaly.model.AnomalyDetails;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.RuleMatch;
import com.medwatch.anomaly.model.RuleStats;
import com.medwatch.anomaly.model.Severity;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of detection rules. Evaluates every enabled rule against a data point and
 * keeps per-rule execution statistics.
 *
 * Built-in rules come from the {@link RuleSet} beans and are registered on construction;
 * a malformed built-in rule fails startup.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    // Guarded by itself. Insertion order is evaluation order.
    private final Map<String, RegisteredRule> rules = new LinkedHashMap<>();
    private final RuleHelpers helpers = new RuleHelpers();
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RuleEngine(List<RuleSet> ruleSets, Tracer tracer, MetricsConfig metricsConfig, Clock clock) {
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (RuleSet ruleSet : ruleSets) {
            for (DetectionRule rule : ruleSet.getRules()) {
                addRule(rule);
            }
            log.info("Registered rule set: {} ({} rules)", ruleSet.getName(), ruleSet.getRules().size());
        }
    }

    /**
     * Register a rule with zeroed statistics.
     *
     * @throws InvalidRuleException if id, name, condition or action is missing, the condition
     *                              is malformed, or the id is already registered
     */
    public void addRule(DetectionRule rule) {
        if (rule == null) throw new InvalidRuleException("Rule is required");
        if (isBlank(rule.getId())) throw new InvalidRuleException("Rule id is required");
        if (isBlank(rule.getName())) throw new InvalidRuleException("Rule " + rule.getId() + " has no name");
        if (rule.getCondition() == null) throw new InvalidRuleException("Rule " + rule.getId() + " has no condition");
        if (rule.getAction() == null) throw new InvalidRuleException("Rule " + rule.getId() + " has no action");
        rule.getCondition().validate();

        synchronized (rules) {
            if (rules.containsKey(rule.getId())) {
                throw new InvalidRuleException("Rule already registered: " + rule.getId());
            }
            rules.put(rule.getId(), new RegisteredRule(rule));
        }
        log.debug("Registered rule: {} ({})", rule.getId(), rule.getName());
    }

    public boolean removeRule(String ruleId) {
        synchronized (rules) {
            boolean removed = rules.remove(ruleId) != null;
            if (removed) log.info("Removed rule: {}", ruleId);
            return removed;
        }
    }

    public boolean enableRule(String ruleId) {
        return setEnabled(ruleId, true);
    }

    public boolean disableRule(String ruleId) {
        return setEnabled(ruleId, false);
    }

    public Optional<DetectionRule> getRule(String ruleId) {
        synchronized (rules) {
            RegisteredRule registered = rules.get(ruleId);
            return registered != null ? Optional.of(registered.rule) : Optional.empty();
        }
    }

    public boolean isEnabled(String ruleId) {
        synchronized (rules) {
            RegisteredRule registered = rules.get(ruleId);
            return registered != null && registered.enabled;
        }
    }

    /**
     * Evaluate every enabled rule against the data point. A rule that throws is logged
     * and skipped, the remaining rules are still evaluated.
     *
     * @return one match per rule whose condition held, in registration order
     */
    @Observed(name = "rules.evaluate", contextualName = "evaluate-rules")
    public List<RuleMatch> evaluate(EnrichedDataPoint dataPoint) {
        RuleContext context = new RuleContext(dataPoint, helpers);
        List<RuleMatch> matches = new ArrayList<>();

        for (RegisteredRule registered : snapshot()) {
            if (!registered.enabled) {
                continue;
            }
            DetectionRule rule = registered.rule;

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getId())
                    .tag("rule.id", rule.getId())
                    .tag("rule.category", String.valueOf(rule.getCategory()))
                    .start();

            long start = System.nanoTime();
            boolean recorded = false;
            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                boolean matched = rule.getCondition().matches(context);
                registered.stats.record(elapsedMs(start), matched, clock.millis());
                recorded = true;
                ruleSpan.tag("rule.matched", String.valueOf(matched));

                if (matched) {
                    matches.add(buildMatch(rule, context));
                    metricsConfig.recordRuleTriggered(String.valueOf(rule.getCategory()));
                    log.debug("Rule matched: {} for {} at {}", rule.getName(),
                            dataPoint.getDataPoint().getMedicineName(), dataPoint.getDataPoint().getLocation());
                }
            } catch (RuntimeException e) {
                if (!recorded) {
                    registered.stats.record(elapsedMs(start), false, clock.millis());
                }
                ruleSpan.error(e);
                RuleEvaluationException failure = new RuleEvaluationException(rule.getId(), e);
                log.error("Error evaluating rule {} for data point {}: {}",
                        rule.getId(), dataPoint.getId(), failure.getMessage(), failure);
                // One failing rule must not block the others
            } finally {
                ruleSpan.end();
            }
        }

        return matches;
    }

    /**
     * Statistics of every registered rule keyed by rule id.
     */
    public Map<String, RuleStats> getRuleStats() {
        Map<String, RuleStats> stats = new LinkedHashMap<>();
        for (RegisteredRule registered : snapshot()) {
            stats.put(registered.rule.getId(), registered.stats.snapshot(registered.rule, registered.enabled));
        }
        return stats;
    }

    public int getRuleCount() {
        synchronized (rules) {
            return rules.size();
        }
    }

    private RuleMatch buildMatch(DetectionRule rule, RuleContext context) {
        AnomalyDetails details = rule.getAction().apply(context);
        if (details == null) {
            throw new RuleEvaluationException("Rule " + rule.getId() + " action returned no details");
        }
        if (details.getType() == null) details.setType(rule.getCategory());
        if (details.getSeverity() == null) {
            details.setSeverity(rule.getSeverity() != null ? rule.getSeverity() : Severity.MEDIUM);
        }
        if (details.getMessage() == null) details.setMessage(rule.getName());

        return RuleMatch.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .category(rule.getCategory())
                .anomaly(details)
                .build();
    }

    private boolean setEnabled(String ruleId, boolean enabled) {
        synchronized (rules) {
            RegisteredRule registered = rules.get(ruleId);
            if (registered == null) return false;
            registered.enabled = enabled;
            log.info("Rule {} {}", ruleId, enabled ? "enabled" : "disabled");
            return true;
        }
    }

    private List<RegisteredRule> snapshot() {
        synchronized (rules) {
            return new ArrayList<>(rules.values());
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class RegisteredRule {
        final DetectionRule rule;
        final RuleStatistics stats = new RuleStatistics();
        volatile boolean enabled;

        RegisteredRule(DetectionRule rule) {
            this.rule = rule;
            this.enabled = rule.isEnabled();
        }
    }
}
