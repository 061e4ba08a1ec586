package com.medwatch.anomaly.engine.rules;

import com.medwatch.anomaly.engine.rules.condition.RuleCondition;
import com.medwatch.anomaly.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRule {

    private String id;
    private String name;
    private String description;
    private String category;
    private Severity severity;
    private RuleCondition condition;
    private RuleAction action;

    @Builder.Default
    private boolean enabled = true;
}
