package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleMatch {

    private String ruleId;
    private String ruleName;
    private String category;
    private AnomalyDetails anomaly;

    public Severity getSeverity() {
        return anomaly != null ? anomaly.getSeverity() : null;
    }
}
