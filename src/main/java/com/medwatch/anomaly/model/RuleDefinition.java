package com.medwatch.anomaly.model;

import com.medwatch.anomaly.engine.rules.condition.RuleCondition;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Declarative detection rule registered at run time")
public class RuleDefinition {

    @Schema(description = "Rule id. Generated when absent.", example = "low-insulin-delhi")
    private String id;

    @Schema(example = "Low insulin stock in Delhi")
    private String name;

    private String description;

    @Schema(example = "shortage")
    private String category;

    @Schema(example = "high")
    private Severity severity;

    @Schema(description = "Condition as an expression string. Used when condition is absent.",
            example = "medicineName == 'Insulin' && currentStock < 100")
    private String expression;

    @Schema(description = "Structured condition tree (comparison, logical, not, expression)")
    private RuleCondition condition;

    @Schema(description = "Anomaly message; {field.path} placeholders are filled from the data point",
            example = "Insulin stock at {location} is {currentStock}")
    private String message;

    @Builder.Default
    private boolean enabled = true;
}
