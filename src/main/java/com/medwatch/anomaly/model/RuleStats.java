package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Run-time statistics of a registered detection rule")
public class RuleStats {

    private String ruleId;
    private String name;
    private String category;
    private Severity severity;
    private boolean enabled;
    private long executions;
    private long matches;

    @Schema(description = "Average condition evaluation time in milliseconds")
    private double averageExecutionTimeMs;

    @Schema(description = "Epoch millis of the last evaluation, null if never evaluated")
    private Long lastExecuted;

    @Schema(description = "matches / executions x 100, 0 when never evaluated")
    private double successRate;
}
