package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeRequest {

    @Schema(description = "Who acknowledged the alert", example = "ops.oncall")
    private String acknowledgedBy;
}
