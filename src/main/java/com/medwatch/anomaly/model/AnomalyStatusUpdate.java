package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Review decision for an anomaly")
public class AnomalyStatusUpdate {

    @Schema(description = "New status", example = "investigating")
    private AnomalyStatus status;

    @Schema(description = "Reviewer", example = "pharmacist.delhi")
    private String reviewedBy;
}
