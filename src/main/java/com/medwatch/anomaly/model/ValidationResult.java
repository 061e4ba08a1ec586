package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of validating a data point")
public class ValidationResult {

    @Schema(description = "True when no errors were found")
    private boolean valid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Schema(description = "Non-fatal findings such as short historical series")
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
