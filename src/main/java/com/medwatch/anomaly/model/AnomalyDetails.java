package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a rule action reports about a match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetails {

    private String type;
    private Severity severity;
    private String message;
    private String description;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @Builder.Default
    private List<String> causes = new ArrayList<>();
}
