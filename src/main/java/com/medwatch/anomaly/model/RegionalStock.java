package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionalStock {

    private String location;
    private Double currentStock;
    private Double criticalThreshold;

    public boolean isShort() {
        return currentStock != null && criticalThreshold != null && currentStock <= criticalThreshold;
    }
}
