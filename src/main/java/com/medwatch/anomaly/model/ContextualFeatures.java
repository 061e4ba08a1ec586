package com.medwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContextualFeatures {

    double locationRisk;
    boolean metroCity;
    String medicineCategory;
    boolean criticalMedicine;
    double seasonalFactor;
    boolean highDemandSeason;
}
