package com.medwatch.anomaly.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * A validated data point together with the feature groups derived from it.
 * Built once per batch and never mutated afterwards.
 */
@Value
@Builder
public class EnrichedDataPoint {

    DataPoint dataPoint;
    ZonedDateTime observedAt;
    DerivedFeatures derived;
    TemporalFeatures temporal;
    NormalizedFeatures normalized;
    ContextualFeatures contextual;

    @Singular
    List<String> warnings;

    public String getId() {
        return dataPoint.getId();
    }
}
