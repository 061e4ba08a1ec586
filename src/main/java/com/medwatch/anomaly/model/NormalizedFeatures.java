package com.medwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Ratios scaled against supplied baselines. A ratio is absent when its baseline is.
 */
@Value
@Builder
public class NormalizedFeatures {

    Double stockLevel;
    Double relativePrice;
    Double relativeDemand;
}
