package com.medwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Features computed directly from a data point's own fields and histories.
 * Values are null when the inputs they depend on are absent.
 */
@Value
@Builder
public class DerivedFeatures {

    Double stockRatio;
    boolean lowStock;
    boolean needsReorder;

    Double priceDeviation;
    boolean priceAnomaly;

    Double stockTrend;
    Double priceTrend;
    Double demandTrend;
    Double stockVolatility;
    Double priceVolatility;
    Double demandVolatility;

    Long daysSinceLastDelivery;
    boolean deliveryOverdue;

    Long daysToExpiry;
    boolean nearExpiry;
    boolean expired;
}
