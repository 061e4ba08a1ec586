package com.medwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TemporalFeatures {

    int hour;
    /** ISO day of week, 1 = Monday through 7 = Sunday. */
    int dayOfWeek;
    int dayOfMonth;
    int month;
    int quarter;
    boolean weekend;
    boolean businessHour;
    int weekOfYear;
}
