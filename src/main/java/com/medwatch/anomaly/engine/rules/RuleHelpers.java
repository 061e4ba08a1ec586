package com.medwatch.anomaly.engine.rules;

import com.medwatch.anomaly.engine.feature.SeriesStatistics;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Helper predicates and calculations available to rule conditions and actions.
 */
public class RuleHelpers {

    public boolean isWithinRange(double value, double min, double max) {
        return value >= min && value <= max;
    }

    public boolean isOutsideRange(double value, double min, double max) {
        return value < min || value > max;
    }

    /**
     * Percentage change from previous to current, 0 when previous is 0.
     */
    public double percentageChange(double current, double previous) {
        if (previous == 0) return 0.0;
        return ((current - previous) / previous) * 100.0;
    }

    /** Absolute number of whole days between two instants. */
    public long daysBetween(ZonedDateTime a, ZonedDateTime b) {
        return Math.abs(ChronoUnit.DAYS.between(a, b));
    }

    public boolean isWeekend(ZonedDateTime time) {
        DayOfWeek day = time.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /** Mean of the last {@code window} values, or null when fewer are available. */
    public Double movingAverage(List<Double> values, int window) {
        return SeriesStatistics.movingAverage(values, window);
    }
}
