package com.medwatch.anomaly.engine.feature;

import java.util.List;

/**
 * Small numeric helpers over historical series (most recent value last).
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static List<Double> trailing(List<Double> series, int window) {
        if (series == null) return List.of();
        int from = Math.max(0, series.size() - window);
        return series.subList(from, series.size());
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (Double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Population standard deviation. */
    public static double stdDev(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (Double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.size());
    }

    /** Standard deviation over mean, 0 when the mean is not positive. */
    public static double coefficientOfVariation(List<Double> values) {
        double mean = mean(values);
        if (mean <= 0) return 0.0;
        return stdDev(values) / mean;
    }

    /**
     * Ordinary least squares slope of the values against their indices 0..n-1.
     */
    public static double slope(List<Double> values) {
        int n = values.size();
        if (n < 2) return 0.0;
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        if (denominator == 0) return 0.0;
        return (n * sumXY - sumX * sumY) / denominator;
    }

    /**
     * Mean of the last {@code window} values, or null when fewer are available.
     */
    public static Double movingAverage(List<Double> values, int window) {
        if (values == null || window <= 0 || values.size() < window) return null;
        return mean(trailing(values, window));
    }
}
