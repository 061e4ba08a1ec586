package com.medwatch.anomaly.engine.feature;

import com.medwatch.anomaly.config.DetectionConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.exception.DataPointValidationException;
import com.medwatch.anomaly.model.ContextualFeatures;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.DerivedFeatures;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.NormalizedFeatures;
import com.medwatch.anomaly.model.TemporalFeatures;
import com.medwatch.anomaly.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates raw data points and derives the feature groups used by the rule engine
 * and the scoring ensemble.
 *
 * Feature groups:
 *   derived    - ratios against thresholds and market price, trailing-window trend and volatility,
 *                delivery and expiry flags
 *   temporal   - calendar position of the observation
 *   normalized - stock, price and demand scaled against capacity, market and average baselines
 *   contextual - location risk, metro classification, medicine category, seasonal factor
 */
@Component
public class FeatureProcessor {

    private static final Logger log = LoggerFactory.getLogger(FeatureProcessor.class);

    private final DetectionConfig.FeatureThresholds thresholds;
    private final ZoneId zone;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public FeatureProcessor(DetectionConfig config, Clock clock, MetricsConfig metricsConfig) {
        this.thresholds = config.getFeatures();
        this.zone = ZoneId.of(config.getZoneId());
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Check required fields, numeric ranges, timestamp format and history contents.
     * Never mutates the data point.
     */
    public ValidationResult validate(DataPoint dp) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (dp == null) {
            errors.add("Data point is required");
            return ValidationResult.builder().valid(false).errors(errors).warnings(warnings).build();
        }

        if (isBlank(dp.getMedicineName())) errors.add("Missing required field: medicineName");
        if (isBlank(dp.getLocation())) errors.add("Missing required field: location");
        if (dp.getCurrentStock() == null) errors.add("Missing required field: currentStock");
        if (isBlank(dp.getTimestamp())) {
            errors.add("Missing required field: timestamp");
        } else if (TimestampParser.parse(dp.getTimestamp(), zone).isEmpty()) {
            errors.add("Invalid timestamp: " + dp.getTimestamp());
        }

        for (Map.Entry<String, Double> field : numericFields(dp).entrySet()) {
            Double value = field.getValue();
            if (value == null) continue;
            if (value.isNaN() || value.isInfinite()) {
                errors.add(field.getKey() + " must be a finite number");
            } else if (value < 0) {
                errors.add(field.getKey() + " must not be negative");
            }
        }

        checkSeries("stockHistory", dp.getStockHistory(), errors);
        checkSeries("priceHistory", dp.getPriceHistory(), errors);
        checkSeries("demandHistory", dp.getDemandHistory(), errors);
        checkSeries("dailyConsumptionHistory", dp.getDailyConsumptionHistory(), errors);

        int minHistory = thresholds.getMinHistoryForWarning();
        if (dp.getStockHistory() != null && dp.getStockHistory().size() < minHistory) {
            warnings.add("Limited stock history (" + dp.getStockHistory().size()
                    + " samples), detection confidence may be reduced");
        }
        if (dp.getPriceHistory() != null && dp.getPriceHistory().size() < minHistory) {
            warnings.add("Limited price history (" + dp.getPriceHistory().size()
                    + " samples), detection confidence may be reduced");
        }

        return ValidationResult.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    /**
     * Enrich each data point independently. Invalid or failing items are logged and skipped,
     * the rest of the batch is still returned in input order.
     */
    public List<EnrichedDataPoint> preprocess(List<DataPoint> dataPoints) {
        List<EnrichedDataPoint> enriched = new ArrayList<>(dataPoints.size());
        for (DataPoint dp : dataPoints) {
            try {
                enriched.add(enrich(dp));
            } catch (DataPointValidationException e) {
                metricsConfig.recordInvalidDataPoint();
                log.warn("Skipping invalid data point: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to preprocess data point {}: {}",
                        dp != null ? dp.getId() : null, e.getMessage(), e);
            }
        }
        return enriched;
    }

    /**
     * Validate and enrich one data point.
     *
     * @throws DataPointValidationException if validation fails
     */
    public EnrichedDataPoint enrich(DataPoint dp) {
        ValidationResult validation = validate(dp);
        if (!validation.isValid()) {
            throw new DataPointValidationException(dp != null ? dp.getId() : null, validation.getErrors());
        }

        ZonedDateTime observedAt = TimestampParser.parse(dp.getTimestamp(), zone).orElseThrow();
        TemporalFeatures temporal = temporalFeatures(observedAt);

        return EnrichedDataPoint.builder()
                .dataPoint(dp)
                .observedAt(observedAt)
                .derived(derivedFeatures(dp))
                .temporal(temporal)
                .normalized(normalizedFeatures(dp))
                .contextual(contextualFeatures(dp, temporal.getMonth()))
                .warnings(validation.getWarnings())
                .build();
    }

    DerivedFeatures derivedFeatures(DataPoint dp) {
        DerivedFeatures.DerivedFeaturesBuilder b = DerivedFeatures.builder();
        double stock = dp.getCurrentStock();

        Double threshold = dp.getCriticalThreshold();
        if (threshold != null) {
            b.lowStock(stock <= threshold);
            if (threshold > 0) b.stockRatio(stock / threshold);
        }
        if (dp.getReorderPoint() != null) {
            b.needsReorder(stock <= dp.getReorderPoint());
        }

        Double marketPrice = dp.getAverageMarketPrice();
        if (dp.getCurrentPrice() != null && marketPrice != null && marketPrice > 0) {
            double deviation = (dp.getCurrentPrice() - marketPrice) / marketPrice;
            b.priceDeviation(deviation);
            b.priceAnomaly(Math.abs(deviation) > thresholds.getPriceDeviationThreshold());
        }

        int window = thresholds.getTrendWindow();
        List<Double> stock7 = SeriesStatistics.trailing(dp.getStockHistory(), window);
        if (stock7.size() >= 3) {
            b.stockTrend(SeriesStatistics.slope(stock7));
            b.stockVolatility(SeriesStatistics.coefficientOfVariation(stock7));
        }
        List<Double> price7 = SeriesStatistics.trailing(dp.getPriceHistory(), window);
        if (price7.size() >= 3) {
            b.priceTrend(SeriesStatistics.slope(price7));
            b.priceVolatility(SeriesStatistics.coefficientOfVariation(price7));
        }
        List<Double> demand7 = SeriesStatistics.trailing(dp.getDemandHistory(), window);
        if (demand7.size() >= 3) {
            b.demandTrend(SeriesStatistics.slope(demand7));
            b.demandVolatility(SeriesStatistics.coefficientOfVariation(demand7));
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));

        Optional<ZonedDateTime> lastDelivery = TimestampParser.parse(dp.getLastDeliveryDate(), zone);
        if (lastDelivery.isPresent()) {
            long days = ChronoUnit.DAYS.between(lastDelivery.get(), now);
            double interval = dp.getAverageDeliveryInterval() != null && dp.getAverageDeliveryInterval() > 0
                    ? dp.getAverageDeliveryInterval() : thresholds.getDefaultDeliveryIntervalDays();
            b.daysSinceLastDelivery(days);
            b.deliveryOverdue(days > interval * thresholds.getDeliveryOverdueFactor());
        }

        Optional<ZonedDateTime> expiry = TimestampParser.parse(dp.getExpiryDate(), zone);
        if (expiry.isPresent()) {
            long days = ChronoUnit.DAYS.between(now, expiry.get());
            b.daysToExpiry(days);
            b.nearExpiry(days > 0 && days <= thresholds.getNearExpiryDays());
            b.expired(days <= 0);
        }

        return b.build();
    }

    TemporalFeatures temporalFeatures(ZonedDateTime t) {
        DayOfWeek day = t.getDayOfWeek();
        int hour = t.getHour();
        return TemporalFeatures.builder()
                .hour(hour)
                .dayOfWeek(day.getValue())
                .dayOfMonth(t.getDayOfMonth())
                .month(t.getMonthValue())
                .quarter((t.getMonthValue() - 1) / 3 + 1)
                .weekend(day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)
                .businessHour(hour >= 9 && hour <= 17)
                .weekOfYear(t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .build();
    }

    NormalizedFeatures normalizedFeatures(DataPoint dp) {
        NormalizedFeatures.NormalizedFeaturesBuilder b = NormalizedFeatures.builder();
        if (dp.getMaxCapacity() != null && dp.getMaxCapacity() > 0) {
            b.stockLevel(Math.min(dp.getCurrentStock() / dp.getMaxCapacity(), 1.0));
        }
        if (dp.getCurrentPrice() != null && dp.getAverageMarketPrice() != null && dp.getAverageMarketPrice() > 0) {
            b.relativePrice(dp.getCurrentPrice() / dp.getAverageMarketPrice());
        }
        if (dp.getCurrentDemand() != null && dp.getAverageDemand() != null && dp.getAverageDemand() > 0) {
            b.relativeDemand(dp.getCurrentDemand() / dp.getAverageDemand());
        }
        return b.build();
    }

    ContextualFeatures contextualFeatures(DataPoint dp, int month) {
        double seasonalFactor = 1.0;
        if (dp.getSeasonalFactors() != null) {
            Double factor = dp.getSeasonalFactors().get(month);
            if (factor != null) seasonalFactor = factor;
        }
        return ContextualFeatures.builder()
                .locationRisk(MedicineContext.locationRisk(dp.getLocation()))
                .metroCity(MedicineContext.isMetro(dp.getLocation()))
                .medicineCategory(MedicineContext.category(dp.getMedicineName()))
                .criticalMedicine(MedicineContext.isCriticalMedicine(dp.getMedicineName()))
                .seasonalFactor(seasonalFactor)
                .highDemandSeason(seasonalFactor > thresholds.getHighDemandSeasonFactor())
                .build();
    }

    private static Map<String, Double> numericFields(DataPoint dp) {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("currentStock", dp.getCurrentStock());
        fields.put("currentPrice", dp.getCurrentPrice());
        fields.put("criticalThreshold", dp.getCriticalThreshold());
        fields.put("reorderPoint", dp.getReorderPoint());
        fields.put("maxCapacity", dp.getMaxCapacity());
        fields.put("averageMarketPrice", dp.getAverageMarketPrice());
        fields.put("maximumRetailPrice", dp.getMaximumRetailPrice());
        fields.put("manufacturingCost", dp.getManufacturingCost());
        fields.put("dailyConsumption", dp.getDailyConsumption());
        fields.put("averageDailyConsumption", dp.getAverageDailyConsumption());
        fields.put("currentDemand", dp.getCurrentDemand());
        fields.put("averageDemand", dp.getAverageDemand());
        fields.put("supplierReliability", dp.getSupplierReliability());
        fields.put("averageDeliveryInterval", dp.getAverageDeliveryInterval());
        fields.put("daysSinceRestock", dp.getDaysSinceRestock());
        return fields;
    }

    private static void checkSeries(String name, List<Double> series, List<String> errors) {
        if (series == null) return;
        for (Double value : series) {
            if (value == null || value.isNaN() || value.isInfinite() || value < 0) {
                errors.add(name + " must contain only non-negative numbers");
                return;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
