package com.medwatch.anomaly.engine.rules.sets;

import com.medwatch.anomaly.engine.rules.DetectionRule;
import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.engine.rules.RuleSet;
import com.medwatch.anomaly.engine.rules.condition.PredicateCondition;
import com.medwatch.anomaly.model.AnomalyDetails;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RegionalStock;
import com.medwatch.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.medwatch.anomaly.engine.rules.sets.RuleDetails.*;

/**
 * Stock depletion, supply chain, demand, expiry and consumption rules.
 */
@Component
public class ShortageRuleSet implements RuleSet {

    static final double DEFAULT_DAILY_CONSUMPTION = 10.0;
    static final double DEFAULT_DELIVERY_INTERVAL_DAYS = 7.0;

    @Override
    public String getName() {
        return "shortage";
    }

    @Override
    public List<DetectionRule> getRules() {
        return List.of(
                criticalStockDepletion(),
                completeStockout(),
                rapidStockDecline(),
                regionalShortagePattern(),
                supplyChainDisruption(),
                seasonalDemandSpike(),
                expiryDateApproaching(),
                unusualConsumptionPattern()
        );
    }

    DetectionRule criticalStockDepletion() {
        return DetectionRule.builder()
                .id("critical-stock-depletion")
                .name("Critical Stock Depletion")
                .category("shortage")
                .severity(Severity.CRITICAL)
                .description("Stock has fallen to or below the critical threshold")
                .condition(PredicateCondition.of("0 < currentStock <= criticalThreshold", ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    return dp.getCriticalThreshold() != null
                            && dp.getCurrentStock() > 0
                            && dp.getCurrentStock() <= dp.getCriticalThreshold();
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    long daysRemaining = estimatedDaysRemaining(dp);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentStock", dp.getCurrentStock());
                    details.put("criticalThreshold", dp.getCriticalThreshold());
                    details.put("estimatedDaysRemaining", daysRemaining);
                    return AnomalyDetails.builder()
                            .type("shortage")
                            .severity(Severity.CRITICAL)
                            .message(String.format("CRITICAL: %s stock at %s is %s (threshold: %s)",
                                    dp.getMedicineName(), dp.getLocation(),
                                    number(dp.getCurrentStock()), number(dp.getCriticalThreshold())))
                            .description(String.format("Stock for %s at %s is below the critical threshold. "
                                            + "Estimated days remaining: %d.",
                                    dp.getMedicineName(), dp.getLocation(), daysRemaining))
                            .details(details)
                            .causes(causes("critically low stock"))
                            .build();
                })
                .build();
    }

    DetectionRule completeStockout() {
        return DetectionRule.builder()
                .id("complete-stockout")
                .name("Complete Stock Out")
                .category("shortage")
                .severity(Severity.CRITICAL)
                .description("Medicine is completely out of stock")
                .condition(PredicateCondition.of("currentStock == 0",
                        ctx -> ctx.getDataPoint().getCurrentStock() == 0))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Map<String, Object> details = baseDetails(dp);
                    details.put("lastStockDate", orNa(dp.getLastStockDate()));
                    details.put("expectedRestockDate", orNa(dp.getExpectedRestockDate()));
                    return AnomalyDetails.builder()
                            .type("shortage")
                            .severity(Severity.CRITICAL)
                            .message(String.format("STOCKOUT: %s is completely out of stock at %s",
                                    dp.getMedicineName(), dp.getLocation()))
                            .description(String.format("%s at %s has reached zero stock. Last stock date: %s. "
                                            + "Expected restock: %s.",
                                    dp.getMedicineName(), dp.getLocation(),
                                    orNa(dp.getLastStockDate()), orNa(dp.getExpectedRestockDate())))
                            .details(details)
                            .causes(causes("zero stock"))
                            .build();
                })
                .build();
    }

    DetectionRule rapidStockDecline() {
        return DetectionRule.builder()
                .id("rapid-stock-decline")
                .name("Rapid Stock Decline")
                .category("shortage")
                .severity(Severity.HIGH)
                .description("Stock is depleting more than twice as fast as normal consumption")
                .condition(PredicateCondition.of("decline rate over last 3 samples > 2 x normal consumption", ctx -> {
                    Double decline = declineRate(ctx.getDataPoint());
                    return decline != null && decline > normalConsumption(ctx.getDataPoint()) * 2;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double decline = declineRate(dp);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentDeclineRate", decline);
                    details.put("normalConsumptionRate", normalConsumption(dp));
                    details.put("projectedStockoutDate", orNa(dp.getProjectedStockoutDate()));
                    return AnomalyDetails.builder()
                            .type("shortage")
                            .severity(Severity.HIGH)
                            .message(String.format("RAPID DECLINE: %s stock is depleting quickly at %s",
                                    dp.getMedicineName(), dp.getLocation()))
                            .description(String.format("Stock is declining by %s units/day against a normal rate of %s.",
                                    number(decline), number(normalConsumption(dp))))
                            .details(details)
                            .causes(causes("rapid consumption increase"))
                            .build();
                })
                .build();
    }

    DetectionRule regionalShortagePattern() {
        return DetectionRule.builder()
                .id("regional-shortage-pattern")
                .name("Regional Shortage Pattern")
                .category("shortage")
                .severity(Severity.HIGH)
                .description("Shortages at three or more locations covering over 30% of the region")
                .condition(PredicateCondition.of("shortLocations >= 3 && shortLocations / locations > 0.3", ctx -> {
                    List<RegionalStock> regional = ctx.getDataPoint().getRegionalData();
                    if (regional == null || regional.isEmpty()) return false;
                    long shortCount = regional.stream().filter(RegionalStock::isShort).count();
                    return shortCount >= 3 && (double) shortCount / regional.size() > 0.3;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    List<RegionalStock> regional = dp.getRegionalData();
                    List<Map<String, Object>> affected = new ArrayList<>();
                    for (RegionalStock stock : regional) {
                        if (stock.isShort()) {
                            Map<String, Object> entry = new LinkedHashMap<>();
                            entry.put("name", stock.getLocation());
                            entry.put("stock", stock.getCurrentStock());
                            entry.put("threshold", stock.getCriticalThreshold());
                            affected.add(entry);
                        }
                    }
                    long percentage = Math.round((double) affected.size() / regional.size() * 100);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("region", dp.getRegion());
                    details.put("affectedLocationsCount", affected.size());
                    details.put("totalLocations", regional.size());
                    details.put("shortagePercentage", percentage);
                    details.put("affectedLocations", affected);
                    return AnomalyDetails.builder()
                            .type("shortage")
                            .severity(Severity.HIGH)
                            .message(String.format("REGIONAL SHORTAGE: %s showing shortages in %s region",
                                    dp.getMedicineName(), orNa(dp.getRegion())))
                            .description(String.format("%d%% of locations in the region are short of %s.",
                                    percentage, dp.getMedicineName()))
                            .details(details)
                            .causes(causes("widespread regional shortage"))
                            .build();
                })
                .build();
    }

    DetectionRule supplyChainDisruption() {
        return DetectionRule.builder()
                .id("supply-chain-disruption")
                .name("Supply Chain Disruption")
                .category("supply-chain")
                .severity(Severity.HIGH)
                .description("Delivery overdue while stock is at or below the reorder point")
                .condition(PredicateCondition.of("daysSinceLastDelivery > 1.5 x interval && currentStock <= reorderPoint", ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Long days = ctx.getData().getDerived().getDaysSinceLastDelivery();
                    return days != null
                            && dp.getReorderPoint() != null
                            && days > deliveryInterval(dp) * 1.5
                            && dp.getCurrentStock() <= dp.getReorderPoint();
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Long days = ctx.getData().getDerived().getDaysSinceLastDelivery();
                    Map<String, Object> details = baseDetails(dp);
                    details.put("daysSinceLastDelivery", days);
                    details.put("averageDeliveryInterval", deliveryInterval(dp));
                    details.put("supplier", orNa(dp.getSupplier()));
                    details.put("expectedDeliveryDate", orNa(dp.getExpectedDeliveryDate()));
                    details.put("currentStock", dp.getCurrentStock());
                    details.put("reorderPoint", dp.getReorderPoint());
                    return AnomalyDetails.builder()
                            .type("supply-chain")
                            .severity(Severity.HIGH)
                            .message(String.format("SUPPLY DISRUPTION: Delivery of %s from %s is delayed",
                                    dp.getMedicineName(), orNa(dp.getSupplier())))
                            .description(String.format("%d days since the last delivery against an average interval "
                                            + "of %s days. Stock %s is at or below the reorder point %s.",
                                    days, number(deliveryInterval(dp)),
                                    number(dp.getCurrentStock()), number(dp.getReorderPoint())))
                            .details(details)
                            .causes(causes("supplier delivery delay"))
                            .build();
                })
                .build();
    }

    DetectionRule seasonalDemandSpike() {
        return DetectionRule.builder()
                .id("seasonal-demand-spike")
                .name("Seasonal Demand Spike")
                .category("demand")
                .severity(Severity.MEDIUM)
                .description("Demand is over 50% above the historical average for the month")
                .condition(PredicateCondition.of("currentDemand > 1.5 x seasonal average", ctx -> {
                    double average = seasonalAverage(ctx);
                    Double demand = ctx.getDataPoint().getCurrentDemand();
                    return average > 0 && demand != null && demand > average * 1.5;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double average = seasonalAverage(ctx);
                    long increase = Math.round((dp.getCurrentDemand() - average) / average * 100);
                    String month = Month.of(ctx.getData().getTemporal().getMonth())
                            .getDisplayName(TextStyle.FULL, Locale.ENGLISH);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentDemand", dp.getCurrentDemand());
                    details.put("historicalAverage", average);
                    details.put("increasePercentage", increase);
                    details.put("currentMonth", month);
                    return AnomalyDetails.builder()
                            .type("demand")
                            .severity(Severity.MEDIUM)
                            .message(String.format("DEMAND SPIKE: Unusual seasonal demand for %s", dp.getMedicineName()))
                            .description(String.format("Demand of %s is %d%% above the %s average.",
                                    number(dp.getCurrentDemand()), increase, month))
                            .details(details)
                            .causes(causes("seasonal demand increase"))
                            .build();
                })
                .build();
    }

    DetectionRule expiryDateApproaching() {
        return DetectionRule.builder()
                .id("expiry-date-approaching")
                .name("Expiry Date Approaching")
                .category("quality")
                .severity(Severity.MEDIUM)
                .description("Stocked medicine expires within 30 days")
                .condition(PredicateCondition.of("0 < daysToExpiry <= 30 && currentStock > 0", ctx -> {
                    Long days = ctx.getData().getDerived().getDaysToExpiry();
                    return days != null && days > 0 && days <= 30 && ctx.getDataPoint().getCurrentStock() > 0;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Long days = ctx.getData().getDerived().getDaysToExpiry();
                    Map<String, Object> details = baseDetails(dp);
                    details.put("expiryDate", dp.getExpiryDate());
                    details.put("daysToExpiry", days);
                    details.put("currentStock", dp.getCurrentStock());
                    details.put("batchNumber", orNa(dp.getBatchNumber()));
                    return AnomalyDetails.builder()
                            .type("quality")
                            .severity(Severity.MEDIUM)
                            .message(String.format("EXPIRY ALERT: %s approaching expiry in %d days",
                                    dp.getMedicineName(), days))
                            .description(String.format("%s units of %s at %s expire on %s.",
                                    number(dp.getCurrentStock()), dp.getMedicineName(),
                                    dp.getLocation(), dp.getExpiryDate()))
                            .details(details)
                            .causes(causes("approaching expiry date"))
                            .build();
                })
                .build();
    }

    DetectionRule unusualConsumptionPattern() {
        return DetectionRule.builder()
                .id("unusual-consumption-pattern")
                .name("Unusual Consumption Pattern")
                .category("consumption")
                .severity(Severity.MEDIUM)
                .description("Recent consumption is more than double the weekly average, suggesting hoarding")
                .condition(PredicateCondition.of("movingAverage(3) > 2 x movingAverage(7)", ctx -> {
                    List<Double> history = ctx.getDataPoint().getDailyConsumptionHistory();
                    if (history == null || history.size() < 7) return false;
                    Double recent = ctx.getHelpers().movingAverage(history, 3);
                    Double weekly = ctx.getHelpers().movingAverage(history, 7);
                    return recent != null && weekly != null && weekly > 0 && recent > weekly * 2;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Double recent = ctx.getHelpers().movingAverage(dp.getDailyConsumptionHistory(), 3);
                    Double weekly = ctx.getHelpers().movingAverage(dp.getDailyConsumptionHistory(), 7);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("recentConsumption", recent);
                    details.put("historicalAverage", weekly);
                    details.put("possibleCause", "Bulk buying or hoarding suspected");
                    return AnomalyDetails.builder()
                            .type("consumption")
                            .severity(Severity.MEDIUM)
                            .message(String.format("UNUSUAL CONSUMPTION: %s shows abnormal buying pattern",
                                    dp.getMedicineName()))
                            .description(String.format("3-day average consumption %s is more than double "
                                    + "the 7-day average %s.", number(recent), number(weekly)))
                            .details(details)
                            .causes(causes("hoarding", "bulk buying"))
                            .build();
                })
                .build();
    }

    static long estimatedDaysRemaining(DataPoint dp) {
        Double consumption = dp.getDailyConsumption();
        double rate = consumption == null || consumption == 0 ? 1.0 : consumption;
        return (long) Math.floor(dp.getCurrentStock() / rate);
    }

    private static Double declineRate(DataPoint dp) {
        List<Double> history = dp.getStockHistory();
        if (history == null || history.size() < 3) return null;
        List<Double> recent = history.subList(history.size() - 3, history.size());
        return (recent.get(0) - recent.get(2)) / 2;
    }

    private static double normalConsumption(DataPoint dp) {
        Double avg = dp.getAverageDailyConsumption();
        return avg != null && avg > 0 ? avg : DEFAULT_DAILY_CONSUMPTION;
    }

    private static double deliveryInterval(DataPoint dp) {
        Double interval = dp.getAverageDeliveryInterval();
        return interval != null && interval > 0 ? interval : DEFAULT_DELIVERY_INTERVAL_DAYS;
    }

    private static double seasonalAverage(RuleContext ctx) {
        Map<Integer, Double> table = ctx.getDataPoint().getSeasonalAverageDemand();
        if (table == null) return 0.0;
        Double average = table.get(ctx.getData().getTemporal().getMonth());
        return average != null ? average : 0.0;
    }
}
