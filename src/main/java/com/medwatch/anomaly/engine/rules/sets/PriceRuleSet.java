package com.medwatch.anomaly.engine.rules.sets;

import com.medwatch.anomaly.engine.feature.SeriesStatistics;
import com.medwatch.anomaly.engine.rules.DetectionRule;
import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.engine.rules.RuleSet;
import com.medwatch.anomaly.engine.rules.condition.PredicateCondition;
import com.medwatch.anomaly.model.AnomalyDetails;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.PharmacyPrice;
import com.medwatch.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.medwatch.anomaly.engine.rules.sets.RuleDetails.*;

/**
 * Price spike, manipulation, disparity, black market, volatility and below-cost rules.
 */
@Component
public class PriceRuleSet implements RuleSet {

    @Override
    public String getName() {
        return "price";
    }

    @Override
    public List<DetectionRule> getRules() {
        return List.of(
                suddenPriceSpike(),
                priceManipulationPattern(),
                crossRegionalPriceDisparity(),
                blackMarketPricing(),
                priceVolatilityAlert(),
                belowCostPricing()
        );
    }

    DetectionRule suddenPriceSpike() {
        return DetectionRule.builder()
                .id("sudden-price-spike")
                .name("Sudden Price Spike")
                .category("price")
                .severity(Severity.HIGH)
                .description("Price rose more than 50% over the previous recorded price")
                .condition(PredicateCondition.of("percentageChange(currentPrice, previousPrice) > 50", ctx -> {
                    Double change = priceChange(ctx);
                    return change != null && change > 50;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double change = priceChange(ctx);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentPrice", dp.getCurrentPrice());
                    details.put("previousPrice", previousPrice(dp));
                    details.put("percentageIncrease", Math.round(change * 10) / 10.0);
                    details.put("averageMarketPrice", dp.getAverageMarketPrice());
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.HIGH)
                            .message(String.format("PRICE SPIKE: %s price increased by %.1f%%",
                                    dp.getMedicineName(), change))
                            .description(String.format("Price of %s at %s moved from %s to %s.",
                                    dp.getMedicineName(), dp.getLocation(),
                                    number(previousPrice(dp)), number(dp.getCurrentPrice())))
                            .details(details)
                            .causes(causes("sudden price increase", "market speculation"))
                            .build();
                })
                .build();
    }

    DetectionRule priceManipulationPattern() {
        return DetectionRule.builder()
                .id("price-manipulation-pattern")
                .name("Price Manipulation Pattern")
                .category("price")
                .severity(Severity.CRITICAL)
                .description("Three or more pharmacies share an identical price over 30% above market")
                .condition(PredicateCondition.of("identical price at >= 3 pharmacies > 1.3 x market",
                        ctx -> suspiciousPrice(ctx.getDataPoint()) != null))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double suspicious = suspiciousPrice(dp);
                    List<String> pharmacies = new ArrayList<>();
                    for (PharmacyPrice p : dp.getRegionalPrices()) {
                        if (p.getPrice() != null && p.getPrice() == suspicious) {
                            pharmacies.add(p.getPharmacy());
                        }
                    }
                    Map<String, Object> details = baseDetails(dp);
                    details.put("suspiciousPrice", suspicious);
                    details.put("pharmaciesWithSamePrice", pharmacies.size());
                    details.put("affectedPharmacies", pharmacies);
                    details.put("averageMarketPrice", dp.getAverageMarketPrice());
                    details.put("region", dp.getRegion());
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.CRITICAL)
                            .message(String.format("CRITICAL: Price manipulation suspected for %s in %s",
                                    dp.getMedicineName(), orNa(dp.getRegion())))
                            .description(String.format("%d pharmacies charge an identical price of %s, "
                                            + "well above the market average of %s.",
                                    pharmacies.size(), number(suspicious), number(dp.getAverageMarketPrice())))
                            .details(details)
                            .causes(causes("price collusion", "market manipulation"))
                            .build();
                })
                .build();
    }

    DetectionRule crossRegionalPriceDisparity() {
        return DetectionRule.builder()
                .id("cross-regional-price-disparity")
                .name("Cross-Regional Price Disparity")
                .category("price")
                .severity(Severity.MEDIUM)
                .description("Prices across regions differ by more than 40%")
                .condition(PredicateCondition.of("(max - min) / min > 0.4", ctx -> {
                    Double disparity = regionalDisparity(ctx.getDataPoint());
                    return disparity != null && disparity > 0.4;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Collection<Double> prices = dp.getCrossRegionalPrices().values();
                    long percentage = Math.round(regionalDisparity(dp) * 100);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("minPrice", Collections.min(prices));
                    details.put("maxPrice", Collections.max(prices));
                    details.put("disparityPercentage", percentage);
                    details.put("regionalPrices", new LinkedHashMap<>(dp.getCrossRegionalPrices()));
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.MEDIUM)
                            .message(String.format("PRICE DISPARITY: %s shows %d%% price difference across regions",
                                    dp.getMedicineName(), percentage))
                            .description(String.format("Regional prices of %s range from %s to %s.",
                                    dp.getMedicineName(), number(Collections.min(prices)),
                                    number(Collections.max(prices))))
                            .details(details)
                            .causes(causes("regional supply imbalance", "transportation costs"))
                            .build();
                })
                .build();
    }

    DetectionRule blackMarketPricing() {
        return DetectionRule.builder()
                .id("black-market-pricing")
                .name("Black Market Pricing")
                .category("price")
                .severity(Severity.CRITICAL)
                .description("Out of stock while selling at over twice the maximum retail price")
                .condition(PredicateCondition.of("currentPrice > 2 x MRP && currentStock == 0", ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Double mrp = dp.getMaximumRetailPrice();
                    return mrp != null && mrp > 0
                            && dp.getCurrentPrice() != null
                            && dp.getCurrentPrice() > mrp * 2
                            && dp.getCurrentStock() == 0;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double markup = (dp.getCurrentPrice() / dp.getMaximumRetailPrice() - 1) * 100;
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentPrice", dp.getCurrentPrice());
                    details.put("maximumRetailPrice", dp.getMaximumRetailPrice());
                    details.put("markupPercentage", Math.round(markup));
                    details.put("currentStock", dp.getCurrentStock());
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.CRITICAL)
                            .message(String.format("CRITICAL: Black market pricing suspected for %s",
                                    dp.getMedicineName()))
                            .description(String.format("%s is out of stock at %s yet offered at %s against an MRP of %s.",
                                    dp.getMedicineName(), dp.getLocation(),
                                    number(dp.getCurrentPrice()), number(dp.getMaximumRetailPrice())))
                            .details(details)
                            .causes(causes("illegal trade", "extreme scarcity"))
                            .build();
                })
                .build();
    }

    DetectionRule priceVolatilityAlert() {
        return DetectionRule.builder()
                .id("price-volatility-alert")
                .name("Price Volatility Alert")
                .category("price")
                .severity(Severity.MEDIUM)
                .description("Coefficient of variation of the last 7 prices exceeds 0.2")
                .condition(PredicateCondition.of("cv(last 7 prices) > 0.2", ctx -> {
                    List<Double> history = ctx.getDataPoint().getPriceHistory();
                    if (history == null || history.size() < 7) return false;
                    return SeriesStatistics.coefficientOfVariation(SeriesStatistics.trailing(history, 7)) > 0.2;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    List<Double> prices = SeriesStatistics.trailing(dp.getPriceHistory(), 7);
                    double cv = SeriesStatistics.coefficientOfVariation(prices);
                    Map<String, Object> details = baseDetails(dp);
                    details.put("coefficientOfVariation", cv);
                    details.put("meanPrice", SeriesStatistics.mean(prices));
                    details.put("standardDeviation", SeriesStatistics.stdDev(prices));
                    details.put("recentPrices", new ArrayList<>(prices));
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.MEDIUM)
                            .message(String.format("VOLATILITY ALERT: High price volatility for %s",
                                    dp.getMedicineName()))
                            .description(String.format("Prices over the last 7 observations vary by %.0f%% of their mean.",
                                    cv * 100))
                            .details(details)
                            .causes(causes("market instability", "supply-demand fluctuations"))
                            .build();
                })
                .build();
    }

    DetectionRule belowCostPricing() {
        return DetectionRule.builder()
                .id("below-cost-pricing")
                .name("Below Cost Pricing")
                .category("price")
                .severity(Severity.MEDIUM)
                .description("Price is more than 20% below manufacturing cost")
                .condition(PredicateCondition.of("currentPrice < 0.8 x manufacturingCost", ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    Double cost = dp.getManufacturingCost();
                    Double price = dp.getCurrentPrice();
                    return cost != null && cost > 0 && price != null && price < cost * 0.8;
                }))
                .action(ctx -> {
                    DataPoint dp = ctx.getDataPoint();
                    double price = dp.getCurrentPrice() != null ? dp.getCurrentPrice() : 0.0;
                    double cost = dp.getManufacturingCost();
                    Map<String, Object> details = baseDetails(dp);
                    details.put("currentPrice", price);
                    details.put("manufacturingCost", cost);
                    details.put("discountPercentage", Math.round((1 - price / cost) * 100));
                    return AnomalyDetails.builder()
                            .type("price")
                            .severity(Severity.MEDIUM)
                            .message(String.format("BELOW COST: %s priced below manufacturing cost",
                                    dp.getMedicineName()))
                            .description(String.format("%s sells at %s against a manufacturing cost of %s.",
                                    dp.getMedicineName(), number(price), number(cost)))
                            .details(details)
                            .causes(causes("overstock", "clearance sale"))
                            .build();
                })
                .build();
    }

    private static Double previousPrice(DataPoint dp) {
        List<Double> history = dp.getPriceHistory();
        if (history == null || history.size() < 2) return null;
        return history.get(history.size() - 2);
    }

    private static Double priceChange(RuleContext ctx) {
        DataPoint dp = ctx.getDataPoint();
        Double previous = previousPrice(dp);
        if (previous == null || dp.getCurrentPrice() == null) return null;
        return ctx.getHelpers().percentageChange(dp.getCurrentPrice(), previous);
    }

    /**
     * The most common regional price when at least 3 pharmacies share it and it is over
     * 1.3 times the market average, otherwise null.
     */
    static Double suspiciousPrice(DataPoint dp) {
        List<PharmacyPrice> prices = dp.getRegionalPrices();
        if (prices == null || prices.size() < 3) return null;

        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (PharmacyPrice p : prices) {
            if (p.getPrice() != null) counts.merge(p.getPrice(), 1, Integer::sum);
        }
        if (counts.isEmpty()) return null;
        int maxCount = Collections.max(counts.values());
        if (maxCount < 3) return null;

        double market = dp.getAverageMarketPrice() != null ? dp.getAverageMarketPrice() : 0.0;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == maxCount && entry.getKey() > market * 1.3) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static Double regionalDisparity(DataPoint dp) {
        Map<String, Double> prices = dp.getCrossRegionalPrices();
        if (prices == null || prices.size() < 2) return null;
        double min = Collections.min(prices.values());
        double max = Collections.max(prices.values());
        if (min <= 0) return null;
        return (max - min) / min;
    }
}
