package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One observation of a medicine's stock, price and demand at a location")
public class DataPoint {

    @Schema(description = "Unique data point identifier. Assigned on submission if absent.", example = "DP-INSULIN-DEL-0001")
    private String id;

    @Schema(description = "Medicine identifier in the inventory system", example = "MED-001")
    private String medicineId;

    @Schema(description = "Medicine name", example = "Insulin")
    private String medicineName;

    @Schema(description = "Location (city) of the observation", example = "Delhi")
    private String location;

    @Schema(description = "Region or state", example = "North")
    private String region;

    @Schema(description = "Units currently in stock", example = "120")
    private Double currentStock;

    @Schema(description = "Current unit price", example = "450.0")
    private Double currentPrice;

    @Schema(description = "Observation time: ISO-8601 instant/date-time or epoch milliseconds",
            example = "2026-01-15T10:30:00Z")
    private String timestamp;

    // Thresholds
    @Schema(description = "Stock level at or below which the medicine is critically short", example = "50")
    private Double criticalThreshold;

    @Schema(description = "Stock level at which a reorder should be placed", example = "100")
    private Double reorderPoint;

    @Schema(description = "Storage capacity for this medicine at the location", example = "1000")
    private Double maxCapacity;

    // Market data
    @Schema(description = "Average market price across pharmacies", example = "400.0")
    private Double averageMarketPrice;

    @Schema(description = "Maximum retail price", example = "500.0")
    private Double maximumRetailPrice;

    @Schema(description = "Manufacturing cost per unit", example = "250.0")
    private Double manufacturingCost;

    // Consumption and demand
    private Double dailyConsumption;
    private Double averageDailyConsumption;
    private Double currentDemand;
    private Double averageDemand;

    // Supply chain
    @Schema(description = "Supplier name", example = "MedSupply Pvt Ltd")
    private String supplier;

    @Schema(description = "Supplier reliability between 0 and 1", example = "0.85")
    private Double supplierReliability;

    @Schema(description = "Date of the last delivery (ISO-8601)", example = "2026-01-01")
    private String lastDeliveryDate;

    @Schema(description = "Average number of days between deliveries", example = "7")
    private Double averageDeliveryInterval;

    private Double daysSinceRestock;
    private String expectedDeliveryDate;
    private String expectedRestockDate;
    private String lastStockDate;
    private String projectedStockoutDate;

    // Quality
    @Schema(description = "Expiry date of the current batch (ISO-8601)", example = "2026-03-01")
    private String expiryDate;

    private String batchNumber;

    // Historical series, most recent last
    private List<Double> stockHistory;
    private List<Double> priceHistory;
    private List<Double> demandHistory;
    private List<Double> dailyConsumptionHistory;

    // Seasonal tables keyed by month 1-12
    private Map<Integer, Double> seasonalFactors;
    private Map<Integer, Double> seasonalAverageDemand;

    // Regional context
    private List<RegionalStock> regionalData;
    private List<PharmacyPrice> regionalPrices;

    @Schema(description = "Price of the same medicine in other regions, keyed by region name")
    private Map<String, Double> crossRegionalPrices;
}
