package com.medwatch.anomaly.engine.feature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static lookup tables for location risk, metro classification and medicine categories.
 */
public final class MedicineContext {

    public static final double DEFAULT_LOCATION_RISK = 0.5;
    public static final String DEFAULT_CATEGORY = "other";

    private static final Map<String, Double> LOCATION_RISK = Map.of(
            "delhi", 0.8,
            "mumbai", 0.7,
            "bangalore", 0.5,
            "chennai", 0.4,
            "kolkata", 0.6,
            "hyderabad", 0.5,
            "pune", 0.4,
            "ahmedabad", 0.6
    );

    private static final Set<String> METRO_CITIES = Set.of(
            "delhi", "mumbai", "bangalore", "chennai", "kolkata", "hyderabad");

    // Insertion order decides which key wins when several match.
    private static final Map<String, String> CATEGORIES = new LinkedHashMap<>();

    static {
        CATEGORIES.put("insulin", "diabetes");
        CATEGORIES.put("metformin", "diabetes");
        CATEGORIES.put("levothyroxine", "thyroid");
        CATEGORIES.put("amlodipine", "cardiovascular");
        CATEGORIES.put("atorvastatin", "cardiovascular");
        CATEGORIES.put("paracetamol", "analgesic");
        CATEGORIES.put("amoxicillin", "antibiotic");
    }

    private static final List<String> CRITICAL_MEDICINES = List.of(
            "insulin", "levothyroxine", "amlodipine", "metformin");

    private MedicineContext() {}

    public static double locationRisk(String location) {
        if (location == null) return DEFAULT_LOCATION_RISK;
        return LOCATION_RISK.getOrDefault(normalize(location), DEFAULT_LOCATION_RISK);
    }

    public static boolean isMetro(String location) {
        return location != null && METRO_CITIES.contains(normalize(location));
    }

    public static String category(String medicineName) {
        if (medicineName == null) return DEFAULT_CATEGORY;
        String name = normalize(medicineName);
        for (Map.Entry<String, String> entry : CATEGORIES.entrySet()) {
            if (name.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_CATEGORY;
    }

    public static boolean isCriticalMedicine(String medicineName) {
        if (medicineName == null) return false;
        String name = normalize(medicineName);
        return CRITICAL_MEDICINES.stream().anyMatch(name::contains);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
