package com.medwatch.anomaly.engine.rules.sets;

import com.medwatch.anomaly.model.DataPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Formatting helpers shared by the built-in rule actions.
 */
final class RuleDetails {

    private RuleDetails() {}

    static Map<String, Object> baseDetails(DataPoint dp) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("medicineName", dp.getMedicineName());
        details.put("medicineId", dp.getMedicineId());
        details.put("location", dp.getLocation());
        return details;
    }

    static List<String> causes(String... causes) {
        return new ArrayList<>(List.of(causes));
    }

    static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    static String number(Double value) {
        if (value == null) return "N/A";
        if (value == Math.rint(value)) return String.valueOf(value.longValue());
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
