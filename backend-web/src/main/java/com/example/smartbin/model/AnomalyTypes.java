package com.example.smartbin.model;

/**
 * Anomaly type names emitted by the built-in detectors. Delegated scorers may report others.
 */
public final class AnomalyTypes {

    public static final String UNUSUAL_USAGE_PATTERN = "UnusualUsagePattern";
    public static final String UNUSUAL_MATERIAL_COMPOSITION = "unusual_material_composition";
    public static final String UNUSUALLY_HEAVY_DEPOSITS = "unusually_heavy_deposits";
    public static final String UNUSUALLY_LIGHT_DEPOSITS = "unusually_light_deposits";
    public static final String HIGH_USAGE_RESIDENTIAL_AREA = "high_usage_residential_area";
    public static final String UNUSUAL_NIGHT_USAGE = "unusual_night_usage";
    public static final String HIGH_FREQUENCY_USER = "high_frequency_user";
    public static final String TEMPORAL_WEIGHT_SPIKE = "temporal_weight_spike";
    public static final String UNUSUALLY_FREQUENT_EVENTS = "unusually_frequent_events";
    public static final String SEASONAL_USAGE_PATTERN = "seasonal_usage_pattern";

    private AnomalyTypes() {
    }

    public static String outlier(String label) {
        return label + "_outlier";
    }
}
