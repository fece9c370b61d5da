package com.example.smartbin.model;

public record BinProfile(
        String binId,
        String locationClass,
        double ratedCapacityKg,
        String locationLabel
) {

    public static final String DEFAULT_LOCATION_CLASS = "unknown";
    public static final double DEFAULT_CAPACITY_KG = 100.0;
    public static final String DEFAULT_LOCATION_LABEL = "Unknown";

    public static BinProfile defaults(String binId) {
        return new BinProfile(binId, DEFAULT_LOCATION_CLASS, DEFAULT_CAPACITY_KG, DEFAULT_LOCATION_LABEL);
    }

    public static BinProfile of(String binId, String locationClass, Double ratedCapacityKg, String locationLabel) {
        return new BinProfile(
                binId,
                locationClass != null && !locationClass.isBlank() ? locationClass : DEFAULT_LOCATION_CLASS,
                ratedCapacityKg != null && ratedCapacityKg > 0 ? ratedCapacityKg : DEFAULT_CAPACITY_KG,
                locationLabel != null && !locationLabel.isBlank() ? locationLabel : DEFAULT_LOCATION_LABEL
        );
    }

    public boolean isResidential() {
        return "residential".equalsIgnoreCase(locationClass);
    }
}
