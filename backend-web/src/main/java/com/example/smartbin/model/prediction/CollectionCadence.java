package com.example.smartbin.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Collection frequencies with their daily operating cost (currency units).
 */
public enum CollectionCadence {
    TWICE_DAILY(80),
    DAILY(50),
    EVERY_OTHER_DAY(30),
    WEEKLY(20);

    private final double costPerDay;

    CollectionCadence(double costPerDay) {
        this.costPerDay = costPerDay;
    }

    public double costPerDay() {
        return costPerDay;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Picks the cadence for a bin filling {@code dailyAverageKg} per day against its rated capacity.
     */
    public static CollectionCadence forLoad(double dailyAverageKg, double ratedCapacityKg) {
        if (dailyAverageKg > ratedCapacityKg * 0.8) {
            return TWICE_DAILY;
        }
        if (dailyAverageKg > ratedCapacityKg * 0.5) {
            return DAILY;
        }
        if (dailyAverageKg > ratedCapacityKg * 0.3) {
            return EVERY_OTHER_DAY;
        }
        return WEEKLY;
    }
}
