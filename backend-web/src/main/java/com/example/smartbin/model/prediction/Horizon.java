package com.example.smartbin.model.prediction;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Forecast windows. The factor discounts confidence for longer horizons.
 */
public enum Horizon {
    SHORT("short", 24, 1.0),
    MEDIUM("medium", 168, 0.9),
    LONG("long", 720, 0.8);

    private final String label;
    private final int hours;
    private final double confidenceFactor;

    Horizon(String label, int hours, double confidenceFactor) {
        this.label = label;
        this.hours = hours;
        this.confidenceFactor = confidenceFactor;
    }

    @JsonKey
    @JsonValue
    public String label() {
        return label;
    }

    public int hours() {
        return hours;
    }

    public double days() {
        return hours / 24.0;
    }

    public double confidenceFactor() {
        return confidenceFactor;
    }

    @Override
    public String toString() {
        return label;
    }
}
