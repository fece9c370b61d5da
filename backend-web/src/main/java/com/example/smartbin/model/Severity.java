package com.example.smartbin.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse for severities reported by external scorers; anything unrecognised is medium.
     */
    public static Severity fromLabel(String label) {
        if (label == null) {
            return MEDIUM;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high", "critical" -> HIGH;
            default -> MEDIUM;
        };
    }
}
