package com.example.smartbin.model;

import com.example.smartbin.exception.MalformedEventException;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * One sensor reading from a bin, joined with the bin and insight fields the store knows about.
 * Numeric readings may be absent; callers filter them before computing statistics.
 */
@Builder(toBuilder = true)
public record BinEvent(
        Long eventId,
        String binId,
        Instant timestamp,
        Double weightKg,
        Double fillLevelPct,
        Integer batteryPct,
        Double purityScore,
        Map<String, Integer> materialCounts,
        String userId,
        boolean anomalyFlagged,
        String locationClass,
        Double ratedCapacityKg,
        String locationLabel
) {

    public static final double DEFAULT_PURITY = 0.85;

    public BinEvent {
        if (binId == null || binId.isBlank()) {
            throw new MalformedEventException("Event " + eventId + " has no bin id");
        }
        if (timestamp == null) {
            throw new MalformedEventException("Event " + eventId + " of bin " + binId + " has no timestamp");
        }
        materialCounts = materialCounts == null ? Map.of() : Map.copyOf(materialCounts);
    }

    /**
     * Purity score, with a missing or zero score read as {@link #DEFAULT_PURITY}.
     */
    public double purityOrDefault() {
        return purityScore != null && purityScore != 0.0 ? purityScore : DEFAULT_PURITY;
    }

    public double weightOrZero() {
        return weightKg != null ? weightKg : 0.0;
    }

    public boolean hasWeight() {
        return weightKg != null;
    }
}
