package com.example.smartbin.model;

import java.time.Instant;
import java.util.Map;

public record DetectionReport(
        Instant windowStart,
        Instant runAt,
        int eventsAnalyzed,
        int binsAnalyzed,
        int anomaliesDetected,
        int anomaliesStored,
        int duplicatesSuppressed,
        Map<String, String> failedBins
) {

    public static DetectionReport empty(Instant windowStart, Instant runAt) {
        return new DetectionReport(windowStart, runAt, 0, 0, 0, 0, 0, Map.of());
    }
}
