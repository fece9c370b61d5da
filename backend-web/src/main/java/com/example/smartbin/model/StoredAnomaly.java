package com.example.smartbin.model;

import java.time.Instant;

/**
 * An anomaly bound to the bin (and latest event) it was detected on, as handed to the store.
 */
public record StoredAnomaly(
        String binId,
        Long eventId,
        Anomaly anomaly,
        Instant detectedAt
) {
}
