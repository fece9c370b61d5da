package com.example.smartbin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A flagged deviation produced by one of the detectors. Confidence is clamped to [0, 1].
 */
public record Anomaly(
        String type,
        Severity severity,
        double confidence,
        Map<String, Object> details,
        String source
) {

    public Anomaly {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        confidence = clamp(confidence);
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Anomaly of(String type, Severity severity, double confidence, Map<String, Object> details, String source) {
        return new Anomaly(type, severity, confidence, details, source);
    }

    public Anomaly withConfidence(double newConfidence) {
        return new Anomaly(type, severity, newConfidence, details, source);
    }

    public Anomaly withDetails(Map<String, Object> newDetails) {
        return new Anomaly(type, severity, confidence, newDetails, source);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
