package com.example.smartbin.ai;

import java.util.Map;

/**
 * One insight or anomaly candidate reported by a delegated backend.
 */
public record DelegatedInsight(
        String type,
        String severity,
        Double confidence,
        String description,
        String recommendation,
        boolean anomalous,
        Map<String, Object> attributes
) {

    public DelegatedInsight {
        attributes = attributes == null ? Map.of() : attributes;
    }

    /**
     * Insights count as anomalies when marked so, typed {@code anomaly}, or reported as high severity.
     */
    public boolean indicatesAnomaly() {
        return anomalous || "anomaly".equalsIgnoreCase(type) || "high".equalsIgnoreCase(severity);
    }
}
