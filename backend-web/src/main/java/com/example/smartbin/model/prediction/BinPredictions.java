package com.example.smartbin.model.prediction;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Full prediction result for one bin. Always structurally complete, including on failure.
 */
public record BinPredictions(
        String binId,
        Instant generatedAt,
        PredictionStatus status,
        String error,
        int dataPoints,
        Map<Horizon, CapacityForecast> capacity,
        UsageForecast usage,
        CollectionPlan collection,
        Map<Horizon, RevenueForecast> revenue,
        MaintenanceForecast maintenance,
        NarrativeInsight delegatedInsights
) {

    public BinPredictions {
        capacity = byHorizon(capacity);
        revenue = byHorizon(revenue);
    }

    private static <V> Map<Horizon, V> byHorizon(Map<Horizon, V> values) {
        EnumMap<Horizon, V> ordered = new EnumMap<>(Horizon.class);
        ordered.putAll(values);
        return Collections.unmodifiableMap(ordered);
    }
}
