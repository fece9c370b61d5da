package com.example.smartbin.analytics;

import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges candidates sharing {@code (type, severity)} into one representative and orders the
 * result by severity, highest first. Applying it twice gives the same list as applying it once.
 */
public final class AnomalyConsolidator {

    private AnomalyConsolidator() {
    }

    public static List<Anomaly> consolidate(List<Anomaly> candidates) {
        Map<Key, Anomaly> merged = new LinkedHashMap<>();
        for (Anomaly candidate : candidates) {
            merged.merge(new Key(candidate.type(), candidate.severity()), candidate, AnomalyConsolidator::mergeInto);
        }
        List<Anomaly> result = new ArrayList<>(merged.values());
        // List.sort is stable, ties keep encounter order
        result.sort(Comparator.comparingInt((Anomaly a) -> a.severity().rank()).reversed());
        return result;
    }

    private static Anomaly mergeInto(Anomaly representative, Anomaly other) {
        Map<String, Object> details = new LinkedHashMap<>(representative.details());
        details.putAll(other.details());
        return representative
                .withConfidence(Math.max(representative.confidence(), other.confidence()))
                .withDetails(details);
    }

    private record Key(String type, Severity severity) {
    }
}
