package com.example.smartbin.analytics.detector;

import com.example.smartbin.analytics.EventWindowAggregator;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyTypes;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Usage-pattern, material-composition and weight-distribution checks.
 */
@Order(2)
@Component
public class PatternAnomalyDetector implements AnomalyDetector {

    static final double HOURLY_SPIKE_RATIO = 3.0;
    static final double WEEKDAY_SPIKE_RATIO = 2.0;
    static final double UNKNOWN_MATERIAL_SHARE = 20.0;
    static final double CONTAMINATED_MATERIAL_SHARE = 10.0;
    static final double HEAVY_DEPOSIT_RATIO = 3.0;
    static final double LIGHT_DEPOSIT_RATIO = 0.1;
    static final int MIN_WEIGHED_EVENTS = 3;

    private final AnalyticsProperties properties;

    public PatternAnomalyDetector(AnalyticsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public List<Anomaly> detect(List<BinEvent> events, BinProfile profile) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (events.isEmpty()) {
            return anomalies;
        }
        usagePattern(events).ifPresent(anomalies::add);
        materialComposition(events).ifPresent(anomalies::add);
        anomalies.addAll(weightDistribution(events));
        return anomalies;
    }

    Optional<Anomaly> usagePattern(List<BinEvent> events) {
        int[] hourly = EventWindowAggregator.hourlyHistogram(events, properties.zone());
        int[] weekday = EventWindowAggregator.weekdayHistogram(events, properties.zone());
        double hourlyRatio = ratio(hourly);
        double weekdayRatio = ratio(weekday);

        String axis;
        double triggeredRatio;
        if (hourlyRatio > HOURLY_SPIKE_RATIO) {
            axis = "hourly";
            triggeredRatio = hourlyRatio;
        } else if (weekdayRatio > WEEKDAY_SPIKE_RATIO) {
            axis = "weekday";
            triggeredRatio = weekdayRatio;
        } else {
            return Optional.empty();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("axis", axis);
        details.put("ratio", triggeredRatio);
        details.put("hourly_ratio", hourlyRatio);
        details.put("weekday_ratio", weekdayRatio);
        return Optional.of(Anomaly.of(AnomalyTypes.UNUSUAL_USAGE_PATTERN, Severity.MEDIUM, 0.8, details, name()));
    }

    Optional<Anomaly> materialComposition(List<BinEvent> events) {
        Map<String, Long> totals = new LinkedHashMap<>();
        long total = 0;
        for (BinEvent event : events) {
            for (Map.Entry<String, Integer> entry : event.materialCounts().entrySet()) {
                int count = Math.max(0, entry.getValue());
                totals.merge(entry.getKey().toLowerCase(Locale.ROOT), (long) count, Long::sum);
                total += count;
            }
        }
        if (total == 0) {
            return Optional.empty();
        }
        Map<String, Double> shares = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : totals.entrySet()) {
            shares.put(entry.getKey(), entry.getValue() * 100.0 / total);
        }
        double unknownShare = shares.getOrDefault("unknown", 0.0);
        double contaminatedShare = shares.getOrDefault("contaminated", 0.0);
        if (unknownShare <= UNKNOWN_MATERIAL_SHARE && contaminatedShare <= CONTAMINATED_MATERIAL_SHARE) {
            return Optional.empty();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unknown_percentage", unknownShare);
        details.put("contaminated_percentage", contaminatedShare);
        details.put("composition", shares);
        return Optional.of(Anomaly.of(AnomalyTypes.UNUSUAL_MATERIAL_COMPOSITION, Severity.MEDIUM, 0.8, details, name()));
    }

    List<Anomaly> weightDistribution(List<BinEvent> events) {
        List<Anomaly> anomalies = new ArrayList<>();
        List<BinEvent> weighed = events.stream().filter(BinEvent::hasWeight).toList();
        if (weighed.size() < MIN_WEIGHED_EVENTS) {
            return anomalies;
        }
        double mean = weighed.stream().mapToDouble(BinEvent::weightKg).average().orElse(0.0);
        if (mean <= 0) {
            return anomalies;
        }
        for (BinEvent event : weighed) {
            double weight = event.weightKg();
            if (weight > mean * HEAVY_DEPOSIT_RATIO) {
                anomalies.add(Anomaly.of(AnomalyTypes.UNUSUALLY_HEAVY_DEPOSITS, Severity.MEDIUM, 0.7,
                        weightDetails(event, mean), name()));
            } else if (weight < mean * LIGHT_DEPOSIT_RATIO) {
                anomalies.add(Anomaly.of(AnomalyTypes.UNUSUALLY_LIGHT_DEPOSITS, Severity.LOW, 0.6,
                        weightDetails(event, mean), name()));
            }
        }
        return anomalies;
    }

    private static Map<String, Object> weightDetails(BinEvent event, double mean) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("weight_kg", event.weightKg());
        details.put("average_weight_kg", mean);
        details.put("multiplier", event.weightKg() / mean);
        details.put("timestamp", event.timestamp().toString());
        return details;
    }

    private static double ratio(int[] buckets) {
        double mean = EventWindowAggregator.mean(buckets);
        return mean == 0 ? 0.0 : EventWindowAggregator.max(buckets) / mean;
    }
}
