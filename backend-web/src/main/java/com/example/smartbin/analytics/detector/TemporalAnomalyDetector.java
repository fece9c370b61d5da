package com.example.smartbin.analytics.detector;

import com.example.smartbin.analytics.EventWindowAggregator;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyTypes;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-series checks over the chronologically sorted events: weight spikes, bursts of events
 * and hours that are busier than usual.
 */
@Slf4j
@Order(4)
@Component
public class TemporalAnomalyDetector implements AnomalyDetector {

    static final int MIN_EVENTS = 5;
    static final double SPIKE_RATIO = 5.0;
    static final double SEASONAL_HOUR_RATIO = 2.0;

    private final AnalyticsProperties properties;

    public TemporalAnomalyDetector(AnalyticsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "temporal";
    }

    @Override
    public List<Anomaly> detect(List<BinEvent> events, BinProfile profile) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (events.size() < MIN_EVENTS) {
            log.debug("Skipping temporal detection for bin {}: {} events", profile.binId(), events.size());
            return anomalies;
        }
        List<BinEvent> sorted = EventWindowAggregator.sortedByTime(events);
        anomalies.addAll(spikes(sorted));
        anomalies.addAll(intervals(sorted));
        anomalies.addAll(seasonalHours(sorted));
        return anomalies;
    }

    List<Anomaly> spikes(List<BinEvent> sorted) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 1; i < sorted.size() - 1; i++) {
            double neighbourAverage = (sorted.get(i - 1).weightOrZero() + sorted.get(i + 1).weightOrZero()) / 2;
            if (neighbourAverage <= 0) {
                continue;
            }
            BinEvent current = sorted.get(i);
            double ratio = current.weightOrZero() / neighbourAverage;
            if (ratio > SPIKE_RATIO) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("weight_kg", current.weightOrZero());
                details.put("neighbour_average_kg", neighbourAverage);
                details.put("spike_ratio", ratio);
                details.put("timestamp", current.timestamp().toString());
                anomalies.add(Anomaly.of(AnomalyTypes.TEMPORAL_WEIGHT_SPIKE, Severity.MEDIUM, 0.8, details, name()));
            }
        }
        return anomalies;
    }

    List<Anomaly> intervals(List<BinEvent> sorted) {
        List<Anomaly> anomalies = new ArrayList<>();
        Duration minimum = properties.minEventInterval();
        for (int i = 1; i < sorted.size(); i++) {
            Duration gap = Duration.between(sorted.get(i - 1).timestamp(), sorted.get(i).timestamp());
            if (gap.compareTo(minimum) < 0) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("interval_seconds", gap.toMillis() / 1000.0);
                details.put("threshold_seconds", minimum.getSeconds());
                details.put("timestamp", sorted.get(i).timestamp().toString());
                anomalies.add(Anomaly.of(AnomalyTypes.UNUSUALLY_FREQUENT_EVENTS, Severity.MEDIUM, 0.7, details, name()));
            }
        }
        return anomalies;
    }

    List<Anomaly> seasonalHours(List<BinEvent> sorted) {
        List<Anomaly> anomalies = new ArrayList<>();
        int[] hourly = EventWindowAggregator.hourlyHistogram(sorted, properties.zone());
        double mean = EventWindowAggregator.mean(hourly);
        for (int hour = 0; hour < hourly.length; hour++) {
            if (hourly[hour] > mean * SEASONAL_HOUR_RATIO) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("hour", hour);
                details.put("count", hourly[hour]);
                details.put("average_hourly_count", mean);
                anomalies.add(Anomaly.of(AnomalyTypes.SEASONAL_USAGE_PATTERN, Severity.LOW, 0.6, details, name()));
            }
        }
        return anomalies;
    }
}
