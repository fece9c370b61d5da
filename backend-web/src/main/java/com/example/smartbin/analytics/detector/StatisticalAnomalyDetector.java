package com.example.smartbin.analytics.detector;

import com.example.smartbin.analytics.Stats;
import com.example.smartbin.analytics.StatisticsToolkit;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Z-score and IQR outliers over the weight, fill level and purity series.
 */
@Slf4j
@Order(1)
@Component
public class StatisticalAnomalyDetector implements AnomalyDetector {

    static final int MIN_EVENTS = 3;

    private final AnalyticsProperties properties;

    public StatisticalAnomalyDetector(AnalyticsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "statistical";
    }

    @Override
    public List<Anomaly> detect(List<BinEvent> events, BinProfile profile) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (events.size() < MIN_EVENTS) {
            log.debug("Skipping statistical detection for bin {}: {} events", profile.binId(), events.size());
            return anomalies;
        }
        anomalies.addAll(outliersOf(events, BinEvent::weightKg, "weight"));
        anomalies.addAll(outliersOf(events, BinEvent::fillLevelPct, "fill_level"));
        anomalies.addAll(outliersOf(events, BinEvent::purityScore, "purity"));
        return anomalies;
    }

    private List<Anomaly> outliersOf(List<BinEvent> events, Function<BinEvent, Double> field, String label) {
        List<Double> values = events.stream()
                .map(field)
                .filter(Objects::nonNull)
                .filter(v -> v > 0)
                .toList();
        if (values.isEmpty()) {
            return List.of();
        }
        Stats stats = StatisticsToolkit.statistics(values);
        return StatisticsToolkit.outliers(values, stats, label,
                properties.zScoreThreshold(), properties.iqrMultiplier());
    }
}
