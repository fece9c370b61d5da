package com.example.smartbin.analytics.detector;

import com.example.smartbin.ai.DelegatedAnalysis;
import com.example.smartbin.ai.DelegatedInsight;
import com.example.smartbin.ai.DelegatedInsightClient;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates anomalies reported by the delegated backend. Any failure of the backend means
 * no delegated anomalies for this run.
 */
@Slf4j
@Order(5)
@Component
public class DelegatedAnomalyDetector implements AnomalyDetector {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final String FALLBACK_TYPE = "delegated_anomaly";

    private final DelegatedInsightClient client;

    public DelegatedAnomalyDetector(DelegatedInsightClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "delegated";
    }

    @Override
    public List<Anomaly> detect(List<BinEvent> events, BinProfile profile) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (events.isEmpty() || !client.isAvailable()) {
            return anomalies;
        }

        DelegatedAnalysis analysis;
        try {
            analysis = client.analyze(events);
        } catch (RuntimeException e) {
            log.warn("Delegated anomaly detection via {} failed for bin {}: {}",
                    client.provider(), profile.binId(), e.getMessage());
            return anomalies;
        }

        for (DelegatedInsight insight : analysis.insights()) {
            if (insight.indicatesAnomaly()) {
                anomalies.add(toAnomaly(insight));
            }
        }
        for (DelegatedInsight insight : analysis.anomalies()) {
            anomalies.add(toAnomaly(insight));
        }
        log.debug("Delegated backend {} reported {} anomalies for bin {}", client.provider(), anomalies.size(), profile.binId());
        return anomalies;
    }

    private Anomaly toAnomaly(DelegatedInsight insight) {
        Map<String, Object> details = new LinkedHashMap<>(insight.attributes());
        details.put("provider", client.provider());
        if (insight.description() != null) {
            details.put("description", insight.description());
        }
        if (insight.recommendation() != null) {
            details.put("recommendation", insight.recommendation());
        }
        String type = insight.type() != null && !insight.type().isBlank() ? insight.type() : FALLBACK_TYPE;
        double confidence = insight.confidence() != null ? insight.confidence() : DEFAULT_CONFIDENCE;
        return Anomaly.of(type, Severity.fromLabel(insight.severity()), confidence, details, name());
    }
}
