package com.example.smartbin.ai;

import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.prediction.NarrativeInsight;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenXAI Xnode backend. Events are classified one request at a time; a bin optimisation
 * endpoint supplies the narrative predictions.
 */
@Slf4j
public class OpenXaiInsightClient implements DelegatedInsightClient {

    private static final int PREDICTION_HORIZON_DAYS = 7;
    static final int MAX_ANALYZED_EVENTS = 50;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenXaiInsightClient(RestClient restClient, ObjectMapper objectMapper, String apiKey) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public String provider() {
        return "openxai";
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public DelegatedAnalysis analyze(List<BinEvent> events) {
        if (!isAvailable() || events.isEmpty()) {
            return DelegatedAnalysis.empty();
        }
        List<BinEvent> batch = events.stream()
                .sorted(Comparator.comparing(BinEvent::timestamp))
                .skip(Math.max(0, events.size() - MAX_ANALYZED_EVENTS))
                .toList();
        log.info("[OpenXAI] Analyzing {} of {} events", batch.size(), events.size());
        List<DelegatedInsight> anomalies = new ArrayList<>();
        int failed = 0;
        int sent = 0;
        UpstreamUnavailableException lastFailure = null;
        for (BinEvent event : batch) {
            // one blocking request per event; stop as soon as the caller gives up
            if (Thread.currentThread().isInterrupted()) {
                throw new UpstreamUnavailableException("[OpenXAI] Analysis interrupted after "
                        + sent + " of " + batch.size() + " requests");
            }
            sent++;
            try {
                classify(event).ifPresent(anomalies::add);
            } catch (UpstreamUnavailableException e) {
                failed++;
                lastFailure = e;
            }
        }
        if (failed == batch.size()) {
            throw lastFailure;
        }
        if (failed > 0) {
            log.warn("[OpenXAI] {} of {} events could not be analyzed", failed, batch.size());
        }
        return new DelegatedAnalysis(List.of(), anomalies,
                "Analyzed " + (batch.size() - failed) + " of " + events.size() + " events");
    }

    Optional<DelegatedInsight> classify(BinEvent event) {
        JsonNode response = post("/v1/analysis/waste-classification", eventPayload(event), "event_" + event.eventId());
        JsonNode analysis = response.path("analysis");
        if (!analysis.path("anomaly_detected").asBoolean(false)) {
            return Optional.empty();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("event_id", event.eventId());
        attributes.put("message", analysis.path("anomaly_message").asText("Unusual waste pattern detected"));
        attributes.put("purity_score", InsightJson.doubleVal(analysis, "purity_score"));
        attributes.put("model_version", response.path("model_version").asText("v1.0"));
        return Optional.of(new DelegatedInsight(
                analysis.path("anomaly_type").asText("UnusualPattern"),
                analysis.path("anomaly_severity").asText("medium"),
                analysis.hasNonNull("anomaly_confidence") ? analysis.get("anomaly_confidence").asDouble() : 0.75,
                InsightJson.text(analysis, "anomaly_message"),
                null,
                true,
                attributes
        ));
    }

    @Override
    public Optional<NarrativeInsight> predict(String binId, PredictionContext context) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("bin_id", binId);
        body.set("historical_data", InsightJson.eventSummary(context.recentEvents(), objectMapper));
        body.put("prediction_horizon", PREDICTION_HORIZON_DAYS);

        JsonNode response = post("/v1/predictions/bin-optimization", body, "predict_" + binId);
        return Optional.of(new NarrativeInsight(
                InsightJson.strings(response, "peak_usage_times"),
                InsightJson.strings(response, "optimization_suggestions"),
                InsightJson.strings(response, "risk_factors")
        ));
    }

    private ObjectNode eventPayload(BinEvent event) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("event_id", event.eventId());
        payload.put("bin_id", event.binId());
        ObjectNode sensor = payload.putObject("sensor_data");
        sensor.put("weight_kg", event.weightOrZero());
        sensor.put("fill_level", event.fillLevelPct() != null ? event.fillLevelPct() : 0.0);
        sensor.put("battery_pct", event.batteryPct());
        payload.set("event_data", objectMapper.valueToTree(event.materialCounts()));
        payload.put("timestamp", event.timestamp().toString());
        ObjectNode context = payload.putObject("context");
        context.put("bin_location", event.locationLabel() != null ? event.locationLabel() : "Unknown");
        context.put("user_id", event.userId());
        return payload;
    }

    private JsonNode post(String path, JsonNode body, String requestId) {
        try {
            JsonNode response = restClient.post()
                    .uri(path)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("X-Request-ID", requestId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new UpstreamUnavailableException("[OpenXAI] Empty response from " + path);
            }
            return response;
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("[OpenXAI] Request to " + path + " failed: " + e.getMessage(), e);
        }
    }
}
