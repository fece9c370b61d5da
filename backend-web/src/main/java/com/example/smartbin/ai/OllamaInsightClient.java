package com.example.smartbin.ai;

import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.prediction.NarrativeInsight;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks an Ollama model for a JSON analysis and pulls the first JSON object out of the generated text.
 */
@Slf4j
public class OllamaInsightClient implements DelegatedInsightClient {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);
    private static final int MAX_PREDICTION_EVENTS = 20;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String model;

    public OllamaInsightClient(RestClient restClient, ObjectMapper objectMapper, String model) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.model = model;
    }

    @Override
    public String provider() {
        return "ollama";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public DelegatedAnalysis analyze(List<BinEvent> events) {
        if (events.isEmpty()) {
            return DelegatedAnalysis.empty();
        }
        log.info("Analyzing {} events with Ollama model {}", events.size(), model);
        JsonNode analysis = generateJson(analysisPrompt(events));
        return new DelegatedAnalysis(
                InsightJson.insights(analysis, "insights", false, objectMapper),
                InsightJson.insights(analysis, "anomalies", true, objectMapper),
                InsightJson.text(analysis, "summary")
        );
    }

    @Override
    public Optional<NarrativeInsight> predict(String binId, PredictionContext context) {
        log.info("Generating predictive insights for bin {} with Ollama model {}", binId, model);
        JsonNode prediction = generateJson(predictionPrompt(binId, context));
        List<String> peakTimes = InsightJson.strings(prediction, "peak_usage_times");
        if (peakTimes.isEmpty()) {
            peakTimes = InsightJson.strings(prediction.path("usage_patterns"), "peak_hours");
        }
        return Optional.of(new NarrativeInsight(
                peakTimes,
                InsightJson.strings(prediction, "optimization_suggestions"),
                InsightJson.strings(prediction, "risk_factors")
        ));
    }

    JsonNode generateJson(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        ObjectNode options = body.putObject("options");
        options.put("temperature", 0.3);
        options.put("top_p", 0.9);
        options.put("num_predict", 1000);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("Ollama generation failed: " + e.getMessage(), e);
        }

        String generated = InsightJson.text(response, "response");
        if (generated == null) {
            throw new UpstreamUnavailableException("Ollama returned no generated text");
        }
        return extractJson(generated);
    }

    JsonNode extractJson(String generated) {
        Matcher matcher = JSON_OBJECT.matcher(generated);
        if (!matcher.find()) {
            throw new UpstreamUnavailableException("No JSON object found in Ollama response");
        }
        try {
            return objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("Unparseable JSON in Ollama response: " + e.getOriginalMessage(), e);
        }
    }

    private String analysisPrompt(List<BinEvent> events) {
        return """
                You are an AI waste management analyst. Analyze the following smart bin events and provide detailed insights.

                EVENT DATA:
                %s

                Identify patterns in fill levels, weights and usage, detect anomalies and provide recommendations.
                Respond only with valid JSON in this format:
                {
                  "insights": [
                    {"type": "capacity_optimization|usage_pattern|anomaly|efficiency|maintenance",
                     "description": "...", "severity": "low|medium|high", "recommendation": "...", "confidence": 0.0}
                  ],
                  "summary": "...",
                  "anomalies": [
                    {"type": "high_fill|low_fill|unusual_weight|timing_anomaly", "description": "...",
                     "severity": "low|medium|high", "confidence": 0.0}
                  ]
                }
                """.formatted(InsightJson.eventSummary(events, objectMapper).toPrettyString());
    }

    private String predictionPrompt(String binId, PredictionContext context) {
        List<BinEvent> recent = context.recentEvents().stream().limit(MAX_PREDICTION_EVENTS).toList();
        return """
                Generate predictive analytics for smart bin operations based on historical data.

                BIN ID: %s
                LOCATION: %s (%s), capacity %.1f kg
                HISTORICAL DATA:
                %s

                Respond only with valid JSON in this format:
                {
                  "peak_usage_times": ["hour ranges"],
                  "optimization_suggestions": ["..."],
                  "risk_factors": ["..."]
                }
                """.formatted(
                binId,
                context.profile().locationLabel(),
                context.profile().locationClass(),
                context.profile().ratedCapacityKg(),
                InsightJson.eventSummary(recent, objectMapper).toPrettyString());
    }
}
