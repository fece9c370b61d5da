package com.example.smartbin.ai;

import com.example.smartbin.EventFixtures;
import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.prediction.NarrativeInsight;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class OllamaInsightClientTest {

    private static final String BASE_URL = "http://ollama.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<BinEvent> events = List.of(EventFixtures.builder("bin-1", EventFixtures.MONDAY)
            .eventId(7L)
            .weightKg(2.5)
            .fillLevelPct(40.0)
            .materialCounts(Map.of("plastic", 3))
            .build());

    private MockRestServiceServer server;
    private OllamaInsightClient client;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OllamaInsightClient(builder.build(), objectMapper, "llama2:7b");
    }

    @Test
    public void testAnalyzeExtractsJsonFromGeneratedText() {
        String generated = "Sure, here is the analysis:\n"
                + "{\"insights\": [{\"type\": \"anomaly\", \"severity\": \"high\", \"description\": \"Spike\", \"confidence\": 0.9},"
                + " {\"type\": \"efficiency\", \"severity\": \"low\", \"description\": \"Fine\"}],"
                + " \"summary\": \"One spike\","
                + " \"anomalies\": [{\"type\": \"high_fill\", \"severity\": \"medium\", \"description\": \"Nearly full\"}]}\n"
                + "Let me know if you need more.";
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llama2:7b"))
                .andExpect(jsonPath("$.stream").value(false))
                .andRespond(withSuccess(ollamaResponse(generated), MediaType.APPLICATION_JSON));

        DelegatedAnalysis analysis = client.analyze(events);

        server.verify();
        assertEquals("One spike", analysis.summary());
        assertEquals(2, analysis.insights().size());
        assertTrue(analysis.insights().get(0).indicatesAnomaly());
        assertEquals(0.9, analysis.insights().get(0).confidence(), 1e-9);
        assertEquals(1, analysis.anomalies().size());
        assertTrue(analysis.anomalies().get(0).anomalous());
        assertEquals("high_fill", analysis.anomalies().get(0).type());
        assertEquals(List.of("type", "severity", "description"),
                List.copyOf(analysis.anomalies().get(0).attributes().keySet()));
        assertEquals("Nearly full", analysis.anomalies().get(0).attributes().get("description"));
    }

    @Test
    public void testPredictFallsBackToUsagePatternPeakHours() {
        String generated = "{\"usage_patterns\": {\"peak_hours\": [\"07:00-09:00\"]},"
                + " \"optimization_suggestions\": [\"Collect at 10:00\"], \"risk_factors\": []}";
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andRespond(withSuccess(ollamaResponse(generated), MediaType.APPLICATION_JSON));

        Optional<NarrativeInsight> insight = client.predict("bin-1",
                new PredictionContext(BinProfile.defaults("bin-1"), events));

        assertTrue(insight.isPresent());
        assertEquals(List.of("07:00-09:00"), insight.get().peakUsageTimes());
        assertEquals(List.of("Collect at 10:00"), insight.get().optimizationSuggestions());
        assertTrue(insight.get().riskFactors().isEmpty());
    }

    @Test
    public void testTextWithoutJsonIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andRespond(withSuccess(ollamaResponse("I cannot help with that."), MediaType.APPLICATION_JSON));

        assertThrows(UpstreamUnavailableException.class, () -> client.analyze(events));
    }

    @Test
    public void testServerErrorIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/api/generate")).andRespond(withServerError());

        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.analyze(events));
        assertNotNull(e.getCause());
    }

    @Test
    public void testBrokenJsonIsUnavailable() {
        assertThrows(UpstreamUnavailableException.class, () -> client.extractJson("{\"insights\": [}"));
        assertEquals("b", client.extractJson("x {\"a\": \"b\"} y").get("a").asText());
    }

    private String ollamaResponse(String generated) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("model", "llama2:7b");
        response.put("response", generated);
        response.put("done", true);
        return response.toString();
    }
}
