package com.example.smartbin.analytics.detector;

import com.example.smartbin.EventFixtures;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyTypes;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ContextualAnomalyDetectorTest {

    private static final Instant NOON = EventFixtures.MONDAY.plus(Duration.ofHours(12));

    private ContextualAnomalyDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new ContextualAnomalyDetector(AnalyticsProperties.defaults());
    }

    @Test
    public void testNightUsage() {
        List<BinEvent> events = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Instant night = EventFixtures.MONDAY.plus(Duration.ofHours(22 + i % 2)).plus(Duration.ofDays(i));
            events.add(EventFixtures.at("bin-1", night));
        }
        events.add(EventFixtures.at("bin-1", NOON));
        events.add(EventFixtures.at("bin-1", NOON.plus(Duration.ofDays(1))));

        List<Anomaly> anomalies = detector.detect(events, BinProfile.defaults("bin-1"));

        assertEquals(1, anomalies.size());
        Anomaly night = anomalies.get(0);
        assertEquals(AnomalyTypes.UNUSUAL_NIGHT_USAGE, night.type());
        assertEquals(Severity.MEDIUM, night.severity());
        assertEquals(0.7, night.confidence());
        assertEquals(8L, night.details().get("night_events"));
    }

    @Test
    public void testEarlyMorningCountsAsNight() {
        List<BinEvent> events = List.of(
                EventFixtures.at("bin-1", EventFixtures.MONDAY.plus(Duration.ofHours(5)).plusSeconds(3599)),
                EventFixtures.at("bin-1", EventFixtures.MONDAY.plus(Duration.ofHours(6))),
                EventFixtures.at("bin-1", NOON));

        List<Anomaly> anomalies = detector.detect(events, BinProfile.defaults("bin-1"));

        assertEquals(1, anomalies.size());
        assertEquals(1L, anomalies.get(0).details().get("night_events"));
    }

    @Test
    public void testBusyResidentialBin() {
        BinProfile residential = new BinProfile("bin-1", "residential", 100, "Block A");

        assertTrue(detector.detect(daytimeEvents(50, null), residential).isEmpty());

        List<Anomaly> anomalies = detector.detect(daytimeEvents(51, null), residential);
        assertEquals(1, anomalies.size());
        assertEquals(AnomalyTypes.HIGH_USAGE_RESIDENTIAL_AREA, anomalies.get(0).type());
        assertEquals(Severity.LOW, anomalies.get(0).severity());

        assertTrue(detector.detect(daytimeEvents(51, null), BinProfile.defaults("bin-1")).isEmpty());
    }

    @Test
    public void testHighFrequencyUser() {
        List<BinEvent> events = new ArrayList<>(daytimeEvents(21, "user-1"));
        events.addAll(daytimeEvents(20, "user-2"));

        List<Anomaly> anomalies = detector.detect(events, BinProfile.defaults("bin-1"));

        assertEquals(1, anomalies.size());
        assertEquals(AnomalyTypes.HIGH_FREQUENCY_USER, anomalies.get(0).type());
        assertEquals("user-1", anomalies.get(0).details().get("user_id"));
        assertEquals(21, anomalies.get(0).details().get("event_count"));
    }

    private static List<BinEvent> daytimeEvents(int count, String userId) {
        List<BinEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(EventFixtures.builder("bin-1", NOON.plusSeconds(i * 60L)).userId(userId).build());
        }
        return events;
    }
}
