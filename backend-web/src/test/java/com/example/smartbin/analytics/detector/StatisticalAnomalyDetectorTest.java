package com.example.smartbin.analytics.detector;

import com.example.smartbin.EventFixtures;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StatisticalAnomalyDetectorTest {

    private StatisticalAnomalyDetector detector;
    private final BinProfile profile = BinProfile.defaults("bin-1");

    @BeforeEach
    public void setUp() {
        detector = new StatisticalAnomalyDetector(AnalyticsProperties.defaults());
    }

    @Test
    public void testNeedsThreeEvents() {
        List<BinEvent> events = EventFixtures.weightSeries("bin-1", EventFixtures.MONDAY, Duration.ofHours(1), 1.0, 100.0);
        assertTrue(detector.detect(events, profile).isEmpty());
    }

    @Test
    public void testFlagsHeavyWeight() {
        List<BinEvent> events = EventFixtures.weightSeries("bin-1", EventFixtures.MONDAY, Duration.ofHours(1),
                10.0, 10.0, 10.0, 10.0, 50.0);

        List<Anomaly> anomalies = detector.detect(events, profile);

        assertEquals(1, anomalies.size());
        assertEquals("weight_outlier", anomalies.get(0).type());
        assertEquals("statistical", anomalies.get(0).source());
    }

    @Test
    public void testNonPositiveReadingsAreIgnored() {
        // with the zero included, 0 would sit below the lower IQR fence
        List<BinEvent> events = EventFixtures.weightSeries("bin-1", EventFixtures.MONDAY, Duration.ofHours(1),
                0.0, 10.0, 10.0, 10.0, 10.0);

        assertTrue(detector.detect(events, profile).isEmpty());
    }

    @Test
    public void testFillLevelAndPuritySeries() {
        List<BinEvent> events = List.of(
                EventFixtures.builder("bin-1", EventFixtures.MONDAY).fillLevelPct(20.0).purityScore(0.9).build(),
                EventFixtures.builder("bin-1", EventFixtures.MONDAY.plusSeconds(600)).fillLevelPct(20.0).purityScore(0.9).build(),
                EventFixtures.builder("bin-1", EventFixtures.MONDAY.plusSeconds(1200)).fillLevelPct(20.0).purityScore(0.9).build(),
                EventFixtures.builder("bin-1", EventFixtures.MONDAY.plusSeconds(1800)).fillLevelPct(20.0).purityScore(0.9).build(),
                EventFixtures.builder("bin-1", EventFixtures.MONDAY.plusSeconds(2400)).fillLevelPct(95.0).purityScore(0.1).build());

        List<String> types = detector.detect(events, profile).stream().map(Anomaly::type).toList();

        assertEquals(List.of("fill_level_outlier", "purity_outlier"), types);
    }
}
