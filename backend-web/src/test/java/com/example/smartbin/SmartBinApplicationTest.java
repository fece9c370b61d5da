package com.example.smartbin;

import com.example.smartbin.ai.DelegatedInsightClient;
import com.example.smartbin.analytics.detector.AnomalyDetector;
import com.example.smartbin.config.AnalyticsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@SpringBootTest
public class SmartBinApplicationTest {

    @Autowired
    private List<AnomalyDetector> detectors;

    @Autowired
    private DelegatedInsightClient delegatedInsightClient;

    @Autowired
    private AnalyticsProperties analyticsProperties;

    @Test
    public void testContextWiresAllDetectorsInOrder() {
        assertEquals(List.of("statistical", "pattern", "contextual", "temporal", "delegated"),
                detectors.stream().map(AnomalyDetector::name).toList());
        assertFalse(delegatedInsightClient.isAvailable());
        assertEquals(Duration.ofDays(7), analyticsProperties.detectionWindow());
        assertEquals(Duration.ofMinutes(5), analyticsProperties.minEventInterval());
    }
}
