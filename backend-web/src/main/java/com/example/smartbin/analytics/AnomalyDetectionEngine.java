package com.example.smartbin.analytics;

import com.example.smartbin.analytics.detector.AnomalyDetector;
import com.example.smartbin.config.AnalyticsProperties;
import com.example.smartbin.exception.AnalyticsException;
import com.example.smartbin.exception.InsufficientDataException;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.model.DetectionReport;
import com.example.smartbin.model.Severity;
import com.example.smartbin.model.StoredAnomaly;
import com.example.smartbin.service.AnomalyStore;
import com.example.smartbin.service.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every detector over the events of each bin, consolidates the candidates and stores the
 * ones not already recorded for the bin within the duplicate window.
 */
@Slf4j
@Service
public class AnomalyDetectionEngine {

    private final List<AnomalyDetector> detectors;
    private final EventStore eventStore;
    private final AnomalyStore anomalyStore;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public AnomalyDetectionEngine(List<AnomalyDetector> detectors,
                                  EventStore eventStore,
                                  AnomalyStore anomalyStore,
                                  AnalyticsProperties properties,
                                  Clock clock) {
        this.detectors = List.copyOf(detectors);
        this.eventStore = eventStore;
        this.anomalyStore = anomalyStore;
        this.properties = properties;
        this.clock = clock;
    }

    public List<Anomaly> detect(List<BinEvent> eventsForBin, BinProfile profile) {
        if (eventsForBin.isEmpty()) {
            return List.of();
        }
        List<Anomaly> candidates = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                List<Anomaly> found = detector.detect(eventsForBin, profile);
                log.debug("Detector {} found {} candidates for bin {}", detector.name(), found.size(), profile.binId());
                candidates.addAll(found);
            } catch (InsufficientDataException e) {
                log.debug("Detector {} skipped for bin {}: {}", detector.name(), profile.binId(), e.getMessage());
            }
        }
        return AnomalyConsolidator.consolidate(candidates);
    }

    /**
     * Ad-hoc detection over one bin's recent history. Nothing is stored.
     */
    public List<Anomaly> detectForBin(String binId, Instant since) {
        List<BinEvent> events = eventStore.fetchBinEvents(binId, since);
        BinProfile profile = eventStore.fetchBinProfile(binId)
                .orElseGet(() -> events.isEmpty() ? BinProfile.defaults(binId) : EventWindowAggregator.buildProfile(events));
        return detect(events, profile);
    }

    public DetectionReport detectAndStoreAnomalies() {
        return detectAndStore(clock.instant());
    }

    public DetectionReport detectAndStore(Instant now) {
        Instant windowStart = now.minus(properties.detectionWindow());
        List<BinEvent> events;
        try {
            events = eventStore.fetchRecentEvents(windowStart);
        } catch (AnalyticsException e) {
            log.warn("Anomaly detection skipped, events unavailable: {}", e.getMessage());
            return DetectionReport.empty(windowStart, now);
        }

        Map<String, List<BinEvent>> byBin = EventWindowAggregator.groupByBin(events);
        Map<String, String> failedBins = new LinkedHashMap<>();
        int detected = 0;
        int stored = 0;
        int suppressed = 0;

        for (Map.Entry<String, List<BinEvent>> entry : byBin.entrySet()) {
            String binId = entry.getKey();
            List<BinEvent> binEvents = entry.getValue();
            try {
                List<Anomaly> anomalies = detect(binEvents, EventWindowAggregator.buildProfile(binEvents));
                detected += anomalies.size();
                if (anomalies.isEmpty()) {
                    continue;
                }
                List<StoredAnomaly> fresh = withoutRecentDuplicates(binId, anomalies, latestEventId(binEvents), now);
                suppressed += anomalies.size() - fresh.size();
                anomalyStore.persist(fresh);
                stored += fresh.size();
            } catch (RuntimeException e) {
                log.error("Anomaly detection failed for bin {}", binId, e);
                failedBins.put(binId, String.valueOf(e.getMessage()));
            }
        }

        log.info("Anomaly detection over {} events in {} bins: {} detected, {} stored, {} suppressed, {} failed bins",
                events.size(), byBin.size(), detected, stored, suppressed, failedBins.size());
        return new DetectionReport(windowStart, now, events.size(), byBin.size(), detected, stored, suppressed,
                Map.copyOf(failedBins));
    }

    private List<StoredAnomaly> withoutRecentDuplicates(String binId, List<Anomaly> anomalies, Long eventId, Instant now) {
        Set<Key> recent = new HashSet<>();
        for (StoredAnomaly existing : anomalyStore.findRecent(binId, now.minus(properties.duplicateWindow()))) {
            recent.add(new Key(existing.anomaly().type(), existing.anomaly().severity()));
        }
        List<StoredAnomaly> fresh = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            if (recent.add(new Key(anomaly.type(), anomaly.severity()))) {
                fresh.add(new StoredAnomaly(binId, eventId, anomaly, now));
            }
        }
        return fresh;
    }

    private static Long latestEventId(List<BinEvent> events) {
        return events.stream()
                .max(Comparator.comparing(BinEvent::timestamp))
                .map(BinEvent::eventId)
                .filter(Objects::nonNull)
                .orElse(null);
    }

    private record Key(String type, Severity severity) {
    }
}
