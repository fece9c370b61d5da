package com.example.smartbin.service;

import com.example.smartbin.analytics.AnomalyDetectionEngine;
import com.example.smartbin.model.DetectionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic batch run of the anomaly detection over the rolling window.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.analytics.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AnomalyDetectionScheduler {

    private final AnomalyDetectionEngine anomalyDetectionEngine;

    public AnomalyDetectionScheduler(AnomalyDetectionEngine anomalyDetectionEngine) {
        this.anomalyDetectionEngine = anomalyDetectionEngine;
    }

    @Scheduled(cron = "${app.analytics.scheduler.cron:0 */10 * * * *}")
    public void runDetection() {
        log.debug("Scheduled anomaly detection starting");
        DetectionReport report = anomalyDetectionEngine.detectAndStoreAnomalies();
        if (!report.failedBins().isEmpty()) {
            log.warn("Scheduled anomaly detection finished with failures for bins {}", report.failedBins().keySet());
        }
    }
}
