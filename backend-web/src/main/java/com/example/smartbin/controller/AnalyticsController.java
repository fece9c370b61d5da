package com.example.smartbin.controller;

import com.example.smartbin.analytics.AnomalyDetectionEngine;
import com.example.smartbin.analytics.PredictiveAnalyticsEngine;
import com.example.smartbin.exception.AnalyticsException;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.DetectionReport;
import com.example.smartbin.model.prediction.BinPredictions;
import com.example.smartbin.model.prediction.CollectionCadence;
import com.example.smartbin.model.prediction.PredictionOptions;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/analytics")
@CrossOrigin(origins = "http://localhost:5173")
public class AnalyticsController {

    private final AnomalyDetectionEngine anomalyDetectionEngine;
    private final PredictiveAnalyticsEngine predictiveAnalyticsEngine;
    private final Clock clock;

    public AnalyticsController(AnomalyDetectionEngine anomalyDetectionEngine,
                               PredictiveAnalyticsEngine predictiveAnalyticsEngine,
                               Clock clock) {
        this.anomalyDetectionEngine = anomalyDetectionEngine;
        this.predictiveAnalyticsEngine = predictiveAnalyticsEngine;
        this.clock = clock;
    }

    @GetMapping("/bins/{binId}/predictions")
    public BinPredictions getPredictions(@PathVariable String binId,
                                         @RequestParam(defaultValue = "daily") String currentCadence,
                                         @RequestParam(defaultValue = "true") boolean insights) {
        PredictionOptions options = new PredictionOptions(parseCadence(currentCadence), insights);
        return predictiveAnalyticsEngine.generatePredictions(binId, options);
    }

    @GetMapping("/bins/{binId}/anomalies")
    public List<Anomaly> getAnomalies(@PathVariable String binId,
                                      @RequestParam(defaultValue = "7") int days) {
        if (days < 1 || days > 90) {
            throw new IllegalArgumentException("days must be between 1 and 90");
        }
        return anomalyDetectionEngine.detectForBin(binId, clock.instant().minus(Duration.ofDays(days)));
    }

    @PostMapping("/anomalies/detect")
    public DetectionReport runDetection() {
        return anomalyDetectionEngine.detectAndStoreAnomalies();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(createErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<Map<String, String>> handleAnalyticsFailure(AnalyticsException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(createErrorResponse(e.getMessage()));
    }

    private static CollectionCadence parseCadence(String value) {
        try {
            return CollectionCadence.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown collection cadence: " + value, e);
        }
    }

    private Map<String, String> createErrorResponse(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return response;
    }
}
