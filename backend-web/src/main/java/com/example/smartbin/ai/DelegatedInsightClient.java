package com.example.smartbin.ai;

import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.prediction.NarrativeInsight;

import java.util.List;
import java.util.Optional;

/**
 * Optional text-generation backend supplying extra anomaly and insight signals.
 * An unconfigured client answers with empty results rather than failing.
 */
public interface DelegatedInsightClient {

    /**
     * Short provider name, used in logs and anomaly details.
     */
    String provider();

    boolean isAvailable();

    /**
     * @throws UpstreamUnavailableException if the backend cannot be reached or answers garbage
     */
    DelegatedAnalysis analyze(List<BinEvent> events);

    /**
     * @throws UpstreamUnavailableException if the backend cannot be reached or answers garbage
     */
    Optional<NarrativeInsight> predict(String binId, PredictionContext context);
}
