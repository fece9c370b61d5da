package com.example.smartbin.ai;

import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.prediction.NarrativeInsight;

import java.util.List;
import java.util.Optional;

/**
 * Used when no delegated backend is configured.
 */
public class NoOpInsightClient implements DelegatedInsightClient {

    @Override
    public String provider() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public DelegatedAnalysis analyze(List<BinEvent> events) {
        return DelegatedAnalysis.empty();
    }

    @Override
    public Optional<NarrativeInsight> predict(String binId, PredictionContext context) {
        return Optional.empty();
    }
}
