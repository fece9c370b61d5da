package com.example.smartbin.model.prediction;

import java.util.List;

/**
 * Free-text insights from the delegated backend, or one of the canned fallbacks.
 */
public record NarrativeInsight(
        List<String> peakUsageTimes,
        List<String> optimizationSuggestions,
        List<String> riskFactors
) {

    public NarrativeInsight {
        peakUsageTimes = peakUsageTimes == null ? List.of() : List.copyOf(peakUsageTimes);
        optimizationSuggestions = optimizationSuggestions == null ? List.of() : List.copyOf(optimizationSuggestions);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    public static NarrativeInsight fallback() {
        return new NarrativeInsight(
                List.of("14:00-16:00", "18:00-20:00"),
                List.of("Add token multiplier campaign", "Consider additional bin placement"),
                List.of("High contamination rate", "Irregular usage patterns")
        );
    }

    public static NarrativeInsight noHistory() {
        return new NarrativeInsight(
                List.of("14:00-16:00", "18:00-20:00"),
                List.of("Monitor usage patterns", "Implement user education"),
                List.of("Limited historical data")
        );
    }
}
