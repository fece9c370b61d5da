package com.example.smartbin.model.prediction;

/**
 * Caller knobs for a prediction run.
 *
 * @param currentCadence the cadence the bin is collected on today, used for the savings figure
 * @param includeDelegatedInsights whether to ask the delegated backend for narrative insights
 */
public record PredictionOptions(
        CollectionCadence currentCadence,
        boolean includeDelegatedInsights
) {

    public PredictionOptions {
        if (currentCadence == null) {
            currentCadence = CollectionCadence.DAILY;
        }
    }

    public static PredictionOptions defaults() {
        return new PredictionOptions(CollectionCadence.DAILY, true);
    }
}
