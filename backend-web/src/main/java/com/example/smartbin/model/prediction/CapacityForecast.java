package com.example.smartbin.model.prediction;

public record CapacityForecast(
        double predictedCapacityKg,
        double confidence,
        Factors factors
) {

    public record Factors(
            double dailyAverageKg,
            Trend trend,
            Seasonality seasonality,
            int bufferPercentage
    ) {
    }
}
