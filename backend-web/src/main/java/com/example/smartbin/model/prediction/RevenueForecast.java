package com.example.smartbin.model.prediction;

public record RevenueForecast(
        double predictedRevenue,
        double confidence,
        double dailyRevenue,
        boolean purityBonusApplied
) {
}
