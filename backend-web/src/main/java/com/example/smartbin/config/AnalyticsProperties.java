package com.example.smartbin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Calibration parameters of the analytics engines. Defaults reproduce the historical thresholds.
 */
@ConfigurationProperties(prefix = "app.analytics")
public record AnalyticsProperties(
        @DefaultValue("2.5") double zScoreThreshold,
        @DefaultValue("1.5") double iqrMultiplier,
        @DefaultValue("300s") Duration minEventInterval,
        @DefaultValue("7d") Duration detectionWindow,
        @DefaultValue("30d") Duration predictionWindow,
        @DefaultValue("1h") Duration duplicateWindow,
        @DefaultValue("2.5") double revenuePerKg,
        @DefaultValue("UTC") ZoneId zone
) {

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(
                2.5,
                1.5,
                Duration.ofSeconds(300),
                Duration.ofDays(7),
                Duration.ofDays(30),
                Duration.ofHours(1),
                2.5,
                ZoneId.of("UTC")
        );
    }
}
