package com.example.smartbin.analytics;

/**
 * Summary statistics of a numeric series. Quartiles are taken at sorted index positions,
 * not interpolated.
 */
public record Stats(
        int count,
        double mean,
        double stdDev,
        double median,
        double q1,
        double q3,
        double iqr,
        double min,
        double max
) {

    public double lowerFence(double multiplier) {
        return q1 - multiplier * iqr;
    }

    public double upperFence(double multiplier) {
        return q3 + multiplier * iqr;
    }
}
