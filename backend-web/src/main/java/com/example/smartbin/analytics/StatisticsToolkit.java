package com.example.smartbin.analytics;

import com.example.smartbin.exception.InsufficientDataException;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyTypes;
import com.example.smartbin.model.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric primitives shared by the detectors.
 */
public final class StatisticsToolkit {

    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.5;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    static final double HIGH_SEVERITY_Z_SCORE = 3.0;
    static final double MAX_OUTLIER_CONFIDENCE = 0.95;

    private StatisticsToolkit() {
    }

    /**
     * Computes summary statistics using the population standard deviation.
     *
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static Stats statistics(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InsufficientDataException("Cannot compute statistics of an empty series");
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int n = sorted.length;

        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;

        double squaredDiffs = 0.0;
        for (double v : sorted) {
            double diff = v - mean;
            squaredDiffs += diff * diff;
        }
        double stdDev = Math.sqrt(squaredDiffs / n);

        double median = sorted[n / 2];
        double q1 = sorted[(int) Math.floor(n * 0.25)];
        double q3 = sorted[(int) Math.floor(n * 0.75)];

        return new Stats(n, mean, stdDev, median, q1, q3, q3 - q1, sorted[0], sorted[n - 1]);
    }

    public static double mean(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InsufficientDataException("Cannot compute the mean of an empty series");
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * Absolute z-score, or 0 when the series has no spread.
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0.0) {
            return 0.0;
        }
        return Math.abs(value - mean) / stdDev;
    }

    public static List<Anomaly> outliers(List<Double> values, Stats stats, String label) {
        return outliers(values, stats, label, DEFAULT_Z_SCORE_THRESHOLD, DEFAULT_IQR_MULTIPLIER);
    }

    /**
     * Flags every value that is a z-score or IQR outlier. A uniform series (stdDev 0) has none.
     */
    public static List<Anomaly> outliers(List<Double> values, Stats stats, String label,
                                         double zScoreThreshold, double iqrMultiplier) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (stats.stdDev() == 0.0) {
            return anomalies;
        }
        double lower = stats.lowerFence(iqrMultiplier);
        double upper = stats.upperFence(iqrMultiplier);

        for (double value : values) {
            double z = zScore(value, stats.mean(), stats.stdDev());
            boolean zScoreOutlier = z > zScoreThreshold;
            boolean iqrOutlier = value < lower || value > upper;
            if (!zScoreOutlier && !iqrOutlier) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("value", value);
            details.put("z_score", z);
            details.put("method", zScoreOutlier ? "z_score" : "iqr");
            details.put("iqr_outlier", iqrOutlier);
            details.put("lower_bound", lower);
            details.put("upper_bound", upper);
            details.put("mean", stats.mean());
            anomalies.add(Anomaly.of(
                    AnomalyTypes.outlier(label),
                    z > HIGH_SEVERITY_Z_SCORE ? Severity.HIGH : Severity.MEDIUM,
                    Math.min(MAX_OUTLIER_CONFIDENCE, z / 4),
                    details,
                    "statistical"
            ));
        }
        return anomalies;
    }
}
