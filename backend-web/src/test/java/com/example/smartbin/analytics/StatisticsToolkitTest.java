package com.example.smartbin.analytics;

import com.example.smartbin.exception.InsufficientDataException;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StatisticsToolkitTest {

    private static final double EPSILON = 1e-9;

    @Test
    public void testStatisticsUsesIndexQuartilesAndPopulationStdDev() {
        Stats stats = StatisticsToolkit.statistics(List.of(5.0, 1.0, 4.0, 2.0, 3.0));

        assertEquals(5, stats.count());
        assertEquals(3.0, stats.mean(), EPSILON);
        assertEquals(Math.sqrt(2.0), stats.stdDev(), EPSILON);
        assertEquals(3.0, stats.median(), EPSILON);
        assertEquals(2.0, stats.q1(), EPSILON);
        assertEquals(4.0, stats.q3(), EPSILON);
        assertEquals(2.0, stats.iqr(), EPSILON);
        assertEquals(1.0, stats.min(), EPSILON);
        assertEquals(5.0, stats.max(), EPSILON);
    }

    @Test
    public void testSummaryIsOrdered() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 37; i++) {
            values.add((double) ((i * 17) % 23));
        }
        Collections.shuffle(values);

        Stats stats = StatisticsToolkit.statistics(values);

        assertTrue(stats.min() <= stats.q1());
        assertTrue(stats.q1() <= stats.median());
        assertTrue(stats.median() <= stats.q3());
        assertTrue(stats.q3() <= stats.max());
        assertTrue(stats.stdDev() >= 0);
    }

    @Test
    public void testEmptySeriesIsInsufficientData() {
        assertThrows(InsufficientDataException.class, () -> StatisticsToolkit.statistics(List.of()));
        assertThrows(InsufficientDataException.class, () -> StatisticsToolkit.mean(List.of()));
    }

    @Test
    public void testZScoreIsZeroWithoutSpread() {
        assertEquals(0.0, StatisticsToolkit.zScore(42.0, 10.0, 0.0), EPSILON);
        assertEquals(2.0, StatisticsToolkit.zScore(6.0, 10.0, 2.0), EPSILON);
    }

    @Test
    public void testUniformSeriesHasNoOutliers() {
        List<Double> values = List.of(7.0, 7.0, 7.0, 7.0, 7.0, 7.0);
        Stats stats = StatisticsToolkit.statistics(values);

        assertTrue(StatisticsToolkit.outliers(values, stats, "weight").isEmpty());
    }

    @Test
    public void testIqrOutlierBelowZScoreThreshold() {
        List<Double> values = List.of(10.0, 10.0, 10.0, 10.0, 50.0);
        Stats stats = StatisticsToolkit.statistics(values);

        assertEquals(18.0, stats.mean(), EPSILON);
        assertEquals(16.0, stats.stdDev(), EPSILON);

        List<Anomaly> outliers = StatisticsToolkit.outliers(values, stats, "weight");

        assertEquals(1, outliers.size());
        Anomaly outlier = outliers.get(0);
        assertEquals("weight_outlier", outlier.type());
        assertEquals(Severity.MEDIUM, outlier.severity());
        assertEquals(0.5, outlier.confidence(), EPSILON);
        assertEquals("iqr", outlier.details().get("method"));
        assertEquals(50.0, outlier.details().get("value"));
        assertEquals(10.0, outlier.details().get("upper_bound"));
        assertEquals("statistical", outlier.source());
    }

    @Test
    public void testExtremeZScoreIsHighSeverityWithCappedConfidence() {
        List<Double> values = new ArrayList<>(Collections.nCopies(19, 0.0));
        values.add(100.0);
        Stats stats = StatisticsToolkit.statistics(values);

        List<Anomaly> outliers = StatisticsToolkit.outliers(values, stats, "fill_level");

        assertEquals(1, outliers.size());
        assertEquals("fill_level_outlier", outliers.get(0).type());
        assertEquals(Severity.HIGH, outliers.get(0).severity());
        assertEquals(0.95, outliers.get(0).confidence(), EPSILON);
        assertEquals("z_score", outliers.get(0).details().get("method"));
    }
}
