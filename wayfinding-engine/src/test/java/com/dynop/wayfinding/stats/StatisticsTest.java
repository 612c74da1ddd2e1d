package com.dynop.wayfinding.stats;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsTest {

    private static final double[] VALUES = {4, 1, 3, 2, 5};

    @Test
    void basicMoments() {
        assertEquals(3.0, Statistics.mean(VALUES), 1e-12);
        assertEquals(Math.sqrt(2.0), Statistics.std(VALUES), 1e-12);
        assertEquals(1.0, Statistics.min(VALUES));
        assertEquals(5.0, Statistics.max(VALUES));
        assertEquals(3.0, Statistics.median(VALUES), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 1.0",
            "25, 2.0",
            "50, 3.0",
            "90, 4.6",
            "100, 5.0"
    })
    void percentileInterpolatesLinearly(double percentile, double expected) {
        assertEquals(expected, Statistics.percentile(VALUES, percentile), 1e-12);
    }

    @Test
    void percentileDoesNotReorderInput() {
        double[] values = {3, 1, 2};
        Statistics.percentile(values, 50);
        assertArrayEquals(new double[]{3, 1, 2}, values);
    }

    @Test
    void emptyInputYieldsZero() {
        double[] empty = new double[0];
        assertEquals(0.0, Statistics.mean(empty));
        assertEquals(0.0, Statistics.std(empty));
        assertEquals(0.0, Statistics.percentile(empty, 90));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1, 100.5, Double.NaN})
    void rejectsPercentileOutsideRange(double percentile) {
        assertThrows(IllegalArgumentException.class, () -> Statistics.percentile(VALUES, percentile));
    }

    @Test
    void distributionSummaryCollectsQuantiles() {
        DistributionSummary summary = DistributionSummary.of(new double[]{10, 20, 30, 40, 50, 60, 70, 80, 90, 100, 110});

        assertEquals(11, summary.getCount());
        assertEquals(60.0, summary.getMean(), 1e-9);
        assertEquals(60.0, summary.getMedian(), 1e-9);
        assertEquals(20.0, summary.getP10(), 1e-9);
        assertEquals(35.0, summary.getP25(), 1e-9);
        assertEquals(85.0, summary.getP75(), 1e-9);
        assertEquals(100.0, summary.getP90(), 1e-9);
        assertEquals(10.0, summary.getMin());
        assertEquals(110.0, summary.getMax());
    }
}
