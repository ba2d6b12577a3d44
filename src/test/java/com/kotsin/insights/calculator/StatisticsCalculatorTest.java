package com.kotsin.insights.calculator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatisticsCalculator
 */
class StatisticsCalculatorTest {

    private static final double EPSILON = 1e-9;

    private final StatisticsCalculator calculator = new StatisticsCalculator();

    // ========== Central tendency ==========

    @Test
    @DisplayName("Mean and median of a small sample")
    void testMeanAndMedian() {
        double[] values = {3, 1, 4, 1, 5};

        assertEquals(2.8, calculator.mean(values), EPSILON);
        assertEquals(3.0, calculator.median(values), EPSILON);
        assertEquals(2.5, calculator.median(new double[]{1, 2, 3, 4}), EPSILON);
    }

    @Test
    @DisplayName("Median leaves the input untouched")
    void testMedian_DoesNotSortInput() {
        double[] values = {5, 1, 3};

        calculator.median(values);

        assertArrayEquals(new double[]{5, 1, 3}, values);
    }

    @Test
    @DisplayName("Empty input yields zeros")
    void testEmptyInput() {
        assertEquals(0.0, calculator.mean(new double[0]));
        assertEquals(0.0, calculator.median(new double[0]));
        assertEquals(0.0, calculator.variance(new double[0]));
        assertEquals(0.0, calculator.stdDev(new double[0]));
    }

    @Test
    @DisplayName("Masked mean skips excluded indexes")
    void testMaskedMean() {
        double[] values = {1, 2, 3, 100};
        boolean[] excluded = {false, false, false, true};

        assertEquals(2.0, calculator.mean(values, excluded), EPSILON);
        assertEquals(1.0, calculator.sampleStdDev(values, excluded, 2.0), EPSILON);
    }

    // ========== Dispersion ==========

    @Test
    @DisplayName("Population vs sample variance")
    void testVariance() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertEquals(4.0, calculator.variance(values), EPSILON);
        assertEquals(2.0, calculator.stdDev(values), EPSILON);
        assertEquals(32.0 / 7.0, calculator.sampleVariance(values), EPSILON);
    }

    @Test
    @DisplayName("Constant series has exactly zero deviation")
    void testConstantSeries() {
        double[] values = {0.1, 0.1, 0.1, 0.1};

        assertTrue(calculator.isConstant(values));
        assertEquals(0.0, calculator.stdDev(values));
        assertEquals(0.0, calculator.zScore(0.1, 0.1, 0.0));
    }

    // ========== Correlation ==========

    @Test
    @DisplayName("Pearson correlation: perfect, inverse, degenerate")
    void testPearsonCorrelation() {
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 4, 6, 8, 10};
        double[] inverse = {10, 8, 6, 4, 2};
        double[] flat = {3, 3, 3, 3, 3};

        assertEquals(1.0, calculator.pearsonCorrelation(x, y, 5), EPSILON);
        assertEquals(-1.0, calculator.pearsonCorrelation(x, inverse, 5), EPSILON);
        assertEquals(0.0, calculator.pearsonCorrelation(x, flat, 5));
        assertEquals(0.0, calculator.pearsonCorrelation(x, y, 1));
    }

    @Test
    @DisplayName("Correlation uses only the leading overlap")
    void testPearsonCorrelation_Prefix() {
        double[] x = {1, 2, 3, 0};
        double[] y = {1, 2, 3, 50};

        assertEquals(1.0, calculator.pearsonCorrelation(x, y, 3), EPSILON);
    }

    // ========== Regression ==========

    @Test
    @DisplayName("Slope and R² of a perfect line")
    void testSlopeAndRSquared() {
        double[] values = {10, 20, 30, 40, 50};

        assertEquals(10.0, calculator.slope(values), EPSILON);
        assertEquals(1.0, calculator.rSquared(values), EPSILON);
    }

    @Test
    @DisplayName("Noise lowers R² but not below 0")
    void testRSquared_Noisy() {
        double[] values = {10, 30, 15, 40, 35, 60};

        double r2 = calculator.rSquared(values);

        assertTrue(r2 > 0.0 && r2 < 1.0);
        assertEquals(0.0, calculator.rSquared(new double[]{7, 7, 7}));
    }
}
