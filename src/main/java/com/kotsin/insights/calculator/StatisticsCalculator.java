package com.kotsin.insights.calculator;

import com.kotsin.insights.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * StatisticsCalculator - Core statistics shared by the analyzers
 *
 * Provides:
 * - Mean, median
 * - Population and sample variance, standard deviation
 * - Z-Score (how many stddev from mean)
 * - Pearson correlation
 * - Least-squares slope and R² against the point index
 *
 * Stateless: every method reads its arguments only, so a single instance is shared
 * across concurrent callers. Masked overloads skip indexes flagged as excluded, which lets
 * iterative procedures drop points without copying arrays.
 */
@Component
public class StatisticsCalculator {

    /**
     * Calculate mean (average) of values
     *
     * @param values Values
     * @return Mean value, or 0 if empty
     */
    public double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }

        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Mean over the indexes not flagged in {@code excluded}
     */
    public double mean(double[] values, boolean[] excluded) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (!excluded[i]) {
                sum += values[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Median of values, 0 if empty. Does not modify the input.
     */
    public double median(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Population variance (divides by N)
     */
    public double variance(double[] values) {
        if (values == null || values.length < 2 || isConstant(values)) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    /**
     * Sample variance (divides by N - 1), 0 for fewer than two values
     */
    public double sampleVariance(double[] values) {
        if (values == null || values.length < 2 || isConstant(values)) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / (values.length - 1);
    }

    /**
     * Population standard deviation.
     *
     * Exactly 0 for constant input, so callers can rely on {@code stdDev == 0}
     * to detect a degenerate series.
     */
    public double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Population standard deviation around a known mean
     */
    public double stdDev(double[] values, double mean) {
        if (values == null || values.length < 2 || isConstant(values)) {
            return 0.0;
        }
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Sample standard deviation (N - 1) over the indexes not flagged in {@code excluded}
     */
    public double sampleStdDev(double[] values, boolean[] excluded, double mean) {
        double sumSquaredDiff = 0.0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (!excluded[i]) {
                double diff = values[i] - mean;
                sumSquaredDiff += diff * diff;
                count++;
            }
        }
        return count < 2 ? 0.0 : Math.sqrt(sumSquaredDiff / (count - 1));
    }

    /**
     * Calculate Z-Score: How many standard deviations from mean
     *
     * Formula: z = (value - mean) / stddev
     *
     * @return Z-score, 0 when stddev is 0
     */
    public double zScore(double value, double mean, double stdDev) {
        return MathUtils.safeDivide(value - mean, stdDev, 0.0);
    }

    /**
     * True when every value is identical (or there are fewer than two values)
     */
    public boolean isConstant(double[] values) {
        if (values == null || values.length < 2) {
            return true;
        }
        double first = values[0];
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], first) != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Pearson correlation over the first {@code length} elements of both arrays.
     *
     * @return r in [-1, 1], or 0 when either side has zero variance or length < 2
     */
    public double pearsonCorrelation(double[] x, double[] y, int length) {
        if (length < 2) {
            return 0.0;
        }

        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < length; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= length;
        meanY /= length;

        double numerator = 0.0;
        double denomX = 0.0;
        double denomY = 0.0;
        for (int i = 0; i < length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            numerator += dx * dy;
            denomX += dx * dx;
            denomY += dy * dy;
        }

        if (denomX == 0 || denomY == 0) {
            return 0.0;
        }

        double r = MathUtils.safeDivide(numerator, Math.sqrt(denomX * denomY), 0.0);
        return MathUtils.clamp(r, -1.0, 1.0);
    }

    /**
     * Least-squares slope of values against their index (0, 1, 2, ...)
     *
     * @return slope per step, 0 for fewer than two values
     */
    public double slope(double[] values) {
        if (values == null || values.length < 2) {
            return 0.0;
        }

        int n = values.length;
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (values[i] - meanY);
            denominator += dx * dx;
        }

        return MathUtils.safeDivide(numerator, denominator, 0.0);
    }

    /**
     * Coefficient of determination of the least-squares line against the index.
     *
     * @return R² in [0, 1], 0 for constant or too-short input
     */
    public double rSquared(double[] values) {
        if (values == null || isConstant(values)) {
            return 0.0;
        }

        int n = values.length;
        double[] index = new double[n];
        for (int i = 0; i < n; i++) {
            index[i] = i;
        }
        double r = pearsonCorrelation(index, values, n);
        return MathUtils.clampUnit(r * r);
    }
}
