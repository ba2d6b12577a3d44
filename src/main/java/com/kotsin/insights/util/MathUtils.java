package com.kotsin.insights.util;

/**
 * Finite-only arithmetic for the analyzers.
 *
 * Statistics over short or flat series routinely divide by a zero deviation or a zero
 * mean. These helpers turn such cases into a caller-chosen fallback so no NaN or
 * Infinity reaches a report.
 */
public final class MathUtils {

    private MathUtils() {}

    // ======================== DIVISION ========================

    /**
     * numerator / denominator, or {@code fallback} when the divisor is zero or not finite,
     * or when the quotient overflows.
     */
    public static double safeDivide(double numerator, double denominator, double fallback) {
        if (!isValidDenominator(denominator)) {
            return fallback;
        }
        double quotient = numerator / denominator;
        return isValidNumber(quotient) ? quotient : fallback;
    }

    public static boolean isValidDenominator(double divisor) {
        return divisor != 0 && isValidNumber(divisor);
    }

    // ======================== FINITENESS ========================

    public static boolean isValidNumber(double value) {
        return Double.isFinite(value);
    }

    /**
     * Unboxed {@code value} when present and finite, {@code fallback} otherwise.
     * Missing KPI metrics arrive here as null.
     */
    public static double valueOrDefault(Double value, double fallback) {
        return value != null && isValidNumber(value) ? value : fallback;
    }

    // ======================== RANGE ========================

    /**
     * Limit {@code value} to [lower, upper]; NaN maps to {@code lower}.
     */
    public static double clamp(double value, double lower, double upper) {
        if (Double.isNaN(value)) {
            return lower;
        }
        return Math.min(upper, Math.max(lower, value));
    }

    /**
     * Scores such as importance and R² live in [0, 1]
     */
    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }
}
