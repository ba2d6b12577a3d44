package com.kotsin.insights.narrative;

import com.kotsin.insights.trend.model.TrendDirection;

import java.util.Locale;

/**
 * NarrativeVocabulary - Every phrase the narrative can contain
 *
 * Kept in one place so wording changes stay consistent and tests can assert on substrings.
 * All number formatting uses {@link Locale#ROOT}.
 */
public final class NarrativeVocabulary {

    private NarrativeVocabulary() {}

    // ======================== TREND ========================

    public static final String UPWARD = "upward";
    public static final String DOWNWARD = "downward";

    public static final String TREND_TEMPLATE = "Metrics show a %s %s trend with %.1f%% %s over the period.";
    public static final String STABLE_TREND = "Metrics remain relatively stable with no significant trend.";

    public static final String GROWTH = "growth";
    public static final String DECLINE = "decline";

    /**
     * |changeRate| at or above which a move is "sharp" / "moderate"; anything smaller is "slight"
     */
    public static final double SHARP_CHANGE = 0.50;
    public static final double MODERATE_CHANGE = 0.15;

    public static final String SHARP = "sharp";
    public static final String MODERATE = "moderate";
    public static final String SLIGHT = "slight";

    public static final double HIGH_VARIANCE = 100.0;
    public static final double MODERATE_VARIANCE = 10.0;

    public static final String HIGH_VARIANCE_PHRASE = "High variance indicates significant fluctuations in the data.";
    public static final String MODERATE_VARIANCE_PHRASE = "Moderate variance suggests some fluctuations in performance.";
    public static final String LOW_VARIANCE_PHRASE = "Low variance indicates consistent performance.";

    // ======================== ANOMALIES ========================

    public static final String NO_ANOMALIES = "No significant anomalies detected in the analyzed period.";
    public static final String ANOMALY_TEMPLATE = "Detected %d %s out of %d data points (%.1f%% anomaly rate).";
    public static final String HIGH_SEVERITY_TEMPLATE = "%d high-severity %s immediate attention.";
    public static final String MEDIUM_SEVERITY_TEMPLATE = "%d medium-severity %s detected.";

    // ======================== DRIVERS ========================

    public static final String NO_DRIVERS = "Insufficient data to determine key performance drivers.";
    public static final String TOP_DRIVER_TEMPLATE = "Key performance driver: %s with %.1f%% importance and %s contribution.";
    public static final String OTHER_DRIVERS_TEMPLATE = "Other significant factors include %s.";

    // ======================== MAPPINGS ========================

    public static String directionWord(TrendDirection direction) {
        return direction == TrendDirection.DECREASING ? DOWNWARD : UPWARD;
    }

    public static String changeNoun(TrendDirection direction) {
        return direction == TrendDirection.DECREASING ? DECLINE : GROWTH;
    }

    public static String magnitudeAdjective(double changeRate) {
        double magnitude = Math.abs(changeRate);
        if (magnitude >= SHARP_CHANGE) {
            return SHARP;
        }
        if (magnitude >= MODERATE_CHANGE) {
            return MODERATE;
        }
        return SLIGHT;
    }

    public static String variancePhrase(double variance) {
        if (variance > HIGH_VARIANCE) {
            return HIGH_VARIANCE_PHRASE;
        }
        if (variance > MODERATE_VARIANCE) {
            return MODERATE_VARIANCE_PHRASE;
        }
        return LOW_VARIANCE_PHRASE;
    }

    public static String anomalyNoun(long count) {
        return count == 1 ? "anomaly" : "anomalies";
    }

    /**
     * "anomaly requires" / "anomalies require"
     */
    public static String anomalyNounWithVerb(long count) {
        return count == 1 ? "anomaly requires" : "anomalies require";
    }

    public static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
