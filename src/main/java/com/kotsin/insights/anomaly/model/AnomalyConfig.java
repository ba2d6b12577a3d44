package com.kotsin.insights.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run anomaly detection settings.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyConfig {

    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_SEASONAL_PERIOD = 7;
    public static final double DEFAULT_ALPHA = 0.05;

    @Builder.Default
    DetectionMethod method = DetectionMethod.ESD;

    /**
     * |z| cutoff for the z-score method; also the unit of the severity tiers
     */
    @Builder.Default
    double threshold = DEFAULT_THRESHOLD;

    /**
     * Points per seasonal cycle, 0 disables de-seasonalizing
     */
    @Builder.Default
    int seasonalPeriod = DEFAULT_SEASONAL_PERIOD;

    /**
     * Significance level of the ESD test
     */
    @Builder.Default
    double alpha = DEFAULT_ALPHA;

    /**
     * Upper bound on ESD removals, 0 means half the series length
     */
    @Builder.Default
    int maxAnomalies = 0;

    public static AnomalyConfig defaults() {
        return AnomalyConfig.builder().build();
    }
}
