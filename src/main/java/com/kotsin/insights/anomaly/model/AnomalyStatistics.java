package com.kotsin.insights.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Summary statistics of one detection run, computed over the de-seasonalized series.
 */
@Value
@Builder
@Jacksonized
public class AnomalyStatistics {

    double mean;

    double stdDev;

    double threshold;

    DetectionMethod method;

    public static AnomalyStatistics zero(double threshold, DetectionMethod method) {
        return new AnomalyStatistics(0.0, 0.0, threshold, method);
    }
}
