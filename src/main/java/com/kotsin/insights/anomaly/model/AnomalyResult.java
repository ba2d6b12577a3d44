package com.kotsin.insights.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * AnomalyResult - Output of {@code AnomalyDetector}
 *
 * Anomalies are listed in series order.
 */
@Value
public class AnomalyResult {

    List<Anomaly> anomalies;

    AnomalyStatistics statistics;

    /**
     * Number of points in the analyzed series
     */
    int totalPoints;

    /**
     * anomalies / totalPoints, 0 for an empty series
     */
    double anomalyRate;

    @Builder
    @Jacksonized
    private AnomalyResult(List<Anomaly> anomalies, AnomalyStatistics statistics,
                          int totalPoints, double anomalyRate) {
        this.anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        this.statistics = statistics;
        this.totalPoints = totalPoints;
        this.anomalyRate = anomalyRate;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    public long countBySeverity(Severity severity) {
        return anomalies.stream().filter(a -> a.getSeverity() == severity).count();
    }

    /**
     * Well-formed result for an empty series: no anomalies, all-zero statistics.
     */
    public static AnomalyResult empty(AnomalyConfig config) {
        return AnomalyResult.builder()
                .anomalies(List.of())
                .statistics(AnomalyStatistics.zero(config.getThreshold(), config.getMethod()))
                .totalPoints(0)
                .anomalyRate(0.0)
                .build();
    }
}
