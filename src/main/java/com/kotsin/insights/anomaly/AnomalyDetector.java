package com.kotsin.insights.anomaly;

import com.kotsin.insights.anomaly.model.Anomaly;
import com.kotsin.insights.anomaly.model.AnomalyConfig;
import com.kotsin.insights.anomaly.model.AnomalyResult;
import com.kotsin.insights.anomaly.model.AnomalyStatistics;
import com.kotsin.insights.anomaly.model.DetectionMethod;
import com.kotsin.insights.anomaly.model.Severity;
import com.kotsin.insights.anomaly.model.TimeSeriesPoint;
import com.kotsin.insights.calculator.StatisticsCalculator;
import com.kotsin.insights.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * AnomalyDetector - Flags unusual points in a single time series
 *
 * Methods:
 * 1. ESD (default) - Iterative Extreme Studentized Deviate test. Each round removes the
 *    most extreme remaining point while its studentized deviation exceeds the critical
 *    value at the current sample size. Bounded to half the series length.
 * 2. Z-SCORE - Flags every point whose |z| exceeds the configured threshold.
 *
 * Both methods score the series after removing the seasonal baseline (see
 * {@link SeasonalAdjuster}); expected values add the seasonal component back.
 *
 * Severity tiers, by |score| relative to the configured threshold c:
 * <pre>
 *   |score| &lt; 1.5c  -> LOW
 *   |score| &lt; 2.5c  -> MEDIUM
 *   otherwise       -> HIGH
 * </pre>
 *
 * ESD scores are measured against the mean and sample standard deviation of the points
 * the test did not remove, so a larger deviation never lands in a lower tier.
 *
 * Degenerate input never throws: an empty series yields all-zero statistics, a constant
 * series yields no anomalies and stdDev 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private static final double LOW_SEVERITY_MULTIPLE = 1.5;
    private static final double MEDIUM_SEVERITY_MULTIPLE = 2.5;

    private final StatisticsCalculator statistics;
    private final SeasonalAdjuster seasonalAdjuster;

    // ======================== MAIN DETECTION ========================

    /**
     * Detect anomalies in an ordered series.
     *
     * @param series Ordered points, one per reporting period
     * @param config Detection settings, null for defaults
     * @return Anomalies in series order plus run statistics
     */
    public AnomalyResult detect(List<TimeSeriesPoint> series, AnomalyConfig config) {
        AnomalyConfig cfg = sanitize(config);

        if (series == null || series.isEmpty()) {
            return AnomalyResult.empty(cfg);
        }

        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }

        if (statistics.isConstant(values)) {
            log.debug("[ANOMALY] Constant series of {} points, nothing to flag", values.length);
            return AnomalyResult.builder()
                    .anomalies(List.of())
                    .statistics(AnomalyStatistics.builder()
                            .mean(values[0])
                            .stdDev(0.0)
                            .threshold(cfg.getThreshold())
                            .method(cfg.getMethod())
                            .build())
                    .totalPoints(values.length)
                    .anomalyRate(0.0)
                    .build();
        }

        double[] seasonal = seasonalAdjuster.seasonalComponents(values, cfg.getSeasonalPeriod());
        double[] adjusted = seasonalAdjuster.adjust(values, seasonal);

        List<Anomaly> anomalies = cfg.getMethod() == DetectionMethod.ZSCORE
                ? detectZScore(series, adjusted, seasonal, cfg)
                : detectEsd(series, adjusted, seasonal, cfg);

        double mean = statistics.mean(adjusted);
        double stdDev = statistics.stdDev(adjusted, mean);

        log.debug("[ANOMALY] method={} points={} anomalies={} mean={} stdDev={}",
                cfg.getMethod().getValue(), values.length, anomalies.size(), mean, stdDev);

        return AnomalyResult.builder()
                .anomalies(anomalies)
                .statistics(AnomalyStatistics.builder()
                        .mean(mean)
                        .stdDev(stdDev)
                        .threshold(cfg.getThreshold())
                        .method(cfg.getMethod())
                        .build())
                .totalPoints(values.length)
                .anomalyRate((double) anomalies.size() / values.length)
                .build();
    }

    // ======================== Z-SCORE ========================

    private List<Anomaly> detectZScore(List<TimeSeriesPoint> series, double[] adjusted,
                                       double[] seasonal, AnomalyConfig cfg) {
        double mean = statistics.mean(adjusted);
        double stdDev = statistics.stdDev(adjusted, mean);
        if (stdDev == 0) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < adjusted.length; i++) {
            double score = statistics.zScore(adjusted[i], mean, stdDev);
            if (Math.abs(score) > cfg.getThreshold()) {
                anomalies.add(toAnomaly(series.get(i), mean + seasonal[i], score,
                        classifySeverity(Math.abs(score), cfg.getThreshold())));
            }
        }
        return List.copyOf(anomalies);
    }

    // ======================== ESD ========================

    /**
     * Iterative ESD over an index set. Removed points are masked rather than spliced out,
     * so each round is a single O(n) pass. The test statistic uses the sample standard
     * deviation, matching the critical values.
     *
     * Flagged points are then scored against the points that survived the test, so every
     * anomaly of one run shares the same mean, deviation and cutoff.
     */
    private List<Anomaly> detectEsd(List<TimeSeriesPoint> series, double[] adjusted,
                                    double[] seasonal, AnomalyConfig cfg) {
        int n = adjusted.length;
        int maxRounds = n / 2;
        if (cfg.getMaxAnomalies() > 0) {
            maxRounds = Math.min(maxRounds, cfg.getMaxAnomalies());
        }

        boolean[] removed = new boolean[n];
        int remaining = n;

        for (int round = 0; round < maxRounds && remaining >= 3; round++) {
            double mean = statistics.mean(adjusted, removed);
            double stdDev = statistics.sampleStdDev(adjusted, removed, mean);
            if (stdDev == 0) {
                break;
            }

            int maxIndex = -1;
            double maxDeviation = -1.0;
            for (int j = 0; j < n; j++) {
                if (removed[j]) {
                    continue;
                }
                double deviation = Math.abs(adjusted[j] - mean);
                if (deviation > maxDeviation) {
                    maxDeviation = deviation;
                    maxIndex = j;
                }
            }

            double testStatistic = maxDeviation / stdDev;
            double criticalValue = EsdCriticalValues.lambda(remaining, cfg.getAlpha());
            if (!(testStatistic > criticalValue)) {
                break;
            }

            removed[maxIndex] = true;
            remaining--;
        }

        if (remaining == n) {
            return List.of();
        }

        // Common reference: the points the test kept
        double cleanMean = statistics.mean(adjusted, removed);
        double cleanStdDev = statistics.sampleStdDev(adjusted, removed, cleanMean);
        if (cleanStdDev == 0) {
            cleanStdDev = statistics.stdDev(adjusted);
        }

        List<Anomaly> anomalies = new ArrayList<>(n - remaining);
        for (int i = 0; i < n; i++) {
            if (removed[i]) {
                double score = statistics.zScore(adjusted[i], cleanMean, cleanStdDev);
                anomalies.add(toAnomaly(series.get(i), cleanMean + seasonal[i], score,
                        classifySeverity(Math.abs(score), cfg.getThreshold())));
            }
        }
        return List.copyOf(anomalies);
    }

    // ======================== HELPERS ========================

    /**
     * Map |score| to a tier relative to the cutoff. Monotonic: a larger |score| never
     * receives a lower tier.
     */
    public Severity classifySeverity(double absScore, double cutoff) {
        if (absScore < cutoff * LOW_SEVERITY_MULTIPLE) {
            return Severity.LOW;
        }
        if (absScore < cutoff * MEDIUM_SEVERITY_MULTIPLE) {
            return Severity.MEDIUM;
        }
        return Severity.HIGH;
    }

    private Anomaly toAnomaly(TimeSeriesPoint point, double expectedValue, double score, Severity severity) {
        return Anomaly.builder()
                .timestamp(point.getTimestamp())
                .value(point.getValue())
                .expectedValue(expectedValue)
                .score(score)
                .severity(severity)
                .build();
    }

    /**
     * Replace missing or out-of-range settings with defaults.
     */
    private AnomalyConfig sanitize(AnomalyConfig config) {
        if (config == null) {
            return AnomalyConfig.defaults();
        }
        AnomalyConfig.AnomalyConfigBuilder builder = config.toBuilder();
        if (config.getMethod() == null) {
            builder.method(DetectionMethod.ESD);
        }
        if (!MathUtils.isValidNumber(config.getThreshold()) || config.getThreshold() <= 0) {
            builder.threshold(AnomalyConfig.DEFAULT_THRESHOLD);
        }
        if (config.getSeasonalPeriod() < 0) {
            builder.seasonalPeriod(0);
        }
        if (!(config.getAlpha() > 0 && config.getAlpha() < 1)) {
            builder.alpha(AnomalyConfig.DEFAULT_ALPHA);
        }
        if (config.getMaxAnomalies() < 0) {
            builder.maxAnomalies(0);
        }
        return builder.build();
    }
}
