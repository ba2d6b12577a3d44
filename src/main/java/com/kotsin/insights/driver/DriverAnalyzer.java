package com.kotsin.insights.driver;

import com.kotsin.insights.calculator.StatisticsCalculator;
import com.kotsin.insights.driver.model.Driver;
import com.kotsin.insights.driver.model.DriverAnalysisResult;
import com.kotsin.insights.driver.model.DriverConfig;
import com.kotsin.insights.driver.model.DriverDirection;
import com.kotsin.insights.driver.model.DriverMetadata;
import com.kotsin.insights.driver.model.DriverMethod;
import com.kotsin.insights.driver.model.FeatureTable;
import com.kotsin.insights.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * DriverAnalyzer - Ranks feature columns by their relationship to a target series
 *
 * Scoring:
 * - CORRELATION: importance = |r|
 * - IMPORTANCE:  importance = |r| * (0.7 + 0.3 * variance / maxVariance), clamped to [0, 1]
 *
 * contribution = r * featureStdDev / targetStdDev (0 when the target is flat),
 * direction follows the sign of r.
 *
 * Alignment: each feature is analyzed over min(len(feature), len(target)) leading samples.
 * Mismatched lengths are tolerated but logged, since they usually mean a misaligned column.
 *
 * Ranking is a stable sort on importance, so equal scores keep feature insertion order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverAnalyzer {

    private static final double CORRELATION_WEIGHT = 0.7;
    private static final double VARIANCE_WEIGHT = 0.3;

    private final StatisticsCalculator statistics;

    /**
     * Analyze features against a target.
     *
     * @param features Named feature columns
     * @param target   Target values, index-aligned with the features
     * @param config   Method and topN, null for defaults
     * @return Top drivers by importance and analysis metadata
     */
    public DriverAnalysisResult analyze(FeatureTable features, double[] target, DriverConfig config) {
        DriverMethod method = config == null || config.getMethod() == null
                ? DriverMethod.IMPORTANCE : config.getMethod();
        int topN = config == null || config.getTopN() <= 0 ? DriverConfig.DEFAULT_TOP_N : config.getTopN();

        if (features == null || features.isEmpty() || target == null || target.length == 0) {
            return DriverAnalysisResult.empty(method);
        }

        // Pass 1: per-feature statistics over the aligned overlap
        List<FeatureStats> featureStats = new ArrayList<>(features.size());
        double maxVariance = 0.0;
        int samplesAnalyzed = 0;

        for (String name : features.featureNames()) {
            double[] column = features.column(name);
            int overlap = Math.min(column.length, target.length);
            if (column.length != target.length) {
                log.warn("[DRIVERS] Feature '{}' has {} samples but target has {}; analyzing {} overlapping samples",
                        name, column.length, target.length, overlap);
            }

            double[] featureValues = Arrays.copyOf(column, overlap);
            double[] targetValues = Arrays.copyOf(target, overlap);

            double r = statistics.pearsonCorrelation(featureValues, targetValues, overlap);
            double variance = MathUtils.valueOrDefault(statistics.variance(featureValues), 0.0);
            double featureStdDev = Math.sqrt(variance);
            double targetStdDev = statistics.stdDev(targetValues);

            featureStats.add(new FeatureStats(name, r, variance, featureStdDev, targetStdDev));
            maxVariance = Math.max(maxVariance, variance);
            samplesAnalyzed = Math.max(samplesAnalyzed, overlap);
        }

        // Pass 2: score
        List<Driver> drivers = new ArrayList<>(featureStats.size());
        for (FeatureStats fs : featureStats) {
            double importance = method == DriverMethod.CORRELATION
                    ? Math.abs(fs.correlation())
                    : weightedImportance(fs, maxVariance);

            double contribution = MathUtils.safeDivide(
                    fs.correlation() * fs.featureStdDev(), fs.targetStdDev(), 0.0);

            drivers.add(Driver.builder()
                    .feature(fs.name())
                    .importance(MathUtils.clampUnit(importance))
                    .contribution(contribution)
                    .direction(DriverDirection.fromCorrelation(fs.correlation()))
                    .build());
        }

        // List.sort is stable: ties keep insertion order
        drivers.sort(Comparator.comparingDouble(Driver::getImportance).reversed());
        List<Driver> top = drivers.size() > topN ? List.copyOf(drivers.subList(0, topN)) : List.copyOf(drivers);

        log.debug("[DRIVERS] method={} features={} samples={} top={}",
                method.getValue(), features.size(), samplesAnalyzed,
                top.isEmpty() ? "none" : top.get(0).getFeature());

        return DriverAnalysisResult.builder()
                .drivers(top)
                .metadata(DriverMetadata.builder()
                        .method(method)
                        .totalFeatures(features.size())
                        .samplesAnalyzed(samplesAnalyzed)
                        .build())
                .build();
    }

    private double weightedImportance(FeatureStats fs, double maxVariance) {
        double normalizedVariance = MathUtils.safeDivide(fs.variance(), maxVariance, 0.0);
        return Math.abs(fs.correlation()) * (CORRELATION_WEIGHT + VARIANCE_WEIGHT * normalizedVariance);
    }

    private record FeatureStats(
            String name,
            double correlation,
            double variance,
            double featureStdDev,
            double targetStdDev
    ) {
    }
}
