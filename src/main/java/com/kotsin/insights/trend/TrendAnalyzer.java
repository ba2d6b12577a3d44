package com.kotsin.insights.trend;

import com.kotsin.insights.anomaly.model.TimeSeriesPoint;
import com.kotsin.insights.calculator.StatisticsCalculator;
import com.kotsin.insights.trend.model.TrendDirection;
import com.kotsin.insights.trend.model.TrendResult;
import com.kotsin.insights.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * TrendAnalyzer - Characterizes the overall direction of a series
 *
 * changeRate = slope * (n - 1) / |mean|, the fitted start-to-end change relative to the
 * series level (raw fitted change when the mean is 0).
 * Direction: above +5% increasing, below -5% decreasing, otherwise stable.
 * Strength: R² of the fit, so a noisy series with the same slope scores lower.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendAnalyzer {

    static final double DIRECTION_THRESHOLD = 0.05;

    private final StatisticsCalculator statistics;

    public TrendResult analyze(List<TimeSeriesPoint> series) {
        if (series == null || series.size() < 2) {
            return TrendResult.flat();
        }

        double[] values = series.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();

        double slope = statistics.slope(values);
        double fittedChange = slope * (values.length - 1);
        double mean = statistics.mean(values);
        double changeRate = MathUtils.safeDivide(fittedChange, Math.abs(mean), fittedChange);
        if (!MathUtils.isValidNumber(changeRate)) {
            changeRate = 0.0;
        }

        TrendDirection direction;
        if (changeRate > DIRECTION_THRESHOLD) {
            direction = TrendDirection.INCREASING;
        } else if (changeRate < -DIRECTION_THRESHOLD) {
            direction = TrendDirection.DECREASING;
        } else {
            direction = TrendDirection.STABLE;
        }

        TrendResult result = TrendResult.builder()
                .direction(direction)
                .strength(statistics.rSquared(values))
                .variance(MathUtils.valueOrDefault(statistics.sampleVariance(values), 0.0))
                .changeRate(changeRate)
                .build();

        log.debug("[TREND] points={} direction={} changeRate={} strength={}",
                values.length, direction.getValue(), changeRate, result.getStrength());
        return result;
    }
}
