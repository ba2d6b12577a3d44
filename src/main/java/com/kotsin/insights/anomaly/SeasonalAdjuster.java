package com.kotsin.insights.anomaly;

import com.kotsin.insights.calculator.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * SeasonalAdjuster - Per-phase seasonal baseline for anomaly scoring
 *
 * For a period p, every point with the same {@code index mod p} belongs to one phase.
 * The phase baseline is the median of that phase, centred on the mean of all phase
 * baselines so the adjusted series keeps its level. The median keeps a single outlier
 * from shifting the baseline of every other point in its phase.
 *
 * Seasonality is only removed when the series holds at least two full cycles.
 */
@Component
@RequiredArgsConstructor
public class SeasonalAdjuster {

    private final StatisticsCalculator statistics;

    /**
     * Seasonal component for every index of {@code values}.
     *
     * @return array aligned with values; all zeros when seasonality handling does not apply
     */
    public double[] seasonalComponents(double[] values, int period) {
        double[] components = new double[values.length];
        if (!applies(values.length, period)) {
            return components;
        }

        double[] baselines = new double[period];
        for (int phase = 0; phase < period; phase++) {
            int count = (values.length - phase + period - 1) / period;
            double[] phaseValues = new double[count];
            for (int k = 0; k < count; k++) {
                phaseValues[k] = values[phase + k * period];
            }
            baselines[phase] = statistics.median(phaseValues);
        }

        double level = statistics.mean(baselines);
        for (int i = 0; i < values.length; i++) {
            components[i] = baselines[i % period] - level;
        }
        return components;
    }

    /**
     * values minus their seasonal components
     */
    public double[] adjust(double[] values, double[] components) {
        double[] adjusted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            adjusted[i] = values[i] - components[i];
        }
        return adjusted;
    }

    public boolean applies(int length, int period) {
        return period > 0 && length >= 2L * period;
    }
}
