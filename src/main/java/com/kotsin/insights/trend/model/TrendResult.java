package com.kotsin.insights.trend.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * TrendResult - Overall direction and consistency of a series
 */
@Value
@Builder
@Jacksonized
public class TrendResult {

    TrendDirection direction;

    /**
     * R² of the least-squares line, in [0, 1]. Higher means steadier movement.
     */
    double strength;

    /**
     * Sample variance of the full series
     */
    double variance;

    /**
     * Fitted change across the window relative to the series mean (0.10 = +10%)
     */
    double changeRate;

    public static TrendResult flat() {
        return TrendResult.builder()
                .direction(TrendDirection.STABLE)
                .strength(0.0)
                .variance(0.0)
                .changeRate(0.0)
                .build();
    }
}
