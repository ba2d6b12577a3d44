package com.kotsin.insights.driver.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run driver analysis settings.
 */
@Value
@Builder(toBuilder = true)
public class DriverConfig {

    public static final int DEFAULT_TOP_N = 5;

    @Builder.Default
    DriverMethod method = DriverMethod.IMPORTANCE;

    /**
     * Maximum number of drivers returned
     */
    @Builder.Default
    int topN = DEFAULT_TOP_N;

    public static DriverConfig defaults() {
        return DriverConfig.builder().build();
    }
}
