package com.kotsin.insights.driver.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Driver - One feature column ranked against the target
 */
@Value
@Builder
@Jacksonized
public class Driver {

    String feature;

    /**
     * Ranking score in [0, 1]
     */
    double importance;

    /**
     * r * featureStdDev / targetStdDev: target movement per one feature stdDev, signed
     */
    double contribution;

    DriverDirection direction;
}
