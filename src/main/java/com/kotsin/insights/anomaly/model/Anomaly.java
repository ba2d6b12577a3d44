package com.kotsin.insights.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Anomaly - A single input point flagged as unusual
 */
@Value
@Builder
@Jacksonized
public class Anomaly {

    /**
     * Timestamp of the flagged point
     */
    String timestamp;

    /**
     * Observed value
     */
    double value;

    /**
     * Estimated mean plus the seasonal component for this point's phase
     */
    double expectedValue;

    /**
     * Signed studentized deviation of the (de-seasonalized) value
     */
    double score;

    Severity severity;
}
