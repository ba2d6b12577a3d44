package com.kotsin.insights.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One reporting period of a metric: ISO timestamp (or date) and its value.
 */
@Value
@Builder
@Jacksonized
public class TimeSeriesPoint {

    String timestamp;

    double value;

    public static TimeSeriesPoint of(String timestamp, double value) {
        return new TimeSeriesPoint(timestamp, value);
    }
}
