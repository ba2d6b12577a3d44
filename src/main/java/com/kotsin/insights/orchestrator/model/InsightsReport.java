package com.kotsin.insights.orchestrator.model;

import com.kotsin.insights.anomaly.model.AnomalyResult;
import com.kotsin.insights.driver.model.DriverAnalysisResult;
import com.kotsin.insights.trend.model.TrendResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InsightsReport - Persisted, immutable bundle of one analysis request
 *
 * Created once by {@code InsightsOrchestrator}, read-only afterwards.
 */
@Value
public class InsightsReport {

    /**
     * insight_&lt;epochMillis&gt;_&lt;random&gt;
     */
    String id;

    /**
     * Generation time, millisecond precision
     */
    Instant timestamp;

    /**
     * Read-only, in the order the query produced them
     */
    Map<String, Object> queryParams;

    AnomalyResult anomalies;

    DriverAnalysisResult drivers;

    TrendResult trends;

    String narrative;

    @Builder
    @Jacksonized
    private InsightsReport(String id, Instant timestamp, Map<String, Object> queryParams,
                           AnomalyResult anomalies, DriverAnalysisResult drivers,
                           TrendResult trends, String narrative) {
        this.id = id;
        this.timestamp = timestamp;
        this.queryParams = queryParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        this.anomalies = anomalies;
        this.drivers = drivers;
        this.trends = trends;
        this.narrative = narrative;
    }
}
