package com.kotsin.insights.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InsightsQuery - Analysis window and optional facility scope
 *
 * The window is applied only when both dates are present.
 */
@Value
@Builder
public class InsightsQuery {

    LocalDate startDate;

    LocalDate endDate;

    String facilityId;

    /**
     * Passed through to the report's query parameters; redaction happens outside the engine
     */
    boolean includePii;

    public boolean hasWindow() {
        return startDate != null && endDate != null;
    }

    /**
     * Query parameters as stored on the report. Dates are ISO strings; absent fields are omitted.
     */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (startDate != null) {
            params.put("startDate", startDate.toString());
        }
        if (endDate != null) {
            params.put("endDate", endDate.toString());
        }
        if (facilityId != null) {
            params.put("facilityId", facilityId);
        }
        params.put("includePII", includePii);
        return Collections.unmodifiableMap(params);
    }

    public static InsightsQuery all() {
        return InsightsQuery.builder().build();
    }
}
