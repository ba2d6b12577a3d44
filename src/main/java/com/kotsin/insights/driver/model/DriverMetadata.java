package com.kotsin.insights.driver.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DriverMetadata {

    DriverMethod method;

    /**
     * Features presented to the analyzer, before topN truncation
     */
    int totalFeatures;

    /**
     * Longest feature/target overlap actually analyzed
     */
    int samplesAnalyzed;
}
