package com.kotsin.insights.driver.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * DriverAnalysisResult - Drivers ranked by descending importance, plus run metadata
 */
@Value
public class DriverAnalysisResult {

    List<Driver> drivers;

    DriverMetadata metadata;

    @Builder
    @Jacksonized
    private DriverAnalysisResult(List<Driver> drivers, DriverMetadata metadata) {
        this.drivers = drivers == null ? List.of() : List.copyOf(drivers);
        this.metadata = metadata;
    }

    public boolean hasDrivers() {
        return !drivers.isEmpty();
    }

    public static DriverAnalysisResult empty(DriverMethod method) {
        return DriverAnalysisResult.builder()
                .drivers(List.of())
                .metadata(DriverMetadata.builder()
                        .method(method)
                        .totalFeatures(0)
                        .samplesAnalyzed(0)
                        .build())
                .build();
    }
}
