package com.kotsin.insights.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * InsightsReportDocument - Stored form of an insights report
 *
 * queryParams, anomalies, drivers and trends hold JSON text so their layout stays
 * independent of the Mongo mapping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "insights_reports")
public class InsightsReportDocument {

    @Id
    private String id;

    @Indexed
    private Instant timestamp;

    private String queryParams;
    private String anomalies;
    private String drivers;
    private String trends;
    private String narrative;

    @Indexed
    private Instant createdAt;
    private Instant updatedAt;
}
