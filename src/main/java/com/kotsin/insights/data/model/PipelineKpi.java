package com.kotsin.insights.data.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * PipelineKpi - One day of recruiting pipeline KPIs for a facility
 *
 * Source rows for insights analysis. Missing metrics read as 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "pipeline_kpis")
public class PipelineKpi {

    @Id
    private String id;

    @Indexed
    private LocalDate date;

    @Indexed
    private String facilityId;

    // ========== Primary metric ==========
    private Double totalApplications;

    // ========== Secondary metrics ==========
    private Double activeApplications;
    private Double avgTimeToFill;
    private Double placementRate;
    private Double responseRate;
}
