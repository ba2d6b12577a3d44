package com.kotsin.insights.orchestrator;

import com.kotsin.insights.anomaly.AnomalyDetector;
import com.kotsin.insights.anomaly.model.AnomalyResult;
import com.kotsin.insights.config.InsightsConfig;
import com.kotsin.insights.data.InsightsDataProvider;
import com.kotsin.insights.data.InsightsDataset;
import com.kotsin.insights.driver.DriverAnalyzer;
import com.kotsin.insights.driver.model.DriverAnalysisResult;
import com.kotsin.insights.narrative.NarrativeGenerator;
import com.kotsin.insights.orchestrator.model.InsightsQuery;
import com.kotsin.insights.orchestrator.model.InsightsReport;
import com.kotsin.insights.orchestrator.model.InsightsUser;
import com.kotsin.insights.store.InsightsReportStore;
import com.kotsin.insights.trend.TrendAnalyzer;
import com.kotsin.insights.trend.model.TrendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * InsightsOrchestrator - Coordinates the insights engine
 *
 * Integrates:
 * 1. InsightsDataProvider - Raw series, features and target for the query window
 * 2. AnomalyDetector, DriverAnalyzer, TrendAnalyzer - Statistical analysis
 * 3. NarrativeGenerator - Text summary
 * 4. InsightsReportStore - Persistence and read-back
 *
 * The only component doing I/O. Collaborator failures are logged and degrade the result
 * (empty dataset, unsaved report, not-found) instead of propagating to the caller.
 * No retries here; those belong to the collaborators or the calling service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightsOrchestrator {

    static final String REPORT_ID_PREFIX = "insight_";

    private final AnomalyDetector anomalyDetector;
    private final DriverAnalyzer driverAnalyzer;
    private final TrendAnalyzer trendAnalyzer;
    private final NarrativeGenerator narrativeGenerator;
    private final InsightsDataProvider dataProvider;
    private final InsightsReportStore reportStore;
    private final InsightsConfig config;
    private final Clock clock;

    // ======================== GENERATION ========================

    /**
     * Generate, persist and return a new insights report.
     *
     * @param query Analysis window and optional facility
     * @param user  Caller identity; a facility bound to the user overrides the query's
     * @return The generated report
     */
    public InsightsReport generateInsights(InsightsQuery query, InsightsUser user) {
        InsightsQuery effectiveQuery = query != null ? query : InsightsQuery.all();
        String facilityId = resolveFacility(effectiveQuery, user);

        long startTime = System.currentTimeMillis();

        // 1. Fetch
        InsightsDataset dataset = fetchDataset(effectiveQuery, facilityId);

        // 2. Analyze
        AnomalyResult anomalies = anomalyDetector.detect(dataset.getTimeSeries(),
                config.getAnomaly().toAnomalyConfig());
        DriverAnalysisResult drivers = driverAnalyzer.analyze(dataset.getFeatures(), dataset.getTarget(),
                config.getDrivers().toDriverConfig());
        TrendResult trends = trendAnalyzer.analyze(dataset.getTimeSeries());

        // 3. Narrate
        String narrative = narrativeGenerator.generate(trends, anomalies, drivers);

        // 4. Assemble
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        InsightsReport report = InsightsReport.builder()
                .id(generateReportId(timestamp))
                .timestamp(timestamp)
                .queryParams(effectiveQuery.toParams())
                .anomalies(anomalies)
                .drivers(drivers)
                .trends(trends)
                .narrative(narrative)
                .build();

        // 5. Persist
        try {
            reportStore.save(report);
        } catch (RuntimeException e) {
            log.error("[INSIGHTS] Failed to persist report {}: {}", report.getId(), e.getMessage(), e);
        }

        log.info("[INSIGHTS] Generated report {} for user={} facility={} in {}ms: {} anomalies, {} drivers, trend={}",
                report.getId(), user != null ? user.getId() : null, facilityId,
                System.currentTimeMillis() - startTime, anomalies.getAnomalies().size(),
                drivers.getDrivers().size(), trends.getDirection().getValue());

        return report;
    }

    // ======================== RETRIEVAL ========================

    /**
     * Read back a previously generated report.
     *
     * @return the report, or empty when the id is unknown or the stored record cannot be read
     */
    public Optional<InsightsReport> getReport(String reportId) {
        if (reportId == null || reportId.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<InsightsReport> report = reportStore.findById(reportId);
            if (report.isEmpty()) {
                log.debug("[INSIGHTS] Report {} not found", reportId);
            }
            return report;
        } catch (RuntimeException e) {
            log.error("[INSIGHTS] Error fetching report {}: {}", reportId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    // ======================== HELPERS ========================

    private InsightsDataset fetchDataset(InsightsQuery query, String facilityId) {
        try {
            InsightsDataset dataset = dataProvider.fetch(query, facilityId);
            return dataset != null ? dataset : InsightsDataset.empty();
        } catch (RuntimeException e) {
            log.error("[INSIGHTS] Error fetching data for facility={}: {}", facilityId, e.getMessage(), e);
            return InsightsDataset.empty();
        }
    }

    /**
     * A user bound to a facility can only see that facility.
     */
    String resolveFacility(InsightsQuery query, InsightsUser user) {
        if (user != null && user.getFacilityId() != null) {
            return user.getFacilityId();
        }
        return query.getFacilityId();
    }

    private String generateReportId(Instant timestamp) {
        return REPORT_ID_PREFIX + timestamp.toEpochMilli() + "_"
                + UUID.randomUUID().toString().replace("-", "");
    }
}
