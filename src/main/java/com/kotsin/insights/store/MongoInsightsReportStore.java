package com.kotsin.insights.store;

import com.kotsin.insights.anomaly.model.AnomalyResult;
import com.kotsin.insights.driver.model.DriverAnalysisResult;
import com.kotsin.insights.orchestrator.model.InsightsReport;
import com.kotsin.insights.store.model.InsightsReportDocument;
import com.kotsin.insights.store.repository.InsightsReportRepository;
import com.kotsin.insights.trend.model.TrendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * MongoInsightsReportStore - Persists insights reports in the insights_reports collection
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoInsightsReportStore implements InsightsReportStore {

    private final InsightsReportRepository reportRepository;
    private final InsightsJsonCodec codec;
    private final Clock clock;

    @Override
    public void save(InsightsReport report) {
        Instant now = clock.instant();
        try {
            Instant createdAt = reportRepository.findById(report.getId())
                    .map(InsightsReportDocument::getCreatedAt)
                    .orElse(now);

            reportRepository.save(InsightsReportDocument.builder()
                    .id(report.getId())
                    .timestamp(report.getTimestamp())
                    .queryParams(codec.write(report.getQueryParams()))
                    .anomalies(codec.write(report.getAnomalies()))
                    .drivers(codec.write(report.getDrivers()))
                    .trends(codec.write(report.getTrends()))
                    .narrative(report.getNarrative())
                    .createdAt(createdAt)
                    .updatedAt(now)
                    .build());

            log.debug("[REPORT-STORE] Saved report {}", report.getId());
        } catch (DataAccessException e) {
            throw new ReportStoreException("Failed to save insights report " + report.getId(), e);
        }
    }

    @Override
    public Optional<InsightsReport> findById(String id) {
        Optional<InsightsReportDocument> document;
        try {
            document = reportRepository.findById(id);
        } catch (DataAccessException e) {
            throw new ReportStoreException("Failed to load insights report " + id, e);
        }
        return document.map(this::toReport);
    }

    private InsightsReport toReport(InsightsReportDocument document) {
        return InsightsReport.builder()
                .id(document.getId())
                .timestamp(document.getTimestamp())
                .queryParams(codec.readMap(document.getQueryParams()))
                .anomalies(codec.read(document.getAnomalies(), AnomalyResult.class))
                .drivers(codec.read(document.getDrivers(), DriverAnalysisResult.class))
                .trends(codec.read(document.getTrends(), TrendResult.class))
                .narrative(document.getNarrative())
                .build();
    }
}
