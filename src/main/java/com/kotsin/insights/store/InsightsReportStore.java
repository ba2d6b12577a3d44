package com.kotsin.insights.store;

import com.kotsin.insights.orchestrator.model.InsightsReport;

import java.util.Optional;

/**
 * InsightsReportStore - Report-store collaborator of the insights engine
 *
 * One record per report id. Implementations may block and signal failures with
 * {@link ReportStoreException}.
 */
public interface InsightsReportStore {

    /**
     * Persist a report; an existing record with the same id is overwritten.
     */
    void save(InsightsReport report);

    /**
     * Load a report by id.
     *
     * @return the report, or empty when no record exists
     */
    Optional<InsightsReport> findById(String id);
}
