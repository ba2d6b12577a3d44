package com.kotsin.insights.data;

import com.kotsin.insights.orchestrator.model.InsightsQuery;

/**
 * InsightsDataProvider - Data-access collaborator of the insights engine
 *
 * Supplies plain numeric sequences for a query window; the engine needs no knowledge
 * of the underlying storage. Implementations may block.
 */
public interface InsightsDataProvider {

    /**
     * Fetch the primary metric series, secondary metric features and target for a window.
     *
     * @param query      Window (start/end dates, applied only when both are set)
     * @param facilityId Facility to scope to, null for all facilities
     * @return Dataset, empty when no rows match
     */
    InsightsDataset fetch(InsightsQuery query, String facilityId);
}
