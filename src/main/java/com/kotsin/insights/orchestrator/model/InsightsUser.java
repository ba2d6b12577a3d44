package com.kotsin.insights.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller identity as seen by the engine. Authorization has already happened upstream.
 */
@Value
@Builder
public class InsightsUser {

    String id;

    /**
     * Facility the user is restricted to, null for organization-wide access
     */
    String facilityId;
}
