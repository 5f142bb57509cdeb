package com.sysmuse.leadership.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Counts over a hierarchy: filled positions, those already linked to an
 * external account, and vacant seats.
 */
@JsonPropertyOrder({"total_positions", "with_slack_id", "vacant"})
public final class HierarchySummary {

    private final int totalPositions;
    private final int withSlackUserId;
    private final int vacantCount;

    public HierarchySummary(int totalPositions, int withSlackUserId, int vacantCount) {
        this.totalPositions = totalPositions;
        this.withSlackUserId = withSlackUserId;
        this.vacantCount = vacantCount;
    }

    @JsonProperty("total_positions")
    public int getTotalPositions() {
        return totalPositions;
    }

    @JsonProperty("with_slack_id")
    public int getWithSlackUserId() {
        return withSlackUserId;
    }

    @JsonProperty("vacant")
    public int getVacantCount() {
        return vacantCount;
    }

    @Override
    public String toString() {
        return "{total=" + totalPositions + ", withSlackId=" + withSlackUserId + ", vacant=" + vacantCount + "}";
    }
}
