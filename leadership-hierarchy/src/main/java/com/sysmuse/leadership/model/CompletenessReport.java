package com.sysmuse.leadership.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonPropertyOrder({"complete", "filled", "missing_required", "vacant", "incomplete"})
public final class CompletenessReport {

    private final List<String> missingRequired;
    private final List<String> vacant;
    private final List<String> incomplete;
    private final int filledCount;

    public CompletenessReport(List<String> missingRequired, List<String> vacant,
                              List<String> incomplete, int filledCount) {
        this.missingRequired = Collections.unmodifiableList(new ArrayList<>(missingRequired));
        this.vacant = Collections.unmodifiableList(new ArrayList<>(vacant));
        this.incomplete = Collections.unmodifiableList(new ArrayList<>(incomplete));
        this.filledCount = filledCount;
    }

    /**
     * Required seats that are neither filled nor marked vacant.
     */
    @JsonProperty("missing_required")
    public List<String> getMissingRequired() {
        return missingRequired;
    }

    @JsonProperty("vacant")
    public List<String> getVacant() {
        return vacant;
    }

    /**
     * Filled seats whose person lacks a name or primary email.
     */
    @JsonProperty("incomplete")
    public List<String> getIncomplete() {
        return incomplete;
    }

    @JsonProperty("filled")
    public int getFilledCount() {
        return filledCount;
    }

    @JsonProperty("complete")
    public boolean isComplete() {
        return missingRequired.isEmpty() && incomplete.isEmpty();
    }

    @Override
    public String toString() {
        return "filled=" + filledCount + ", missingRequired=" + missingRequired.size()
                + ", vacant=" + vacant.size() + ", incomplete=" + incomplete.size();
    }
}
