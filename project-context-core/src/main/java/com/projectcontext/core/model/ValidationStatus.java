package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome category of a validation.
 *
 * <p>Ordered by severity: when several conditions apply, the most severe one
 * becomes the status and the rest are reported as warnings.
 */
public enum ValidationStatus {
    @JsonProperty("ok")
    OK,

    @JsonProperty("structuralIssue")
    STRUCTURAL_ISSUE,

    @JsonProperty("lowConfidence")
    LOW_CONFIDENCE,

    @JsonProperty("mismatch")
    MISMATCH;

    /**
     * Returns true if the safeguard policy has to decide on this status.
     *
     * @return true for mismatch and low confidence
     */
    public boolean requiresPolicy() {
        return this == MISMATCH || this == LOW_CONFIDENCE;
    }

    public ValidationStatus escalate(ValidationStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
