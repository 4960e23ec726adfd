package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Safeguard state for one invocation.
 *
 * <p>{@link #PENDING_CONFIRMATION} is transient: it is reported to observers while
 * the confirmation callback runs but never appears in an audit record.
 */
public enum Decision {
    @JsonProperty("allowed")
    ALLOWED,

    @JsonProperty("pendingConfirmation")
    PENDING_CONFIRMATION,

    @JsonProperty("confirmed")
    CONFIRMED,

    @JsonProperty("blocked")
    BLOCKED;

    public boolean isFinal() {
        return this != PENDING_CONFIRMATION;
    }

    /**
     * Returns true if the caller may proceed with the operation.
     *
     * @return true for allowed and confirmed
     */
    public boolean permitsOperation() {
        return this == ALLOWED || this == CONFIRMED;
    }
}
