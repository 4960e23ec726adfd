package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one resolution decision, one line in the audit log.
 *
 * @param id event id
 * @param timestamp time the decision was made
 * @param operation caller-supplied operation label
 * @param actor who asked, nullable
 * @param detection detection result the decision was based on
 * @param validation validation result the decision was based on
 * @param decision final decision, never {@link Decision#PENDING_CONFIRMATION}
 * @param confirmation confirmation answer when one was requested, nullable
 * @param note short explanation of how the decision was reached, nullable
 */
public record AuditEvent(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("operation") String operation,
    @JsonProperty("actor") String actor,
    @JsonProperty("detection") DetectionResult detection,
    @JsonProperty("validation") ValidationResult validation,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("confirmation") ConfirmationResponse confirmation,
    @JsonProperty("note") String note
) {
    /**
     * Compact constructor with validation.
     */
    public AuditEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        if (!decision.isFinal()) {
            throw new IllegalArgumentException("audit events record final decisions only: " + decision);
        }
        if (detection == null) {
            detection = DetectionResult.empty();
        }
    }
}
