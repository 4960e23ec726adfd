package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * Output of one detection strategy for one project.
 *
 * @param projectId candidate project id
 * @param confidence confidence in [0, 1]
 * @param method strategy that produced the candidate
 * @param evidence human-readable explanation
 */
public record DetectionCandidate(
    @JsonProperty("projectId") String projectId,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("method") DetectionMethod method,
    @JsonProperty("evidence") String evidence
) {
    /**
     * Highest confidence first, then method priority, then project id.
     */
    public static final Comparator<DetectionCandidate> RANKING =
        Comparator.comparingDouble(DetectionCandidate::confidence).reversed()
            .thenComparing(DetectionCandidate::method)
            .thenComparing(DetectionCandidate::projectId);

    /**
     * Compact constructor with validation.
     */
    public DetectionCandidate {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (evidence == null) {
            evidence = "";
        }
    }
}
