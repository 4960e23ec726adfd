package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A different project that could be confused with the resolved one.
 *
 * @param projectId id of the confusable project
 * @param name display name of the confusable project
 * @param score similarity or detection confidence that triggered the flag
 * @param reason why it was flagged
 */
public record SimilarProject(
    @JsonProperty("projectId") String projectId,
    @JsonProperty("name") String name,
    @JsonProperty("score") double score,
    @JsonProperty("reason") String reason
) {
    /**
     * Compact constructor with validation.
     */
    public SimilarProject {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
