package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating a detection against the caller's stated project.
 *
 * @param status outcome category
 * @param resolvedProjectId project the operation would act on (stated if given, else detected), nullable
 * @param detectedProjectId top detection candidate, nullable
 * @param statedProjectId project the caller named, nullable
 * @param similarProjects confusable sibling projects
 * @param warnings human-readable warnings, in the order they were raised
 */
public record ValidationResult(
    @JsonProperty("status") ValidationStatus status,
    @JsonProperty("resolvedProjectId") String resolvedProjectId,
    @JsonProperty("detectedProjectId") String detectedProjectId,
    @JsonProperty("statedProjectId") String statedProjectId,
    @JsonProperty("similarProjects") List<SimilarProject> similarProjects,
    @JsonProperty("warnings") List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        Objects.requireNonNull(status, "status must not be null");
        similarProjects = similarProjects == null ? List.of() : List.copyOf(similarProjects);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == ValidationStatus.OK;
    }
}
