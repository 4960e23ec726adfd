package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate of all detection strategies for one resolution attempt.
 *
 * @param candidates one candidate per project, highest confidence first
 * @param ambiguous true when the top two candidates are close enough to be indistinguishable
 * @param strategyCandidates raw candidates as emitted by each strategy, before merging
 * @param warnings strategies that abstained because of an error
 */
public record DetectionResult(
    @JsonProperty("candidates") List<DetectionCandidate> candidates,
    @JsonProperty("ambiguous") boolean ambiguous,
    @JsonProperty("strategyCandidates") List<DetectionCandidate> strategyCandidates,
    @JsonProperty("warnings") List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public DetectionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        strategyCandidates = strategyCandidates == null ? List.of() : List.copyOf(strategyCandidates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DetectionResult empty() {
        return new DetectionResult(List.of(), false, List.of(), List.of());
    }

    /**
     * Returns the highest-ranked candidate.
     *
     * @return top candidate, empty if no strategy produced one
     */
    public Optional<DetectionCandidate> top() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Returns the merged confidence for a project, or 0.0 when no strategy named it.
     *
     * @param projectId project id
     * @return merged confidence
     */
    public double confidenceFor(String projectId) {
        return candidates.stream()
            .filter(candidate -> candidate.projectId().equals(projectId))
            .mapToDouble(DetectionCandidate::confidence)
            .findFirst()
            .orElse(0.0);
    }
}
