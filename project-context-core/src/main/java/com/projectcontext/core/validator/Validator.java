package com.projectcontext.core.validator;

import com.projectcontext.core.config.EngineConfig.ValidationSettings;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionResult;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.model.SimilarProject;
import com.projectcontext.core.model.ValidationResult;
import com.projectcontext.core.model.ValidationStatus;
import com.projectcontext.core.similarity.SimilarityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a detection result against the project the caller says it is working on.
 *
 * <p>Status precedence, most severe first: {@code mismatch}, {@code lowConfidence},
 * {@code structuralIssue}, {@code ok}. Every condition that applies adds a warning,
 * whether or not it decides the status. Confusable sibling projects only add
 * warnings.
 */
public class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final ValidationSettings settings;

    public Validator(ValidationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Validates a detection.
     *
     * @param detection detection result
     * @param statedReference id, name or alias of the project the caller named, nullable
     * @param registry registry snapshot the detection ran against
     * @return validation result
     */
    public ValidationResult validate(DetectionResult detection, String statedReference, Registry registry) {
        Objects.requireNonNull(detection, "detection must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        List<String> warnings = new ArrayList<>();
        ValidationStatus status = ValidationStatus.OK;

        Optional<DetectionCandidate> top = detection.top();
        String detectedId = top.map(DetectionCandidate::projectId).orElse(null);

        boolean stated = statedReference != null && !statedReference.isBlank();
        Optional<ProjectRecord> statedProject = stated ? registry.findByReference(statedReference) : Optional.empty();
        String statedId = statedProject.map(ProjectRecord::id).orElse(stated ? statedReference.trim() : null);

        if (stated && statedProject.isEmpty()) {
            status = status.escalate(ValidationStatus.MISMATCH);
            warnings.add("Stated project '" + statedReference.trim() + "' is not registered");
        }

        if (statedProject.isPresent() && top.isPresent() && !top.get().projectId().equals(statedId)) {
            DetectionCandidate best = top.get();
            if (best.confidence() >= settings.trustThreshold()) {
                status = status.escalate(ValidationStatus.MISMATCH);
                warnings.add(String.format(Locale.ROOT,
                    "Stated project '%s' does not match detected project '%s' (confidence %.2f via %s: %s)",
                    statedId, best.projectId(), best.confidence(), best.method().getId(), best.evidence()));
            } else {
                status = status.escalate(ValidationStatus.LOW_CONFIDENCE);
                warnings.add(String.format(Locale.ROOT,
                    "Stated project '%s' differs from weakly detected project '%s' (confidence %.2f)",
                    statedId, best.projectId(), best.confidence()));
            }
        }

        if (top.isEmpty()) {
            status = status.escalate(ValidationStatus.LOW_CONFIDENCE);
            warnings.add("No project could be detected from the working context");
        } else if (top.get().confidence() < settings.minConfidence()) {
            status = status.escalate(ValidationStatus.LOW_CONFIDENCE);
            warnings.add(String.format(Locale.ROOT, "Detected project '%s' has low confidence %.2f (minimum %.2f)",
                top.get().projectId(), top.get().confidence(), settings.minConfidence()));
        }
        if (detection.ambiguous()) {
            DetectionCandidate first = detection.candidates().get(0);
            DetectionCandidate second = detection.candidates().get(1);
            status = status.escalate(ValidationStatus.LOW_CONFIDENCE);
            warnings.add(String.format(Locale.ROOT, "Detection is ambiguous between '%s' (%.2f) and '%s' (%.2f)",
                first.projectId(), first.confidence(), second.projectId(), second.confidence()));
        }

        String resolvedId = statedProject.map(ProjectRecord::id).orElse(detectedId);
        Optional<ProjectRecord> resolved = registry.project(resolvedId);

        if (resolved.isPresent()) {
            List<String> structural = structuralProblems(resolved.get());
            if (!structural.isEmpty()) {
                status = status.escalate(ValidationStatus.STRUCTURAL_ISSUE);
                warnings.addAll(structural);
            }
        }

        List<SimilarProject> similar = similarProjects(detection, registry, resolved.orElse(null),
            statedProject.orElse(null));
        for (SimilarProject project : similar) {
            warnings.add(String.format(Locale.ROOT, "Similar project '%s' (%s): %s",
                project.projectId(), project.name(), project.reason()));
        }

        warnings.addAll(detection.warnings());

        log.debug("Validation status {} for resolved project '{}' (detected '{}', stated '{}')",
            status, resolvedId, detectedId, statedId);
        return new ValidationResult(status, resolvedId, detectedId, statedId, similar, warnings);
    }

    /**
     * Checks that a project's root directory exists and holds every declared marker.
     *
     * @param project project to check
     * @return human-readable problems, empty when the structure is intact
     */
    public static List<String> structuralProblems(ProjectRecord project) {
        List<String> problems = new ArrayList<>();
        Path root;
        try {
            root = Paths.get(project.path());
        } catch (InvalidPathException e) {
            problems.add("Project '" + project.id() + "' has an invalid root path: " + project.path());
            return problems;
        }
        if (!Files.isDirectory(root)) {
            problems.add("Project '" + project.id() + "' root is missing: " + project.path());
            return problems;
        }
        for (String marker : project.markers()) {
            if (!Files.exists(root.resolve(marker))) {
                problems.add("Project '" + project.id() + "' is missing marker '" + marker + "'");
            }
        }
        return problems;
    }

    private List<SimilarProject> similarProjects(DetectionResult detection, Registry registry,
                                                 ProjectRecord resolved, ProjectRecord stated) {
        Map<String, SimilarProject> similar = new LinkedHashMap<>();
        List<ProjectRecord> references = new ArrayList<>();
        if (resolved != null) {
            references.add(resolved);
        }
        if (stated != null && stated != resolved) {
            references.add(stated);
        }

        for (ProjectRecord other : registry.allProjects()) {
            if (references.stream().anyMatch(reference -> reference.id().equals(other.id()))) {
                continue;
            }
            for (ProjectRecord reference : references) {
                NamePair pair = closestNames(reference, other);
                if (pair.score() >= settings.confusableThreshold()) {
                    similar.merge(other.id(),
                        new SimilarProject(other.id(), other.name(), pair.score(), String.format(Locale.ROOT,
                            "name '%s' resembles '%s' of '%s' (similarity %.2f)",
                            pair.otherName(), pair.referenceName(), reference.id(), pair.score())),
                        (a, b) -> a.score() >= b.score() ? a : b);
                }
            }
        }

        String resolvedId = resolved == null ? null : resolved.id();
        for (DetectionCandidate candidate : detection.candidates()) {
            if (candidate.projectId().equals(resolvedId) || candidate.confidence() < settings.minConfidence()) {
                continue;
            }
            Optional<ProjectRecord> project = registry.project(candidate.projectId());
            if (project.isEmpty() || similar.containsKey(candidate.projectId())) {
                continue;
            }
            similar.put(candidate.projectId(), new SimilarProject(candidate.projectId(), project.get().name(),
                candidate.confidence(), String.format(Locale.ROOT, "also detected via %s with confidence %.2f: %s",
                    candidate.method().getId(), candidate.confidence(), candidate.evidence())));
        }
        return new ArrayList<>(similar.values());
    }

    private static NamePair closestNames(ProjectRecord reference, ProjectRecord other) {
        NamePair best = new NamePair(reference.name(), other.name(), 0.0);
        for (String referenceName : reference.allNames()) {
            for (String otherName : other.allNames()) {
                double score = SimilarityEngine.score(referenceName, otherName);
                if (score > best.score()) {
                    best = new NamePair(referenceName, otherName, score);
                }
            }
        }
        return best;
    }

    private record NamePair(String referenceName, String otherName, double score) {
    }
}
