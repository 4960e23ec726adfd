package com.projectcontext.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration of the resolution engine.
 *
 * <p>Loaded from {@code project-context.yaml} in the context home directory. Every
 * section and every value is optional; anything missing takes the default shown
 * below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * registry:
 *   file: "registry.json"
 *   auditLog: "audit.log"
 *
 * detection:
 *   fuzzyFloor: 0.6
 *   fuzzyWeight: 0.85
 *   vcsConfidence: 0.9
 *   markerCap: 0.85
 *   pathDecayPerLevel: 0.05
 *   nestedProjectPenalty: 0.1
 *   pathFloor: 0.5
 *   maxAscent: 10
 *   ambiguityGap: 0.1
 *   projectRootMarkers: [".git", ".claude", ".taskmaster", "package.json", "pom.xml"]
 *
 * validation:
 *   minConfidence: 0.5
 *   trustThreshold: 0.7
 *   confusableThreshold: 0.7
 *
 * safeguard:
 *   onMismatch: confirm
 *   onLowConfidence: confirm
 *   confirmationTimeoutSeconds: 30
 * }</pre>
 *
 * @param registry file locations relative to the context home
 * @param detection detector tuning
 * @param validation validator thresholds
 * @param safeguard safeguard policy
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("registry") RegistrySettings registry,
    @JsonProperty("detection") DetectionSettings detection,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("safeguard") SafeguardSettings safeguard
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public EngineConfig {
        if (registry == null) {
            registry = RegistrySettings.defaults();
        }
        if (detection == null) {
            detection = DetectionSettings.defaults();
        }
        if (validation == null) {
            validation = ValidationSettings.defaults();
        }
        if (safeguard == null) {
            safeguard = SafeguardSettings.defaults();
        }
    }

    /**
     * Creates a configuration with every value at its default.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    /**
     * Registry and audit log file names.
     *
     * @param file registry document, relative to the context home
     * @param auditLog audit log, relative to the context home
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistrySettings(
        @JsonProperty("file") String file,
        @JsonProperty("auditLog") String auditLog
    ) {
        public RegistrySettings {
            if (file == null || file.isBlank()) {
                file = "registry.json";
            }
            if (auditLog == null || auditLog.isBlank()) {
                auditLog = "audit.log";
            }
        }

        public static RegistrySettings defaults() {
            return new RegistrySettings(null, null);
        }
    }

    /**
     * Detector tuning.
     *
     * @param fuzzyFloor minimum similarity for the name strategy to emit a candidate
     * @param fuzzyWeight factor applied to the similarity score to get the name strategy's confidence
     * @param vcsConfidence confidence of a remote URL match
     * @param markerCap maximum confidence of the marker strategy
     * @param pathDecayPerLevel confidence lost per directory ascended by the path strategy
     * @param nestedProjectPenalty extra confidence lost per traversed directory that looks like a project root
     * @param pathFloor lowest confidence the path strategy reports for an ancestor match
     * @param maxAscent how many parent directories the path and marker strategies inspect
     * @param ambiguityGap confidence gap at or below which the top two candidates are ambiguous
     * @param projectRootMarkers entries whose presence makes a directory look like a project root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectionSettings(
        @JsonProperty("fuzzyFloor") Double fuzzyFloor,
        @JsonProperty("fuzzyWeight") Double fuzzyWeight,
        @JsonProperty("vcsConfidence") Double vcsConfidence,
        @JsonProperty("markerCap") Double markerCap,
        @JsonProperty("pathDecayPerLevel") Double pathDecayPerLevel,
        @JsonProperty("nestedProjectPenalty") Double nestedProjectPenalty,
        @JsonProperty("pathFloor") Double pathFloor,
        @JsonProperty("maxAscent") Integer maxAscent,
        @JsonProperty("ambiguityGap") Double ambiguityGap,
        @JsonProperty("projectRootMarkers") List<String> projectRootMarkers
    ) {
        public DetectionSettings {
            fuzzyFloor = fuzzyFloor == null ? 0.6 : fuzzyFloor;
            fuzzyWeight = fuzzyWeight == null ? 0.85 : fuzzyWeight;
            vcsConfidence = vcsConfidence == null ? 0.9 : vcsConfidence;
            markerCap = markerCap == null ? 0.85 : Math.min(markerCap, 0.99);
            pathDecayPerLevel = pathDecayPerLevel == null ? 0.05 : pathDecayPerLevel;
            nestedProjectPenalty = nestedProjectPenalty == null ? 0.1 : nestedProjectPenalty;
            pathFloor = pathFloor == null ? 0.5 : pathFloor;
            maxAscent = maxAscent == null ? 10 : maxAscent;
            ambiguityGap = ambiguityGap == null ? 0.1 : ambiguityGap;
            projectRootMarkers = projectRootMarkers == null
                ? List.of(".git", ".claude", ".taskmaster", "package.json", "pom.xml")
                : List.copyOf(projectRootMarkers);
        }

        public static DetectionSettings defaults() {
            return new DetectionSettings(null, null, null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Validator thresholds.
     *
     * @param minConfidence below this the top candidate is not trusted at all
     * @param trustThreshold at or above this a contradicting detection is a mismatch
     * @param confusableThreshold name similarity at or above which another project is flagged
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("minConfidence") Double minConfidence,
        @JsonProperty("trustThreshold") Double trustThreshold,
        @JsonProperty("confusableThreshold") Double confusableThreshold
    ) {
        public ValidationSettings {
            minConfidence = minConfidence == null ? 0.5 : minConfidence;
            trustThreshold = trustThreshold == null ? 0.7 : trustThreshold;
            confusableThreshold = confusableThreshold == null ? 0.7 : confusableThreshold;
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(null, null, null);
        }
    }

    /**
     * What to do with each status that needs a policy decision.
     */
    public enum PolicyAction {
        /** Block without asking. */
        @JsonProperty("block")
        BLOCK,
        /** Ask the caller's confirmation callback. */
        @JsonProperty("confirm")
        CONFIRM
    }

    /**
     * Safeguard policy.
     *
     * @param onMismatch action for a mismatch
     * @param onLowConfidence action for low confidence
     * @param confirmationTimeoutSeconds how long a confirmation may take before it counts as a refusal
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SafeguardSettings(
        @JsonProperty("onMismatch") PolicyAction onMismatch,
        @JsonProperty("onLowConfidence") PolicyAction onLowConfidence,
        @JsonProperty("confirmationTimeoutSeconds") Long confirmationTimeoutSeconds
    ) {
        public SafeguardSettings {
            onMismatch = onMismatch == null ? PolicyAction.CONFIRM : onMismatch;
            onLowConfidence = onLowConfidence == null ? PolicyAction.CONFIRM : onLowConfidence;
            confirmationTimeoutSeconds = confirmationTimeoutSeconds == null || confirmationTimeoutSeconds <= 0
                ? 30L
                : confirmationTimeoutSeconds;
        }

        public static SafeguardSettings defaults() {
            return new SafeguardSettings(null, null, null);
        }

        public Duration confirmationTimeout() {
            return Duration.ofSeconds(confirmationTimeoutSeconds);
        }
    }
}
