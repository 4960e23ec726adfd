package com.projectcontext.core.detector;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.strategy.FuzzyNameStrategy;
import com.projectcontext.core.detector.strategy.MarkerStrategy;
import com.projectcontext.core.detector.strategy.PathStrategy;
import com.projectcontext.core.detector.strategy.VcsStrategy;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionResult;
import com.projectcontext.core.model.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every detection strategy and merges their candidates.
 *
 * <p>Candidates are merged per project by keeping the best-ranked one, then
 * sorted by {@link DetectionCandidate#RANKING}. The result is ambiguous when the
 * top two merged candidates are within the ambiguity gap of each other.
 */
public class Detector {

    private static final Logger log = LoggerFactory.getLogger(Detector.class);

    private static final double EPSILON = 1e-9;

    private final List<DetectionStrategy> strategies;
    private final double ambiguityGap;

    public Detector(List<DetectionStrategy> strategies, double ambiguityGap) {
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies must not be null"));
        this.ambiguityGap = ambiguityGap;
    }

    /**
     * Creates a detector with the path, vcs, marker and fuzzy name strategies.
     *
     * @param settings detection settings
     * @return configured detector
     */
    public static Detector withDefaultStrategies(DetectionSettings settings) {
        return new Detector(List.of(
            new PathStrategy(settings),
            new VcsStrategy(settings),
            new MarkerStrategy(settings),
            new FuzzyNameStrategy(settings)
        ), settings.ambiguityGap());
    }

    /**
     * Detects candidate projects for the given context.
     *
     * @param context operation signals
     * @param registry registry snapshot
     * @return merged and ranked result
     */
    public DetectionResult detect(DetectionContext context, Registry registry) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        List<DetectionCandidate> raw = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (DetectionStrategy strategy : strategies) {
            String method = strategy.getMethod().getId();
            try {
                List<DetectionCandidate> found = strategy.detect(context, registry);
                log.debug("Strategy '{}' produced {} candidates", method, found.size());
                raw.addAll(found);
            } catch (IOException | RuntimeException e) {
                log.warn("Strategy '{}' failed and abstains: {}", method, e.getMessage());
                log.debug("Strategy failure details", e);
                warnings.add("Detection strategy '" + method + "' abstained: " + e.getMessage());
            }
        }

        List<DetectionCandidate> merged = merge(raw);
        boolean ambiguous = isAmbiguous(merged);
        if (ambiguous) {
            log.debug("Ambiguous detection between '{}' and '{}'",
                merged.get(0).projectId(), merged.get(1).projectId());
        }
        return new DetectionResult(merged, ambiguous, raw, warnings);
    }

    static List<DetectionCandidate> merge(List<DetectionCandidate> raw) {
        Map<String, DetectionCandidate> best = new LinkedHashMap<>();
        for (DetectionCandidate candidate : raw) {
            best.merge(candidate.projectId(), candidate,
                (existing, incoming) -> DetectionCandidate.RANKING.compare(incoming, existing) < 0 ? incoming : existing);
        }
        List<DetectionCandidate> merged = new ArrayList<>(best.values());
        merged.sort(DetectionCandidate.RANKING);
        return merged;
    }

    private boolean isAmbiguous(List<DetectionCandidate> merged) {
        if (merged.size() < 2) {
            return false;
        }
        double gap = merged.get(0).confidence() - merged.get(1).confidence();
        return gap <= ambiguityGap + EPSILON;
    }
}
