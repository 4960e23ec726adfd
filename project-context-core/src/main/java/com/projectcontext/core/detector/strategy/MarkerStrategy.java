package com.projectcontext.core.detector.strategy;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.DetectionContext;
import com.projectcontext.core.detector.DetectionStrategy;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionMethod;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks for a directory at or above the working directory that holds a
 * project's declared markers.
 *
 * <p>The first directory, walking upwards, where any project's markers are found
 * decides the candidates. Confidence grows with the share of the project's markers
 * present and with how rare those markers are across the registry, shrinks with
 * every level ascended, and never exceeds {@code markerCap}.
 */
public class MarkerStrategy implements DetectionStrategy {

    private static final double BASE = 0.3;
    private static final double COVERAGE_WEIGHT = 0.35;
    private static final double RARITY_WEIGHT = 0.25;
    private static final double DEPTH_DECAY = 0.05;

    private final DetectionSettings settings;

    public MarkerStrategy(DetectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MARKER;
    }

    @Override
    public List<DetectionCandidate> detect(DetectionContext context, Registry registry) {
        List<ProjectRecord> withMarkers = registry.allProjects().stream()
            .filter(project -> !project.markers().isEmpty())
            .toList();
        if (withMarkers.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> owners = countOwners(withMarkers);

        Path cwd = FileUtils.canonicalize(context.cwd());
        List<Path> levels = FileUtils.selfAndAncestors(cwd, settings.maxAscent());
        for (int depth = 0; depth < levels.size(); depth++) {
            Path dir = levels.get(depth);
            List<DetectionCandidate> found = new ArrayList<>();
            for (ProjectRecord project : withMarkers) {
                List<String> present = presentMarkers(dir, project);
                if (present.isEmpty()) {
                    continue;
                }
                double coverage = (double) present.size() / project.markers().size();
                double rarity = present.stream()
                    .mapToDouble(marker -> 1.0 / owners.get(marker))
                    .average()
                    .orElse(0.0);
                double confidence = BASE + COVERAGE_WEIGHT * coverage + RARITY_WEIGHT * rarity - DEPTH_DECAY * depth;
                confidence = Math.max(0.0, Math.min(settings.markerCap(), confidence));
                found.add(new DetectionCandidate(project.id(), confidence, DetectionMethod.MARKER,
                    present.size() + "/" + project.markers().size() + " markers " + present + " found in " + dir));
            }
            if (!found.isEmpty()) {
                return found;
            }
        }
        return List.of();
    }

    private static List<String> presentMarkers(Path dir, ProjectRecord project) {
        List<String> present = new ArrayList<>();
        for (String marker : project.markers()) {
            Path candidate = dir.resolve(marker).normalize();
            if (candidate.startsWith(dir) && Files.exists(candidate)) {
                present.add(marker);
            }
        }
        return present;
    }

    private static Map<String, Integer> countOwners(List<ProjectRecord> projects) {
        Map<String, Integer> owners = new HashMap<>();
        for (ProjectRecord project : projects) {
            for (String marker : project.markers()) {
                owners.merge(marker, 1, Integer::sum);
            }
        }
        return owners;
    }
}
