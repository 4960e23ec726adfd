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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches the working directory against registered project roots.
 *
 * <p>An exact match scores 1.0. Otherwise the nearest registered ancestor wins,
 * losing {@code pathDecayPerLevel} per level ascended and
 * {@code nestedProjectPenalty} for each traversed directory that looks like a
 * project root of its own, never dropping below {@code pathFloor}.
 */
public class PathStrategy implements DetectionStrategy {

    private final DetectionSettings settings;

    public PathStrategy(DetectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.PATH;
    }

    @Override
    public List<DetectionCandidate> detect(DetectionContext context, Registry registry) {
        Path cwd = FileUtils.canonicalize(context.cwd());

        int nearestLevel = Integer.MAX_VALUE;
        List<ProjectRecord> nearest = new ArrayList<>();
        for (ProjectRecord project : registry.allProjects()) {
            Path root = FileUtils.canonicalize(Paths.get(project.path()));
            if (!cwd.startsWith(root)) {
                continue;
            }
            int level = cwd.getNameCount() - root.getNameCount();
            if (level > settings.maxAscent() || level > nearestLevel) {
                continue;
            }
            if (level < nearestLevel) {
                nearestLevel = level;
                nearest.clear();
            }
            nearest.add(project);
        }

        List<DetectionCandidate> candidates = new ArrayList<>();
        for (ProjectRecord project : nearest) {
            if (nearestLevel == 0) {
                candidates.add(new DetectionCandidate(project.id(), 1.0, DetectionMethod.PATH,
                    "working directory is the project root " + project.path()));
                continue;
            }
            int nested = countNestedRoots(cwd, nearestLevel);
            double confidence = 1.0
                - settings.pathDecayPerLevel() * nearestLevel
                - settings.nestedProjectPenalty() * nested;
            confidence = Math.max(settings.pathFloor(), Math.min(1.0, confidence));
            String evidence = "working directory is " + nearestLevel + " level(s) below " + project.path()
                + (nested > 0 ? " through " + nested + " nested project root(s)" : "");
            candidates.add(new DetectionCandidate(project.id(), confidence, DetectionMethod.PATH, evidence));
        }
        return candidates;
    }

    /**
     * Counts directories from {@code cwd} up to, but excluding, the matched root
     * that carry a project-root marker.
     */
    private int countNestedRoots(Path cwd, int levels) {
        int count = 0;
        Path dir = cwd;
        for (int i = 0; i < levels && dir != null; i++) {
            if (looksLikeProjectRoot(dir)) {
                count++;
            }
            dir = dir.getParent();
        }
        return count;
    }

    private boolean looksLikeProjectRoot(Path dir) {
        for (String marker : settings.projectRootMarkers()) {
            if (Files.exists(dir.resolve(marker))) {
                return true;
            }
        }
        return false;
    }
}
