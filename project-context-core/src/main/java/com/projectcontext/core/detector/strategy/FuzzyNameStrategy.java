package com.projectcontext.core.detector.strategy;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.DetectionContext;
import com.projectcontext.core.detector.DetectionStrategy;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionMethod;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.similarity.SimilarityEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches a mentioned project name against registered names and aliases.
 *
 * <p>Only the best-scoring project is emitted, and only when its score reaches
 * {@code fuzzyFloor}; its confidence is that score times {@code fuzzyWeight}, so a
 * name mention alone never outranks an exact path match. Ties prefer an exact
 * match, then the lowest project id.
 */
public class FuzzyNameStrategy implements DetectionStrategy {

    private final DetectionSettings settings;

    public FuzzyNameStrategy(DetectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.FUZZY_NAME;
    }

    @Override
    public List<DetectionCandidate> detect(DetectionContext context, Registry registry) {
        String mentioned = context.mentionedName();
        if (mentioned == null) {
            return List.of();
        }
        ProjectRecord bestProject = null;
        NameMatch best = null;
        for (ProjectRecord project : registry.allProjects()) {
            NameMatch match = bestMatch(mentioned, project);
            if (match == null || match.score() < settings.fuzzyFloor()) {
                continue;
            }
            if (best == null || match.isBetterThan(best)
                || (!best.isBetterThan(match) && project.id().compareTo(bestProject.id()) < 0)) {
                best = match;
                bestProject = project;
            }
        }
        if (best == null) {
            return List.of();
        }
        double confidence = Math.min(1.0, best.score() * settings.fuzzyWeight());
        return List.of(new DetectionCandidate(bestProject.id(), confidence, DetectionMethod.FUZZY_NAME,
            String.format(Locale.ROOT, "'%s' matches '%s' (similarity %.2f)", mentioned, best.name(), best.score())));
    }

    /**
     * Best-scoring name of the project; ties prefer an exact match, then the
     * alphabetically first name.
     */
    static NameMatch bestMatch(String query, ProjectRecord project) {
        List<String> names = new ArrayList<>(project.allNames());
        names.add(project.id());
        NameMatch best = null;
        for (String name : names) {
            NameMatch match = new NameMatch(name, SimilarityEngine.score(query, name));
            if (best == null || match.isBetterThan(best)) {
                best = match;
            }
        }
        return best;
    }

    record NameMatch(String name, double score) {

        boolean exact() {
            return score >= 1.0;
        }

        boolean isBetterThan(NameMatch other) {
            if (score != other.score) {
                return score > other.score;
            }
            if (exact() != other.exact()) {
                return exact();
            }
            return name.compareTo(other.name) < 0;
        }
    }
}
