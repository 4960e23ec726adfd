package com.projectcontext.core.detector.strategy;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.DetectionContext;
import com.projectcontext.core.detector.DetectionStrategy;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionMethod;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.vcs.RemoteUrls;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches the operation's VCS remote against registered remotes.
 */
public class VcsStrategy implements DetectionStrategy {

    private final DetectionSettings settings;

    public VcsStrategy(DetectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.VCS;
    }

    @Override
    public List<DetectionCandidate> detect(DetectionContext context, Registry registry) {
        String remote = RemoteUrls.normalize(context.vcsRemote());
        if (remote.isEmpty()) {
            return List.of();
        }
        List<DetectionCandidate> candidates = new ArrayList<>();
        for (ProjectRecord project : registry.allProjects()) {
            for (String registered : project.vcsRemotes()) {
                if (remote.equals(RemoteUrls.normalize(registered))) {
                    candidates.add(new DetectionCandidate(project.id(), settings.vcsConfidence(),
                        DetectionMethod.VCS, "remote " + context.vcsRemote() + " matches " + registered));
                    break;
                }
            }
        }
        return candidates;
    }
}
