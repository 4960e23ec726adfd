package com.projectcontext.core.engine;

import com.projectcontext.core.detector.DetectionContext;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One call to {@link ContextResolutionEngine#resolve}.
 *
 * @param operation label of the operation about to run
 * @param cwd working directory of the operation
 * @param vcsRemote remote URL of the enclosing repository, nullable
 * @param mentionedName project name mentioned by the caller, nullable
 * @param statedProjectId id, name or alias of the project the caller says it is working on, nullable
 * @param actor who asks, nullable
 */
public record ResolveRequest(
    String operation,
    Path cwd,
    String vcsRemote,
    String mentionedName,
    String statedProjectId,
    String actor
) {
    /**
     * Compact constructor with validation.
     */
    public ResolveRequest {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(cwd, "cwd must not be null");
        if (operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be blank");
        }
        statedProjectId = blankToNull(statedProjectId);
        actor = blankToNull(actor);
    }

    public static ResolveRequest of(String operation, Path cwd) {
        return new ResolveRequest(operation, cwd, null, null, null, null);
    }

    public ResolveRequest withVcsRemote(String remote) {
        return new ResolveRequest(operation, cwd, remote, mentionedName, statedProjectId, actor);
    }

    public ResolveRequest withMentionedName(String name) {
        return new ResolveRequest(operation, cwd, vcsRemote, name, statedProjectId, actor);
    }

    public ResolveRequest withStatedProject(String projectId) {
        return new ResolveRequest(operation, cwd, vcsRemote, mentionedName, projectId, actor);
    }

    public ResolveRequest withActor(String newActor) {
        return new ResolveRequest(operation, cwd, vcsRemote, mentionedName, statedProjectId, newActor);
    }

    DetectionContext toDetectionContext() {
        return new DetectionContext(cwd, vcsRemote, mentionedName);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
