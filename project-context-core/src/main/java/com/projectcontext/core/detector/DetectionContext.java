package com.projectcontext.core.detector;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Signals available to the detection strategies for one operation.
 *
 * @param cwd working directory of the operation
 * @param vcsRemote remote URL of the enclosing repository, nullable
 * @param mentionedName project name mentioned by the caller, nullable
 */
public record DetectionContext(
    Path cwd,
    String vcsRemote,
    String mentionedName
) {
    /**
     * Compact constructor with validation.
     */
    public DetectionContext {
        Objects.requireNonNull(cwd, "cwd must not be null");
        if (vcsRemote != null && vcsRemote.isBlank()) {
            vcsRemote = null;
        }
        if (mentionedName != null && mentionedName.isBlank()) {
            mentionedName = null;
        }
    }

    public static DetectionContext of(Path cwd) {
        return new DetectionContext(cwd, null, null);
    }
}
