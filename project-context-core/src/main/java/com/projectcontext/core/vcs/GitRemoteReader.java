package com.projectcontext.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads the {@code origin} remote of the repository enclosing a directory.
 *
 * <p>Looks for the nearest {@code .git} entry at or above the start directory.
 * A {@code .git} directory is read directly; a {@code .git} file (worktree or
 * submodule) is followed through its {@code gitdir:} line and, for worktrees,
 * the {@code commondir} file. No git process is spawned.
 */
public class GitRemoteReader {

    private static final Logger log = LoggerFactory.getLogger(GitRemoteReader.class);

    private static final String DEFAULT_REMOTE = "origin";

    /**
     * Returns the URL of {@code origin} for the repository enclosing {@code start}.
     *
     * @param start directory to start from
     * @return remote URL, empty when there is no repository or no origin remote
     * @throws IOException if a git metadata file exists but cannot be read
     */
    public Optional<String> readOriginUrl(Path start) throws IOException {
        return readRemoteUrl(start, DEFAULT_REMOTE);
    }

    public Optional<String> readRemoteUrl(Path start, String remoteName) throws IOException {
        Optional<Path> config = findConfig(start.toAbsolutePath().normalize());
        if (config.isEmpty()) {
            log.debug("No git repository above {}", start);
            return Optional.empty();
        }
        log.debug("Reading remote '{}' from {}", remoteName, config.get());
        return parseRemoteUrl(Files.readAllLines(config.get(), StandardCharsets.UTF_8), remoteName);
    }

    Optional<Path> findConfig(Path start) throws IOException {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            Path dotGit = dir.resolve(".git");
            if (Files.isDirectory(dotGit)) {
                return existing(dotGit.resolve("config"));
            }
            if (Files.isRegularFile(dotGit)) {
                return resolveGitFile(dir, dotGit);
            }
        }
        return Optional.empty();
    }

    private Optional<Path> resolveGitFile(Path dir, Path dotGit) throws IOException {
        String content = Files.readString(dotGit, StandardCharsets.UTF_8).trim();
        if (!content.startsWith("gitdir:")) {
            log.warn("Unrecognized .git file at {}", dotGit);
            return Optional.empty();
        }
        Path gitDir = dir.resolve(content.substring("gitdir:".length()).trim()).normalize();
        Path commonDirFile = gitDir.resolve("commondir");
        if (Files.isRegularFile(commonDirFile)) {
            String commonDir = Files.readString(commonDirFile, StandardCharsets.UTF_8).trim();
            gitDir = gitDir.resolve(commonDir).normalize();
        }
        return existing(gitDir.resolve("config"));
    }

    /**
     * Extracts {@code url} from the {@code [remote "name"]} section of a git config.
     *
     * @param lines config file lines
     * @param remoteName remote to look up
     * @return url, empty if the section or key is missing
     */
    static Optional<String> parseRemoteUrl(List<String> lines, String remoteName) {
        String wantedSection = "remote \"" + remoteName + "\"";
        boolean inSection = false;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                int end = line.indexOf(']');
                inSection = end > 0 && line.substring(1, end).trim().equals(wantedSection);
                continue;
            }
            if (inSection) {
                int equals = line.indexOf('=');
                if (equals > 0 && line.substring(0, equals).trim().equalsIgnoreCase("url")) {
                    String value = line.substring(equals + 1).trim();
                    return value.isEmpty() ? Optional.empty() : Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> existing(Path path) {
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }
}
