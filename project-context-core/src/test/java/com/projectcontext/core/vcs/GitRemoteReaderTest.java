package com.projectcontext.core.vcs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GitRemoteReader}.
 */
class GitRemoteReaderTest {

    private static final String CONFIG = """
        [core]
        \trepositoryformatversion = 0
        [remote "upstream"]
        \turl = https://github.com/upstream/api.git
        [remote "origin"]
        \turl = git@github.com:acme/api.git
        \tfetch = +refs/heads/*:refs/remotes/origin/*
        [branch "main"]
        \tremote = origin
        """;

    @TempDir
    Path tempDir;

    private final GitRemoteReader reader = new GitRemoteReader();

    @Test
    void readOriginUrl_fromNestedDirectory_findsEnclosingRepository() throws IOException {
        Path repo = tempDir.resolve("api");
        Files.createDirectories(repo.resolve(".git"));
        Files.writeString(repo.resolve(".git/config"), CONFIG);
        Path nested = Files.createDirectories(repo.resolve("src/main"));

        assertThat(reader.readOriginUrl(nested)).contains("git@github.com:acme/api.git");
        assertThat(reader.readRemoteUrl(nested, "upstream")).contains("https://github.com/upstream/api.git");
    }

    @Test
    void readOriginUrl_worktreeGitFile_followsGitdirAndCommondir() throws IOException {
        Path main = tempDir.resolve("main");
        Path worktreeMeta = Files.createDirectories(main.resolve(".git/worktrees/feature"));
        Files.writeString(main.resolve(".git/config"), CONFIG);
        Files.writeString(worktreeMeta.resolve("commondir"), "../..\n");

        Path worktree = Files.createDirectories(tempDir.resolve("feature"));
        Files.writeString(worktree.resolve(".git"), "gitdir: " + worktreeMeta + "\n");

        assertThat(reader.readOriginUrl(worktree)).contains("git@github.com:acme/api.git");
    }

    @Test
    void findConfig_plainDirectory_findsNothingInsideIt() throws IOException {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));

        Optional<Path> config = reader.findConfig(plain);

        // the machine running the tests may itself sit inside a repository
        assertThat(config.filter(path -> path.startsWith(tempDir))).isEmpty();
        assertThat(GitRemoteReader.parseRemoteUrl(List.of("[core]", "bare = false"), "origin")).isEmpty();
    }

    @Test
    void parseRemoteUrl_ignoresCommentsAndOtherSections() {
        List<String> lines = List.of(
            "# comment",
            "[remote \"origin\"]",
            "  ; another comment",
            "  URL = https://example.com/team/repo.git");

        assertThat(GitRemoteReader.parseRemoteUrl(lines, "origin")).contains("https://example.com/team/repo.git");
        assertThat(GitRemoteReader.parseRemoteUrl(lines, "fork")).isEmpty();
    }
}
