package com.projectcontext.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectcontext.core.model.ProjectRecord;
import com.projectcontext.core.model.Registry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.projectcontext.core.TestProjects.project;
import static com.projectcontext.core.TestProjects.withMarkers;
import static com.projectcontext.core.TestProjects.withRemotes;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileRegistryStore}.
 */
class FileRegistryStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private FileRegistryStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("registry.json");
        store = new FileRegistryStore(file);
    }

    @Test
    void load_missingFile_returnsEmptyRegistry() {
        Registry registry = store.load();

        assertThat(registry.projects()).isEmpty();
        assertThat(registry.activeProjectId()).isNull();
        assertThat(registry.version()).isEqualTo(Registry.CURRENT_VERSION);
        assertThat(file).doesNotExist();
    }

    @Test
    void save_thenLoad_preservesProjectsAndActivePointers() {
        ProjectRecord app = withMarkers(withRemotes(project("app", tempDir.resolve("app"), "web"),
            "git@github.com:acme/app.git"), "package.json");
        ProjectRecord api = project("api", tempDir.resolve("api"), "backend");
        Registry registry = Registry.empty().withProject(app).withProject(api).withActive("api", "app");

        store.save(registry);
        Registry loaded = store.load();

        assertThat(loaded.projects()).containsOnlyKeys("app", "api");
        assertThat(loaded.project("app")).contains(app);
        assertThat(loaded.activeProjectId()).isEqualTo("api");
        assertThat(loaded.previousProjectId()).isEqualTo("app");
    }

    @Test
    void save_writesVersionedDocumentWithProjectArray() throws IOException {
        store.save(Registry.empty().withProject(project("app", tempDir.resolve("app"))).withActive("app", null));

        JsonNode document = new ObjectMapper().readTree(file.toFile());

        assertThat(document.get("version").intValue()).isEqualTo(1);
        assertThat(document.get("activeProjectId").asText()).isEqualTo("app");
        assertThat(document.get("projects").isArray()).isTrue();
        assertThat(document.get("projects").get(0).get("createdAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
    }

    @Test
    void load_corruptFile_throwsAndLeavesBytesUnchanged() throws IOException {
        byte[] corrupt = "{\"version\": 1, \"projects\": [ {\"id\": \"app\"".getBytes(StandardCharsets.UTF_8);
        Files.write(file, corrupt);

        assertThatThrownBy(() -> store.load())
            .isInstanceOf(CorruptRegistryException.class)
            .hasMessageContaining(file.toString());

        assertThat(Files.readAllBytes(file)).isEqualTo(corrupt);
    }

    @Test
    void load_unknownField_isCorrupt() throws IOException {
        Files.writeString(file, """
            {"version": 1, "projects": [], "activeProjectId": null, "color": "blue"}
            """);

        assertThatThrownBy(() -> store.load()).isInstanceOf(CorruptRegistryException.class);
    }

    @Test
    void load_missingVersion_isCorrupt() throws IOException {
        Files.writeString(file, "{\"projects\": []}");

        assertThatThrownBy(() -> store.load()).isInstanceOf(CorruptRegistryException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void load_versionBelowOne_isCorrupt(int version) throws IOException {
        Files.writeString(file, "{\"version\": " + version + ", \"projects\": []}");

        assertThatThrownBy(() -> store.load())
            .isInstanceOf(CorruptRegistryException.class)
            .hasMessageContaining("invalid 'version' " + version);
    }

    @Test
    void load_nonObjectDocument_isCorrupt() throws IOException {
        Files.writeString(file, "[1, 2, 3]");

        assertThatThrownBy(() -> store.load()).isInstanceOf(CorruptRegistryException.class);
    }

    @Test
    void load_duplicateProjectId_isCorrupt() throws IOException {
        String path = tempDir.toAbsolutePath().toString().replace("\\", "\\\\");
        Files.writeString(file, "{\"version\": 1, \"projects\": ["
            + "{\"id\": \"app\", \"name\": \"App\", \"path\": \"" + path + "\"},"
            + "{\"id\": \"app\", \"name\": \"App 2\", \"path\": \"" + path + "\"}]}");

        assertThatThrownBy(() -> store.load())
            .isInstanceOf(CorruptRegistryException.class)
            .hasMessageContaining("duplicate project id 'app'");
    }

    @Test
    void load_newerVersion_throwsUnsupportedVersion() throws IOException {
        Files.writeString(file, "{\"version\": 2, \"projects\": [], \"newField\": true}");

        assertThatThrownBy(() -> store.load())
            .isInstanceOf(UnsupportedRegistryVersionException.class)
            .satisfies(e -> assertThat(((UnsupportedRegistryVersionException) e).getVersion()).isEqualTo(2));
    }

    @Test
    void load_danglingActiveProject_loadsWithoutFailing() throws IOException {
        Files.writeString(file, "{\"version\": 1, \"projects\": [], \"activeProjectId\": \"gone\"}");

        Registry registry = store.load();

        assertThat(registry.activeProjectId()).isEqualTo("gone");
        assertThat(registry.activeProject()).isEmpty();
    }

    @Test
    void save_invariantViolation_leavesPreviousFileUntouched() throws IOException {
        store.save(Registry.empty().withProject(project("app", tempDir.resolve("app"), "shared")));
        byte[] before = Files.readAllBytes(file);

        Registry invalid = store.load().withProject(project("api", tempDir.resolve("api"), "shared"));

        assertThatThrownBy(() -> store.save(invalid))
            .isInstanceOf(RegistryInvariantViolationException.class)
            .hasMessageContaining("alias 'shared'");
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void withLock_actionThrows_releasesLockForNextCaller() {
        assertThatThrownBy(() -> store.withLock(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        String result = store.withLock(() -> store.withLock(() -> "nested"));

        assertThat(result).isEqualTo("nested");
        assertThat(tempDir.resolve("registry.json.lock")).exists();
    }
}
