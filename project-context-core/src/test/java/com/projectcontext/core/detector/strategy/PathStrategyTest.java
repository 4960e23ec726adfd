package com.projectcontext.core.detector.strategy;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.DetectionContext;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.DetectionMethod;
import com.projectcontext.core.model.Registry;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.projectcontext.core.TestProjects.project;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PathStrategy}.
 */
class PathStrategyTest {

    @TempDir
    Path tempDir;

    private final PathStrategy strategy = new PathStrategy(DetectionSettings.defaults());

    @Test
    void getMethod_returnsPath() {
        assertThat(strategy.getMethod()).isEqualTo(DetectionMethod.PATH);
    }

    @Test
    void detect_atProjectRoot_returnsFullConfidence() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Registry registry = Registry.empty().withProject(project("app", app));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(app), registry);

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.projectId()).isEqualTo("app");
            assertThat(c.confidence()).isEqualTo(1.0);
            assertThat(c.method()).isEqualTo(DetectionMethod.PATH);
        });
    }

    @Test
    void detect_oneLevelBelowRoot_decaysConfidence() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Path src = Files.createDirectories(app.resolve("src"));
        Registry registry = Registry.empty().withProject(project("app", app));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(src), registry);

        assertThat(candidates).singleElement()
            .extracting(DetectionCandidate::confidence, InstanceOfAssertFactories.DOUBLE)
            .isEqualTo(0.95, within(1e-9));
    }

    @Test
    void detect_throughNestedProjectRoot_appliesPenalty() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Path lib = Files.createDirectories(app.resolve("packages").resolve("lib"));
        Files.writeString(lib.resolve("package.json"), "{}");
        Registry registry = Registry.empty().withProject(project("app", app));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(lib), registry);

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.confidence()).isCloseTo(0.8, within(1e-9));
            assertThat(c.evidence()).contains("nested project root");
        });
    }

    @Test
    void detect_deepBelowRoot_neverDropsBelowFloor() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Path deep = Files.createDirectories(app.resolve("a").resolve("b").resolve("c"));
        PathStrategy steep = new PathStrategy(settings(0.2, 10));
        Registry registry = Registry.empty().withProject(project("app", app));

        List<DetectionCandidate> candidates = steep.detect(DetectionContext.of(deep), registry);

        assertThat(candidates).singleElement()
            .extracting(DetectionCandidate::confidence)
            .isEqualTo(0.5);
    }

    @Test
    void detect_beyondMaxAscent_returnsNothing() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Path deep = Files.createDirectories(app.resolve("a").resolve("b").resolve("c"));
        PathStrategy shallow = new PathStrategy(settings(0.05, 2));
        Registry registry = Registry.empty().withProject(project("app", app));

        assertThat(shallow.detect(DetectionContext.of(deep), registry)).isEmpty();
    }

    @Test
    void detect_nestedRegisteredProjects_nearestWins() throws IOException {
        Path outer = Files.createDirectories(tempDir.resolve("workspace"));
        Path inner = Files.createDirectories(outer.resolve("inner"));
        Path src = Files.createDirectories(inner.resolve("src"));
        Registry registry = Registry.empty()
            .withProject(project("outer", outer))
            .withProject(project("inner", inner));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(src), registry);

        assertThat(candidates).extracting(DetectionCandidate::projectId).containsExactly("inner");
    }

    @Test
    void detect_siblingWithSharedPrefix_doesNotMatch() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Path sibling = Files.createDirectories(tempDir.resolve("app-two"));
        Registry registry = Registry.empty().withProject(project("app", app));

        assertThat(strategy.detect(DetectionContext.of(sibling), registry)).isEmpty();
    }

    private static DetectionSettings settings(double decay, int maxAscent) {
        return new DetectionSettings(null, null, null, null, decay, null, null, maxAscent, null, null);
    }
}
