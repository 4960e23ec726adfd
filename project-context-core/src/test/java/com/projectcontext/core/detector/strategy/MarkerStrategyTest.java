package com.projectcontext.core.detector.strategy;

import com.projectcontext.core.config.EngineConfig.DetectionSettings;
import com.projectcontext.core.detector.DetectionContext;
import com.projectcontext.core.model.DetectionCandidate;
import com.projectcontext.core.model.Registry;
import org.junit.jupiter.api.BeforeEach;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.projectcontext.core.TestProjects.project;
import static com.projectcontext.core.TestProjects.withMarkers;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MarkerStrategy}.
 */
class MarkerStrategyTest {

    @TempDir
    Path tempDir;

    private final MarkerStrategy strategy = new MarkerStrategy(DetectionSettings.defaults());

    private Path checkout;

    @BeforeEach
    void setUp() throws IOException {
        checkout = Files.createDirectories(tempDir.resolve("checkout"));
        Files.writeString(checkout.resolve("package.json"), "{}");
        Files.createDirectories(checkout.resolve(".taskmaster"));
    }

    @Test
    void detect_allUniqueMarkersPresent_isCappedAtMarkerCap() {
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("elsewhere")), "package.json", ".taskmaster"));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(checkout), registry);

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.projectId()).isEqualTo("app");
            assertThat(c.confidence()).isEqualTo(0.85);
        });
    }

    @Test
    void detect_partialCoverage_lowersConfidence() {
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("elsewhere")), "package.json", "Cargo.toml"));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(checkout), registry);

        assertThat(candidates).singleElement()
            .extracting(DetectionCandidate::confidence, InstanceOfAssertFactories.DOUBLE)
            .isEqualTo(0.725, within(1e-9));
    }

    @Test
    void detect_markerSharedByTwoProjects_lowersConfidenceForBoth() {
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("a")), "package.json"))
            .withProject(withMarkers(project("web", tempDir.resolve("b")), "package.json"));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(checkout), registry);

        assertThat(candidates).hasSize(2)
            .allSatisfy(c -> assertThat(c.confidence()).isCloseTo(0.775, within(1e-9)));
    }

    @Test
    void detect_belowMarkerDirectory_decaysPerLevel() throws IOException {
        Path deep = Files.createDirectories(checkout.resolve("src").resolve("main"));
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("elsewhere")), "package.json", ".taskmaster"));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(deep), registry);

        assertThat(candidates).singleElement()
            .extracting(DetectionCandidate::confidence, InstanceOfAssertFactories.DOUBLE)
            .isEqualTo(0.8, within(1e-9));
    }

    @Test
    void detect_nearestMarkerDirectoryWins() throws IOException {
        Path nested = Files.createDirectories(checkout.resolve("service"));
        Files.writeString(nested.resolve("pom.xml"), "<project/>");
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("a")), "package.json"))
            .withProject(withMarkers(project("service", tempDir.resolve("b")), "pom.xml"));

        List<DetectionCandidate> candidates = strategy.detect(DetectionContext.of(nested), registry);

        assertThat(candidates).extracting(DetectionCandidate::projectId).containsExactly("service");
    }

    @Test
    void detect_markerEscapingDirectory_isIgnored() throws IOException {
        Files.writeString(tempDir.resolve("outside.txt"), "x");
        Registry registry = Registry.empty()
            .withProject(withMarkers(project("app", tempDir.resolve("a")), "../outside.txt"));

        assertThat(strategy.detect(DetectionContext.of(checkout), registry)).isEmpty();
    }

    @Test
    void detect_projectsWithoutMarkers_returnsNothing() {
        Registry registry = Registry.empty().withProject(project("app", checkout));

        assertThat(strategy.detect(DetectionContext.of(checkout), registry)).isEmpty();
    }
}
