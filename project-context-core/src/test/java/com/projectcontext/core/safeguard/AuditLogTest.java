package com.projectcontext.core.safeguard;

import com.projectcontext.core.MutableClock;
import com.projectcontext.core.TestProjects;
import com.projectcontext.core.model.AuditEvent;
import com.projectcontext.core.model.Decision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AuditLog}.
 */
class AuditLogTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Path file;
    private AuditLog auditLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestProjects.T0);
        file = tempDir.resolve("logs").resolve("audit.jsonl");
        auditLog = new AuditLog(file, clock);
    }

    @Test
    void readAll_missingFile_returnsEmptyList() {
        assertThat(auditLog.readAll()).isEmpty();
    }

    @Test
    void append_writesOneLinePerEvent_inOrder() throws IOException {
        auditLog.append(event("first"));
        auditLog.append(event("second"));

        assertThat(Files.readAllLines(file)).hasSize(2);
        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("first", "second");
    }

    @Test
    void readAll_tornLastLine_isSkippedAndNextAppendStartsFreshLine() throws IOException {
        auditLog.append(event("first"));
        Files.writeString(file, "{\"id\":\"torn", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("first");

        auditLog.append(event("second"));

        assertThat(Files.readAllLines(file)).hasSize(3);
        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("first", "second");
    }

    @Test
    void readAll_tornLineEndingMidCharacter_isSkipped() throws IOException {
        auditLog.append(event("first"));
        byte[] prefix = "{\"note\":\"caf".getBytes(StandardCharsets.UTF_8);
        byte[] torn = Arrays.copyOf(prefix, prefix.length + 1);
        torn[prefix.length] = (byte) 0xC3;
        Files.write(file, torn, StandardOpenOption.APPEND);

        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("first");

        auditLog.append(event("second"));

        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("first", "second");
    }

    @Test
    void readAll_nonAsciiRecord_isReadBack() {
        auditLog.append(event("déploiement"));

        assertThat(auditLog.readAll()).extracting(AuditEvent::operation).containsExactly("déploiement");
    }

    @Test
    void tail_returnsNewestEventsOldestFirst() {
        auditLog.append(event("a"));
        auditLog.append(event("b"));
        auditLog.append(event("c"));

        assertThat(auditLog.tail(2)).extracting(AuditEvent::operation).containsExactly("b", "c");
        assertThat(auditLog.tail(10)).hasSize(3);
        assertThatThrownBy(() -> auditLog.tail(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trim_keepsNewestAndAuditsItself() {
        auditLog.append(event("a"));
        auditLog.append(event("b"));
        auditLog.append(event("c"));
        clock.advance(Duration.ofMinutes(1));

        AuditEvent trimEvent = auditLog.trim(1, "ops");

        assertThat(trimEvent.operation()).isEqualTo(AuditLog.RETENTION_TRIM_OPERATION);
        assertThat(trimEvent.actor()).isEqualTo("ops");
        assertThat(trimEvent.decision()).isEqualTo(Decision.ALLOWED);
        assertThat(trimEvent.note()).isEqualTo("removed 2 record(s), kept 1");
        assertThat(trimEvent.timestamp()).isEqualTo(TestProjects.T0.plus(Duration.ofMinutes(1)));
        assertThat(auditLog.readAll()).extracting(AuditEvent::operation)
            .containsExactly("c", AuditLog.RETENTION_TRIM_OPERATION);
    }

    @Test
    void trim_negativeKeep_throwsException() {
        assertThatThrownBy(() -> auditLog.trim(-1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void append_concurrentWriters_loseNoRecords() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        auditLog.append(event("op-" + thread + "-" + i));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(auditLog.readAll()).hasSize(100);
        assertThat(Files.readAllLines(file)).hasSize(100);
    }

    @Test
    void newEventId_isUniquePerCall() {
        assertThat(AuditLog.newEventId(TestProjects.T0, "edit"))
            .hasSize(16)
            .isNotEqualTo(AuditLog.newEventId(TestProjects.T0, "edit"));
    }

    private AuditEvent event(String operation) {
        return new AuditEvent(AuditLog.newEventId(clock.instant(), operation), clock.instant(), operation, "tester",
            null, null, Decision.ALLOWED, null, null);
    }
}
