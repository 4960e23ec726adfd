package com.projectcontext.core.safeguard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectcontext.core.model.AuditEvent;
import com.projectcontext.core.model.Decision;
import com.projectcontext.core.util.FileLocks;
import com.projectcontext.core.util.FileUtils;
import com.projectcontext.core.util.IdGenerator;
import com.projectcontext.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only JSON Lines log of {@link AuditEvent}s.
 *
 * <p>Each event is one line written with a single append under an exclusive lock,
 * then forced to disk. Readers skip lines that cannot be parsed, so a torn last
 * line never hides the records before it. The only way records leave the log is
 * {@link #trim(int, String)}, which is itself audited.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    /** Operation label of the event appended after a retention trim. */
    public static final String RETENTION_TRIM_OPERATION = "retention-trim";

    private final Path file;
    private final Path lockFile;
    private final ObjectMapper mapper;
    private final Clock clock;

    public AuditLog(Path file) {
        this(file, Clock.systemUTC());
    }

    public AuditLog(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonMappers.strictJson();
    }

    public Path getFile() {
        return file;
    }

    /**
     * Creates a new event id.
     *
     * @param timestamp event time
     * @param operation operation label
     * @return 16-hex id
     */
    public static String newEventId(Instant timestamp, String operation) {
        return IdGenerator.generate(timestamp.toString(), operation, UUID.randomUUID().toString());
    }

    /**
     * Appends one event.
     *
     * @param event event to record
     * @throws AuditLogException if the event could not be durably written
     */
    public void append(AuditEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        byte[] line;
        try {
            line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new AuditLogException("Failed to serialize audit event " + event.id(), e);
        }
        try {
            FileLocks.withLock(lockFile, () -> {
                appendLine(line);
                return null;
            });
            log.debug("Audited {} '{}' -> {}", event.id(), event.operation(), event.decision());
        } catch (IOException e) {
            throw new AuditLogException("Failed to append audit event to " + file, e);
        }
    }

    private void appendLine(byte[] line) throws IOException {
        Files.createDirectories(file.getParent());
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            ByteBuffer buffer;
            if (size > 0 && !endsWithNewline(channel, size)) {
                // Start a fresh line after a torn record
                buffer = ByteBuffer.allocate(line.length + 1);
                buffer.put((byte) '\n').put(line).flip();
            } else {
                buffer = ByteBuffer.wrap(line);
            }
            channel.position(size);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    /**
     * Reads every parseable event, oldest first.
     *
     * @return events
     * @throws AuditLogException if the log exists but cannot be read
     */
    public List<AuditEvent> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new AuditLogException("Failed to read audit log " + file, e);
        }

        List<AuditEvent> events = new ArrayList<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        int lineNumber = 0;
        int start = 0;
        while (start < content.length) {
            int end = start;
            while (end < content.length && content[end] != '\n') {
                end++;
            }
            ByteBuffer bytes = ByteBuffer.wrap(content, start, end - start);
            start = end + 1;
            lineNumber++;
            String line;
            try {
                line = decoder.decode(bytes).toString();
            } catch (CharacterCodingException e) {
                log.warn("Skipping audit record with invalid UTF-8 at {}:{}", file, lineNumber);
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, AuditEvent.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping unreadable audit record at {}:{}: {}", file, lineNumber, e.getMessage());
            }
        }
        return events;
    }

    /**
     * Returns the newest {@code count} events, oldest first.
     *
     * @param count how many events
     * @return up to {@code count} events
     */
    public List<AuditEvent> tail(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<AuditEvent> events = readAll();
        return events.subList(Math.max(0, events.size() - count), events.size());
    }

    /**
     * Keeps only the newest {@code keepLast} events, then appends a
     * {@value #RETENTION_TRIM_OPERATION} event recording the trim.
     *
     * <p>Unparseable lines are dropped by the rewrite. The rewrite is atomic.
     *
     * @param keepLast number of events to keep
     * @param actor who requested the trim, nullable
     * @return the retention-trim event
     * @throws AuditLogException if the log cannot be rewritten or the trim cannot be audited
     */
    public AuditEvent trim(int keepLast, String actor) {
        if (keepLast < 0) {
            throw new IllegalArgumentException("keepLast must not be negative: " + keepLast);
        }
        try {
            return FileLocks.withLock(lockFile, () -> {
                List<AuditEvent> events = readAll();
                List<AuditEvent> kept = events.subList(Math.max(0, events.size() - keepLast), events.size());
                int removed = events.size() - kept.size();

                StringBuilder content = new StringBuilder();
                for (AuditEvent event : kept) {
                    content.append(mapper.writeValueAsString(event)).append('\n');
                }
                FileUtils.writeAtomically(file, content.toString().getBytes(StandardCharsets.UTF_8));

                Instant now = clock.instant();
                AuditEvent trimEvent = new AuditEvent(newEventId(now, RETENTION_TRIM_OPERATION), now,
                    RETENTION_TRIM_OPERATION, actor, null, null, Decision.ALLOWED, null,
                    "removed " + removed + " record(s), kept " + kept.size());
                append(trimEvent);
                log.info("Trimmed audit log {}: removed {}, kept {}", file, removed, kept.size());
                return trimEvent;
            });
        } catch (IOException e) {
            throw new AuditLogException("Failed to trim audit log " + file, e);
        }
    }
}
