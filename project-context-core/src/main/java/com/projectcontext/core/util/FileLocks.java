package com.projectcontext.core.util;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive locks on lock files, shared across threads and processes.
 *
 * <p>Within this JVM a re-entrant lock per lock file serializes threads; across
 * processes an OS lock on the file itself does. Nested calls from the thread that
 * already holds the lock run directly.
 */
public final class FileLocks {

    private static final Map<Path, ReentrantLock> THREAD_LOCKS = new ConcurrentHashMap<>();

    private FileLocks() {
        // Utility class
    }

    /**
     * Action run while the lock is held.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    /**
     * Runs {@code action} holding the exclusive lock on {@code lockFile}.
     *
     * <p>The lock file is created if needed and never deleted. Both locks are
     * released on every exit path.
     *
     * @param lockFile lock file
     * @param action action to run
     * @param <T> result type
     * @return result of {@code action}
     * @throws IOException if the lock cannot be taken or {@code action} fails
     */
    public static <T> T withLock(Path lockFile, LockedAction<T> action) throws IOException {
        Path key = lockFile.toAbsolutePath().normalize();
        ReentrantLock threadLock = THREAD_LOCKS.computeIfAbsent(key, path -> new ReentrantLock());
        threadLock.lock();
        try {
            if (threadLock.getHoldCount() > 1) {
                return action.run();
            }
            Files.createDirectories(key.getParent());
            try (FileChannel channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } finally {
            threadLock.unlock();
        }
    }
}
