package com.projectcontext.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileLocks}.
 */
class FileLocksTest {

    @TempDir
    Path tempDir;

    @Test
    void withLock_nestedCallOnSameThread_doesNotDeadlock() throws IOException {
        Path lockFile = tempDir.resolve("registry.lock");

        String result = FileLocks.withLock(lockFile, () -> FileLocks.withLock(lockFile, () -> "inner"));

        assertThat(result).isEqualTo("inner");
        assertThat(lockFile).exists();
    }

    @Test
    void withLock_actionThrows_releasesLock() throws IOException {
        Path lockFile = tempDir.resolve("registry.lock");

        assertThatThrownBy(() -> FileLocks.withLock(lockFile, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(FileLocks.withLock(lockFile, () -> "again")).isEqualTo("again");
    }

    @Test
    void withLock_concurrentThreads_neverOverlap() throws Exception {
        Path lockFile = tempDir.resolve("registry.lock");
        AtomicInteger inside = new AtomicInteger();
        List<Integer> observed = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 20; j++) {
                        FileLocks.withLock(lockFile, () -> {
                            observed.add(inside.incrementAndGet());
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(observed).hasSize(80).containsOnly(1);
    }
}
