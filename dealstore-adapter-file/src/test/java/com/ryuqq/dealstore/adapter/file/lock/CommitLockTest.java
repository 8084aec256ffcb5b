package com.ryuqq.dealstore.adapter.file.lock;

import com.ryuqq.dealstore.core.exception.LockTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CommitLock (lock marker) 테스트.
 */
class CommitLockTest {

    @TempDir
    Path tempDir;

    private Path file;
    private BackoffCalculator fastBackoff;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("pipeline.json");
        fastBackoff = new BackoffCalculator(1, 5, 0.0);
    }

    @Test
    void markerPath_isFilePlusLockSuffix() {
        assertThat(CommitLock.markerFor(file).getFileName().toString()).isEqualTo("pipeline.json.lock");
    }

    @Test
    void acquire_createsMarker_andCloseDeletesIt() {
        try (CommitLock lock = CommitLock.acquire(file, 1, fastBackoff)) {
            assertThat(Files.exists(lock.markerPath())).isTrue();
        }

        assertThat(Files.exists(CommitLock.markerFor(file))).isFalse();
    }

    @Test
    void close_isIdempotent() {
        CommitLock lock = CommitLock.acquire(file, 1, fastBackoff);

        lock.close();
        lock.close();

        assertThat(Files.exists(lock.markerPath())).isFalse();
    }

    @Test
    void heldMarker_timesOutAfterMaxAttempts() throws Exception {
        Files.createFile(CommitLock.markerFor(file));
        AtomicInteger delays = new AtomicInteger();
        BackoffCalculator counting = new BackoffCalculator(1, 5, 0.0, () -> {
            delays.incrementAndGet();
            return 0.0;
        });

        assertThatThrownBy(() -> CommitLock.acquire(file, 4, counting))
            .isInstanceOfSatisfying(LockTimeoutException.class, e -> {
                assertThat(e.getAttempts()).isEqualTo(4);
                assertThat(e.getLockPath()).isEqualTo(CommitLock.markerFor(file));
            });
        assertThat(delays.get()).as("no sleep after the last attempt").isEqualTo(3);
    }

    @Test
    void waitingCommitter_acquiresOnceHolderReleases() throws Exception {
        CommitLock holder = CommitLock.acquire(file, 1, fastBackoff);

        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try (CommitLock lock = CommitLock.acquire(file, 500, fastBackoff)) {
                assertThat(Files.exists(lock.markerPath())).isTrue();
            }
        });
        Thread.sleep(30);
        assertThat(waiter).isNotDone();

        holder.close();

        waiter.get(5, TimeUnit.SECONDS);
        assertThat(Files.exists(CommitLock.markerFor(file))).isFalse();
    }

    @Test
    void invalidMaxAttempts_isRejected() {
        assertThatThrownBy(() -> CommitLock.acquire(file, 0, fastBackoff))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
