package com.ryuqq.dealstore.adapter.file.lock;

import com.ryuqq.dealstore.core.exception.LockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cross-process commit lock held as a marker file next to the durable file.
 *
 * <p>The marker {@code {path}.lock} is created with {@code CREATE_NEW}, so exactly one
 * process can hold it. A process that finds the marker retries with exponential backoff
 * and gives up with {@link LockTimeoutException} after the configured number of attempts.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (CommitLock lock = CommitLock.acquire(file, 10, backoff)) {
 *     // write temp, validate, backup, move
 * }
 * </pre>
 *
 * <p>A process killed while holding the lock leaves a stale marker that blocks later
 * committers until it is removed by hand.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class CommitLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommitLock.class);

    private final Path markerPath;
    private boolean released;

    private CommitLock(Path markerPath) {
        this.markerPath = markerPath;
    }

    /**
     * Marker path for a durable file.
     */
    public static Path markerFor(Path file) {
        return file.resolveSibling(file.getFileName().toString() + ".lock");
    }

    /**
     * Creates the marker, retrying while another holder owns it.
     *
     * @param file durable file being committed
     * @param maxAttempts creation attempts before giving up (1 이상)
     * @param backoff delay between attempts
     * @return the held lock
     * @throws LockTimeoutException if the marker still exists after maxAttempts
     * @throws UncheckedIOException if the marker cannot be created for another reason
     */
    public static CommitLock acquire(Path file, int maxAttempts, BackoffCalculator backoff) {
        if (file == null || backoff == null) {
            throw new IllegalArgumentException("file and backoff cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        Path marker = markerFor(file);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Files.createFile(marker);
                log.debug("Acquired commit lock {} on attempt {}", marker, attempt);
                return new CommitLock(marker);
            } catch (FileAlreadyExistsException e) {
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = backoff.delayFor(attempt);
                log.debug("Commit lock {} is held, retrying in {}ms (attempt {}/{})",
                    marker, delay, attempt, maxAttempts);
                sleep(delay);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create lock marker " + marker, e);
            }
        }
        log.warn("Gave up on commit lock {} after {} attempts", marker, maxAttempts);
        throw new LockTimeoutException(marker, maxAttempts);
    }

    public Path markerPath() {
        return markerPath;
    }

    /**
     * Deletes the marker. Calling it twice is harmless.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(markerPath);
            log.debug("Released commit lock {}", markerPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete lock marker " + markerPath, e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for commit lock", e);
        }
    }
}
