package com.ryuqq.dealstore.core.exception;

import java.nio.file.Path;

/**
 * Another writer held the commit lock for longer than the retry budget allows.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class LockTimeoutException extends DealStoreException {

    private final Path lockPath;
    private final int attempts;

    public LockTimeoutException(Path lockPath, int attempts) {
        super("Could not acquire lock " + lockPath + " after " + attempts + " attempts");
        this.lockPath = lockPath;
        this.attempts = attempts;
    }

    public Path getLockPath() {
        return lockPath;
    }

    public int getAttempts() {
        return attempts;
    }
}
