package com.ryuqq.dealstore.adapter.file;

import java.nio.file.Path;

/**
 * Hook called before each {@link CommitStep}.
 *
 * <p>Throwing from {@link #beforeStep} aborts the commit at that point as a crash would,
 * which is how interruption tests reach each step.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommitInterceptor {

    CommitInterceptor NONE = (step, file, tempFile) -> { };

    /**
     * @param step step about to run
     * @param file durable file
     * @param tempFile temp file of this commit (may not exist yet)
     */
    void beforeStep(CommitStep step, Path file, Path tempFile);
}
