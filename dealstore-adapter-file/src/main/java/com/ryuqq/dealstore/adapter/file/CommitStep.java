package com.ryuqq.dealstore.adapter.file;

/**
 * Steps of the commit protocol, in execution order.
 *
 * <pre>
 * LOCK_ACQUIRED → WRITE_TEMP → VALIDATE_TEMP → BACKUP → REPLACE → PRUNE_BACKUPS
 * </pre>
 *
 * <p>A failure at or before {@link #REPLACE} leaves the durable file byte-identical.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public enum CommitStep {

    /** Lock marker created. */
    LOCK_ACQUIRED,

    /** Encoding the workbook to the temp file. */
    WRITE_TEMP,

    /** Re-reading and validating the temp file. */
    VALIDATE_TEMP,

    /** Copying the current durable file to a backup. */
    BACKUP,

    /** Moving the temp file over the durable file. */
    REPLACE,

    /** Deleting backups beyond the retention count. */
    PRUNE_BACKUPS
}
