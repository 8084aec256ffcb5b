/**
 * Store failure taxonomy, rooted at {@link com.ryuqq.dealstore.core.exception.DealStoreException}.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dealstore.core.exception.IntegrityException}: invalid file structure</li>
 *   <li>{@link com.ryuqq.dealstore.core.exception.UnsupportedSchemaVersionException}: unknown on-disk version</li>
 *   <li>{@link com.ryuqq.dealstore.core.exception.LockTimeoutException}: commit lock not acquired in time</li>
 * </ul>
 *
 * <p>Patch validation problems are not exceptions; see {@code core.patch.RejectedField}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.exception;
