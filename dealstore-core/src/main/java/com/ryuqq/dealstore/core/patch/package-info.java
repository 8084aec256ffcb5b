/**
 * Patch / validation engine.
 *
 * <p>Partial updates arrive as untyped name → value maps (from RPC or console callers).
 * {@link com.ryuqq.dealstore.core.patch.DealPatcher} validates each entry against a static
 * whitelist and reports applied and rejected fields separately, so a caller can always
 * tell which of its requested changes took effect.</p>
 *
 * <p><strong>Flow:</strong></p>
 * <pre>
 * getById → not found?  PatchResult.notFound
 *         → DealPatcher.apply(copy, patch)
 *         → nothing applied and something rejected?  PatchResult.validationFailed (nothing saved)
 *         → normalize → upsert → saveChanges → PatchResult.succeeded
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.patch;
