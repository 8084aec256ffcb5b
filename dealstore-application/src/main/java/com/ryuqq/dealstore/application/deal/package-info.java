/**
 * Deal use cases composed from the core engines and a {@link com.ryuqq.dealstore.core.spi.DealRepository}.
 *
 * <p><strong>Patch flow:</strong></p>
 * <pre>
 * get ──not found──▶ PatchResult.notFound
 *  │
 *  ▼
 * DealPatcher.apply ──nothing applied, something rejected──▶ PatchResult.validationFailed
 *  │
 *  ▼
 * DealNormalizer ─▶ upsert ─▶ saveChanges ─▶ PatchResult.succeeded
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.application.deal;
