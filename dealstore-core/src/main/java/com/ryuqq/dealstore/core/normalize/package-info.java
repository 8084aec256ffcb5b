/**
 * Normalization engine and shared field parsers.
 *
 * <p>{@link com.ryuqq.dealstore.core.normalize.DealNormalizer} is a pure function of the
 * deal, the injected {@link com.ryuqq.dealstore.core.context.SystemContext} and the lookup
 * tables. Given the same three inputs it always produces the same output, which is what
 * makes the write path replayable.</p>
 *
 * <p><strong>Fixed Point:</strong></p>
 * <pre>
 * r1 = normalizer.normalizeWithTracking(deal)
 * r2 = normalizer.normalizeWithTracking(r1.deal())
 * r2.changes() is empty, r2.deal() equals r1.deal()
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.normalize;
