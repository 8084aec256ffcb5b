/**
 * Deterministic context: the injected clock and id generator.
 *
 * <p>Nothing on the write path calls {@code LocalDate.now()} or {@code UUID.randomUUID()}
 * directly. It asks the {@link com.ryuqq.dealstore.core.context.SystemContext} instead,
 * so tests and synthetic-data runs are replayable.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.context;
