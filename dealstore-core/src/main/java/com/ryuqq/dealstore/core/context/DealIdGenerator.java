package com.ryuqq.dealstore.core.context;

/**
 * Strategy for generating new deal identifiers.
 *
 * <p>All built-in strategies produce ids of the form {@code D-yyyyMMdd-XXXXXXXX}.
 * Which strategy is active decides whether the write path is reproducible:</p>
 * <ul>
 *   <li>{@link RandomDealIdGenerator}: production, unique across runs</li>
 *   <li>{@link SeededDealIdGenerator}: same sequence for the same seed</li>
 *   <li>{@link SequentialDealIdGenerator}: counter-based, for tests</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public interface DealIdGenerator {

    /**
     * Generates the next identifier.
     *
     * @return a new, non-blank deal id
     */
    String generate();
}
