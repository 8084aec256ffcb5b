/**
 * In-memory {@code DealRepository} adapter.
 *
 * <p>This package provides a thread-safe, non-durable implementation of the repository SPI.
 * It is the reference implementation the contract suite is written against, and the
 * test double application-layer tests use.</p>
 *
 * <p><strong>Thread-safety:</strong></p>
 * <ul>
 *   <li>All operations synchronize on the repository instance</li>
 *   <li>Stored and returned deals are copies, so no state escapes the lock</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart; {@code saveChanges()} does nothing</li>
 *   <li>Linear-time lookups; intended for tests and small data sets</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.adapter.inmemory;
