/**
 * Service Provider Interface for deal storage.
 *
 * <p>This package defines the contract storage adapters implement. Two adapters ship with
 * the project:</p>
 *
 * <ul>
 *   <li>{@code dealstore-adapter-inmemory}: pure in-memory cache, commit is a no-op</li>
 *   <li>{@code dealstore-adapter-file}: durable workbook file with crash-safe commits,
 *       schema migration, backups and a cross-process lock</li>
 * </ul>
 *
 * <p><strong>Contract Verification:</strong></p>
 * <p>Every adapter runs the abstract contract suite from {@code dealstore-testkit}
 * ({@code AbstractDealRepositoryContractTest}) against its own implementation.</p>
 *
 * <p><strong>Blocking vs. async:</strong></p>
 * <pre>
 * DealRepository (blocking)
 *        │
 *        ▼ BlockingToAsyncDealRepository(executor)
 * AsyncDealRepository (CompletableFuture)
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
package com.ryuqq.dealstore.core.spi;
