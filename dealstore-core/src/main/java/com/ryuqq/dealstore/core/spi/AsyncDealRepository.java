package com.ryuqq.dealstore.core.spi;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Future-based view of {@link DealRepository} for callers that must not block.
 *
 * <p>Semantics of each operation are exactly those of the blocking contract; failures
 * complete the future exceptionally with the same exception types.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 * @see BlockingToAsyncDealRepository
 */
public interface AsyncDealRepository {

    CompletableFuture<List<Deal>> getAll();

    CompletableFuture<Optional<Deal>> getById(String dealId);

    CompletableFuture<List<Deal>> query(DealFilter filter, LocalDate referenceDate);

    CompletableFuture<Void> upsert(Deal deal);

    CompletableFuture<Void> upsertMany(Collection<Deal> deals);

    CompletableFuture<Void> delete(String dealId);

    CompletableFuture<Void> saveChanges();
}
