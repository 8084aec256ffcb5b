package com.ryuqq.dealstore.core.spi;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a blocking {@link DealRepository} on an executor.
 *
 * <p>Every call is submitted to the given executor, so a repository that blocks on file
 * I/O or on the commit lock never blocks the caller's thread. Use a dedicated I/O pool;
 * the common fork-join pool is a poor fit for blocking work.</p>
 *
 * <pre>
 * ExecutorService io = Executors.newFixedThreadPool(2);
 * AsyncDealRepository repo = new BlockingToAsyncDealRepository(fileRepository, io);
 * repo.upsert(deal).thenCompose(v -&gt; repo.saveChanges()).join();
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class BlockingToAsyncDealRepository implements AsyncDealRepository {

    private final DealRepository delegate;
    private final Executor executor;

    public BlockingToAsyncDealRepository(DealRepository delegate, Executor executor) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Deal>> getAll() {
        return CompletableFuture.supplyAsync(delegate::getAll, executor);
    }

    @Override
    public CompletableFuture<Optional<Deal>> getById(String dealId) {
        return CompletableFuture.supplyAsync(() -> delegate.getById(dealId), executor);
    }

    @Override
    public CompletableFuture<List<Deal>> query(DealFilter filter, LocalDate referenceDate) {
        return CompletableFuture.supplyAsync(() -> delegate.query(filter, referenceDate), executor);
    }

    @Override
    public CompletableFuture<Void> upsert(Deal deal) {
        return CompletableFuture.runAsync(() -> delegate.upsert(deal), executor);
    }

    @Override
    public CompletableFuture<Void> upsertMany(Collection<Deal> deals) {
        return CompletableFuture.runAsync(() -> delegate.upsertMany(deals), executor);
    }

    @Override
    public CompletableFuture<Void> delete(String dealId) {
        return CompletableFuture.runAsync(() -> delegate.delete(dealId), executor);
    }

    @Override
    public CompletableFuture<Void> saveChanges() {
        return CompletableFuture.runAsync(delegate::saveChanges, executor);
    }

    public DealRepository delegate() {
        return delegate;
    }
}
