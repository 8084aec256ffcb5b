package com.ryuqq.dealstore.core.spi;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Record store SPI for deals.
 *
 * <p>This interface is the seam between the application service and a storage adapter.
 * Implementations keep the working set in memory; mutations are visible immediately to
 * the same instance and reach durable storage only on {@link #saveChanges()}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Read access returning defensive copies (getAll, getById, query)</li>
 *   <li>Case-insensitive keyed mutation (upsert, upsertMany, delete)</li>
 *   <li>Commit of pending changes (saveChanges)</li>
 * </ul>
 *
 * <p><strong>Commit Semantics:</strong></p>
 * <pre>
 * upsert/delete  → in-memory working set updated, store marked dirty
 * saveChanges()  → in-memory: no-op
 *                → durable:   lock → temp write → validate → backup → atomic rename → unlock
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Copies: callers never receive or retain a reference to stored state</li>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Blocking: methods may block on I/O; see {@link AsyncDealRepository} for a future-based view</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public interface DealRepository {

    /**
     * Returns every deal.
     *
     * @return copies of all stored deals, in storage order
     */
    List<Deal> getAll();

    /**
     * Finds a deal by id, ignoring case.
     *
     * @param dealId deal key
     * @return copy of the deal, or empty if absent
     * @throws IllegalArgumentException if dealId is null
     */
    Optional<Deal> getById(String dealId);

    /**
     * Returns deals matching every predicate of the filter.
     *
     * @param filter predicates (use {@link DealFilter#all()} for no restriction)
     * @param referenceDate date that relative predicates ("overdue", "no contact in N days") use
     * @return copies of matching deals, in storage order
     * @throws IllegalArgumentException if filter or referenceDate is null
     */
    List<Deal> query(DealFilter filter, LocalDate referenceDate);

    /**
     * Inserts the deal, or replaces the stored deal with the same id (ignoring case).
     *
     * <p>A copy is stored; later changes to the argument do not affect the store.</p>
     *
     * @param deal deal with a non-blank id
     * @throws IllegalArgumentException if deal is null or its id is blank
     */
    void upsert(Deal deal);

    /**
     * Upserts each deal in order.
     *
     * @param deals deals with non-blank ids
     * @throws IllegalArgumentException if deals is null or any id is blank
     */
    void upsertMany(Collection<Deal> deals);

    /**
     * Removes the deal with the given id. A missing id is a no-op.
     *
     * @param dealId deal key
     * @throws IllegalArgumentException if dealId is null
     */
    void delete(String dealId);

    /**
     * Persists pending changes.
     *
     * @throws com.ryuqq.dealstore.core.exception.DealStoreException if the commit cannot complete;
     *         durable storage is left unchanged in that case
     */
    void saveChanges();
}
