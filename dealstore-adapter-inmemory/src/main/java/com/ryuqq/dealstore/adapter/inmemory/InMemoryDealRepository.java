package com.ryuqq.dealstore.adapter.inmemory;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;
import com.ryuqq.dealstore.core.spi.DealRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of {@link DealRepository} for tests and as a reference.
 *
 * <p>Deals are kept in insertion order in a plain list guarded by this instance's monitor.
 * Every read returns copies and every write stores a copy, so no caller ever holds a
 * reference into the store.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>getById / upsert / delete:</strong> O(N) linear scan with case-insensitive id comparison</li>
 *   <li><strong>getAll / query:</strong> O(N) plus one copy per returned deal</li>
 *   <li><strong>saveChanges:</strong> O(1), no-op</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No normalization: callers store exactly what they pass in</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDealRepository repository = new InMemoryDealRepository();
 * repository.upsert(deal);
 * repository.getById("d-20250315-00000001");   // 대소문자 무시
 * repository.clear();                          // 테스트 간 초기화
 * </pre>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class InMemoryDealRepository implements DealRepository {

    private final List<Deal> deals = new ArrayList<>();

    public InMemoryDealRepository() {
    }

    /**
     * Creates a repository pre-populated with copies of the given deals.
     *
     * @param initial deals to load
     */
    public InMemoryDealRepository(Collection<Deal> initial) {
        load(initial);
    }

    @Override
    public synchronized List<Deal> getAll() {
        List<Deal> copies = new ArrayList<>(deals.size());
        for (Deal deal : deals) {
            copies.add(deal.copy());
        }
        return copies;
    }

    @Override
    public synchronized Optional<Deal> getById(String dealId) {
        if (dealId == null) {
            throw new IllegalArgumentException("dealId cannot be null");
        }
        int index = indexOf(dealId);
        return index < 0 ? Optional.empty() : Optional.of(deals.get(index).copy());
    }

    @Override
    public synchronized List<Deal> query(DealFilter filter, LocalDate referenceDate) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate cannot be null");
        }
        List<Deal> matches = new ArrayList<>();
        for (Deal deal : deals) {
            if (filter.matches(deal, referenceDate)) {
                matches.add(deal.copy());
            }
        }
        return matches;
    }

    @Override
    public synchronized void upsert(Deal deal) {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        if (deal.getDealId().isBlank()) {
            throw new IllegalArgumentException("dealId cannot be blank");
        }
        int index = indexOf(deal.getDealId());
        if (index >= 0) {
            deals.set(index, deal.copy());
        } else {
            deals.add(deal.copy());
        }
    }

    @Override
    public synchronized void upsertMany(Collection<Deal> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("deals cannot be null");
        }
        for (Deal deal : batch) {
            upsert(deal);
        }
    }

    @Override
    public synchronized void delete(String dealId) {
        if (dealId == null) {
            throw new IllegalArgumentException("dealId cannot be null");
        }
        int index = indexOf(dealId);
        if (index >= 0) {
            deals.remove(index);
        }
    }

    /**
     * No-op: there is nothing durable to write.
     */
    @Override
    public void saveChanges() {
    }

    /**
     * Removes all deals (테스트 초기화용).
     */
    public synchronized void clear() {
        deals.clear();
    }

    /**
     * Replaces the content with copies of the given deals.
     *
     * @param initial deals to load
     */
    public synchronized void load(Collection<Deal> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("deals cannot be null");
        }
        deals.clear();
        upsertMany(initial);
    }

    public synchronized int size() {
        return deals.size();
    }

    private int indexOf(String dealId) {
        for (int i = 0; i < deals.size(); i++) {
            if (deals.get(i).getDealId().equalsIgnoreCase(dealId)) {
                return i;
            }
        }
        return -1;
    }
}
