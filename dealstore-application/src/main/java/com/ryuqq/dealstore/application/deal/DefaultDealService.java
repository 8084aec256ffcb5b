package com.ryuqq.dealstore.application.deal;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;
import com.ryuqq.dealstore.core.normalize.DealNormalizer;
import com.ryuqq.dealstore.core.normalize.NormalizationResult;
import com.ryuqq.dealstore.core.patch.AppliedPatch;
import com.ryuqq.dealstore.core.patch.DealPatcher;
import com.ryuqq.dealstore.core.patch.PatchResult;
import com.ryuqq.dealstore.core.spi.DealRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DealService} over any {@link DealRepository}.
 *
 * <p>The normalizer carries the {@link com.ryuqq.dealstore.core.context.SystemContext} used for
 * generated ids, default dates and the reference date of {@link #search(DealFilter)}.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class DefaultDealService implements DealService {

    private static final Logger log = LoggerFactory.getLogger(DefaultDealService.class);

    private final DealRepository repository;
    private final DealNormalizer normalizer;
    private final DealPatcher patcher;

    public DefaultDealService(DealRepository repository, DealNormalizer normalizer) {
        this(repository, normalizer, new DealPatcher());
    }

    public DefaultDealService(DealRepository repository, DealNormalizer normalizer, DealPatcher patcher) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (patcher == null) {
            throw new IllegalArgumentException("patcher cannot be null");
        }
        this.repository = repository;
        this.normalizer = normalizer;
        this.patcher = patcher;
    }

    @Override
    public List<Deal> list() {
        return repository.getAll();
    }

    @Override
    public List<Deal> search(DealFilter filter) {
        return repository.query(filter, normalizer.context().today());
    }

    @Override
    public Optional<Deal> get(String dealId) {
        return repository.getById(dealId);
    }

    @Override
    public NormalizationResult upsert(Deal deal) {
        NormalizationResult result = normalizer.normalizeWithTracking(deal);
        repository.upsert(result.deal());
        repository.saveChanges();
        log.debug("Upserted deal {} ({} normalization change(s))",
            result.deal().getDealId(), result.changes().size());
        return result;
    }

    @Override
    public List<NormalizationResult> importDeals(Collection<Deal> deals) {
        if (deals == null) {
            throw new IllegalArgumentException("deals cannot be null");
        }
        List<NormalizationResult> results = new ArrayList<>(deals.size());
        List<Deal> normalized = new ArrayList<>(deals.size());
        for (Deal deal : deals) {
            NormalizationResult result = normalizer.normalizeWithTracking(deal);
            results.add(result);
            normalized.add(result.deal());
        }
        repository.upsertMany(normalized);
        repository.saveChanges();
        log.info("Imported {} deal(s)", normalized.size());
        return results;
    }

    @Override
    public PatchResult patch(String dealId, Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Optional<Deal> existing = repository.getById(dealId);
        if (existing.isEmpty()) {
            log.debug("Patch target {} not found", dealId);
            return PatchResult.notFound(dealId);
        }

        Deal working = existing.get();
        AppliedPatch patch = patcher.apply(working, fields);
        if (patch.nothingApplied()) {
            log.debug("Patch of {} rejected entirely: {}", dealId, patch.rejected());
            return PatchResult.validationFailed(patch.rejected());
        }
        if (patch.applied().isEmpty()) {
            return PatchResult.succeeded(working, List.of(), List.of(), List.of());
        }

        NormalizationResult normalized = normalizer.normalizeWithTracking(working);
        repository.upsert(normalized.deal());
        repository.saveChanges();
        if (!patch.rejected().isEmpty()) {
            log.info("Patched {} with {} field(s), rejected {}", dealId, patch.applied().size(),
                patch.rejected().size());
        }
        return PatchResult.succeeded(normalized.deal(), patch.applied(), patch.rejected(), normalized.changes());
    }

    @Override
    public boolean delete(String dealId) {
        if (repository.getById(dealId).isEmpty()) {
            return false;
        }
        repository.delete(dealId);
        repository.saveChanges();
        log.debug("Deleted deal {}", dealId);
        return true;
    }
}
