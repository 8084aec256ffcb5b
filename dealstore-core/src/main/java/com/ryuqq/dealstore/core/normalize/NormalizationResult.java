package com.ryuqq.dealstore.core.normalize;

import com.ryuqq.dealstore.core.model.Deal;

import java.util.List;

/**
 * Normalized copy of a deal plus the changes that produced it.
 *
 * @param deal normalized deal (a new instance, never the input)
 * @param changes every field the pass changed, in rule order
 * @author DealStore Team
 * @since 1.0.0
 */
public record NormalizationResult(Deal deal, List<NormalizationChange> changes) {

    public NormalizationResult {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
