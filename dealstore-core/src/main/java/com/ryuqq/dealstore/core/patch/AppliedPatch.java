package com.ryuqq.dealstore.core.patch;

import java.util.List;

/**
 * What {@link DealPatcher#apply} did to a working copy.
 *
 * @param applied fields written, in request order
 * @param rejected fields refused, in request order
 * @author DealStore Team
 * @since 1.0.0
 */
public record AppliedPatch(List<AppliedField> applied, List<RejectedField> rejected) {

    public AppliedPatch {
        applied = List.copyOf(applied);
        rejected = List.copyOf(rejected);
    }

    /**
     * True when every requested field was refused, so the caller must not save anything.
     */
    public boolean nothingApplied() {
        return applied.isEmpty() && !rejected.isEmpty();
    }
}
