package com.ryuqq.dealstore.core.patch;

import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.normalize.NormalizationChange;

import java.util.List;

/**
 * Outcome of one patch request.
 *
 * <p><strong>Cases:</strong></p>
 * <ul>
 *   <li>{@link #notFound(String)}: no deal with that id, nothing changed</li>
 *   <li>{@link #validationFailed(List)}: every field rejected, nothing saved</li>
 *   <li>{@link #succeeded}: at least one field applied and saved; {@code success} is
 *       false when some fields were rejected (partial success)</li>
 * </ul>
 *
 * @param success true only if every requested field was applied
 * @param deal the saved deal, null when nothing was saved
 * @param appliedFields fields written
 * @param rejectedFields fields refused, with reasons
 * @param normalizationChanges derived-field changes made after the patch
 * @param error summary message, null on full success
 * @author DealStore Team
 * @since 1.0.0
 */
public record PatchResult(
    boolean success,
    Deal deal,
    List<AppliedField> appliedFields,
    List<RejectedField> rejectedFields,
    List<NormalizationChange> normalizationChanges,
    String error
) {

    public PatchResult {
        appliedFields = List.copyOf(appliedFields);
        rejectedFields = List.copyOf(rejectedFields);
        normalizationChanges = List.copyOf(normalizationChanges);
    }

    public static PatchResult notFound(String dealId) {
        return new PatchResult(false, null, List.of(), List.of(), List.of(), "Deal not found: " + dealId);
    }

    public static PatchResult validationFailed(List<RejectedField> rejected) {
        return new PatchResult(false, null, List.of(), rejected, List.of(),
            "Validation failed for " + rejected.size() + " field(s)");
    }

    public static PatchResult succeeded(
        Deal deal,
        List<AppliedField> applied,
        List<RejectedField> rejected,
        List<NormalizationChange> changes
    ) {
        String error = rejected.isEmpty()
            ? null
            : "Partial success: " + rejected.size() + " field(s) rejected";
        return new PatchResult(rejected.isEmpty(), deal, applied, rejected, changes, error);
    }
}
