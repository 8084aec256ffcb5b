package com.ryuqq.dealstore.core.normalize;

/**
 * One field rewritten by a normalization pass.
 *
 * @param field canonical field name, e.g. {@code "PostcodeArea"}
 * @param oldValue text form of the value before the pass (null if unset)
 * @param newValue text form of the value after the pass
 * @param reason human-readable explanation
 * @author DealStore Team
 * @since 1.0.0
 */
public record NormalizationChange(String field, String oldValue, String newValue, String reason) {

    public NormalizationChange {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }
}
