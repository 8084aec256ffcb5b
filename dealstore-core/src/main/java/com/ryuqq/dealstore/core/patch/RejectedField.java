package com.ryuqq.dealstore.core.patch;

/**
 * A patch field that was refused, with the reason.
 *
 * <p>Rejections are data, not exceptions: one bad field never aborts the rest of the patch.</p>
 *
 * @param field field name exactly as the caller sent it
 * @param attemptedValue text form of the refused value
 * @param reason why the field was refused
 * @author DealStore Team
 * @since 1.0.0
 */
public record RejectedField(String field, String attemptedValue, String reason) {
}
