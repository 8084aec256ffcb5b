package com.ryuqq.dealstore.core.patch;

/**
 * A patch field that was written to the deal.
 *
 * @param field canonical field name
 * @param oldValue text form of the previous value (null if unset)
 * @param newValue text form of the written value (null if cleared)
 * @author DealStore Team
 * @since 1.0.0
 */
public record AppliedField(String field, String oldValue, String newValue) {
}
