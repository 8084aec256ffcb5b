package com.ryuqq.dealstore.core.patch;

/**
 * Result of converting one raw patch value into a field's type.
 *
 * @param <T> target field type
 * @author DealStore Team
 * @since 1.0.0
 */
sealed interface ParsedValue<T> permits ParsedValue.Accepted, ParsedValue.Rejected {

    static <T> ParsedValue<T> accepted(T value) {
        return new Accepted<>(value);
    }

    static <T> ParsedValue<T> rejected(String reason) {
        return new Rejected<>(reason);
    }

    record Accepted<T>(T value) implements ParsedValue<T> {
    }

    record Rejected<T>(String reason) implements ParsedValue<T> {
    }
}
