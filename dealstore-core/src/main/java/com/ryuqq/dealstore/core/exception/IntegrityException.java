package com.ryuqq.dealstore.core.exception;

import java.util.List;

/**
 * The durable file (or a freshly written temp file) failed structural validation.
 *
 * <p>On load this is raised only after restoring the newest backup was attempted and also
 * failed. On commit it means the new file was discarded and the durable file is untouched.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class IntegrityException extends DealStoreException {

    private final List<String> errors;

    public IntegrityException(String message, List<String> errors) {
        super(message + (errors.isEmpty() ? "" : ": " + String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<String> getErrors() {
        return errors;
    }
}
