package com.ryuqq.dealstore.core.exception;

/**
 * Base type of every failure raised by a deal store.
 *
 * <p>Unchecked, like the rest of the storage contract. Subclasses identify what went wrong
 * so that callers can react (restore a backup, retry later, ask for an upgrade) without
 * parsing messages.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public abstract class DealStoreException extends RuntimeException {

    protected DealStoreException(String message) {
        super(message);
    }

    protected DealStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
