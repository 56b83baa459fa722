package io.workgraph.storage;

/**
 * The store could not be reached or timed out waiting for a lock, so the outcome of
 * the attempted operation is unknown. Transient; callers may retry.
 */
public class StoreUnavailableException extends StoreException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
