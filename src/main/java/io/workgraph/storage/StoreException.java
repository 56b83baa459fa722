package io.workgraph.storage;

/**
 * A store operation failed and its outcome is known to be a failure.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
