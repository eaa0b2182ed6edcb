package io.shopsync;

/**
 * Unchecked exception wrapping failures of the local embedded database.
 */
public final class LocalStoreException extends RuntimeException {
    public LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public LocalStoreException(String message) {
        super(message);
    }
}
