package io.shopsync.dispatch;

/**
 * No handler is registered for an entry's table and operation. The entry is exhausted
 * immediately since replaying it cannot succeed.
 */
public final class UnroutableOperationException extends RuntimeException {
    public UnroutableOperationException(String message) {
        super(message);
    }
}
