package io.shopsync.queue;

/**
 * A queued payload cannot be decoded: invalid JSON, an unknown envelope version or an
 * unknown type tag. Replaying it can never succeed.
 */
public final class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
