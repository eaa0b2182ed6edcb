package io.shopsync;

import java.time.Duration;

/**
 * Another sale held the sale lock for longer than the configured wait. The condition is
 * transient: the caller should retry the user action rather than queue a duplicate.
 */
public final class SaleBusyException extends RuntimeException {
    public SaleBusyException(Duration waited) {
        super("Sale processing is busy, please try again (waited " + waited.toMillis() + " ms)");
    }
}
