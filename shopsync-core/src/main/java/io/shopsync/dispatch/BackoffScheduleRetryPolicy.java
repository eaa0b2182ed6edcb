package io.shopsync.dispatch;

import java.util.Arrays;

/**
 * Retry policy backed by a fixed delay table. The delay for {@code attempts} is
 * {@code schedule[min(attempts, schedule.length - 1)]}; no jitter.
 */
public final class BackoffScheduleRetryPolicy implements RetryPolicy {
    private static final long[] DEFAULT_SCHEDULE_MS = {1000L, 2000L, 5000L, 10000L, 30000L};

    private final long[] scheduleMs;

    /**
     * Creates a policy with the default schedule 1s, 2s, 5s, 10s, 30s.
     */
    public BackoffScheduleRetryPolicy() {
        this(DEFAULT_SCHEDULE_MS);
    }

    /**
     * @param scheduleMs delays in milliseconds, indexed by prior attempts
     */
    public BackoffScheduleRetryPolicy(long... scheduleMs) {
        if (scheduleMs == null || scheduleMs.length == 0) {
            throw new IllegalArgumentException("scheduleMs must not be empty");
        }
        for (long delay : scheduleMs) {
            if (delay < 0) {
                throw new IllegalArgumentException("scheduleMs entries must be >= 0, got: " + delay);
            }
        }
        this.scheduleMs = scheduleMs.clone();
    }

    @Override
    public long computeDelayMs(int attempts) {
        int index = Math.min(Math.max(0, attempts), scheduleMs.length - 1);
        return scheduleMs[index];
    }

    @Override
    public String toString() {
        return "BackoffScheduleRetryPolicy" + Arrays.toString(scheduleMs);
    }
}
