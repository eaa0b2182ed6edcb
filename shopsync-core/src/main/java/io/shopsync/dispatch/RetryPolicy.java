package io.shopsync.dispatch;

/**
 * Strategy for computing the advisory delay before a failed entry is retried.
 *
 * @see BackoffScheduleRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next retry.
     *
     * @param attempts attempts the entry had made before the failure (0 for the first failure)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
