package io.shopsync.spi;

/**
 * Observability hook for exporting sync counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of queue entries replayed successfully.
     */
    void incrementSyncSuccess();

    /**
     * Increments the count of failed replays that will be retried.
     */
    void incrementSyncFailure();

    /**
     * Increments the count of entries that ran out of attempts or failed permanently.
     */
    void incrementSyncExhausted();

    /**
     * Records the number of entries still waiting to be replayed.
     *
     * @param depth pending, non-exhausted entries
     */
    void recordPendingDepth(int depth);

    /**
     * Increments the count of sales recorded locally.
     */
    default void incrementSaleProcessed() {
    }

    /**
     * Increments the count of sales rejected because the sale lock was held.
     */
    default void incrementSaleBusy() {
    }

    /**
     * Records how long the last drain took.
     *
     * @param durationMs drain duration in milliseconds (always non-negative)
     */
    default void recordDrainDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSyncSuccess() {
        }

        @Override
        public void incrementSyncFailure() {
        }

        @Override
        public void incrementSyncExhausted() {
        }

        @Override
        public void recordPendingDepth(int depth) {
        }
    }
}
