package io.shopsync.dispatch;

import java.time.Instant;

/**
 * Snapshot of the sync queue for diagnostics.
 *
 * @param pendingOperations   uncompleted entries, exhausted ones included
 * @param failedOperations    exhausted entries
 * @param retryableOperations entries that will still be drained
 * @param isProcessing        whether a drain is running
 * @param lastProcessed       when the last drain finished, or {@code null} if none has
 */
public record SyncStats(
        int pendingOperations,
        int failedOperations,
        int retryableOperations,
        boolean isProcessing,
        Instant lastProcessed) {
}
