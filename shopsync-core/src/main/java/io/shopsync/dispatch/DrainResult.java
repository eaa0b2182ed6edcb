package io.shopsync.dispatch;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one {@link SyncDispatcher#drain()} call.
 *
 * @param processed         entries taken from the queue
 * @param succeeded         entries replayed and completed
 * @param failed            entries that failed, retryable or not
 * @param errors            one error per failed entry, plus batch-level failures
 * @param alreadyInProgress {@code true} if another drain was running and this call did nothing
 * @param retryAfter        advisory delay before failed entries should be retried, or
 *                          {@code null} when nothing needs retrying
 */
public record DrainResult(
        int processed,
        int succeeded,
        int failed,
        List<SyncError> errors,
        boolean alreadyInProgress,
        Duration retryAfter) {

    public DrainResult {
        errors = List.copyOf(errors);
    }

    static DrainResult inProgress() {
        return new DrainResult(0, 0, 0, List.of(), true, null);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
