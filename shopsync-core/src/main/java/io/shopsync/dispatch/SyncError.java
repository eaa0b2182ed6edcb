package io.shopsync.dispatch;

/**
 * One failure reported by a drain.
 *
 * @param operationKey key of the failed entry, or {@code "dispatcher"} for batch-level failures
 */
public record SyncError(String operationKey, String message) {
}
