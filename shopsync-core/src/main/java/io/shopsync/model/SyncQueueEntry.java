package io.shopsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted sync queue row.
 *
 * @param id           ULID of the entry
 * @param operationKey unique key identifying the logical operation, used for upserts
 * @param data         serialized {@code SyncPayload}
 * @param synced       {@code true} once the operation completed remotely
 */
public record SyncQueueEntry(
        String id,
        String operationKey,
        String tableName,
        String recordId,
        SyncOperation operation,
        String data,
        int attempts,
        int maxAttempts,
        boolean synced,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public SyncQueueEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operationKey, "operationKey");
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(operation, "operation");
    }

    /**
     * An entry is exhausted once its attempt budget is spent without completing.
     */
    public boolean exhausted() {
        return !synced && attempts >= maxAttempts;
    }
}
