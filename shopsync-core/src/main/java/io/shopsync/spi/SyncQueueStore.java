package io.shopsync.spi;

import io.shopsync.model.SyncQueueEntry;

import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for the sync queue table.
 *
 * <p>Entries are keyed by a unique operation key. All methods take an explicit
 * {@link Connection}; implementations throw {@link io.shopsync.LocalStoreException}.
 */
public interface SyncQueueStore {

    /**
     * Inserts {@code entry}, or rewrites the entry with the same operation key.
     *
     * <p>Rewriting replaces the payload and resets attempts and error. A pending entry keeps
     * its {@code created_at} (queue position); a completed entry is reopened with the new
     * entry's {@code created_at}.
     */
    void upsert(Connection conn, SyncQueueEntry entry);

    /**
     * Returns pending, non-exhausted entries in FIFO order ({@code created_at}, then id).
     *
     * @param limit max entries, or {@code 0} for no limit
     */
    List<SyncQueueEntry> pollPending(Connection conn, int limit);

    /**
     * Returns every uncompleted entry, exhausted ones included, in FIFO order.
     *
     * @param limit max entries, or {@code 0} for no limit
     */
    List<SyncQueueEntry> listPending(Connection conn, int limit);

    Optional<SyncQueueEntry> findByOperationKey(Connection conn, String operationKey);

    int markCompleted(Connection conn, String id);

    /**
     * Increments attempts and stores the error message.
     */
    int recordFailure(Connection conn, String id, String error);

    /**
     * Sets attempts to the entry's max attempts so it is never polled again.
     */
    int markExhausted(Connection conn, String id, String error);

    /**
     * Removes the uncompleted entry with the given operation key.
     *
     * @return rows removed
     */
    int cancel(Connection conn, String operationKey);

    /**
     * Counts pending, non-exhausted entries.
     */
    int countPending(Connection conn);

    /**
     * Counts uncompleted entries, exhausted ones included, for {@code tableName} whose record
     * id is one of {@code recordIds}.
     */
    int countPendingFor(Connection conn, String tableName, Collection<String> recordIds);

    int countExhausted(Connection conn);

    /**
     * Marks all exhausted entries completed without replaying them.
     *
     * @return entries cleared
     */
    int completeExhausted(Connection conn);

    /**
     * Deletes every entry.
     */
    int clear(Connection conn);
}
