package io.shopsync.queue;

import com.github.f4b6a3.ulid.UlidCreator;
import io.shopsync.model.SyncOperation;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.SyncQueueStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable FIFO of pending remote mutations.
 *
 * <p>Entries are written with {@link #enqueue} inside the caller's local transaction, so a
 * mutation and its sync entry commit or roll back together. Each entry has a unique
 * operation key; enqueuing an existing key rewrites that entry instead of adding a second one.
 *
 * @see SyncQueueStore
 */
public final class SyncQueue {
    private static final Logger logger = Logger.getLogger(SyncQueue.class.getName());

    private final LocalTransactions transactions;
    private final SyncQueueStore store;
    private final PayloadCodec codec;
    private final int maxAttempts;
    private volatile EnqueueHook hook;

    /**
     * @param transactions local transaction scoping
     * @param store        queue persistence
     * @param codec        payload codec; {@code null} uses {@link PayloadCodec#getDefault()}
     * @param maxAttempts  attempt budget stamped on new entries, must be &ge; 1
     */
    public SyncQueue(LocalTransactions transactions, SyncQueueStore store, PayloadCodec codec, int maxAttempts) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.store = Objects.requireNonNull(store, "store");
        this.codec = codec == null ? PayloadCodec.getDefault() : codec;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.hook = EnqueueHook.NOOP;
    }

    /**
     * Builds the operation key {@code <table>:<operation>:<recordId>}.
     */
    public static String operationKey(String table, SyncOperation operation, String recordId) {
        return table + ":" + operation.name() + ":" + recordId;
    }

    /**
     * Replaces the hook notified after enqueued entries commit.
     *
     * @param hook the hook; {@code null} resets to {@link EnqueueHook#NOOP}
     */
    public void setEnqueueHook(EnqueueHook hook) {
        this.hook = hook == null ? EnqueueHook.NOOP : hook;
    }

    public PayloadCodec codec() {
        return codec;
    }

    /**
     * Enqueues {@code payload} under the key derived from its table, operation and
     * {@code recordId}.
     */
    public SyncQueueEntry enqueue(Connection conn, String recordId, SyncPayload payload) {
        return enqueue(conn, operationKey(payload.table(), payload.operation(), recordId), recordId, payload);
    }

    /**
     * Enqueues {@code payload} under an explicit operation key within the caller's transaction.
     *
     * <p>A pending entry with the same key gets the new payload with attempts and error reset,
     * keeping its place in the queue. A completed entry with the same key is reopened at the
     * back of the queue.
     *
     * @return the entry as written
     */
    public SyncQueueEntry enqueue(Connection conn, String operationKey, String recordId, SyncPayload payload) {
        Objects.requireNonNull(operationKey, "operationKey");
        Objects.requireNonNull(payload, "payload");
        Instant now = Instant.now();
        SyncQueueEntry entry = new SyncQueueEntry(
                UlidCreator.getMonotonicUlid().toString(),
                operationKey,
                payload.table(),
                recordId,
                payload.operation(),
                codec.encode(payload),
                0,
                maxAttempts,
                false,
                null,
                now,
                now);
        store.upsert(conn, entry);
        SyncQueueEntry stored = store.findByOperationKey(conn, operationKey).orElse(entry);
        EnqueueHook current = hook;
        transactions.afterCommit(() -> notifyHook(current, stored));
        return stored;
    }

    private static void notifyHook(EnqueueHook hook, SyncQueueEntry entry) {
        try {
            hook.afterCommit(entry);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "EnqueueHook.afterCommit failed for " + entry.operationKey(), e);
        }
    }

    public SyncPayload decode(SyncQueueEntry entry) {
        return codec.decode(entry.data());
    }

    /**
     * Returns up to {@code limit} pending, non-exhausted entries, oldest first.
     */
    public List<SyncQueueEntry> dequeueBatch(int limit) {
        return transactions.inTransaction(conn -> store.pollPending(conn, limit));
    }

    /**
     * Returns up to {@code limit} uncompleted entries including exhausted ones, oldest first.
     */
    public List<SyncQueueEntry> pending(int limit) {
        return transactions.inTransaction(conn -> store.listPending(conn, limit));
    }

    public Optional<SyncQueueEntry> find(Connection conn, String operationKey) {
        return store.findByOperationKey(conn, operationKey);
    }

    /**
     * Returns the uncompleted entry with {@code operationKey}, if any.
     */
    public Optional<SyncQueueEntry> findPending(Connection conn, String operationKey) {
        return store.findByOperationKey(conn, operationKey).filter(e -> !e.synced());
    }

    /**
     * Marks {@code entry} completed unless it was rewritten by a later {@link #enqueue} since it
     * was read, or cancelled.
     *
     * @return {@code true} if the entry was completed
     */
    public boolean completeIfUnchanged(Connection conn, SyncQueueEntry entry) {
        Optional<SyncQueueEntry> current = store.findByOperationKey(conn, entry.operationKey());
        if (current.isEmpty() || current.get().synced()
                || !current.get().id().equals(entry.id())
                || !Objects.equals(current.get().data(), entry.data())) {
            return false;
        }
        return store.markCompleted(conn, entry.id()) > 0;
    }

    public void recordFailure(String id, String error) {
        transactions.inTransaction(conn -> store.recordFailure(conn, id, error));
    }

    public void markExhausted(String id, String error) {
        transactions.inTransaction(conn -> store.markExhausted(conn, id, error));
    }

    /**
     * Drops the uncompleted entry with {@code operationKey}.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean cancel(Connection conn, String operationKey) {
        return store.cancel(conn, operationKey) > 0;
    }

    /**
     * Returns {@code true} if any uncompleted entry targets one of {@code recordIds} in
     * {@code tableName}.
     */
    public boolean hasPending(Connection conn, String tableName, Collection<String> recordIds) {
        return store.countPendingFor(conn, tableName, recordIds) > 0;
    }

    public int countPending() {
        return transactions.inTransaction(store::countPending);
    }

    public int countExhausted() {
        return transactions.inTransaction(store::countExhausted);
    }

    /**
     * Marks every exhausted entry completed without replaying it.
     *
     * @return entries cleared
     */
    public int clearExhausted() {
        int cleared = transactions.inTransaction(store::completeExhausted);
        if (cleared > 0) {
            logger.log(Level.INFO, "Cleared {0} exhausted sync operation(s)", cleared);
        }
        return cleared;
    }

    public int clear(Connection conn) {
        return store.clear(conn);
    }
}
