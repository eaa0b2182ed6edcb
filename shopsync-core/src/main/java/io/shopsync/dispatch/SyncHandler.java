package io.shopsync.dispatch;

import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.SyncPayload;

/**
 * Replays one kind of queued mutation against the remote backend.
 *
 * <p>Handlers must be idempotent: an entry whose remote call succeeded but whose local
 * completion did not commit is replayed, and the replay must not duplicate remote rows.
 *
 * @see io.shopsync.registry.HandlerRegistry
 */
@FunctionalInterface
public interface SyncHandler {

    /**
     * Replays the entry.
     *
     * @param entry   the queue entry being replayed
     * @param payload its decoded payload
     * @return the local bookkeeping to apply once the entry is completed
     * @throws Exception any failure; the dispatcher records it and retries the entry later
     */
    SyncOutcome handle(SyncQueueEntry entry, SyncPayload payload) throws Exception;
}
