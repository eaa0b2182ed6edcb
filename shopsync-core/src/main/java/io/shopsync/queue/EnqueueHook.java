package io.shopsync.queue;

import io.shopsync.model.SyncQueueEntry;

/**
 * Notified once an enqueued entry is durable, i.e. after the enclosing local transaction
 * commits. Exceptions are logged and swallowed.
 */
@FunctionalInterface
public interface EnqueueHook {

    EnqueueHook NOOP = entry -> {
    };

    void afterCommit(SyncQueueEntry entry);
}
