package io.shopsync.model;

/**
 * Kind of mutation a sync queue entry replays against the remote backend.
 */
public enum SyncOperation {
    INSERT,
    UPDATE,
    DELETE
}
