/**
 * Local-first data layer with an offline write queue.
 *
 * <p>Records are written to a local embedded store first; every mutation enqueues a
 * sync entry in the same local transaction. The {@link io.shopsync.dispatch.SyncDispatcher}
 * later replays those entries against the remote backend, resolving temporary
 * {@link io.shopsync.Identifier identifiers} into persistent ones.
 *
 * <p>Start from {@link io.shopsync.storage.StorageFacade}.
 */
package io.shopsync;
