/**
 * Replay of queued mutations against the remote backend.
 *
 * <p>{@link io.shopsync.dispatch.SyncDispatcher} drains the queue one batch at a time;
 * {@link io.shopsync.dispatch.SyncHandler}s do the remote calls, and
 * {@link io.shopsync.dispatch.RetryPolicy} computes the advisory backoff after a failure.
 */
package io.shopsync.dispatch;
