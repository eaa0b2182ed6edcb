/**
 * The durable sync queue and its versioned payload format.
 *
 * @see io.shopsync.queue.SyncQueue
 * @see io.shopsync.queue.SyncPayload
 */
package io.shopsync.queue;
