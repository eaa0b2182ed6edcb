/**
 * The storage facade: one object wiring the local store, the sync queue, the dispatcher and
 * the scheduler together.
 */
package io.shopsync.storage;
