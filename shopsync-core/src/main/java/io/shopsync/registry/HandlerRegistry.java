package io.shopsync.registry;

import io.shopsync.dispatch.SyncHandler;
import io.shopsync.model.SyncOperation;

/**
 * Looks up the handler for a queue entry by its table and operation.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

    /**
     * Returns the handler for the pair, or {@code null} if none is registered.
     *
     * @param table     local table of the entry
     * @param operation operation of the entry
     * @return the handler, or {@code null}
     */
    SyncHandler handlerFor(String table, SyncOperation operation);
}
