package io.shopsync.registry;

import io.shopsync.dispatch.SyncHandler;
import io.shopsync.model.SyncOperation;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry with one handler per {@code (table, operation)} pair.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("inventory", SyncOperation.INSERT, inventoryHandler)
 *     .register("inventory", SyncOperation.UPDATE, inventoryHandler);
 * }</pre>
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
    private final Map<String, SyncHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers the handler for a pair.
     *
     * @return this registry for chaining
     * @throws IllegalStateException if the pair already has a handler
     */
    public DefaultHandlerRegistry register(String table, SyncOperation operation, SyncHandler handler) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(handler, "handler");
        SyncHandler previous = handlers.putIfAbsent(key(table, operation), handler);
        if (previous != null) {
            throw new IllegalStateException("Handler already registered for " + key(table, operation));
        }
        return this;
    }

    @Override
    public SyncHandler handlerFor(String table, SyncOperation operation) {
        return handlers.get(key(table, operation));
    }

    private static String key(String table, SyncOperation operation) {
        return table + "/" + operation.name();
    }
}
