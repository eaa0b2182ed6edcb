/**
 * Handler routing by {@code (table, operation)} pairs.
 *
 * <p>Entries with no matching handler are unroutable and exhausted immediately.
 *
 * @see io.shopsync.registry.HandlerRegistry
 * @see io.shopsync.registry.DefaultHandlerRegistry
 */
package io.shopsync.registry;
