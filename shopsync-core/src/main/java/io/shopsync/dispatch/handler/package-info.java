/**
 * Built-in sync handlers for inventory, sales, expenses and user profiles.
 *
 * <p>Register them with {@link io.shopsync.dispatch.handler.SyncHandlers#registerDefaults}.
 */
package io.shopsync.dispatch.handler;
