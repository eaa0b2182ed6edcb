/**
 * JDBC implementations of the local storage SPIs.
 *
 * <p>{@link io.shopsync.jdbc.JdbcLocalStore} backs the record tables,
 * {@link io.shopsync.jdbc.JdbcSyncQueueStore} the sync queue. The schema ships as the
 * classpath resource {@code io/shopsync/jdbc/schema.sql}.
 */
package io.shopsync.jdbc;
