/**
 * Manual JDBC transaction management with a thread-bound connection.
 */
package io.shopsync.jdbc.tx;
