package io.shopsync.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction scoping over the local store.
 *
 * <p>{@link #inTransaction} joins a transaction already active on the calling thread, so
 * repository methods compose: the outermost call commits, any failure rolls the whole unit
 * back. After-commit callbacks run once the outermost transaction commits.
 */
public interface LocalTransactions {

    /**
     * Runs {@code work} inside a transaction and returns its result.
     *
     * @param work unit of work receiving the transaction's connection
     * @return the value returned by {@code work}
     * @throws io.shopsync.LocalStoreException if the connection or commit fails, or
     *                                         {@code work} throws {@link SQLException}
     */
    <T> T inTransaction(TxWork<T> work);

    /**
     * Returns {@code true} if a transaction is currently active on this thread.
     */
    boolean isTransactionActive();

    /**
     * Registers a callback to run after the current transaction commits. Without an active
     * transaction the callback runs immediately.
     *
     * @param callback action to execute post-commit
     */
    void afterCommit(Runnable callback);

    /**
     * Unit of work executed with a transactional connection.
     */
    @FunctionalInterface
    interface TxWork<T> {
        T apply(Connection conn) throws SQLException;
    }
}
