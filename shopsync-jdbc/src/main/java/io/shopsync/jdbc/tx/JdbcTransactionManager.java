package io.shopsync.jdbc.tx;

import io.shopsync.LocalStoreException;
import io.shopsync.jdbc.DataSourceConnectionProvider;
import io.shopsync.spi.ConnectionProvider;
import io.shopsync.spi.LocalTransactions;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for the local JDBC database. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Most callers use {@link #inTransaction}, which joins a transaction already bound to the
 * calling thread:
 * <pre>{@code
 * InventoryItem item = txManager.inTransaction(conn -> inventory.insert(conn, draft));
 * }</pre>
 *
 * <p>Explicit transactions are available via try-with-resources on {@link #begin()}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     inventory.insert(tx.connection(), draft);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager implements LocalTransactions {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Creates a manager over {@code dataSource} with its own thread-bound context.
   */
  public static JdbcTransactionManager forDataSource(DataSource dataSource) {
    return new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), new ThreadLocalTxContext());
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(connection, e);
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  @Override
  public <T> T inTransaction(TxWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      return apply(work, txContext.currentConnection());
    }
    try (Transaction tx = begin()) {
      T result = apply(work, tx.connection());
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw new LocalStoreException("Local transaction failed", e);
    }
  }

  private static <T> T apply(TxWork<T> work, Connection conn) {
    try {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new LocalStoreException("Local transaction work failed", e);
    }
  }

  @Override
  public boolean isTransactionActive() {
    return txContext.isTransactionActive();
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    if (txContext.isTransactionActive()) {
      txContext.afterCommit(callback);
    } else {
      callback.run();
    }
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to restore auto-commit", e);
      } finally {
        try {
          connection.close();
        } finally {
          if (committed) {
            txContext.clearAfterCommit();
          } else {
            txContext.clearAfterRollback();
          }
        }
      }
    }

    private void safeRollback(SQLException primary) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        primary.addSuppressed(e);
      }
    }
  }
}
