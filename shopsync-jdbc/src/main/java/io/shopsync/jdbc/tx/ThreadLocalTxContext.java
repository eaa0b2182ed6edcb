package io.shopsync.jdbc.tx;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-bound transaction state: the open connection and the callbacks to run once it
 * commits.
 *
 * <p>Managed by {@link JdbcTransactionManager}, which handles binding, commit callbacks and
 * cleanup.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  public boolean isTransactionActive() {
    return state.get() != null;
  }

  public Connection currentConnection() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current.connection;
  }

  public void afterCommit(Runnable callback) {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    current.afterCommit.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the transaction and runs its after-commit callbacks in registration order. Every
   * callback runs even if an earlier one throws; the first failure is rethrown with the
   * others suppressed.
   */
  void clearAfterCommit() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    RuntimeException first = null;
    for (Runnable callback : current.afterCommit) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  /**
   * Unbinds the transaction and drops its callbacks.
   */
  void clearAfterRollback() {
    state.remove();
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
