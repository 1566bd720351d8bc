package mailrelay.jdbc.tx;

import mailrelay.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link TxContext} that keeps the current transaction in a {@link ThreadLocal}.
 *
 * <p>Meant for manual JDBC transactions driven by {@link JdbcTransactionManager}, which binds
 * the connection, runs the callbacks and clears the state. After-commit callbacks all run;
 * the first exception among them is rethrown with the rest suppressed, so a failed publish
 * reaches the code that committed.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<BoundTransaction> bound = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return bound.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return requireBound().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireBound().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireBound().afterRollback.add(callback);
  }

  void bind(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    if (bound.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    bound.set(new BoundTransaction(connection));
  }

  void completeCommitted() {
    complete(true);
  }

  void completeRolledBack() {
    complete(false);
  }

  private void complete(boolean committed) {
    BoundTransaction current = bound.get();
    if (current == null) {
      return;
    }
    // Unbind first so callbacks may start a new transaction on this thread.
    bound.remove();
    RuntimeException first = null;
    for (Runnable callback : committed ? current.afterCommit : current.afterRollback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private BoundTransaction requireBound() {
    BoundTransaction current = bound.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class BoundTransaction {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private BoundTransaction(Connection connection) {
      this.connection = connection;
    }
  }
}
