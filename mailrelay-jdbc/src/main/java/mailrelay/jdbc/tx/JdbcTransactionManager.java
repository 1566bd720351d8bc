package mailrelay.jdbc.tx;

import mailrelay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Use {@link #inTransaction} for a unit of work, or try-with-resources on the returned
 * {@link Transaction}:
 * <pre>{@code
 * OutboxEntry entry = txManager.inTransaction(
 *     () -> enqueuer.enqueue(messageId, recipients, subject, body));
 *
 * try (var tx = txManager.begin()) {
 *     enqueuer.enqueue(messageId, recipients, subject, body);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>{@link Transaction#commit()} runs the after-commit callbacks once the database commit
 * has succeeded and rethrows their first failure, typically a
 * {@link mailrelay.DispatchUnavailableException}. The data stays committed in that case.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   * @throws IllegalStateException if this thread already has an active transaction
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code work} in a new transaction and commits it.
   *
   * <p>If {@code work} throws, the transaction rolls back and no notification is published.
   * If the commit succeeds but a notification cannot be published, the
   * {@link mailrelay.DispatchUnavailableException} propagates with the entry committed.
   */
  public <T> T inTransaction(TransactionalWork<T> work) throws SQLException {
    Objects.requireNonNull(work, "work");
    try (Transaction tx = begin()) {
      T result = work.run();
      tx.commit();
      return result;
    }
  }

  @FunctionalInterface
  public interface TransactionalWork<T> {
    T run() throws SQLException;
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
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
        finish(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        logger.fine("Transaction closed without commit; rolling back");
        rollback();
      }
    }

    // The connection is released before callbacks run; the thread is unbound either way.
    private void finish(boolean committed) throws SQLException {
      completed = true;
      try {
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        } finally {
          connection.close();
        }
      } finally {
        if (committed) {
          txContext.completeCommitted();
        } else {
          txContext.completeRolledBack();
        }
      }
    }

    private void safeRollback(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
