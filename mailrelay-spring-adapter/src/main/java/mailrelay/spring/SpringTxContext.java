package mailrelay.spring;

import mailrelay.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>Connections are obtained through {@link DataSourceUtils} so the outbox insert runs on the
 * connection of the surrounding Spring-managed transaction.
 *
 * <p>All callbacks registered during one transaction share a single
 * {@link TransactionSynchronization}. After commit every publish callback runs, even when an
 * earlier one fails; the first failure (typically a
 * {@link mailrelay.DispatchUnavailableException}) then propagates out of the transaction
 * manager's {@code commit}, after the data is committed. A suspended transaction keeps its
 * callbacks apart from the inner {@code REQUIRES_NEW} transaction.
 *
 * <p><b>Compatibility note:</b> transaction synchronization must be active
 * ({@code SYNCHRONIZATION_ALWAYS} or {@code SYNCHRONIZATION_ON_ACTUAL_TRANSACTION}, the
 * defaults). With {@code SYNCHRONIZATION_NEVER}, {@code currentConnection()},
 * {@code afterCommit()} and {@code afterRollback()} throw {@link IllegalStateException}.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
    private static final Logger logger = Logger.getLogger(SpringTxContext.class.getName());

    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Returns {@code true} inside an actual read-write Spring transaction.
     */
    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive()
                && !TransactionSynchronizationManager.isCurrentTransactionReadOnly();
    }

    @Override
    public Connection currentConnection() {
        requireWritableTransaction("currentConnection");
        return DataSourceUtils.getConnection(dataSource);
    }

    @Override
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireWritableTransaction("afterCommit");
        callbacks().onCommit.add(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        requireWritableTransaction("afterRollback");
        callbacks().onRollback.add(callback);
    }

    public DataSource dataSource() {
        return dataSource;
    }

    // Bound under this context as key, so two contexts never share callbacks.
    private TransactionCallbacks callbacks() {
        TransactionCallbacks callbacks = (TransactionCallbacks) TransactionSynchronizationManager.getResource(this);
        if (callbacks == null) {
            callbacks = new TransactionCallbacks(this);
            TransactionSynchronizationManager.bindResource(this, callbacks);
            TransactionSynchronizationManager.registerSynchronization(callbacks);
        }
        return callbacks;
    }

    private void requireWritableTransaction(String operation) {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active read-write transaction");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException(
                    "Transaction synchronization is not active; cannot perform " + operation);
        }
    }

    private static final class TransactionCallbacks implements TransactionSynchronization {
        private final Object key;
        private final List<Runnable> onCommit = new ArrayList<>();
        private final List<Runnable> onRollback = new ArrayList<>();

        TransactionCallbacks(Object key) {
            this.key = key;
        }

        @Override
        public void suspend() {
            TransactionSynchronizationManager.unbindResource(key);
        }

        @Override
        public void resume() {
            TransactionSynchronizationManager.bindResource(key, this);
        }

        @Override
        public void afterCommit() {
            // A callback may open a new transaction; it must not see these callbacks.
            TransactionSynchronizationManager.unbindResourceIfPossible(key);
            RuntimeException first = null;
            for (Runnable callback : onCommit) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    if (first == null) {
                        first = e;
                    } else {
                        first.addSuppressed(e);
                    }
                }
            }
            if (first != null) {
                throw first;
            }
        }

        @Override
        public void afterCompletion(int status) {
            TransactionSynchronizationManager.unbindResourceIfPossible(key);
            if (status != STATUS_ROLLED_BACK) {
                return;
            }
            for (Runnable callback : onRollback) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "After-rollback callback failed", e);
                }
            }
        }
    }
}
