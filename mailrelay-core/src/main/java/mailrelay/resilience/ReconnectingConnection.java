package mailrelay.resilience;

import mailrelay.util.Sleeper;

import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owned, lazily (re)established connection to an external service.
 *
 * <p>Three ways to obtain the connection:
 * <ul>
 *   <li>{@link #connectAtStartup()}: up to {@link ReconnectPolicy#startupAttempts()} attempts
 *       with backoff, then fails</li>
 *   <li>{@link #ensureConnected()}: returns the open connection or makes one attempt; after a
 *       failure it fails fast until the backoff window has passed</li>
 *   <li>{@link #connectNow()}: returns the open connection or makes one attempt, ignoring the
 *       backoff window; for callers that pace their own retries</li>
 *   <li>{@link #awaitReconnect()}: retries with backoff until connected, closed or interrupted</li>
 * </ul>
 *
 * <p>A connection found closed is discarded and replaced, never reused. Thread-safe.
 *
 * @param <C> connection type
 */
public final class ReconnectingConnection<C> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReconnectingConnection.class.getName());

  /**
   * Opens a new connection.
   */
  @FunctionalInterface
  public interface Connector<C> {
    C connect() throws Exception;
  }

  /**
   * Releases a connection.
   */
  @FunctionalInterface
  public interface Closer<C> {
    void close(C connection) throws Exception;
  }

  private final String name;
  private final Connector<C> connector;
  private final Predicate<C> openCheck;
  private final Closer<C> closer;
  private final ReconnectPolicy policy;
  private final Sleeper sleeper;
  private final LongSupplier clockMs;

  private C current;
  private int consecutiveFailures;
  private long nextAttemptAtMs;
  private Exception lastFailure;
  private boolean closed;

  private ReconnectingConnection(Builder<C> builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.connector = Objects.requireNonNull(builder.connector, "connector");
    this.openCheck = builder.openCheck != null ? builder.openCheck : c -> true;
    this.closer = builder.closer != null ? builder.closer : c -> { };
    this.policy = builder.policy != null ? builder.policy : ReconnectPolicy.defaults();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.clockMs = builder.clockMs != null ? builder.clockMs : System::currentTimeMillis;
  }

  public static <C> Builder<C> builder(String name, Connector<C> connector) {
    return new Builder<>(name, connector);
  }

  /**
   * Returns the open connection, connecting once if there is none.
   *
   * @throws ConnectionUnavailableException if the attempt fails, or a previous attempt failed
   *     and its backoff window has not elapsed
   */
  public synchronized C ensureConnected() {
    checkNotClosed();
    if (isOpen()) {
      return current;
    }
    dropCurrent();
    long waitMs = nextAttemptAtMs - clockMs.getAsLong();
    if (consecutiveFailures > 0 && waitMs > 0) {
      throw new ConnectionUnavailableException(name + " unavailable; next reconnect attempt in "
          + waitMs + " ms", lastFailure);
    }
    return attempt();
  }

  /**
   * Returns the open connection, or makes one connect attempt even inside the backoff window.
   * A failure still advances the backoff seen by {@link #ensureConnected()}.
   *
   * @throws ConnectionUnavailableException if the attempt fails
   */
  public synchronized C connectNow() {
    checkNotClosed();
    if (isOpen()) {
      return current;
    }
    dropCurrent();
    return attempt();
  }

  /**
   * Connects with a bounded number of attempts, as done at process startup.
   *
   * @throws ConnectionUnavailableException if every attempt fails
   */
  public C connectAtStartup() {
    int attempts = policy.startupAttempts();
    ConnectionUnavailableException failure = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      synchronized (this) {
        checkNotClosed();
        if (isOpen()) {
          return current;
        }
        dropCurrent();
        try {
          return attempt();
        } catch (ConnectionUnavailableException e) {
          failure = e;
        }
      }
      if (attempt < attempts) {
        try {
          sleeper.sleep(policy.backoff().computeDelayMs(attempt));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new ConnectionUnavailableException(name + " startup connect interrupted", e);
        }
      }
    }
    throw new ConnectionUnavailableException(
        name + " unreachable after " + attempts + " attempts", failure.getCause());
  }

  /**
   * Retries with backoff until a connection is open. Never gives up on its own.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws ConnectionUnavailableException if closed while waiting
   */
  public C awaitReconnect() throws InterruptedException {
    while (true) {
      long waitMs;
      synchronized (this) {
        checkNotClosed();
        if (isOpen()) {
          return current;
        }
        dropCurrent();
        waitMs = consecutiveFailures == 0 ? 0L : nextAttemptAtMs - clockMs.getAsLong();
        if (waitMs <= 0) {
          try {
            return attempt();
          } catch (ConnectionUnavailableException e) {
            waitMs = nextAttemptAtMs - clockMs.getAsLong();
          }
        }
      }
      sleeper.sleep(Math.max(0L, waitMs));
    }
  }

  // Caller holds the monitor.
  private C attempt() {
    try {
      C connection = connector.connect();
      if (consecutiveFailures > 0) {
        logger.info(name + " reconnected after " + consecutiveFailures + " failed attempt(s)");
      }
      current = connection;
      consecutiveFailures = 0;
      nextAttemptAtMs = 0L;
      lastFailure = null;
      return connection;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      consecutiveFailures++;
      lastFailure = e;
      long delayMs = policy.backoff().computeDelayMs(consecutiveFailures);
      nextAttemptAtMs = clockMs.getAsLong() + delayMs;
      logger.log(Level.WARNING, name + " connect attempt " + consecutiveFailures
          + " failed; retry in " + delayMs + " ms: " + e);
      throw new ConnectionUnavailableException(name + " connect failed", e);
    }
  }

  private boolean isOpen() {
    if (current == null) {
      return false;
    }
    try {
      return openCheck.test(current);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, name + " liveness check failed", e);
      return false;
    }
  }

  private void dropCurrent() {
    if (current == null) {
      return;
    }
    C stale = current;
    current = null;
    try {
      closer.close(stale);
    } catch (Exception e) {
      logger.log(Level.FINE, "Ignoring failure while closing stale " + name + " connection", e);
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new ConnectionUnavailableException(name + " connection is closed");
    }
  }

  /**
   * Closes and forgets the current connection; the next call reconnects.
   */
  public synchronized void discard() {
    dropCurrent();
  }

  public synchronized boolean isConnected() {
    return !closed && isOpen();
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  @Override
  public synchronized void close() {
    closed = true;
    dropCurrent();
  }

  /** Builder for {@link ReconnectingConnection}. */
  public static final class Builder<C> {
    private final String name;
    private final Connector<C> connector;
    private Predicate<C> openCheck;
    private Closer<C> closer;
    private ReconnectPolicy policy;
    private Sleeper sleeper;
    private LongSupplier clockMs;

    private Builder(String name, Connector<C> connector) {
      this.name = name;
      this.connector = connector;
    }

    /** Liveness check; a connection failing it is discarded. Defaults to always open. */
    public Builder<C> openCheck(Predicate<C> openCheck) {
      this.openCheck = openCheck;
      return this;
    }

    public Builder<C> closer(Closer<C> closer) {
      this.closer = closer;
      return this;
    }

    /** Defaults to {@link ReconnectPolicy#defaults()}. */
    public Builder<C> policy(ReconnectPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Builder<C> sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Millisecond clock for backoff windows. Defaults to {@link System#currentTimeMillis()}. */
    public Builder<C> clock(LongSupplier clockMs) {
      this.clockMs = clockMs;
      return this;
    }

    public ReconnectingConnection<C> build() {
      return new ReconnectingConnection<>(this);
    }
  }
}
