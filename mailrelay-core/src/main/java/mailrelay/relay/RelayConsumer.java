package mailrelay.relay;

import mailrelay.model.OutboxEntry;
import mailrelay.notify.MalformedNotificationException;
import mailrelay.notify.Notification;
import mailrelay.notify.NotificationCodec;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.ConnectionProvider;
import mailrelay.spi.Delivery;
import mailrelay.spi.MailTransport;
import mailrelay.spi.MetricsExporter;
import mailrelay.spi.OutboxEntryStore;
import mailrelay.util.DaemonThreadFactory;
import mailrelay.util.Sleeper;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes outbox notifications from the broker and turns them into mail.
 *
 * <p>Deliveries are handed off to a single worker thread, so notifications are processed one
 * at a time per relay. For each one the relay loads the entry, runs a {@link DeliveryLoop}
 * and records the outcome:
 * <ul>
 *   <li>malformed payload, unknown entry or entry already SENT: acknowledged, nothing written</li>
 *   <li>delivered: entry marked SENT, acknowledged</li>
 *   <li>every attempt failed: entry marked FAILED ({@code retries + 1}), acknowledged</li>
 *   <li>any other failure (store unreachable, unexpected exception): requeued so the broker
 *       redelivers it, after a short pause</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. {@link #close()} stops intake, waits up to the
 * drain timeout for the notification in progress, then interrupts the worker. Anything not
 * acknowledged by then is redelivered by the broker.
 *
 * @see RelayConsumer.Builder
 */
public final class RelayConsumer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RelayConsumer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxEntryStore outboxStore;
  private final BrokerChannel brokerChannel;
  private final NotificationCodec codec;
  private final DeliveryLoop deliveryLoop;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;
  private final Clock clock;
  private final long requeueDelayMs;
  private final long drainTimeoutMs;

  private final ExecutorService worker;
  private final AtomicBoolean accepting = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile BrokerChannel.Subscription subscription;

  private RelayConsumer(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.brokerChannel = Objects.requireNonNull(builder.brokerChannel, "brokerChannel");
    MailTransport transport = Objects.requireNonNull(builder.transport, "transport");
    this.codec = builder.codec != null ? builder.codec : new NotificationCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 30_000);

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.requeueDelayMs < 0) {
      throw new IllegalArgumentException("requeueDelayMs must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.requeueDelayMs = builder.requeueDelayMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.deliveryLoop = new DeliveryLoop(transport, retryPolicy, builder.maxAttempts, sleeper, metrics);
    this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("relay"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Attaches to the broker and starts accepting notifications.
   *
   * @throws IllegalStateException if already started or closed
   */
  public synchronized void start() {
    if (closed.get()) {
      throw new IllegalStateException("RelayConsumer is closed");
    }
    if (subscription != null) {
      throw new IllegalStateException("RelayConsumer already started");
    }
    accepting.set(true);
    subscription = brokerChannel.subscribe(this::accept);
    logger.info("Relay consuming notifications (maxAttempts=" + deliveryLoop.maxAttempts() + ")");
  }

  private void accept(Delivery delivery) {
    if (!accepting.get()) {
      settle(delivery, false, "(shutting down)");
      return;
    }
    metrics.recordInFlight(inFlight.incrementAndGet());
    try {
      worker.execute(() -> {
        SettlementTracking tracked = new SettlementTracking(delivery);
        try {
          handle(tracked);
        } catch (Throwable t) {
          // An Error escaped handle(); an unsettled delivery would stall the consumer.
          logger.log(Level.SEVERE, "Unhandled error while processing notification", t);
          if (!tracked.isSettled()) {
            metrics.incrementRequeued();
            pauseBeforeRequeue();
            settle(tracked, false, "(unhandled error)");
          }
        } finally {
          metrics.recordInFlight(inFlight.decrementAndGet());
        }
      });
    } catch (RejectedExecutionException e) {
      metrics.recordInFlight(inFlight.decrementAndGet());
      settle(delivery, false, "(shutting down)");
    }
  }

  /**
   * Processes one delivery synchronously on the calling thread and settles it.
   * The worker calls this for every delivery; tests may call it directly.
   *
   * @return how the delivery was settled
   */
  public RelayOutcome handle(Delivery delivery) {
    Notification notification;
    try {
      notification = codec.decode(delivery.body());
    } catch (MalformedNotificationException e) {
      logger.log(Level.WARNING, "Dropping malformed notification: " + e.getMessage());
      metrics.incrementDropped();
      settle(delivery, true, "(malformed)");
      return RelayOutcome.DROPPED;
    }

    String outboxId = notification.outboxId();
    try {
      RelayOutcome outcome = process(outboxId);
      settle(delivery, true, outboxId);
      return outcome;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.info("Interrupted while processing outbox entry " + outboxId
          + "; leaving notification for redelivery");
      settle(delivery, false, outboxId);
      return RelayOutcome.REQUEUED;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Infrastructure failure while processing outbox entry " + outboxId
          + "; notification will be redelivered", e);
      metrics.incrementRequeued();
      pauseBeforeRequeue();
      settle(delivery, false, outboxId);
      return RelayOutcome.REQUEUED;
    }
  }

  private RelayOutcome process(String outboxId) throws SQLException, InterruptedException {
    Optional<OutboxEntry> found = withConnection(conn -> outboxStore.findById(conn, outboxId));
    if (found.isEmpty()) {
      logger.warning("Outbox entry " + outboxId + " not found; dropping notification");
      metrics.incrementDropped();
      return RelayOutcome.DROPPED;
    }
    OutboxEntry entry = found.get();
    if (entry.isSent()) {
      logger.fine("Outbox entry " + outboxId + " already sent; acknowledging duplicate");
      metrics.incrementDropped();
      return RelayOutcome.DUPLICATE;
    }

    DeliveryOutcome outcome = deliveryLoop.deliver(entry);
    if (outcome.delivered()) {
      Instant sentAt = clock.instant();
      boolean updated = withConnection(conn -> outboxStore.markSent(conn, outboxId, sentAt));
      if (updated) {
        metrics.incrementDeliverySent();
        metrics.recordDeliveryLatencyMs(Math.max(0L, Duration.between(entry.createdAt(), sentAt).toMillis()));
      } else {
        // Counted by the relay that recorded it.
        logger.warning("Outbox entry " + outboxId + " was already marked sent by another relay");
      }
      return RelayOutcome.SENT;
    }

    String error = outcome.lastError().describe();
    withConnection(conn -> outboxStore.markFailed(conn, outboxId, error));
    metrics.incrementDeliveryFailed();
    logger.warning("Outbox entry " + outboxId + " failed after " + outcome.attempts()
        + " attempts: " + error);
    return RelayOutcome.FAILED;
  }

  private <T> T withConnection(SqlFunction<T> op) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  // Keeps a dead dependency from turning into a tight redelivery loop.
  private void pauseBeforeRequeue() {
    if (requeueDelayMs == 0) {
      return;
    }
    try {
      sleeper.sleep(requeueDelayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void settle(Delivery delivery, boolean ack, String outboxId) {
    try {
      if (ack) {
        delivery.ack();
      } else {
        delivery.requeue();
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to " + (ack ? "acknowledge" : "requeue")
          + " notification for " + outboxId + "; the broker will redeliver it", e);
    }
  }

  /** Remembers whether the wrapped delivery has been acked or requeued. */
  private static final class SettlementTracking implements Delivery {
    private final Delivery delegate;
    private volatile boolean settled;

    SettlementTracking(Delivery delegate) {
      this.delegate = delegate;
    }

    boolean isSettled() {
      return settled;
    }

    @Override
    public byte[] body() {
      return delegate.body();
    }

    @Override
    public boolean redelivered() {
      return delegate.redelivered();
    }

    @Override
    public void ack() {
      settled = true;
      delegate.ack();
    }

    @Override
    public void requeue() {
      settled = true;
      delegate.requeue();
    }
  }

  /**
   * Returns the number of notifications accepted but not yet settled.
   */
  public int inFlight() {
    return inFlight.get();
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  /**
   * Graceful shutdown: cancels the broker subscription, waits for in-flight work up to the
   * drain timeout, then interrupts the worker.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    accepting.set(false);
    BrokerChannel.Subscription current = subscription;
    if (current != null) {
      try {
        current.cancel();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to cancel broker subscription", e);
      }
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; " + inFlight.get()
            + " notification(s) left for broker redelivery");
        worker.shutdownNow();
        worker.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link RelayConsumer}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxEntryStore outboxStore;
    private BrokerChannel brokerChannel;
    private MailTransport transport;
    private NotificationCodec codec;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private MetricsExporter metrics;
    private Sleeper sleeper;
    private Clock clock;
    private long requeueDelayMs = 1_000;
    private long drainTimeoutMs = 10_000;

    private Builder() {}

    /**
     * Connection source for reading entries and recording outcomes. <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder outboxStore(OutboxEntryStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder brokerChannel(BrokerChannel brokerChannel) {
      this.brokerChannel = brokerChannel;
      return this;
    }

    /** <b>Required.</b> */
    public Builder transport(MailTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder codec(NotificationCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Backoff between attempts within one delivery cycle.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 s base and 30 s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Transport attempts per delivery cycle before the entry is marked FAILED.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Pause implementation used between attempts and before requeueing.
     * Optional. Defaults to {@link Sleeper#SYSTEM}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Source of {@code sent_at} timestamps. Optional. Defaults to UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Pause before returning a notification to the broker after an infrastructure failure.
     *
     * <p>Optional. Defaults to {@code 1000}. {@code 0} requeues immediately.
     */
    public Builder requeueDelayMs(long requeueDelayMs) {
      this.requeueDelayMs = requeueDelayMs;
      return this;
    }

    /**
     * Maximum time {@link #close()} waits for in-flight work.
     *
     * <p>Optional. Defaults to {@code 10000}.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public RelayConsumer build() {
      return new RelayConsumer(this);
    }
  }
}
