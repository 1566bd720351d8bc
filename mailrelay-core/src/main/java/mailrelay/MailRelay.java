package mailrelay;

import mailrelay.backfill.PendingBackfillScheduler;
import mailrelay.health.PipelineHealth;
import mailrelay.notify.NotificationCodec;
import mailrelay.notify.NotificationPublisher;
import mailrelay.relay.RelayConsumer;
import mailrelay.relay.RetryPolicy;
import mailrelay.replay.FailedEntryManager;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.CacheStore;
import mailrelay.spi.ConnectionProvider;
import mailrelay.spi.MailTransport;
import mailrelay.spi.MetricsExporter;
import mailrelay.spi.OutboxEntryStore;
import mailrelay.spi.TxContext;
import mailrelay.util.JsonCodec;
import mailrelay.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the enqueue path, relay, backfill scan, replay and
 * health probe into a single {@link AutoCloseable} unit.
 *
 * <p>Two builders match the two process roles:
 * <ul>
 *   <li>{@link #producer()}: application process that enqueues email; no relay</li>
 *   <li>{@link #notifier()}: relay process consuming notifications, with optional backfill</li>
 * </ul>
 *
 * <p>{@code build()} connects the broker with bounded retries and fails if it stays
 * unreachable.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MailRelay relay = MailRelay.notifier()
 *     .connectionProvider(connProvider)
 *     .outboxStore(store)
 *     .brokerChannel(broker)
 *     .transport(smtp)
 *     .build()) {
 *   relay.awaitShutdownSignal();
 * }
 * }</pre>
 *
 * @see EmailEnqueuer
 * @see RelayConsumer
 */
public final class MailRelay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailRelay.class.getName());

  private final EmailEnqueuer enqueuer;
  private final RelayConsumer relay;
  private final PendingBackfillScheduler backfill;
  private final FailedEntryManager failedEntries;
  private final PipelineHealth health;
  private final BrokerChannel brokerChannel;
  private final MailTransport transport;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Object shutdownSignal = new Object();

  private MailRelay(EmailEnqueuer enqueuer, RelayConsumer relay,
      PendingBackfillScheduler backfill, FailedEntryManager failedEntries,
      PipelineHealth health, BrokerChannel brokerChannel, MailTransport transport,
      MetricsExporter metrics) {
    this.enqueuer = enqueuer;
    this.relay = relay;
    this.backfill = backfill;
    this.failedEntries = failedEntries;
    this.health = health;
    this.brokerChannel = brokerChannel;
    this.transport = transport;
    this.metrics = metrics;
  }

  /**
   * Returns the enqueue path.
   *
   * @throws IllegalStateException if no {@link TxContext} was configured
   */
  public EmailEnqueuer enqueuer() {
    if (enqueuer == null) {
      throw new IllegalStateException("No txContext configured; this instance cannot enqueue");
    }
    return enqueuer;
  }

  /**
   * Returns the relay, or {@code null} for a producer.
   */
  public RelayConsumer relay() {
    return relay;
  }

  public FailedEntryManager failedEntries() {
    return failedEntries;
  }

  public PipelineHealth health() {
    return health;
  }

  /**
   * Registers a JVM shutdown hook that closes this instance, so SIGTERM drains the relay.
   */
  public MailRelay registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::close, "mailrelay-shutdown"));
    return this;
  }

  /**
   * Blocks until {@link #close()} is called, typically from the shutdown hook.
   */
  public void awaitShutdownSignal() throws InterruptedException {
    synchronized (shutdownSignal) {
      while (!closed.get()) {
        shutdownSignal.wait();
      }
    }
  }

  /**
   * Shuts down in order: backfill, relay (draining in-flight work), transport, broker,
   * metrics. Null components are skipped. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.info("Shutting down mail relay");
    RuntimeException first = null;
    if (backfill != null) {
      try {
        backfill.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (relay != null) {
      try {
        relay.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (transport != null) {
      try {
        transport.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      brokerChannel.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    synchronized (shutdownSignal) {
      shutdownSignal.notifyAll();
    }
    if (first != null) {
      throw first;
    }
  }

  public static ProducerBuilder producer() {
    return new ProducerBuilder();
  }

  public static NotifierBuilder notifier() {
    return new NotifierBuilder();
  }

  // ── Abstract builder ─────────────────────────────────────────────

  /**
   * Parameters shared by both roles.
   *
   * @param <B> the concrete builder type (CRTP)
   */
  public static abstract sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits ProducerBuilder, NotifierBuilder {

    ConnectionProvider connectionProvider;
    TxContext txContext;
    OutboxEntryStore outboxStore;
    BrokerChannel brokerChannel;
    CacheStore cache;
    MetricsExporter metrics;
    JsonCodec jsonCodec;
    private final AtomicBoolean built = new AtomicBoolean(false);

    AbstractBuilder() {}

    void markBuilt() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
    }

    @SuppressWarnings("unchecked")
    private B self() {
      return (B) this;
    }

    /** <b>Required.</b> */
    public B connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return self();
    }

    /** Transaction bridge for {@link EmailEnqueuer}. */
    public B txContext(TxContext txContext) {
      this.txContext = txContext;
      return self();
    }

    /** <b>Required.</b> */
    public B outboxStore(OutboxEntryStore outboxStore) {
      this.outboxStore = outboxStore;
      return self();
    }

    /** <b>Required.</b> Closed together with this instance. */
    public B brokerChannel(BrokerChannel brokerChannel) {
      this.brokerChannel = brokerChannel;
      return self();
    }

    /** Optional cache, probed by {@link PipelineHealth}. */
    public B cache(CacheStore cache) {
      this.cache = cache;
      return self();
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    /** Optional. Defaults to {@link JsonCodec#getDefault()}. */
    public B jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return self();
    }

    void validateRequired() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(outboxStore, "outboxStore");
      Objects.requireNonNull(brokerChannel, "brokerChannel");
    }

    MetricsExporter metricsOrNoop() {
      return metrics != null ? metrics : MetricsExporter.NOOP;
    }

    NotificationPublisher newPublisher() {
      NotificationCodec codec = new NotificationCodec(jsonCodec != null ? jsonCodec : JsonCodec.getDefault());
      return new NotificationPublisher(brokerChannel, codec, metricsOrNoop());
    }

    EmailEnqueuer newEnqueuer(NotificationPublisher publisher) {
      return txContext == null ? null : new EmailEnqueuer(txContext, outboxStore, publisher);
    }

    public abstract MailRelay build();
  }

  // ── Producer builder ─────────────────────────────────────────────

  /**
   * Builder for processes that only enqueue: {@code txContext} is required and no relay runs.
   */
  public static final class ProducerBuilder extends AbstractBuilder<ProducerBuilder> {

    ProducerBuilder() {}

    @Override
    void validateRequired() {
      super.validateRequired();
      Objects.requireNonNull(txContext, "txContext");
    }

    @Override
    public MailRelay build() {
      validateRequired();
      markBuilt();
      brokerChannel.connect();
      NotificationPublisher publisher = newPublisher();
      return new MailRelay(newEnqueuer(publisher), null, null,
          new FailedEntryManager(connectionProvider, outboxStore, publisher),
          new PipelineHealth(connectionProvider, brokerChannel, cache),
          brokerChannel, null, metrics);
    }
  }

  // ── Notifier builder ─────────────────────────────────────────────

  /**
   * Builder for the relay process: consumes notifications and delivers mail.
   */
  public static final class NotifierBuilder extends AbstractBuilder<NotifierBuilder> {
    private MailTransport transport;
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;
    private Sleeper sleeper;
    private long requeueDelayMs = 1_000;
    private long drainTimeoutMs = 10_000;
    private Duration backfillInterval;
    private Duration backfillStaleAfter = Duration.ofMinutes(10);
    private int backfillBatchSize = 100;

    NotifierBuilder() {}

    /** <b>Required.</b> Closed together with this instance. */
    public NotifierBuilder transport(MailTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Attempts per delivery cycle. Optional. Defaults to {@code 3}. */
    public NotifierBuilder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Backoff between attempts. Optional. Defaults to 1 s doubling to 30 s. */
    public NotifierBuilder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public NotifierBuilder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Pause before requeueing after an infrastructure failure. Defaults to {@code 1000}. */
    public NotifierBuilder requeueDelayMs(long requeueDelayMs) {
      this.requeueDelayMs = requeueDelayMs;
      return this;
    }

    /** Maximum wait for in-flight work on close. Defaults to {@code 10000}. */
    public NotifierBuilder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Enables the backfill scan of stale PENDING entries.
     *
     * @param interval   delay between scans
     * @param staleAfter minimum entry age before republishing
     * @param batchSize  maximum entries per scan
     */
    public NotifierBuilder backfill(Duration interval, Duration staleAfter, int batchSize) {
      this.backfillInterval = Objects.requireNonNull(interval, "interval");
      this.backfillStaleAfter = Objects.requireNonNull(staleAfter, "staleAfter");
      this.backfillBatchSize = batchSize;
      return this;
    }

    @Override
    void validateRequired() {
      super.validateRequired();
      Objects.requireNonNull(transport, "transport");
    }

    /**
     * Connects the broker, starts the relay and, if configured, the backfill scan.
     * Anything already started is closed again if a later step fails.
     */
    @Override
    public MailRelay build() {
      validateRequired();
      markBuilt();
      brokerChannel.connect();

      NotificationPublisher publisher = newPublisher();
      RelayConsumer.Builder rb = RelayConsumer.builder()
          .connectionProvider(connectionProvider)
          .outboxStore(outboxStore)
          .brokerChannel(brokerChannel)
          .transport(transport)
          .maxAttempts(maxAttempts)
          .requeueDelayMs(requeueDelayMs)
          .drainTimeoutMs(drainTimeoutMs)
          .metrics(metricsOrNoop());
      if (jsonCodec != null) {
        rb.codec(new NotificationCodec(jsonCodec));
      }
      if (retryPolicy != null) {
        rb.retryPolicy(retryPolicy);
      }
      if (sleeper != null) {
        rb.sleeper(sleeper);
      }

      RelayConsumer relay;
      try {
        relay = rb.build();
        relay.start();
      } catch (RuntimeException e) {
        brokerChannel.close();
        throw e;
      }

      PendingBackfillScheduler backfill = null;
      if (backfillInterval != null) {
        try {
          backfill = PendingBackfillScheduler.builder()
              .connectionProvider(connectionProvider)
              .outboxStore(outboxStore)
              .publisher(publisher)
              .staleAfter(backfillStaleAfter)
              .batchSize(backfillBatchSize)
              .intervalMs(backfillInterval.toMillis())
              .metrics(metricsOrNoop())
              .build();
          backfill.start();
        } catch (RuntimeException e) {
          if (backfill != null) {
            backfill.close();
          }
          relay.close();
          brokerChannel.close();
          throw e;
        }
      }

      return new MailRelay(newEnqueuer(publisher), relay, backfill,
          new FailedEntryManager(connectionProvider, outboxStore, publisher),
          new PipelineHealth(connectionProvider, brokerChannel, cache),
          brokerChannel, transport, metrics);
    }
  }
}
