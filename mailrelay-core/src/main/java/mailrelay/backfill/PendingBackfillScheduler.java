package mailrelay.backfill;

import mailrelay.DispatchUnavailableException;
import mailrelay.model.OutboxEntry;
import mailrelay.notify.NotificationPublisher;
import mailrelay.spi.ConnectionProvider;
import mailrelay.spi.MetricsExporter;
import mailrelay.spi.OutboxEntryStore;
import mailrelay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic catch-up for entries whose notification never reached the broker.
 *
 * <p>Each cycle selects PENDING entries older than {@code staleAfter} and republishes their
 * notifications. A publish failure ends the cycle; the next one tries again. An entry whose
 * original notification is still queued may be published twice; the relay acknowledges the
 * second one without sending because the entry is SENT by then.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 */
public final class PendingBackfillScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PendingBackfillScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final OutboxEntryStore outboxStore;
    private final NotificationPublisher publisher;
    private final Duration staleAfter;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> task;
    private volatile boolean closed;

    private PendingBackfillScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.staleAfter = Objects.requireNonNull(builder.staleAfter, "staleAfter");

        if (staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("PendingBackfillScheduler has been closed");
        }
        if (task != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("backfill"));
        task = scheduler.scheduleWithFixedDelay(this::runCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void runCycle() {
        try {
            backfillOnce();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Backfill cycle failed", e);
        }
    }

    /**
     * Runs one backfill cycle. Called by the scheduler; tests may call it directly.
     *
     * @return number of notifications republished
     */
    public int backfillOnce() {
        if (closed) {
            return 0;
        }
        Instant createdBefore = clock.instant().minus(staleAfter);
        List<OutboxEntry> stale;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            stale = outboxStore.findStalePending(conn, createdBefore, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load stale pending outbox entries", e);
            return 0;
        }

        int republished = 0;
        for (OutboxEntry entry : stale) {
            try {
                publisher.publish(entry.id());
            } catch (DispatchUnavailableException e) {
                logger.warning("Broker unavailable; backfill stopped after " + republished
                    + " of " + stale.size() + " entries");
                break;
            }
            metrics.incrementBackfillRepublished();
            republished++;
        }
        if (republished > 0) {
            logger.info("Republished " + republished + " stale pending outbox entries");
        }
        return republished;
    }

    /**
     * Cancels the schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link PendingBackfillScheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxEntryStore outboxStore;
        private NotificationPublisher publisher;
        private Duration staleAfter = Duration.ofMinutes(10);
        private int batchSize = 100;
        private long intervalMs = 300_000;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder outboxStore(OutboxEntryStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        public Builder publisher(NotificationPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /**
         * Minimum age of a PENDING entry before it is republished. Defaults to 10 minutes.
         */
        public Builder staleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
            return this;
        }

        /** Maximum entries per cycle. Defaults to {@code 100}. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Delay between cycles. Defaults to 5 minutes. */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PendingBackfillScheduler build() {
            return new PendingBackfillScheduler(this);
        }
    }
}
