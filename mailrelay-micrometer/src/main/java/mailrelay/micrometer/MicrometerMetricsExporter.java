package mailrelay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import mailrelay.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailrelay.publish.success}: notifications handed to the broker</li>
 *   <li>{@code mailrelay.publish.failure}: notifications that could not be published</li>
 *   <li>{@code mailrelay.delivery.sent}: entries delivered and marked SENT</li>
 *   <li>{@code mailrelay.delivery.failed}: delivery cycles that exhausted every attempt</li>
 *   <li>{@code mailrelay.delivery.attempt.failed}: individual transport attempts that failed</li>
 *   <li>{@code mailrelay.relay.dropped}: notifications acknowledged without delivery</li>
 *   <li>{@code mailrelay.relay.requeued}: notifications returned to the broker</li>
 *   <li>{@code mailrelay.backfill.republished}: notifications republished by the backfill scan</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code mailrelay.relay.inflight}: notifications currently being processed</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code mailrelay.delivery.latency.ms}: time from enqueue to delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "mailrelay";

    private final MeterRegistry registry;
    private final Counter published;
    private final Counter publishFailed;
    private final Counter deliverySent;
    private final Counter deliveryFailed;
    private final Counter attemptFailed;
    private final Counter dropped;
    private final Counter requeued;
    private final Counter backfillRepublished;
    private final Gauge inFlightGauge;
    private final DistributionSummary deliveryLatency;

    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "mailrelay"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.mailrelay"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.published = Counter.builder(namePrefix + ".publish.success")
                .description("Notifications handed to the broker")
                .register(registry);
        this.publishFailed = Counter.builder(namePrefix + ".publish.failure")
                .description("Notifications that could not be published")
                .register(registry);
        this.deliverySent = Counter.builder(namePrefix + ".delivery.sent")
                .description("Entries delivered and marked SENT")
                .register(registry);
        this.deliveryFailed = Counter.builder(namePrefix + ".delivery.failed")
                .description("Delivery cycles that exhausted all attempts")
                .register(registry);
        this.attemptFailed = Counter.builder(namePrefix + ".delivery.attempt.failed")
                .description("Transport attempts that failed")
                .register(registry);
        this.dropped = Counter.builder(namePrefix + ".relay.dropped")
                .description("Notifications acknowledged without delivery")
                .register(registry);
        this.requeued = Counter.builder(namePrefix + ".relay.requeued")
                .description("Notifications returned to the broker after an infrastructure failure")
                .register(registry);
        this.backfillRepublished = Counter.builder(namePrefix + ".backfill.republished")
                .description("Notifications republished for stale PENDING entries")
                .register(registry);

        this.inFlightGauge = Gauge.builder(namePrefix + ".relay.inflight", inFlight, AtomicInteger::get)
                .register(registry);

        this.deliveryLatency = DistributionSummary.builder(namePrefix + ".delivery.latency.ms")
                .description("Time from enqueue to delivery in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementPublished() {
        if (closed) return;
        published.increment();
    }

    @Override
    public void incrementPublishFailed() {
        if (closed) return;
        publishFailed.increment();
    }

    @Override
    public void incrementDeliverySent() {
        if (closed) return;
        deliverySent.increment();
    }

    @Override
    public void incrementDeliveryFailed() {
        if (closed) return;
        deliveryFailed.increment();
    }

    @Override
    public void incrementAttemptFailed() {
        if (closed) return;
        attemptFailed.increment();
    }

    @Override
    public void incrementDropped() {
        if (closed) return;
        dropped.increment();
    }

    @Override
    public void incrementRequeued() {
        if (closed) return;
        requeued.increment();
    }

    @Override
    public void incrementBackfillRepublished() {
        if (closed) return;
        backfillRepublished.increment();
    }

    @Override
    public void recordInFlight(int inFlight) {
        if (closed) return;
        this.inFlight.set(inFlight);
    }

    @Override
    public void recordDeliveryLatencyMs(long latencyMs) {
        if (closed) return;
        deliveryLatency.record(latencyMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the pipeline is closed to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(published, publishFailed, deliverySent, deliveryFailed,
                attemptFailed, dropped, requeued, backfillRepublished,
                inFlightGauge, deliveryLatency)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
