package mailrelay.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of notifications handed to the broker.
     */
    void incrementPublished();

    /**
     * Increments the count of notifications that could not be published.
     */
    void incrementPublishFailed();

    /**
     * Increments the count of entries delivered and marked SENT.
     */
    void incrementDeliverySent();

    /**
     * Increments the count of delivery cycles that exhausted all attempts.
     */
    void incrementDeliveryFailed();

    /**
     * Increments the count of individual transport attempts that failed.
     */
    void incrementAttemptFailed();

    /**
     * Increments the count of notifications acknowledged without delivery
     * (malformed payload, unknown entry or entry already sent).
     */
    void incrementDropped();

    /**
     * Increments the count of notifications returned to the broker after an
     * infrastructure failure.
     */
    void incrementRequeued();

    /**
     * Increments the count of notifications republished by the backfill scan.
     */
    default void incrementBackfillRepublished() {
    }

    /**
     * Records the number of notifications currently being processed by the relay.
     */
    void recordInFlight(int inFlight);

    /**
     * Records the time from enqueue to successful delivery.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementPublishFailed() {
        }

        @Override
        public void incrementDeliverySent() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementAttemptFailed() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementRequeued() {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }
    }
}
