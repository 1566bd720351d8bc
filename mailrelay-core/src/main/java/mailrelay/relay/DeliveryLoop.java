package mailrelay.relay;

import mailrelay.TransportException;
import mailrelay.model.OutboxEntry;
import mailrelay.spi.MailTransport;
import mailrelay.spi.MetricsExporter;
import mailrelay.util.Sleeper;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded retry loop around {@link MailTransport#send}: at most {@code maxAttempts} strictly
 * sequential attempts, pausing {@code retryPolicy.computeDelayMs(attempt)} after each failure
 * except the last.
 *
 * <p>Only {@link TransportException} is absorbed. Anything else escapes to the caller, which
 * treats it as an infrastructure failure.
 */
public final class DeliveryLoop {
  private static final Logger logger = Logger.getLogger(DeliveryLoop.class.getName());

  private final MailTransport transport;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  public DeliveryLoop(MailTransport transport, RetryPolicy retryPolicy, int maxAttempts,
      Sleeper sleeper, MetricsExporter metrics) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.transport = Objects.requireNonNull(transport, "transport");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Runs one delivery cycle for {@code entry}.
   *
   * @throws InterruptedException if interrupted after a failed attempt or while backing off;
   *     the caller must not record an outcome
   */
  public DeliveryOutcome deliver(OutboxEntry entry) throws InterruptedException {
    TransportException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        transport.send(entry.recipients(), entry.subject(), entry.body());
        return DeliveryOutcome.delivered(attempt);
      } catch (TransportException e) {
        lastError = e;
        metrics.incrementAttemptFailed();
        logger.log(Level.WARNING, "Attempt " + attempt + "/" + maxAttempts
            + " failed for outbox entry " + entry.id() + ": " + e.describe());
      }
      if (Thread.interrupted()) {
        throw new InterruptedException("Delivery of outbox entry " + entry.id() + " interrupted");
      }
      if (attempt < maxAttempts) {
        sleeper.sleep(retryPolicy.computeDelayMs(attempt));
      }
    }
    return DeliveryOutcome.exhausted(maxAttempts, lastError);
  }

  public int maxAttempts() {
    return maxAttempts;
  }
}
