package mailrelay.notify;

import mailrelay.DispatchUnavailableException;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes one notification per call to the broker. Makes a single attempt; reconnecting
 * is left to the {@link BrokerChannel}.
 */
public final class NotificationPublisher {
  private static final Logger logger = Logger.getLogger(NotificationPublisher.class.getName());

  private final BrokerChannel brokerChannel;
  private final NotificationCodec codec;
  private final MetricsExporter metrics;

  public NotificationPublisher(BrokerChannel brokerChannel, NotificationCodec codec,
      MetricsExporter metrics) {
    this.brokerChannel = Objects.requireNonNull(brokerChannel, "brokerChannel");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Publishes the notification for {@code outboxId}.
   *
   * @throws DispatchUnavailableException if the broker did not accept the message
   */
  public void publish(String outboxId) {
    byte[] payload = codec.encode(new Notification(outboxId));
    try {
      brokerChannel.publish(payload);
    } catch (RuntimeException e) {
      metrics.incrementPublishFailed();
      logger.log(Level.WARNING, "Failed to publish notification for outbox entry " + outboxId, e);
      throw new DispatchUnavailableException(outboxId, e);
    }
    metrics.incrementPublished();
  }
}
