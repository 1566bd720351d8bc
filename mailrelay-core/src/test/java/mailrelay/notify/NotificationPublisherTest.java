package mailrelay.notify;

import mailrelay.DispatchUnavailableException;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.BrokerException;
import mailrelay.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NotificationPublisherTest {

  @Test
  void publishesEncodedNotification() {
    CapturingBroker broker = new CapturingBroker();
    CountingMetrics metrics = new CountingMetrics();
    NotificationPublisher publisher = new NotificationPublisher(broker, new NotificationCodec(), metrics);

    publisher.publish("0190a0b2-5f3c-7d41-9a1e-3b2c4d5e6f70");

    assertEquals(1, broker.payloads.size());
    assertEquals("{\"outbox_id\":\"0190a0b2-5f3c-7d41-9a1e-3b2c4d5e6f70\"}", new String(broker.payloads.get(0)));
    assertEquals(1, metrics.published.get());
    assertEquals(0, metrics.publishFailed.get());
  }

  @Test
  void brokerFailureBecomesDispatchUnavailable() {
    CapturingBroker broker = new CapturingBroker();
    broker.failure = new BrokerException("confirm timeout");
    CountingMetrics metrics = new CountingMetrics();
    NotificationPublisher publisher = new NotificationPublisher(broker, new NotificationCodec(), metrics);

    DispatchUnavailableException e = assertThrows(DispatchUnavailableException.class,
        () -> publisher.publish("0190a0b2-5f3c-7d41-9a1e-3b2c4d5e6f70"));

    assertEquals("0190a0b2-5f3c-7d41-9a1e-3b2c4d5e6f70", e.outboxId());
    assertSame(broker.failure, e.getCause());
    assertEquals(0, metrics.published.get());
    assertEquals(1, metrics.publishFailed.get());
  }

  private static final class CapturingBroker implements BrokerChannel {
    final List<byte[]> payloads = new ArrayList<>();
    RuntimeException failure;

    @Override
    public void connect() {
    }

    @Override
    public void publish(byte[] payload) {
      if (failure != null) {
        throw failure;
      }
      payloads.add(payload);
    }

    @Override
    public Subscription subscribe(DeliveryHandler handler) {
      throw new UnsupportedOperationException();
    }

    @Override
    public boolean isOpen() {
      return failure == null;
    }

    @Override
    public void close() {
    }
  }

  private static final class CountingMetrics implements MetricsExporter {
    final AtomicInteger published = new AtomicInteger();
    final AtomicInteger publishFailed = new AtomicInteger();

    @Override public void incrementPublished() { published.incrementAndGet(); }
    @Override public void incrementPublishFailed() { publishFailed.incrementAndGet(); }
    @Override public void incrementDeliverySent() {}
    @Override public void incrementDeliveryFailed() {}
    @Override public void incrementAttemptFailed() {}
    @Override public void incrementDropped() {}
    @Override public void incrementRequeued() {}
    @Override public void recordInFlight(int inFlight) {}
  }
}
