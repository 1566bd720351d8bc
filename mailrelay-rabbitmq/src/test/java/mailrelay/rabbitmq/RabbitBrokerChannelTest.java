package mailrelay.rabbitmq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import mailrelay.relay.ExponentialBackoffRetryPolicy;
import mailrelay.resilience.ReconnectPolicy;
import mailrelay.spi.BrokerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RabbitBrokerChannelTest {
  private final RefusingConnectionFactory factory = new RefusingConnectionFactory();
  private final List<Long> sleeps = new CopyOnWriteArrayList<>();
  private RabbitBrokerChannel channel;

  @AfterEach
  void tearDown() {
    if (channel != null) {
      channel.close();
    }
  }

  @Test
  void connectGivesUpAfterStartupAttempts() {
    channel = newChannel(new ReconnectPolicy(3, new ExponentialBackoffRetryPolicy(100, 1_000)));

    BrokerException e = assertThrows(BrokerException.class, channel::connect);

    assertEquals(3, factory.attempts.get());
    assertEquals(List.of(100L, 200L), sleeps);
    assertInstanceOf(ConnectException.class, e.getCause());
    assertFalse(channel.isOpen());
  }

  @Test
  void publishFailsFastWhileInsideBackoffWindow() {
    channel = newChannel(new ReconnectPolicy(1, new ExponentialBackoffRetryPolicy(60_000, 60_000)));
    byte[] payload = "{\"outbox_id\":\"x\"}".getBytes(StandardCharsets.UTF_8);

    assertThrows(BrokerException.class, () -> channel.publish(payload));
    assertThrows(BrokerException.class, () -> channel.publish(payload));
    assertThrows(BrokerException.class, () -> channel.publish(payload));

    assertEquals(1, factory.attempts.get());
  }

  @Test
  void subscribeFailsWhenBrokerUnreachable() {
    channel = newChannel(new ReconnectPolicy(1, new ExponentialBackoffRetryPolicy(60_000, 60_000)));

    assertThrows(BrokerException.class, () -> channel.subscribe(delivery -> { }));
    assertEquals(1, factory.attempts.get());
  }

  @Test
  void closeIsIdempotentAndRejectsNewSubscriptions() {
    channel = newChannel(ReconnectPolicy.of(1, 10, 10));

    channel.close();
    channel.close();

    assertFalse(channel.isOpen());
    assertThrows(BrokerException.class, () -> channel.subscribe(delivery -> { }));
    assertThrows(BrokerException.class, () -> channel.publish(new byte[0]));
    assertEquals(0, factory.attempts.get());
  }

  private RabbitBrokerChannel newChannel(ReconnectPolicy policy) {
    RabbitSettings settings = RabbitSettings.defaults().withReconnect(policy);
    return new RabbitBrokerChannel(settings, factory, sleeps::add);
  }

  private static final class RefusingConnectionFactory extends ConnectionFactory {
    final AtomicInteger attempts = new AtomicInteger();

    @Override
    public Connection newConnection(String clientProvidedName) throws IOException, TimeoutException {
      attempts.incrementAndGet();
      throw new ConnectException("Connection refused");
    }
  }
}
