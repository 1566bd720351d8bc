package mailrelay;

import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import mailrelay.relay.ExponentialBackoffRetryPolicy;
import mailrelay.spi.BrokerException;
import mailrelay.testing.InMemoryBrokerChannel;
import mailrelay.testing.InMemoryOutboxEntryStore;
import mailrelay.testing.RecordingSleeper;
import mailrelay.testing.RecordingTransport;
import mailrelay.testing.StubConnections;
import mailrelay.testing.StubTxContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class MailRelayTest {
  private final InMemoryOutboxEntryStore store = new InMemoryOutboxEntryStore();
  private final InMemoryBrokerChannel broker = new InMemoryBrokerChannel();
  private final RecordingTransport transport = new RecordingTransport();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final StubTxContext tx = new StubTxContext();
  private MailRelay mailRelay;

  @AfterEach
  void tearDown() {
    if (mailRelay != null) {
      mailRelay.close();
    }
    broker.close();
  }

  @Test
  void enqueuedEmailIsDeliveredAfterCommit() throws InterruptedException {
    mailRelay = notifier().txContext(tx).build();

    tx.begin();
    OutboxEntry entry = mailRelay.enqueuer().enqueue("msg-1", List.of("a@x.com"), "Hi", "Body");
    tx.commit();

    assertTrue(waitFor(() -> store.get(entry.id()).status() == DeliveryStatus.SENT));
    assertTrue(waitFor(() -> broker.acked.size() == 1));
    assertEquals(1, transport.sent.size());
    assertEquals("ok", mailRelay.health().check().status());
  }

  @Test
  void exhaustedDeliveryCanBeReplayed() throws InterruptedException {
    transport.failNext(2, TransportException.Kind.CONNECT);
    mailRelay = notifier().txContext(tx).maxAttempts(2).build();

    tx.begin();
    OutboxEntry entry = mailRelay.enqueuer().enqueue("msg-1", List.of("a@x.com"), "Hi", "Body");
    tx.commit();
    assertTrue(waitFor(() -> store.get(entry.id()).status() == DeliveryStatus.FAILED));
    assertEquals(1, mailRelay.failedEntries().count());

    assertTrue(mailRelay.failedEntries().replay(entry.id()));

    assertTrue(waitFor(() -> store.get(entry.id()).status() == DeliveryStatus.SENT));
    assertEquals(1, store.get(entry.id()).retries());
    assertEquals(0, mailRelay.failedEntries().count());
  }

  @Test
  void backfillRepublishesEntriesWhosePublishFailed() throws InterruptedException {
    mailRelay = notifier().txContext(tx)
        .backfill(Duration.ofMillis(20), Duration.ZERO, 10)
        .build();

    broker.down = true;
    tx.begin();
    OutboxEntry entry = mailRelay.enqueuer().enqueue("msg-1", List.of("a@x.com"), "Hi", "Body");
    assertThrows(DispatchUnavailableException.class, tx::commit);
    assertEquals(DeliveryStatus.PENDING, store.get(entry.id()).status());
    broker.down = false;

    assertTrue(waitFor(() -> store.get(entry.id()).status() == DeliveryStatus.SENT));
  }

  @Test
  void closeReleasesEverythingOnce() {
    mailRelay = notifier().build();

    mailRelay.close();
    mailRelay.close();

    assertTrue(transport.closed);
    assertTrue(broker.closed);
    assertFalse(mailRelay.relay().isAccepting());
  }

  @Test
  void awaitShutdownSignalReturnsAfterClose() throws InterruptedException {
    mailRelay = notifier().build();
    Thread waiter = new Thread(() -> {
      try {
        mailRelay.awaitShutdownSignal();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();

    mailRelay.close();
    waiter.join(5_000);

    assertFalse(waiter.isAlive());
  }

  @Test
  void notifierWithoutTxContextCannotEnqueue() {
    mailRelay = notifier().build();

    assertThrows(IllegalStateException.class, mailRelay::enqueuer);
  }

  @Test
  void producerRunsNoRelay() {
    mailRelay = MailRelay.producer()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .brokerChannel(broker)
        .txContext(tx)
        .build();

    assertNull(mailRelay.relay());
    assertNotNull(mailRelay.enqueuer());
    assertEquals(1, broker.connectCalls.get());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> MailRelay.notifier()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .brokerChannel(broker)
        .build());
    assertThrows(NullPointerException.class, () -> MailRelay.producer()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .brokerChannel(broker)
        .build());

    MailRelay.NotifierBuilder builder = notifier();
    mailRelay = builder.build();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void unreachableBrokerFailsBuild() {
    broker.down = true;

    assertThrows(BrokerException.class, () -> notifier().build());
    assertFalse(transport.closed);
  }

  private MailRelay.NotifierBuilder notifier() {
    return MailRelay.notifier()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .brokerChannel(broker)
        .transport(transport)
        .retryPolicy(new ExponentialBackoffRetryPolicy(10, 10))
        .sleeper(sleeper)
        .requeueDelayMs(0);
  }

  private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      Thread.sleep(10);
    }
    return false;
  }
}
