package mailrelay.replay;

import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import mailrelay.notify.NotificationCodec;
import mailrelay.notify.NotificationPublisher;
import mailrelay.testing.InMemoryBrokerChannel;
import mailrelay.testing.InMemoryOutboxEntryStore;
import mailrelay.testing.StubConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FailedEntryManagerTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final InMemoryOutboxEntryStore store = new InMemoryOutboxEntryStore();
  private final InMemoryBrokerChannel broker = new InMemoryBrokerChannel();
  private final NotificationCodec codec = new NotificationCodec();
  private final FailedEntryManager manager = new FailedEntryManager(StubConnections.provider(), store,
      new NotificationPublisher(broker, codec, null));

  @AfterEach
  void tearDown() {
    broker.close();
  }

  @Test
  void queryAndCountSeeOnlyFailedEntries() {
    OutboxEntry older = put(T0, DeliveryStatus.FAILED);
    OutboxEntry newer = put(T0.plusSeconds(60), DeliveryStatus.FAILED);
    put(T0, DeliveryStatus.PENDING);
    put(T0, DeliveryStatus.SENT);

    assertEquals(List.of(older.id(), newer.id()), manager.query(10).stream().map(OutboxEntry::id).toList());
    assertEquals(List.of(older.id()), manager.query(1).stream().map(OutboxEntry::id).toList());
    assertEquals(2, manager.count());
  }

  @Test
  void replayRepublishesWithoutChangingStatus() {
    OutboxEntry failed = put(T0, DeliveryStatus.FAILED);

    assertTrue(manager.replay(failed.id()));

    assertEquals(1, broker.published.size());
    assertEquals(failed.id(), codec.decode(broker.published.get(0)).outboxId());
    assertEquals(DeliveryStatus.FAILED, store.get(failed.id()).status());
  }

  @Test
  void replayIgnoresEntriesThatAreNotFailed() {
    OutboxEntry sent = put(T0, DeliveryStatus.SENT);
    OutboxEntry pending = put(T0, DeliveryStatus.PENDING);

    assertFalse(manager.replay(sent.id()));
    assertFalse(manager.replay(pending.id()));
    assertFalse(manager.replay(UUID.randomUUID().toString()));
    assertTrue(broker.published.isEmpty());
  }

  @Test
  void replayAllStopsWhenBrokerIsDown() {
    put(T0, DeliveryStatus.FAILED);
    put(T0.plusSeconds(1), DeliveryStatus.FAILED);
    put(T0.plusSeconds(2), DeliveryStatus.FAILED);

    assertEquals(2, manager.replayAll(2));
    assertEquals(2, broker.published.size());

    broker.down = true;
    assertEquals(0, manager.replayAll(10));
    assertFalse(manager.replay(manager.query(1).get(0).id()));
  }

  @Test
  void storeFailuresReportEmptyResults() {
    put(T0, DeliveryStatus.FAILED);
    store.failuresToInject.set(3);

    assertEquals(List.of(), manager.query(10));
    assertEquals(0, manager.count());
    assertFalse(manager.replay(UUID.randomUUID().toString()));
    assertEquals(1, manager.count());
  }

  private OutboxEntry put(Instant createdAt, DeliveryStatus status) {
    OutboxEntry entry = new OutboxEntry(UUID.randomUUID().toString(), "msg-1", List.of("a@x.com"),
        "Hi", "Body", status, status == DeliveryStatus.FAILED ? 1 : 0,
        status == DeliveryStatus.FAILED ? "CONNECT: refused" : null, createdAt,
        status == DeliveryStatus.SENT ? createdAt : null);
    store.put(entry);
    return entry;
  }
}
