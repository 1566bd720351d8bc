package mailrelay.spring;

import mailrelay.DispatchUnavailableException;
import mailrelay.EmailEnqueuer;
import mailrelay.jdbc.store.H2OutboxEntryStore;
import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import mailrelay.notify.NotificationCodec;
import mailrelay.notify.NotificationPublisher;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.BrokerException;
import mailrelay.spi.MetricsExporter;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringTxContextTest {
  private JdbcDataSource dataSource;
  private SpringTxContext txContext;
  private DataSourceTransactionManager txManager;
  private RecordingBroker broker;
  private EmailEnqueuer enqueuer;

  @BeforeEach
  void setup() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:mailrelay_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    applySchema();
    txContext = new SpringTxContext(dataSource);
    txManager = new DataSourceTransactionManager(dataSource);
    broker = new RecordingBroker();
    NotificationPublisher publisher = new NotificationPublisher(broker, new NotificationCodec(),
        MetricsExporter.NOOP);
    enqueuer = new EmailEnqueuer(txContext, new H2OutboxEntryStore(), publisher);
  }

  @Test
  void commitPublishesAfterTheRowIsVisible() throws Exception {
    AtomicReference<Integer> statusSeenByPublish = new AtomicReference<>();
    broker.onPublish = payload -> statusSeenByPublish.set(statusOf(idIn(payload)));

    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    OutboxEntry entry;
    try {
      entry = enqueuer.enqueue("msg-1", List.of("a@example.com"), "Hi", "Body");
      assertTrue(broker.published.isEmpty());
      txManager.commit(status);
    } catch (RuntimeException ex) {
      txManager.rollback(status);
      throw ex;
    }

    assertEquals(List.of("{\"outbox_id\":\"" + entry.id() + "\"}"), broker.published);
    assertEquals(DeliveryStatus.PENDING.code(), statusSeenByPublish.get());
  }

  @Test
  void rollbackPersistsNothingAndPublishesNothing() throws Exception {
    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    OutboxEntry entry = enqueuer.enqueue("msg-2", List.of("a@example.com"), "Hi", "Body");
    txManager.rollback(status);

    assertTrue(broker.published.isEmpty());
    assertEquals(-1, statusOf(entry.id()));
  }

  @Test
  void publishFailureSurfacesFromCommitWithEntryStillPending() throws Exception {
    broker.failing = true;
    TransactionTemplate template = new TransactionTemplate(txManager);
    AtomicReference<String> id = new AtomicReference<>();

    DispatchUnavailableException e = assertThrows(DispatchUnavailableException.class,
        () -> template.executeWithoutResult(tx ->
            id.set(enqueuer.enqueue("msg-3", List.of("a@example.com"), "Hi", "Body").id())));

    assertEquals(id.get(), e.outboxId());
    assertEquals(DeliveryStatus.PENDING.code(), statusOf(id.get()));
  }

  @Test
  void laterPublishesRunWhenAnEarlierOneFails() throws Exception {
    broker.failuresLeft.set(1);
    TransactionTemplate template = new TransactionTemplate(txManager);
    List<String> ids = new ArrayList<>();

    DispatchUnavailableException e = assertThrows(DispatchUnavailableException.class,
        () -> template.executeWithoutResult(tx -> {
          ids.add(enqueuer.enqueue("msg-5", List.of("a@example.com"), "One", "Body").id());
          ids.add(enqueuer.enqueue("msg-6", List.of("b@example.com"), "Two", "Body").id());
        }));

    assertEquals(ids.get(0), e.outboxId());
    assertEquals(List.of("{\"outbox_id\":\"" + ids.get(1) + "\"}"), broker.published);
    assertEquals(DeliveryStatus.PENDING.code(), statusOf(ids.get(0)));
  }

  @Test
  void requiresNewTransactionPublishesOnItsOwnCommit() {
    TransactionTemplate outer = new TransactionTemplate(txManager);
    TransactionTemplate inner = new TransactionTemplate(txManager);
    inner.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    AtomicReference<String> outerId = new AtomicReference<>();
    AtomicReference<String> innerId = new AtomicReference<>();

    outer.executeWithoutResult(tx -> {
      outerId.set(enqueuer.enqueue("msg-7", List.of("a@example.com"), "Outer", "Body").id());
      inner.executeWithoutResult(t ->
          innerId.set(enqueuer.enqueue("msg-8", List.of("a@example.com"), "Inner", "Body").id()));
      assertEquals(List.of(idPayload(innerId.get())), broker.published);
    });

    assertEquals(List.of(idPayload(innerId.get()), idPayload(outerId.get())), broker.published);
  }

  @Test
  void afterRollbackRunsOnlyOnRollback() {
    AtomicBoolean rolledBack = new AtomicBoolean();
    TransactionTemplate template = new TransactionTemplate(txManager);

    template.executeWithoutResult(tx -> txContext.afterRollback(() -> rolledBack.set(true)));
    assertFalse(rolledBack.get());

    template.executeWithoutResult(tx -> {
      txContext.afterRollback(() -> rolledBack.set(true));
      tx.setRollbackOnly();
    });
    assertTrue(rolledBack.get());
  }

  @Test
  void usesTheTransactionBoundConnection() {
    TransactionTemplate template = new TransactionTemplate(txManager);

    template.executeWithoutResult(tx -> {
      Connection first = txContext.currentConnection();
      Connection second = txContext.currentConnection();
      assertEquals(first, second);
    });
  }

  @Test
  void outsideTransactionIsRejected() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
    assertThrows(IllegalStateException.class,
        () -> enqueuer.enqueue("msg-4", List.of("a@example.com"), "Hi", "Body"));
  }

  @Test
  void readOnlyTransactionIsNotWritable() {
    TransactionTemplate template = new TransactionTemplate(txManager);
    template.setReadOnly(true);

    template.executeWithoutResult(tx -> assertFalse(txContext.isTransactionActive()));
  }

  private void applySchema() throws SQLException, IOException {
    String script;
    try (InputStream in = getClass().getResourceAsStream("/schema/h2.sql")) {
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    }
  }

  private static String idPayload(String id) {
    return "{\"outbox_id\":\"" + id + "\"}";
  }

  private static String idIn(String payload) {
    return payload.substring("{\"outbox_id\":\"".length(), payload.length() - 2);
  }

  private int statusOf(String id) {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT status FROM email_outbox WHERE id=?")) {
      ps.setString(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getInt(1) : -1;
      }
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private static final class RecordingBroker implements BrokerChannel {
    final List<String> published = new CopyOnWriteArrayList<>();
    volatile boolean failing;
    final AtomicInteger failuresLeft = new AtomicInteger();
    volatile Consumer<String> onPublish = payload -> { };

    @Override
    public void connect() {
    }

    @Override
    public void publish(byte[] payload) {
      if (failing || failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
        throw new BrokerException("broker down");
      }
      String text = new String(payload, StandardCharsets.UTF_8);
      onPublish.accept(text);
      published.add(text);
    }

    @Override
    public Subscription subscribe(DeliveryHandler handler) {
      return () -> { };
    }

    @Override
    public boolean isOpen() {
      return true;
    }

    @Override
    public void close() {
    }
  }
}
