package mailrelay.replay;

import mailrelay.DispatchUnavailableException;
import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import mailrelay.notify.NotificationPublisher;
import mailrelay.spi.ConnectionProvider;
import mailrelay.spi.OutboxEntryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for entries whose last delivery cycle failed.
 *
 * <p>Replaying republishes the notification; the entry keeps FAILED until a later attempt
 * succeeds, and another exhausted cycle adds one more to {@code retries}. Store and broker
 * errors are logged and reported as an empty, zero or {@code false} result.
 */
public final class FailedEntryManager {
  private static final Logger logger = Logger.getLogger(FailedEntryManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxEntryStore outboxStore;
  private final NotificationPublisher publisher;

  public FailedEntryManager(ConnectionProvider connectionProvider, OutboxEntryStore outboxStore,
      NotificationPublisher publisher) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
  }

  /**
   * Returns FAILED entries, oldest first.
   */
  public List<OutboxEntry> query(int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.findByStatus(conn, DeliveryStatus.FAILED, limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query failed outbox entries", e);
      return List.of();
    }
  }

  public int count() {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.countByStatus(conn, DeliveryStatus.FAILED);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to count failed outbox entries", e);
      return 0;
    }
  }

  /**
   * Republishes the notification of one FAILED entry.
   *
   * @return {@code true} if published; {@code false} if the entry is missing, not FAILED, or
   *     the broker is unavailable
   */
  public boolean replay(String outboxId) {
    Optional<OutboxEntry> entry;
    try (Connection conn = connectionProvider.getConnection()) {
      entry = outboxStore.findById(conn, outboxId);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load outbox entry for replay: " + outboxId, e);
      return false;
    }
    if (entry.isEmpty() || entry.get().status() != DeliveryStatus.FAILED) {
      return false;
    }
    return publish(outboxId);
  }

  /**
   * Republishes up to {@code limit} FAILED entries, oldest first.
   *
   * @return number of notifications published
   */
  public int replayAll(int limit) {
    int replayed = 0;
    for (OutboxEntry entry : query(limit)) {
      if (!publish(entry.id())) {
        break;
      }
      replayed++;
    }
    return replayed;
  }

  private boolean publish(String outboxId) {
    try {
      publisher.publish(outboxId);
      logger.info("Replayed failed outbox entry " + outboxId);
      return true;
    } catch (DispatchUnavailableException e) {
      logger.log(Level.SEVERE, "Failed to replay outbox entry " + outboxId, e);
      return false;
    }
  }
}
