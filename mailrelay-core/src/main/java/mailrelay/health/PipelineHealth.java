package mailrelay.health;

import mailrelay.spi.BrokerChannel;
import mailrelay.spi.CacheStore;
import mailrelay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes the database, broker and cache. Never throws; a failing probe reports the
 * dependency as down.
 */
public final class PipelineHealth {
  private static final Logger logger = Logger.getLogger(PipelineHealth.class.getName());
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final ConnectionProvider connectionProvider;
  private final BrokerChannel brokerChannel;
  private final CacheStore cache;

  /**
   * @param cache optional; {@code null} when the deployment has no cache
   */
  public PipelineHealth(ConnectionProvider connectionProvider, BrokerChannel brokerChannel,
      CacheStore cache) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.brokerChannel = Objects.requireNonNull(brokerChannel, "brokerChannel");
    this.cache = cache;
  }

  public HealthReport check() {
    return new HealthReport(databaseUp(), brokerUp(), cacheUp());
  }

  private boolean databaseUp() {
    try (Connection conn = connectionProvider.getConnection()) {
      return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Database health probe failed", e);
      return false;
    }
  }

  private boolean brokerUp() {
    try {
      return brokerChannel.isOpen();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Broker health probe failed", e);
      return false;
    }
  }

  private boolean cacheUp() {
    if (cache == null) {
      return true;
    }
    try {
      return cache.ping();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cache health probe failed", e);
      return false;
    }
  }
}
