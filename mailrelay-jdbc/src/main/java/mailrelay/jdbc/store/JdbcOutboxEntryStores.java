package mailrelay.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC outbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcOutboxEntryStore store = JdbcOutboxEntryStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcOutboxEntryStore store =
 *     JdbcOutboxEntryStores.detect("jdbc:postgresql://db/app").withTableName("mail_outbox");
 *
 * // Get by name
 * AbstractJdbcOutboxEntryStore store = JdbcOutboxEntryStores.get("mysql");
 * }</pre>
 */
public final class JdbcOutboxEntryStores {

  private static final List<AbstractJdbcOutboxEntryStore> STORES;
  private static final Map<String, AbstractJdbcOutboxEntryStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcOutboxEntryStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcOutboxEntryStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcOutboxEntryStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcOutboxEntryStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcOutboxEntryStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcOutboxEntryStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown outbox store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcOutboxEntryStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect outbox store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcOutboxEntryStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcOutboxEntryStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No outbox store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
