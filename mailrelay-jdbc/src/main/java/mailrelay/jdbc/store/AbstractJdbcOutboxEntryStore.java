package mailrelay.jdbc.store;

import mailrelay.jdbc.JdbcTemplate;
import mailrelay.jdbc.TableNames;
import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import mailrelay.spi.OutboxEntryStore;
import mailrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>State changes are single-row conditional updates guarded by {@code status <> SENT}, so
 * a SENT row is never modified and concurrent relays cannot both record a result for it.
 * Subclasses supply the dialect name, the JDBC URL prefixes they handle and, where needed,
 * the bind expression for the JSON recipients column. Register custom implementations via
 * {@code META-INF/services/mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore}.
 *
 * @see JdbcOutboxEntryStores
 */
public abstract class AbstractJdbcOutboxEntryStore implements OutboxEntryStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final String COLUMNS =
      "id, message_id, recipients, subject, body, status, retries, last_error, created_at, sent_at";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<OutboxEntry> rowMapper;

  protected AbstractJdbcOutboxEntryStore() {
    this(TableNames.DEFAULT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcOutboxEntryStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      Timestamp sentAt = rs.getTimestamp("sent_at");
      return new OutboxEntry(
          rs.getString("id"),
          rs.getString("message_id"),
          this.jsonCodec.readStringArray(rs.getString("recipients")),
          rs.getString("subject"),
          rs.getString("body"),
          DeliveryStatus.fromCode(rs.getInt("status")),
          rs.getInt("retries"),
          rs.getString("last_error"),
          rs.getTimestamp("created_at").toInstant(),
          sentAt == null ? null : sentAt.toInstant());
    };
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcOutboxEntryStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Bind expression for the recipients column. Plain {@code ?} unless the column type
   * needs an explicit cast.
   */
  protected String recipientsParam() {
    return "?";
  }

  @Override
  public void insert(Connection conn, OutboxEntry entry) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,"
        + recipientsParam() + ",?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, "insert outbox entry " + entry.id(), sql,
        entry.id(), entry.messageId(), jsonCodec.writeStringArray(entry.recipients()),
        entry.subject(), entry.body(), entry.status(), entry.retries(),
        truncateError(entry.lastError()), entry.createdAt(), entry.sentAt());
  }

  @Override
  public Optional<OutboxEntry> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, "load outbox entry " + id, sql, rowMapper, id);
  }

  @Override
  public boolean markSent(Connection conn, String id, Instant sentAt) {
    String sql = "UPDATE " + tableName
        + " SET status=" + DeliveryStatus.SENT.code() + ", sent_at=?, last_error=NULL"
        + " WHERE id=? AND status<>" + DeliveryStatus.SENT.code();
    return JdbcTemplate.update(conn, "mark outbox entry " + id + " sent", sql,
        Objects.requireNonNull(sentAt, "sentAt"), id) == 1;
  }

  @Override
  public boolean markFailed(Connection conn, String id, String error) {
    String sql = "UPDATE " + tableName
        + " SET status=" + DeliveryStatus.FAILED.code() + ", retries=retries+1, last_error=?"
        + " WHERE id=? AND status<>" + DeliveryStatus.SENT.code();
    return JdbcTemplate.update(conn, "mark outbox entry " + id + " failed", sql,
        truncateError(error), id) == 1;
  }

  @Override
  public List<OutboxEntry> findStalePending(Connection conn, Instant createdBefore, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE status=" + DeliveryStatus.PENDING.code() + " AND created_at < ?"
        + " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, "scan stale pending entries", sql, rowMapper, createdBefore, limit);
  }

  @Override
  public List<OutboxEntry> findByStatus(Connection conn, DeliveryStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE status=? ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, "list " + status + " entries", sql, rowMapper, status, limit);
  }

  @Override
  public int countByStatus(Connection conn, DeliveryStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE status=?";
    return JdbcTemplate.count(conn, "count " + status + " entries", sql, status);
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
