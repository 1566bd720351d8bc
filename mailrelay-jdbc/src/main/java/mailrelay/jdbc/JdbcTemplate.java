package mailrelay.jdbc;

import mailrelay.model.DeliveryStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement helper for the outbox stores.
 *
 * <p>Every call names the operation it performs; a {@link SQLException} surfaces as an
 * {@link OutboxStoreException} whose message starts with that name. {@link Instant} binds
 * as a timestamp and {@link DeliveryStatus} as its numeric code.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  private interface StatementCallback<T> {
    T apply(PreparedStatement ps) throws SQLException;
  }

  /** Runs an INSERT or UPDATE and returns the affected row count. */
  public static int update(Connection conn, String operation, String sql, Object... params) {
    return execute(conn, operation, sql, params, PreparedStatement::executeUpdate);
  }

  public static <T> List<T> query(Connection conn, String operation, String sql,
      RowMapper<T> mapper, Object... params) {
    return execute(conn, operation, sql, params, ps -> {
      List<T> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(mapper.map(rs));
        }
      }
      return rows;
    });
  }

  /**
   * Looks up at most one row, as for a primary key.
   *
   * @throws OutboxStoreException if the statement yields more than one row
   */
  public static <T> Optional<T> queryOne(Connection conn, String operation, String sql,
      RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, operation, sql, mapper, params);
    if (rows.size() > 1) {
      throw new OutboxStoreException(operation + ": expected at most one row, got " + rows.size());
    }
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Runs a {@code COUNT(*)} style statement. */
  public static int count(Connection conn, String operation, String sql, Object... params) {
    return queryOne(conn, operation, sql, rs -> rs.getInt(1), params)
        .orElseThrow(() -> new OutboxStoreException(operation + ": count returned no row"));
  }

  private static <T> T execute(Connection conn, String operation, String sql, Object[] params,
      StatementCallback<T> callback) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return callback.apply(ps);
    } catch (SQLException e) {
      throw new OutboxStoreException(operation + " failed (SQLState " + e.getSQLState() + ")", e);
    }
  }

  private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (value instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (value instanceof DeliveryStatus status) {
      ps.setInt(index, status.code());
    } else if (value instanceof String s) {
      ps.setString(index, s);
    } else if (value instanceof Integer n) {
      ps.setInt(index, n);
    } else {
      ps.setObject(index, value);
    }
  }

  private JdbcTemplate() {}
}
