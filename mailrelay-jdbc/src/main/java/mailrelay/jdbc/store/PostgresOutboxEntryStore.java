package mailrelay.jdbc.store;

import mailrelay.util.JsonCodec;

import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>{@code recipients} is a {@code jsonb} column, so the bound text is cast explicitly;
 * the driver would otherwise send it as {@code varchar} and the insert would fail.
 */
public final class PostgresOutboxEntryStore extends AbstractJdbcOutboxEntryStore {

  public PostgresOutboxEntryStore() {
    super();
  }

  public PostgresOutboxEntryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxEntryStore withTableName(String tableName) {
    return new PostgresOutboxEntryStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String recipientsParam() {
    return "CAST(? AS jsonb)";
  }
}
