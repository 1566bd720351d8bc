package mailrelay.jdbc.store;

import mailrelay.util.JsonCodec;

import java.util.List;

/**
 * H2 outbox store. Primarily for testing.
 */
public final class H2OutboxEntryStore extends AbstractJdbcOutboxEntryStore {

  public H2OutboxEntryStore() {
    super();
  }

  public H2OutboxEntryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxEntryStore withTableName(String tableName) {
    return new H2OutboxEntryStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
