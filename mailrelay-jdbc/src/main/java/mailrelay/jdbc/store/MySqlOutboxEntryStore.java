package mailrelay.jdbc.store;

import mailrelay.util.JsonCodec;

import java.util.List;

/**
 * MySQL outbox store. Also handles MariaDB and TiDB URLs.
 *
 * <p>The {@code recipients} column is of type {@code JSON}; MySQL accepts the array text as
 * is and returns it re-serialized, which the reader tolerates.
 */
public final class MySqlOutboxEntryStore extends AbstractJdbcOutboxEntryStore {

  public MySqlOutboxEntryStore() {
    super();
  }

  public MySqlOutboxEntryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxEntryStore withTableName(String tableName) {
    return new MySqlOutboxEntryStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
