/**
 * JDBC-based {@link mailrelay.spi.OutboxEntryStore} implementations.
 *
 * <p>{@link mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore} provides the SQL and row
 * mapping; the subclasses differ in dialect name, URL prefixes and how the JSON recipients
 * column is bound.
 *
 * @see mailrelay.jdbc.store.H2OutboxEntryStore
 * @see mailrelay.jdbc.store.MySqlOutboxEntryStore
 * @see mailrelay.jdbc.store.PostgresOutboxEntryStore
 * @see mailrelay.jdbc.store.JdbcOutboxEntryStores
 */
package mailrelay.jdbc.store;
