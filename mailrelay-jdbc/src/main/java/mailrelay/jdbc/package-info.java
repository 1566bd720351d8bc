/**
 * JDBC support for the email outbox.
 *
 * <p>{@link mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore} holds the shared SQL;
 * {@link mailrelay.jdbc.store.JdbcOutboxEntryStores} picks the dialect from a JDBC URL.
 * {@link mailrelay.jdbc.tx.JdbcTransactionManager} covers applications without a
 * transaction framework. DDL for each database lives under {@code schema/} on the classpath.
 *
 * @see mailrelay.jdbc.store.JdbcOutboxEntryStores
 * @see mailrelay.jdbc.tx.JdbcTransactionManager
 */
package mailrelay.jdbc;
