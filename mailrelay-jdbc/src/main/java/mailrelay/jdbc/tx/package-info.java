/**
 * Manual JDBC transaction management for applications without a transaction framework.
 *
 * @see mailrelay.jdbc.tx.JdbcTransactionManager
 * @see mailrelay.jdbc.tx.ThreadLocalTxContext
 */
package mailrelay.jdbc.tx;
