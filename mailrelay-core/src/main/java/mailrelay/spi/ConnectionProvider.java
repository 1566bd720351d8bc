package mailrelay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work outside the caller's transaction
 * (relay status updates, backfill scans, replay queries).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see mailrelay.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
