package mailrelay.spi;

import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for outbox entries: PENDING → SENT, PENDING → FAILED, FAILED → SENT.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Status updates are single-row conditional updates that never
 * touch a row already in {@link DeliveryStatus#SENT}. Implementations live in the
 * {@code mailrelay-jdbc} module.
 *
 * @see mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore
 */
public interface OutboxEntryStore {

    /**
     * Inserts a new entry. The entry is expected to be {@link DeliveryStatus#PENDING}.
     *
     * @param conn  the JDBC connection (typically within the caller's transaction)
     * @param entry the entry to persist
     */
    void insert(Connection conn, OutboxEntry entry);

    /**
     * Loads an entry by id.
     *
     * @param conn the JDBC connection
     * @param id   the entry id
     * @return the entry, or empty if no row has this id
     */
    Optional<OutboxEntry> findById(Connection conn, String id);

    /**
     * Transitions an entry to SENT, records {@code sentAt} and clears {@code last_error}.
     *
     * @param conn   the JDBC connection
     * @param id     the entry id
     * @param sentAt delivery timestamp
     * @return {@code true} if the row changed; {@code false} if it is missing or already SENT
     */
    boolean markSent(Connection conn, String id, Instant sentAt);

    /**
     * Transitions an entry to FAILED, increments {@code retries} by one and records the error.
     *
     * @param conn  the JDBC connection
     * @param id    the entry id
     * @param error diagnostic of the last failed attempt
     * @return {@code true} if the row changed; {@code false} if it is missing or already SENT
     */
    boolean markFailed(Connection conn, String id, String error);

    /**
     * Returns PENDING entries created before {@code createdBefore}, oldest first.
     *
     * @param conn          the JDBC connection
     * @param createdBefore exclusive upper bound on {@code created_at}
     * @param limit         maximum number of entries to return
     */
    List<OutboxEntry> findStalePending(Connection conn, Instant createdBefore, int limit);

    /**
     * Returns entries in the given status, oldest first.
     *
     * @param conn   the JDBC connection
     * @param status status filter
     * @param limit  maximum number of entries to return
     */
    List<OutboxEntry> findByStatus(Connection conn, DeliveryStatus status, int limit);

    /**
     * Counts entries in the given status.
     */
    int countByStatus(Connection conn, DeliveryStatus status);
}
