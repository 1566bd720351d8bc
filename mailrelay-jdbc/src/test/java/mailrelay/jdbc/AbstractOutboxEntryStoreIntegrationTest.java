package mailrelay.jdbc;

import mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore;
import mailrelay.model.DeliveryStatus;
import mailrelay.model.OutboxEntry;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store behavior against real databases. Subclasses provide the DataSource and store.
 */
abstract class AbstractOutboxEntryStoreIntegrationTest {

    abstract DataSource dataSource();

    abstract AbstractJdbcOutboxEntryStore store();

    @Test
    void insertAndLoadPreservesRecipientOrder() throws Exception {
        OutboxEntry entry = OutboxEntry.pending(UUID.randomUUID().toString(), "msg-1",
                List.of("z@x.com", "a@x.com", "Ünïcode <u@x.com>"), "Subject é", "Body\nline 2", now());

        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            store().insert(conn, entry);

            OutboxEntry loaded = store().findById(conn, entry.id()).orElseThrow();
            assertEquals(entry.recipients(), loaded.recipients());
            assertEquals(entry.subject(), loaded.subject());
            assertEquals(entry.body(), loaded.body());
            assertEquals(DeliveryStatus.PENDING, loaded.status());
            assertEquals(entry.createdAt(), loaded.createdAt());
            assertNull(loaded.sentAt());
        }
    }

    @Test
    void conditionalUpdatesNeverLeaveSent() throws Exception {
        OutboxEntry entry = OutboxEntry.pending(UUID.randomUUID().toString(), "msg-1",
                List.of("a@x.com"), "s", "b", now());

        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            store().insert(conn, entry);

            assertTrue(store().markFailed(conn, entry.id(), "CONNECT: refused"));
            assertTrue(store().markSent(conn, entry.id(), now()));
            assertFalse(store().markSent(conn, entry.id(), now()));
            assertFalse(store().markFailed(conn, entry.id(), "late"));

            OutboxEntry loaded = store().findById(conn, entry.id()).orElseThrow();
            assertEquals(DeliveryStatus.SENT, loaded.status());
            assertEquals(1, loaded.retries());
            assertNull(loaded.lastError());
        }
    }

    @Test
    void scansAndCounts() throws Exception {
        Instant t0 = now();
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            OutboxEntry old = OutboxEntry.pending(UUID.randomUUID().toString(), "m", List.of("a@x.com"),
                    "s", "b", t0.minusSeconds(3600));
            OutboxEntry fresh = OutboxEntry.pending(UUID.randomUUID().toString(), "m", List.of("a@x.com"),
                    "s", "b", t0);
            store().insert(conn, old);
            store().insert(conn, fresh);

            List<OutboxEntry> stale = store().findStalePending(conn, t0.minusSeconds(600), 10);
            assertEquals(List.of(old.id()), stale.stream().map(OutboxEntry::id).toList());

            store().markFailed(conn, fresh.id(), "x");
            assertEquals(1, store().countByStatus(conn, DeliveryStatus.FAILED));
            assertEquals(fresh.id(), store().findByStatus(conn, DeliveryStatus.FAILED, 5).get(0).id());
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
