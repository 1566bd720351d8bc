package mailrelay;

import com.github.f4b6a3.ulid.UlidCreator;
import mailrelay.model.OutboxEntry;
import mailrelay.notify.NotificationPublisher;
import mailrelay.spi.OutboxEntryStore;
import mailrelay.spi.TxContext;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point for scheduling an email within the caller's transaction.
 *
 * <p>{@link #enqueue} requires an active transaction via {@link TxContext}. The entry is
 * inserted on the transaction's connection, so it commits or rolls back together with the
 * caller's other changes. After commit the notification is published exactly once; if that
 * fails, the commit call throws {@link DispatchUnavailableException} while the entry stays
 * committed as PENDING. Nothing is published on rollback.
 *
 * <p>Repeated calls for the same {@code messageId} create independent entries.
 *
 * @see NotificationPublisher
 * @see mailrelay.spi.TxContext
 */
public final class EmailEnqueuer {
    private static final Logger logger = Logger.getLogger(EmailEnqueuer.class.getName());

    private final TxContext txContext;
    private final OutboxEntryStore outboxStore;
    private final NotificationPublisher publisher;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public EmailEnqueuer(TxContext txContext, OutboxEntryStore outboxStore,
            NotificationPublisher publisher) {
        this(txContext, outboxStore, publisher, Clock.systemUTC(),
                () -> UlidCreator.getMonotonicUlid().toUuid().toString());
    }

    /**
     * @param clock       source of {@code created_at}
     * @param idGenerator source of entry ids; defaults produce time-ordered UUIDs
     */
    public EmailEnqueuer(
            TxContext txContext,
            OutboxEntryStore outboxStore,
            NotificationPublisher publisher,
            Clock clock,
            Supplier<String> idGenerator
    ) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Records a PENDING outbox entry in the current transaction and schedules its
     * notification for after commit.
     *
     * @param messageId  originating message, for audit only
     * @param recipients non-empty list of addresses; copied
     * @param subject    subject snapshot
     * @param body       body snapshot
     * @return the persisted entry
     * @throws IllegalStateException    if no transaction is active
     * @throws IllegalArgumentException if {@code messageId} is blank, or {@code recipients}
     *                                  is empty or contains a blank address
     */
    public OutboxEntry enqueue(String messageId, List<String> recipients, String subject, String body) {
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(recipients, "recipients");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(body, "body");
        if (messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("recipients must not be empty");
        }
        for (String recipient : recipients) {
            if (recipient == null || recipient.isBlank()) {
                throw new IllegalArgumentException("recipients must not contain blank addresses");
            }
        }

        OutboxEntry entry = OutboxEntry.pending(idGenerator.get(), messageId,
                List.copyOf(recipients), subject, body, clock.instant());
        outboxStore.insert(txContext.currentConnection(), entry);

        String id = entry.id();
        txContext.afterCommit(() -> publisher.publish(id));
        txContext.afterRollback(() -> logger.fine("Transaction rolled back; outbox entry " + id + " discarded"));
        return entry;
    }
}
