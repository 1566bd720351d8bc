package mailrelay.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One row of the email outbox: an immutable payload snapshot plus its delivery state.
 *
 * <p>{@code recipients}, {@code subject} and {@code body} are captured at enqueue time and
 * never change, so later edits to the originating message do not affect delivery.
 *
 * @see mailrelay.spi.OutboxEntryStore
 */
public record OutboxEntry(
    String id,
    String messageId,
    List<String> recipients,
    String subject,
    String body,
    DeliveryStatus status,
    int retries,
    String lastError,
    Instant createdAt,
    Instant sentAt
) {

  public OutboxEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
  }

  /**
   * Creates a fresh entry in {@link DeliveryStatus#PENDING} with no retries.
   */
  public static OutboxEntry pending(String id, String messageId, List<String> recipients,
      String subject, String body, Instant createdAt) {
    return new OutboxEntry(id, messageId, recipients, subject, body,
        DeliveryStatus.PENDING, 0, null, createdAt, null);
  }

  public boolean isSent() {
    return status == DeliveryStatus.SENT;
  }
}
