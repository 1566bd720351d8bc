package mailrelay.notify;

import java.util.Objects;

/**
 * Broker message announcing that an outbox entry is ready for delivery. Carries only the
 * entry reference; the relay loads everything else from the store.
 */
public record Notification(String outboxId) {

  public Notification {
    Objects.requireNonNull(outboxId, "outboxId");
  }
}
