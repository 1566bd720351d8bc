package mailrelay;

/**
 * The outbox entry was committed but its notification could not be published.
 *
 * <p>The entry stays PENDING and is not rolled back; callers should treat the originating
 * operation as accepted but delayed.
 */
public class DispatchUnavailableException extends RuntimeException {
  private final String outboxId;

  public DispatchUnavailableException(String outboxId, Throwable cause) {
    super("Notification for outbox entry " + outboxId + " could not be published", cause);
    this.outboxId = outboxId;
  }

  public String outboxId() {
    return outboxId;
  }
}
