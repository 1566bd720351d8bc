package mailrelay.model;

/**
 * Lifecycle of an {@link OutboxEntry}.
 *
 * <p>{@code PENDING} is initial. {@code SENT} is terminal. {@code FAILED} is terminal for one
 * delivery cycle only: a redelivered or replayed notification may still move the entry to
 * {@code SENT}.
 */
public enum DeliveryStatus {
  PENDING(0),
  SENT(1),
  FAILED(2);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
