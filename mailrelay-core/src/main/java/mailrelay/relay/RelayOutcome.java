package mailrelay.relay;

/**
 * How the relay settled one notification.
 */
public enum RelayOutcome {
  /** Delivered; entry marked SENT; acknowledged. */
  SENT,
  /** All attempts failed; entry marked FAILED; acknowledged. */
  FAILED,
  /** Entry was already SENT; acknowledged without sending. */
  DUPLICATE,
  /** Malformed payload or unknown entry; acknowledged and dropped. */
  DROPPED,
  /** Infrastructure failure or shutdown; returned to the broker unacknowledged. */
  REQUEUED
}
