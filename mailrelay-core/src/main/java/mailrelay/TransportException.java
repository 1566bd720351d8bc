package mailrelay;

import java.util.Objects;

/**
 * Raised by a {@link mailrelay.spi.MailTransport} when a send attempt fails.
 *
 * <p>The relay absorbs these into its retry loop: once every attempt of a cycle has failed the
 * entry is marked FAILED and the error never crosses the relay boundary.
 */
public class TransportException extends Exception {

  /**
   * Broad cause of a transport failure.
   */
  public enum Kind {
    CONNECT,
    AUTH,
    RECIPIENTS_REFUSED,
    DATA,
    TIMEOUT,
    DISCONNECTED
  }

  private final Kind kind;

  public TransportException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public TransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Text stored as {@code last_error} on the outbox entry.
   */
  public String describe() {
    return kind + ": " + getMessage();
  }
}
