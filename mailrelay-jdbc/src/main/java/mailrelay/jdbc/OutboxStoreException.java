package mailrelay.jdbc;

/**
 * Unchecked failure of a JDBC outbox store operation; the cause, when present, is the
 * underlying {@link java.sql.SQLException}.
 *
 * <p>The relay treats it like any other infrastructure error and requeues the notification.
 */
public final class OutboxStoreException extends RuntimeException {

  public OutboxStoreException(String message) {
    super(message);
  }

  public OutboxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
