package mailrelay.notify;

/**
 * A broker payload that does not carry a usable outbox reference. Never retried.
 */
public class MalformedNotificationException extends IllegalArgumentException {

  public MalformedNotificationException(String message) {
    super(message);
  }

  public MalformedNotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
