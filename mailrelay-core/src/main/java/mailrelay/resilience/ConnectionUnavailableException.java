package mailrelay.resilience;

/**
 * A {@link ReconnectingConnection} could not supply an open connection.
 *
 * <p>Adapters translate this into their own failure type (broker or transport).
 */
public class ConnectionUnavailableException extends RuntimeException {

  public ConnectionUnavailableException(String message) {
    super(message);
  }

  public ConnectionUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
