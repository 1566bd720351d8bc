package mailrelay.spi;

/**
 * Raised by a {@link BrokerChannel} when the broker cannot be reached or an operation on
 * it fails at the connection level.
 */
public class BrokerException extends RuntimeException {

  public BrokerException(String message) {
    super(message);
  }

  public BrokerException(String message, Throwable cause) {
    super(message, cause);
  }
}
