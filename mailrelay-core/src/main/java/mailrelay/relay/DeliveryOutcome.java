package mailrelay.relay;

import mailrelay.TransportException;

/**
 * Result of one delivery cycle: delivered on some attempt, or every attempt failed.
 *
 * @param delivered {@code true} if an attempt succeeded
 * @param attempts  number of attempts made
 * @param lastError failure of the final attempt; {@code null} when delivered
 */
public record DeliveryOutcome(boolean delivered, int attempts, TransportException lastError) {

  static DeliveryOutcome delivered(int attempts) {
    return new DeliveryOutcome(true, attempts, null);
  }

  static DeliveryOutcome exhausted(int attempts, TransportException lastError) {
    return new DeliveryOutcome(false, attempts, lastError);
  }
}
