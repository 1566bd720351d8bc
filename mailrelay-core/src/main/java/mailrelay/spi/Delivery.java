package mailrelay.spi;

/**
 * A message received from the {@link BrokerChannel}, settled exactly once by
 * {@link #ack()} or {@link #requeue()}.
 */
public interface Delivery {

    /**
     * Returns the raw message body.
     */
    byte[] body();

    /**
     * Returns {@code true} if the broker has handed this message out before.
     */
    boolean redelivered();

    /**
     * Removes the message from the queue permanently.
     *
     * @throws BrokerException if the acknowledgement cannot reach the broker
     */
    void ack();

    /**
     * Returns the message to the queue for later redelivery.
     *
     * @throws BrokerException if the broker cannot be reached
     */
    void requeue();
}
