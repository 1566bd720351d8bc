package mailrelay.spi;

/**
 * Durable queue carrying outbox notifications between the enqueue path and the relay.
 *
 * <p>The channel is bound to one configured queue. Payloads are opaque bytes; every publish
 * is persistent. Unacknowledged deliveries are redelivered by the broker once a consumer
 * attaches again.
 *
 * @see mailrelay.rabbitmq.RabbitBrokerChannel
 */
public interface BrokerChannel extends AutoCloseable {

    /**
     * Connects at startup, retrying a bounded number of times.
     *
     * @throws BrokerException if the broker stays unreachable
     */
    void connect();

    /**
     * Publishes a persistent message to the queue.
     *
     * @param payload message body
     * @throws BrokerException if the message could not be handed to the broker
     */
    void publish(byte[] payload);

    /**
     * Starts consuming. Deliveries are passed to {@code handler} on a broker thread and stay
     * unacknowledged until the handler settles them. If the connection drops, the channel
     * reattaches the handler once the broker is reachable again.
     *
     * @param handler callback for each delivery
     * @return a handle that stops intake when cancelled
     * @throws BrokerException if the consumer cannot be attached
     */
    Subscription subscribe(DeliveryHandler handler);

    /**
     * Returns {@code true} if the underlying connection is currently open.
     */
    boolean isOpen();

    @Override
    void close();

    /**
     * Callback receiving broker deliveries.
     */
    @FunctionalInterface
    interface DeliveryHandler {
        void onDelivery(Delivery delivery);
    }

    /**
     * Handle on an active consumer.
     */
    interface Subscription {
        /**
         * Stops intake of new deliveries. Deliveries already handed out can still be settled.
         */
        void cancel();
    }
}
