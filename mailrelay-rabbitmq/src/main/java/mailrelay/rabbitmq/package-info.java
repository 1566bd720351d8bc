/**
 * RabbitMQ implementation of {@link mailrelay.spi.BrokerChannel}.
 *
 * <p>Uses the AMQP client with its own automatic recovery turned off; reconnection is driven by
 * {@link mailrelay.resilience.ReconnectingConnection} so publishers fail fast while the broker
 * is down and consumers reattach once it returns.
 */
package mailrelay.rabbitmq;
