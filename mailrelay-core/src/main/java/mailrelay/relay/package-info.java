/**
 * The relay: consumes notifications, runs the bounded delivery loop and records SENT or
 * FAILED.
 *
 * <p>Transport failures stay inside one delivery cycle and end in FAILED. Failures of the
 * relay's own dependencies leave the notification unacknowledged so the broker redelivers it.
 *
 * @see mailrelay.relay.RelayConsumer
 * @see mailrelay.relay.DeliveryLoop
 */
package mailrelay.relay;
