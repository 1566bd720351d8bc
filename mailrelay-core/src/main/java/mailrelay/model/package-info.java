/**
 * Domain model of the email outbox.
 *
 * @see mailrelay.model.OutboxEntry
 * @see mailrelay.model.DeliveryStatus
 */
package mailrelay.model;
