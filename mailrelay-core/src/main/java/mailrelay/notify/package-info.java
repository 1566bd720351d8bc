/**
 * Broker notifications: the {@code {"outbox_id": ...}} payload, its codec and the publisher
 * shared by the enqueue path, the backfill scan and replay.
 */
package mailrelay.notify;
