/**
 * Query, count and replay of FAILED outbox entries.
 */
package mailrelay.replay;
