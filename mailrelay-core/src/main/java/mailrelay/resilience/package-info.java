/**
 * Reconnect-with-backoff for broker and transport connections, and graceful degradation of
 * the cache.
 */
package mailrelay.resilience;
