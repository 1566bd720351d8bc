/**
 * Redis-backed {@link mailrelay.spi.CacheStore}.
 */
package mailrelay.redis;
