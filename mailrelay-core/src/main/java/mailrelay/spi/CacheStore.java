package mailrelay.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache for non-authoritative data.
 *
 * <p>Raw implementations may throw on connection failure; wrap them in
 * {@link mailrelay.resilience.ResilientCacheStore} so callers only ever see a miss or a no-op.
 *
 * @see mailrelay.redis.RedissonCacheStore
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Returns {@code true} if the cache backend answers.
     */
    boolean ping();
}
