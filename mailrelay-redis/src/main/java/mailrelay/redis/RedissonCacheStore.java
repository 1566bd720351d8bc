package mailrelay.redis;

import mailrelay.resilience.ReconnectingConnection;
import mailrelay.spi.CacheStore;
import mailrelay.util.Sleeper;
import org.redisson.Redisson;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CacheStore} on a single Redis server through Redisson, with string values.
 *
 * <p>The client is built lazily. If Redis is unreachable, calls fail fast until the reconnect
 * backoff window has passed. Failures propagate as unchecked exceptions; wrap the store in
 * {@link mailrelay.resilience.ResilientCacheStore} to degrade them to misses.
 */
public final class RedissonCacheStore implements CacheStore, AutoCloseable {
  private final RedisSettings settings;
  private final ReconnectingConnection<RedissonClient> client;

  public RedissonCacheStore(RedisSettings settings) {
    this(settings, Sleeper.SYSTEM);
  }

  RedissonCacheStore(RedisSettings settings, Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.client = ReconnectingConnection.<RedissonClient>builder("Redis", () -> Redisson.create(config(settings)))
        .openCheck(c -> !c.isShutdown() && !c.isShuttingDown())
        .closer(RedissonClient::shutdown)
        .policy(settings.reconnect())
        .sleeper(sleeper)
        .build();
  }

  static Config config(RedisSettings settings) {
    Config config = new Config();
    config.useSingleServer()
        .setAddress(settings.address())
        .setPassword(settings.password())
        .setDatabase(settings.database())
        .setConnectTimeout(settings.connectTimeoutMs())
        .setTimeout(settings.timeoutMs())
        .setRetryAttempts(1)
        .setRetryInterval(200)
        .setConnectionPoolSize(8)
        .setConnectionMinimumIdleSize(1);
    return config;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(bucket(key).get());
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    Objects.requireNonNull(value, "value");
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      bucket(key).set(value);
    } else {
      bucket(key).set(value, ttl);
    }
  }

  @Override
  public void delete(String key) {
    bucket(key).delete();
  }

  @Override
  public boolean ping() {
    return client.ensureConnected().getRedisNodes(RedisNodes.SINGLE).pingAll();
  }

  private RBucket<String> bucket(String key) {
    Objects.requireNonNull(key, "key");
    return client.ensureConnected().getBucket(settings.keyPrefix() + key, StringCodec.INSTANCE);
  }

  @Override
  public void close() {
    client.close();
  }
}
