package mailrelay.redis;

import mailrelay.resilience.ReconnectPolicy;

import java.util.Objects;

/**
 * Settings for {@link RedissonCacheStore}.
 *
 * @param address          {@code redis://host:port} or {@code rediss://host:port}
 * @param password         server password, or {@code null}
 * @param database         database index
 * @param keyPrefix        prepended to every key
 * @param connectTimeoutMs socket connect timeout
 * @param timeoutMs        command response timeout
 * @param reconnect        backoff between client rebuilds
 */
public record RedisSettings(
    String address,
    String password,
    int database,
    String keyPrefix,
    int connectTimeoutMs,
    int timeoutMs,
    ReconnectPolicy reconnect
) {

  public RedisSettings {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(keyPrefix, "keyPrefix");
    Objects.requireNonNull(reconnect, "reconnect");
    if (!address.startsWith("redis://") && !address.startsWith("rediss://")) {
      throw new IllegalArgumentException("address must start with redis:// or rediss://, got: " + address);
    }
    if (database < 0) {
      throw new IllegalArgumentException("database must be >= 0, got: " + database);
    }
    if (connectTimeoutMs <= 0 || timeoutMs <= 0) {
      throw new IllegalArgumentException("timeouts must be > 0");
    }
  }

  public static RedisSettings defaults() {
    return new RedisSettings("redis://localhost:6379", null, 0, "mailrelay:", 2_000, 1_000,
        ReconnectPolicy.defaults());
  }

  public RedisSettings withAddress(String address) {
    return new RedisSettings(address, password, database, keyPrefix, connectTimeoutMs, timeoutMs, reconnect);
  }

  public RedisSettings withPassword(String password) {
    return new RedisSettings(address, password, database, keyPrefix, connectTimeoutMs, timeoutMs, reconnect);
  }

  public RedisSettings withKeyPrefix(String keyPrefix) {
    return new RedisSettings(address, password, database, keyPrefix, connectTimeoutMs, timeoutMs, reconnect);
  }

  public RedisSettings withReconnect(ReconnectPolicy reconnect) {
    return new RedisSettings(address, password, database, keyPrefix, connectTimeoutMs, timeoutMs, reconnect);
  }

  @Override
  public String toString() {
    return "RedisSettings[address=" + address + ", database=" + database + ", keyPrefix=" + keyPrefix + "]";
  }
}
