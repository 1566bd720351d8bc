package mailrelay.resilience;

import mailrelay.spi.CacheStore;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CacheStore} decorator that never lets a cache failure reach the caller.
 *
 * <p>A failing {@code get} is a miss, a failing {@code set} or {@code delete} is a no-op and a
 * failing {@code ping} is {@code false}. The first failure after a healthy period is logged at
 * WARNING and the following ones at FINE until an operation succeeds again.
 */
public final class ResilientCacheStore implements CacheStore {
  private static final Logger logger = Logger.getLogger(ResilientCacheStore.class.getName());

  private final CacheStore delegate;
  private final AtomicBoolean degraded = new AtomicBoolean(false);

  public ResilientCacheStore(CacheStore delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public Optional<String> get(String key) {
    return guard("get " + key, () -> delegate.get(key), Optional.empty());
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    guard("set " + key, () -> {
      delegate.set(key, value, ttl);
      return null;
    }, null);
  }

  @Override
  public void delete(String key) {
    guard("delete " + key, () -> {
      delegate.delete(key);
      return null;
    }, null);
  }

  @Override
  public boolean ping() {
    return guard("ping", delegate::ping, Boolean.FALSE);
  }

  public boolean isDegraded() {
    return degraded.get();
  }

  private <T> T guard(String operation, Supplier<T> call, T fallback) {
    try {
      T result = call.get();
      if (degraded.compareAndSet(true, false)) {
        logger.info("Cache recovered");
      }
      return result;
    } catch (RuntimeException e) {
      if (degraded.compareAndSet(false, true)) {
        logger.log(Level.WARNING, "Cache unavailable, degrading to misses: " + operation, e);
      } else {
        logger.log(Level.FINE, "Cache still unavailable: " + operation, e);
      }
      return fallback;
    }
  }
}
