package mailrelay.resilience;

import mailrelay.spi.CacheStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class ResilientCacheStoreTest {

  private final FlakyCache backend = new FlakyCache();
  private final ResilientCacheStore cache = new ResilientCacheStore(backend);

  @Test
  void passesThroughWhileHealthy() {
    cache.set("k", "v", Duration.ofMinutes(1));

    assertEquals(Optional.of("v"), cache.get("k"));
    assertTrue(cache.ping());
    cache.delete("k");
    assertEquals(Optional.empty(), cache.get("k"));
    assertFalse(cache.isDegraded());
  }

  @Test
  void failuresDegradeToMissesAndNoOps() {
    cache.set("k", "v", Duration.ofMinutes(1));
    backend.down = true;

    assertEquals(Optional.empty(), cache.get("k"));
    assertDoesNotThrow(() -> cache.set("k2", "v2", Duration.ofMinutes(1)));
    assertDoesNotThrow(() -> cache.delete("k"));
    assertFalse(cache.ping());
    assertTrue(cache.isDegraded());
  }

  @Test
  void recoversWhenBackendAnswersAgain() {
    backend.down = true;
    cache.get("k");
    assertTrue(cache.isDegraded());

    backend.down = false;
    cache.set("k", "v", Duration.ofMinutes(1));

    assertFalse(cache.isDegraded());
    assertEquals(Optional.of("v"), cache.get("k"));
  }

  private static final class FlakyCache implements CacheStore {
    final Map<String, String> values = new ConcurrentHashMap<>();
    volatile boolean down;

    @Override
    public Optional<String> get(String key) {
      check();
      return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
      check();
      values.put(key, value);
    }

    @Override
    public void delete(String key) {
      check();
      values.remove(key);
    }

    @Override
    public boolean ping() {
      check();
      return true;
    }

    private void check() {
      if (down) {
        throw new IllegalStateException("connection refused");
      }
    }
  }
}
