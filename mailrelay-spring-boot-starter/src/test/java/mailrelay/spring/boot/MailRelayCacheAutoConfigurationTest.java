package mailrelay.spring.boot;

import mailrelay.redis.RedisSettings;
import mailrelay.redis.RedissonCacheStore;
import mailrelay.resilience.ResilientCacheStore;
import mailrelay.spi.CacheStore;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class MailRelayCacheAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(MailRelayCacheAutoConfiguration.class));

  @Test
  void disabledByDefault() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("redissonCacheStore"));
      assertFalse(ctx.containsBean("cacheStore"));
    });
  }

  @Test
  void enabledWrapsRedisInResilientStore() {
    runner.withPropertyValues("mailrelay.cache.enabled=true").run(ctx -> {
      assertTrue(ctx.containsBean("redissonCacheStore"));
      assertInstanceOf(ResilientCacheStore.class, ctx.getBean(CacheStore.class));
      assertFalse(ctx.getBean(ResilientCacheStore.class).isDegraded());
    });
  }

  @Test
  void rejectsNonRedisAddress() {
    runner.withPropertyValues("mailrelay.cache.enabled=true", "mailrelay.cache.address=localhost:6379")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void redisSettingsFromProperties() {
    MailRelayProperties props = new MailRelayProperties();
    props.getCache().setAddress("redis://cache:6380");
    props.getCache().setDatabase(3);
    props.getCache().setKeyPrefix("school:");

    RedisSettings settings = MailRelayCacheAutoConfiguration.redisSettings(props.getCache());

    assertEquals("redis://cache:6380", settings.address());
    assertEquals(3, settings.database());
    assertEquals("school:", settings.keyPrefix());
    assertNull(settings.password());
  }
}
