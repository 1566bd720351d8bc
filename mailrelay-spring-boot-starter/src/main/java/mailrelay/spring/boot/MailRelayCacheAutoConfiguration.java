package mailrelay.spring.boot;

import mailrelay.redis.RedisSettings;
import mailrelay.redis.RedissonCacheStore;
import mailrelay.resilience.ReconnectPolicy;
import mailrelay.resilience.ResilientCacheStore;
import mailrelay.spi.CacheStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Auto-configuration for the Redis cache.
 *
 * <p>Enabled with {@code mailrelay.cache.enabled=true}. Exposes the raw
 * {@link RedissonCacheStore} and, as the primary {@link CacheStore}, a
 * {@link ResilientCacheStore} around it so Redis outages degrade to cache misses.
 */
@AutoConfiguration(before = MailRelayAutoConfiguration.class)
@ConditionalOnClass(RedissonCacheStore.class)
@ConditionalOnProperty(prefix = "mailrelay.cache", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(MailRelayProperties.class)
public class MailRelayCacheAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public RedissonCacheStore redissonCacheStore(MailRelayProperties props) {
    return new RedissonCacheStore(redisSettings(props.getCache()));
  }

  @Bean
  @Primary
  @ConditionalOnMissingBean(ResilientCacheStore.class)
  public ResilientCacheStore cacheStore(RedissonCacheStore redissonCacheStore) {
    return new ResilientCacheStore(redissonCacheStore);
  }

  static RedisSettings redisSettings(MailRelayProperties.Cache cache) {
    RedisSettings defaults = RedisSettings.defaults();
    return new RedisSettings(cache.getAddress(), cache.getPassword(), cache.getDatabase(),
        cache.getKeyPrefix(), defaults.connectTimeoutMs(), defaults.timeoutMs(), ReconnectPolicy.defaults());
  }
}
