package mailrelay.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import mailrelay.micrometer.MicrometerMetricsExporter;
import mailrelay.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code mailrelay.metrics.enabled} is true (default).
 *
 * <p>Runs after the actuator registry setup and before {@link MailRelayAutoConfiguration},
 * so the {@link MetricsExporter} bean is available for injection into the MailRelay composite.
 */
@AutoConfiguration(
    before = MailRelayAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "mailrelay.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailRelayProperties.class)
public class MailRelayMicrometerAutoConfiguration {

  // Closed by MailRelay.
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MailRelayProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
