package mailrelay.spring.boot;

import mailrelay.EmailEnqueuer;
import mailrelay.MailRelay;
import mailrelay.jdbc.DataSourceConnectionProvider;
import mailrelay.jdbc.TableNames;
import mailrelay.jdbc.store.AbstractJdbcOutboxEntryStore;
import mailrelay.jdbc.store.JdbcOutboxEntryStores;
import mailrelay.rabbitmq.RabbitBrokerChannel;
import mailrelay.rabbitmq.RabbitSettings;
import mailrelay.relay.ExponentialBackoffRetryPolicy;
import mailrelay.resilience.ReconnectPolicy;
import mailrelay.smtp.SmtpMailTransport;
import mailrelay.smtp.SmtpSettings;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.CacheStore;
import mailrelay.spi.ConnectionProvider;
import mailrelay.spi.MailTransport;
import mailrelay.spi.MetricsExporter;
import mailrelay.spi.TxContext;
import mailrelay.spring.SpringTxContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the mail relay.
 *
 * <p>Wires a {@link MailRelay} composite from a {@link DataSource} and
 * {@link MailRelayProperties}. In {@code PRODUCER} mode (the default) the application gets an
 * {@link EmailEnqueuer} bound to Spring transactions; {@code NOTIFIER} mode additionally
 * starts the relay with an SMTP transport.
 *
 * <p>The broker channel and mail transport are owned and closed by the {@link MailRelay}.
 *
 * @see MailRelayProperties
 * @see MailRelayMicrometerAutoConfiguration
 * @see MailRelayCacheAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MailRelay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MailRelayProperties.class)
public class MailRelayAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(MailRelayAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcOutboxEntryStore outboxEntryStore(DataSource dataSource, MailRelayProperties props) {
    AbstractJdbcOutboxEntryStore detected = JdbcOutboxEntryStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(BrokerChannel.class)
  public RabbitBrokerChannel brokerChannel(MailRelayProperties props) {
    return new RabbitBrokerChannel(rabbitSettings(props.getBroker()));
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MailTransport.class)
  @ConditionalOnProperty(prefix = "mailrelay", name = "mode", havingValue = "notifier")
  public SmtpMailTransport mailTransport(MailRelayProperties props) {
    return new SmtpMailTransport(smtpSettings(props.getSmtp()));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MailRelay mailRelay(MailRelayProperties props,
                             ConnectionProvider connectionProvider,
                             TxContext txContext,
                             AbstractJdbcOutboxEntryStore outboxStore,
                             BrokerChannel brokerChannel,
                             ObjectProvider<MailTransport> transportProvider,
                             ObjectProvider<CacheStore> cacheProvider,
                             ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    CacheStore cache = cacheProvider.getIfAvailable();

    return switch (props.getMode()) {
      case PRODUCER -> {
        var builder = MailRelay.producer()
            .connectionProvider(connectionProvider)
            .txContext(txContext)
            .outboxStore(outboxStore)
            .brokerChannel(brokerChannel)
            .cache(cache);
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
      case NOTIFIER -> {
        MailTransport transport = transportProvider.getIfAvailable();
        if (transport == null) {
          throw new IllegalStateException("mailrelay.mode=NOTIFIER requires a MailTransport");
        }
        MailRelayProperties.Relay relay = props.getRelay();
        var builder = MailRelay.notifier()
            .connectionProvider(connectionProvider)
            .txContext(txContext)
            .outboxStore(outboxStore)
            .brokerChannel(brokerChannel)
            .cache(cache)
            .transport(transport)
            .maxAttempts(relay.getMaxAttempts())
            .retryPolicy(new ExponentialBackoffRetryPolicy(
                relay.getBaseDelayMs(), relay.getMaxDelayMs()))
            .requeueDelayMs(relay.getRequeueDelayMs())
            .drainTimeoutMs(relay.getDrainTimeoutMs());
        if (metrics != null) {
          builder.metrics(metrics);
        }
        MailRelayProperties.Backfill backfill = props.getBackfill();
        if (backfill.isEnabled()) {
          builder.backfill(backfill.getInterval(), backfill.getStaleAfter(), backfill.getBatchSize());
        }
        log.info("Starting mail relay notifier: queue={}, maxAttempts={}, backfill={}",
            props.getBroker().getQueue(), relay.getMaxAttempts(), backfill.isEnabled());
        yield builder.build();
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public EmailEnqueuer emailEnqueuer(MailRelay mailRelay) {
    return mailRelay.enqueuer();
  }

  static RabbitSettings rabbitSettings(MailRelayProperties.Broker broker) {
    ReconnectPolicy reconnect = ReconnectPolicy.of(broker.getStartupAttempts(),
        broker.getReconnectBaseDelayMs(), broker.getReconnectMaxDelayMs());
    return new RabbitSettings(broker.getUri(), broker.getQueue(), broker.getPrefetch(),
        RabbitSettings.defaults().connectTimeoutMs(), broker.getConfirmTimeoutMs(), reconnect);
  }

  static SmtpSettings smtpSettings(MailRelayProperties.Smtp smtp) {
    return new SmtpSettings(smtp.getHost(), smtp.getPort(), smtp.getUsername(), smtp.getPassword(),
        smtp.getSecurity(), smtp.getFrom(), smtp.getConnectTimeoutMs(), smtp.getReadTimeoutMs(),
        ReconnectPolicy.defaults());
  }
}
