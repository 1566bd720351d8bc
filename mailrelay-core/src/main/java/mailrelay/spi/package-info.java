/**
 * Service Provider Interfaces for plugging the pipeline into its collaborators.
 *
 * <p>Transactions and connections ({@link mailrelay.spi.TxContext},
 * {@link mailrelay.spi.ConnectionProvider}), persistence ({@link mailrelay.spi.OutboxEntryStore}),
 * the queue ({@link mailrelay.spi.BrokerChannel}), the mail transport
 * ({@link mailrelay.spi.MailTransport}), the cache ({@link mailrelay.spi.CacheStore}) and
 * metrics ({@link mailrelay.spi.MetricsExporter}).
 */
package mailrelay.spi;
