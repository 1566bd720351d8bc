/**
 * Spring transaction integration for the mail relay.
 *
 * <p>{@link mailrelay.spring.SpringTxContext} bridges Spring's transaction synchronization
 * with the {@link mailrelay.spi.TxContext} SPI, so an email enqueued inside a
 * {@code @Transactional} method is published only after that transaction commits.
 *
 * @see mailrelay.spring.SpringTxContext
 */
package mailrelay.spring;
