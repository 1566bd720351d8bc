/**
 * Spring Boot auto-configuration for the mail relay.
 *
 * <p>Configure with {@code mailrelay.*} properties; see
 * {@link mailrelay.spring.boot.MailRelayProperties}.
 */
package mailrelay.spring.boot;
