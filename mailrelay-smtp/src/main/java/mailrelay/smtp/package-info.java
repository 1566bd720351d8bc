/**
 * SMTP implementation of {@link mailrelay.spi.MailTransport} on Jakarta Mail.
 */
package mailrelay.smtp;
