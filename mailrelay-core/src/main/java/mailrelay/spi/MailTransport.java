package mailrelay.spi;

import mailrelay.TransportException;

import java.util.List;

/**
 * Outbound mail transport used by the relay.
 *
 * @see mailrelay.smtp.SmtpMailTransport
 */
public interface MailTransport extends AutoCloseable {

    /**
     * Sends one message to all recipients.
     *
     * @param recipients destination addresses, in order
     * @param subject    subject line
     * @param body       plain-text body
     * @throws TransportException if the transport rejects or cannot deliver the message
     */
    void send(List<String> recipients, String subject, String body) throws TransportException;

    /**
     * Releases any session held by the transport. Default does nothing.
     */
    @Override
    default void close() {
    }
}
