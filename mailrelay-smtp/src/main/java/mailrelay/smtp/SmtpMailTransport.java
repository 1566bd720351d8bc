package mailrelay.smtp;

import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import mailrelay.TransportException;
import mailrelay.TransportException.Kind;
import mailrelay.resilience.ConnectionUnavailableException;
import mailrelay.resilience.ReconnectingConnection;
import mailrelay.spi.MailTransport;
import mailrelay.util.Sleeper;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * {@link MailTransport} that keeps one authenticated SMTP session open and reuses it.
 *
 * <p>The session is opened lazily on the first send. A failure that leaves the session in an
 * unknown state discards it and the next send opens a new one right away; a failed connect
 * surfaces as {@link Kind#CONNECT}. A refused recipient or rejected message keeps the session.
 *
 * <p>Sends are serialized on the single session.
 */
public final class SmtpMailTransport implements MailTransport {
  private static final Logger logger = Logger.getLogger(SmtpMailTransport.class.getName());

  private final SmtpSettings settings;
  private final Session session;
  private final InternetAddress sender;
  private final ReconnectingConnection<Transport> connection;

  public SmtpMailTransport(SmtpSettings settings) {
    this(settings, Sleeper.SYSTEM);
  }

  SmtpMailTransport(SmtpSettings settings, Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.session = Session.getInstance(sessionProperties(settings));
    try {
      this.sender = new InternetAddress(settings.from(), true);
    } catch (AddressException e) {
      throw new IllegalArgumentException("Invalid sender address: " + settings.from(), e);
    }
    this.connection = ReconnectingConnection.<Transport>builder("SMTP " + settings.host(), this::openTransport)
        .openCheck(Transport::isConnected)
        .closer(Transport::close)
        .policy(settings.reconnect())
        .sleeper(sleeper)
        .build();
  }

  static Properties sessionProperties(SmtpSettings settings) {
    Properties props = new Properties();
    props.put("mail.smtp.host", settings.host());
    props.put("mail.smtp.port", String.valueOf(settings.port()));
    props.put("mail.smtp.auth", String.valueOf(settings.authenticated()));
    props.put("mail.smtp.connectiontimeout", String.valueOf(settings.connectTimeoutMs()));
    props.put("mail.smtp.timeout", String.valueOf(settings.readTimeoutMs()));
    props.put("mail.smtp.writetimeout", String.valueOf(settings.readTimeoutMs()));
    switch (settings.security()) {
      case STARTTLS:
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "true");
        break;
      case TLS:
        props.put("mail.smtp.ssl.enable", "true");
        break;
      default:
        break;
    }
    return props;
  }

  private Transport openTransport() throws MessagingException {
    Transport transport = session.getTransport("smtp");
    if (settings.authenticated()) {
      transport.connect(settings.host(), settings.port(), settings.username(), settings.password());
    } else {
      transport.connect(settings.host(), settings.port(), null, null);
    }
    logger.info("SMTP session opened to " + settings.host() + ":" + settings.port());
    return transport;
  }

  @Override
  public synchronized void send(List<String> recipients, String subject, String body)
      throws TransportException {
    MimeMessage message;
    try {
      message = buildMessage(recipients, subject, body);
    } catch (AddressException e) {
      throw new TransportException(Kind.RECIPIENTS_REFUSED, e.getMessage(), e);
    } catch (MessagingException e) {
      throw new TransportException(Kind.DATA, e.getMessage(), e);
    }

    Transport transport;
    try {
      // The delivery loop backs off between attempts, so every attempt really connects.
      transport = connection.connectNow();
    } catch (ConnectionUnavailableException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new TransportException(classifyConnect(cause), describe(e, cause), e);
    }

    try {
      transport.sendMessage(message, message.getAllRecipients());
    } catch (SendFailedException e) {
      Address[] invalid = e.getInvalidAddresses();
      if (invalid != null && invalid.length > 0) {
        throw new TransportException(Kind.RECIPIENTS_REFUSED, e.getMessage(), e);
      }
      throw new TransportException(Kind.DATA, e.getMessage(), e);
    } catch (MessagingException e) {
      connection.discard();
      throw new TransportException(classifySend(e), e.getMessage(), e);
    }
  }

  MimeMessage buildMessage(List<String> recipients, String subject, String body)
      throws MessagingException {
    InternetAddress[] to = new InternetAddress[recipients.size()];
    for (int i = 0; i < to.length; i++) {
      to[i] = new InternetAddress(recipients.get(i), true);
    }
    MimeMessage message = new MimeMessage(session);
    message.setFrom(sender);
    message.setRecipients(Message.RecipientType.TO, to);
    message.setSubject(subject, StandardCharsets.UTF_8.name());
    message.setText(body, StandardCharsets.UTF_8.name());
    message.setSentDate(new Date());
    return message;
  }

  static Kind classifyConnect(Throwable error) {
    if (hasCause(error, AuthenticationFailedException.class)) {
      return Kind.AUTH;
    }
    if (hasCause(error, SocketTimeoutException.class)) {
      return Kind.TIMEOUT;
    }
    return Kind.CONNECT;
  }

  static Kind classifySend(Throwable error) {
    if (hasCause(error, SocketTimeoutException.class)) {
      return Kind.TIMEOUT;
    }
    if (hasCause(error, IOException.class)) {
      return Kind.DISCONNECTED;
    }
    return Kind.DATA;
  }

  private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
    for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
      if (type.isInstance(t)) {
        return true;
      }
    }
    return false;
  }

  private static String describe(ConnectionUnavailableException e, Throwable cause) {
    return cause == e || cause.getMessage() == null ? e.getMessage() : cause.getMessage();
  }

  public boolean isConnected() {
    return connection.isConnected();
  }

  @Override
  public void close() {
    connection.close();
  }
}
