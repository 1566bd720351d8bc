package mailrelay.smtp;

import mailrelay.resilience.ReconnectPolicy;

import java.util.Objects;

/**
 * Settings for {@link SmtpMailTransport}.
 *
 * @param host             SMTP server host
 * @param port             SMTP server port
 * @param username         login user, or {@code null} to skip authentication
 * @param password         login password
 * @param security         transport security
 * @param from             sender address placed in {@code From}
 * @param connectTimeoutMs socket connect timeout
 * @param readTimeoutMs    socket read and write timeout
 * @param reconnect        backoff between session reconnects
 */
public record SmtpSettings(
    String host,
    int port,
    String username,
    String password,
    Security security,
    String from,
    int connectTimeoutMs,
    int readTimeoutMs,
    ReconnectPolicy reconnect
) {

  public static final String DEFAULT_FROM = "noreply@edutrack.local";

  /**
   * How the session is protected.
   */
  public enum Security {
    /** Plain SMTP. */
    NONE,
    /** Upgrade with STARTTLS; refuse to continue without it. */
    STARTTLS,
    /** Implicit TLS from the first byte (SMTPS). */
    TLS
  }

  public SmtpSettings {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(security, "security");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(reconnect, "reconnect");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (connectTimeoutMs < 0 || readTimeoutMs < 0) {
      throw new IllegalArgumentException("timeouts must be >= 0");
    }
  }

  public static SmtpSettings defaults() {
    return new SmtpSettings("localhost", 587, null, null, Security.STARTTLS, DEFAULT_FROM,
        10_000, 30_000, ReconnectPolicy.defaults());
  }

  public boolean authenticated() {
    return username != null && !username.isEmpty();
  }

  public SmtpSettings withServer(String host, int port) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  public SmtpSettings withCredentials(String username, String password) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  public SmtpSettings withSecurity(Security security) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  public SmtpSettings withFrom(String from) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  public SmtpSettings withTimeouts(int connectTimeoutMs, int readTimeoutMs) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  public SmtpSettings withReconnect(ReconnectPolicy reconnect) {
    return new SmtpSettings(host, port, username, password, security, from,
        connectTimeoutMs, readTimeoutMs, reconnect);
  }

  @Override
  public String toString() {
    return "SmtpSettings[host=" + host + ", port=" + port + ", username=" + username
        + ", security=" + security + ", from=" + from + "]";
  }
}
