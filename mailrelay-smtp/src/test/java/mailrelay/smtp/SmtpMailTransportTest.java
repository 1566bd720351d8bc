package mailrelay.smtp;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import mailrelay.TransportException;
import mailrelay.TransportException.Kind;
import mailrelay.relay.ExponentialBackoffRetryPolicy;
import mailrelay.resilience.ReconnectPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmtpMailTransportTest {
  private static final ReconnectPolicy SLOW_RECONNECT =
      new ReconnectPolicy(1, new ExponentialBackoffRetryPolicy(60_000, 60_000));

  private FakeSmtpServer server;
  private SmtpMailTransport transport;

  @BeforeEach
  void setUp() throws Exception {
    server = new FakeSmtpServer();
    transport = new SmtpMailTransport(plainSettings(server.port()), millis -> { });
  }

  @AfterEach
  void tearDown() throws Exception {
    transport.close();
    server.close();
  }

  @Test
  void sendsMessagesOverOneReusedSession() throws Exception {
    transport.send(List.of("a@example.com", "b@example.com"), "Weekly report", "Hello there");
    transport.send(List.of("c@example.com"), "Second", "Again");

    assertEquals(1, server.connections.get());
    assertEquals(2, server.messages.size());
    String first = server.messages.get(0);
    assertTrue(first.contains("From: noreply@edutrack.local"), first);
    assertTrue(first.contains("To: a@example.com, b@example.com"), first);
    assertTrue(first.contains("Subject: Weekly report"), first);
    assertTrue(first.contains("Hello there"), first);
    assertTrue(transport.isConnected());
  }

  @Test
  void refusedRecipientKeepsSession() throws Exception {
    server.refusedRecipients.add("ghost@example.com");

    TransportException e = assertThrows(TransportException.class,
        () -> transport.send(List.of("ghost@example.com"), "s", "b"));
    transport.send(List.of("real@example.com"), "s", "b");

    assertEquals(Kind.RECIPIENTS_REFUSED, e.kind());
    assertEquals(1, server.connections.get());
    assertEquals(1, server.messages.size());
  }

  @Test
  void rejectedMessageIsDataFailure() {
    server.dataReply = "554 5.6.0 message rejected";

    TransportException e = assertThrows(TransportException.class,
        () -> transport.send(List.of("a@example.com"), "s", "b"));

    assertEquals(Kind.DATA, e.kind());
    assertTrue(e.describe().startsWith("DATA: "));
  }

  @Test
  void malformedAddressFailsBeforeConnecting() {
    TransportException e = assertThrows(TransportException.class,
        () -> transport.send(List.of("not an address"), "s", "b"));

    assertEquals(Kind.RECIPIENTS_REFUSED, e.kind());
    assertEquals(0, server.connections.get());
  }

  @Test
  void refusedConnectionIsConnectFailure() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = socket.getLocalPort();
    }
    SmtpMailTransport unreachable = new SmtpMailTransport(plainSettings(port), millis -> { });
    try {
      TransportException first = assertThrows(TransportException.class,
          () -> unreachable.send(List.of("a@example.com"), "s", "b"));
      TransportException second = assertThrows(TransportException.class,
          () -> unreachable.send(List.of("a@example.com"), "s", "b"));

      assertEquals(Kind.CONNECT, first.kind());
      assertEquals(Kind.CONNECT, second.kind());
      assertFalse(unreachable.isConnected());
    } finally {
      unreachable.close();
    }
  }

  @Test
  void sendReconnectsAsSoonAsServerIsBackDespiteReconnectBackoff() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = socket.getLocalPort();
    }
    SmtpMailTransport recovering = new SmtpMailTransport(plainSettings(port), millis -> { });
    try {
      TransportException down = assertThrows(TransportException.class,
          () -> recovering.send(List.of("a@example.com"), "s", "b"));
      assertEquals(Kind.CONNECT, down.kind());

      try (FakeSmtpServer restarted = new FakeSmtpServer(port)) {
        recovering.send(List.of("a@example.com"), "s", "b");

        assertEquals(1, restarted.connections.get());
        assertEquals(1, restarted.messages.size());
        assertTrue(recovering.isConnected());
      }
    } finally {
      recovering.close();
    }
  }

  @Test
  void sendAfterCloseFails() {
    transport.close();

    TransportException e = assertThrows(TransportException.class,
        () -> transport.send(List.of("a@example.com"), "s", "b"));
    assertEquals(Kind.CONNECT, e.kind());
  }

  @Test
  void buildsUtf8PlainTextMessage() throws Exception {
    MimeMessage message = transport.buildMessage(
        List.of("a@example.com", "b@example.com"), "Grüße", "Привет");

    assertEquals(new InternetAddress("noreply@edutrack.local"), message.getFrom()[0]);
    assertEquals(2, message.getRecipients(Message.RecipientType.TO).length);
    assertEquals("Grüße", message.getSubject());
    assertEquals("Привет", message.getContent());
    assertTrue(message.getHeader("Subject", null).startsWith("=?UTF-8?"));
  }

  @Test
  void classifiesConnectFailures() {
    assertEquals(Kind.AUTH, SmtpMailTransport.classifyConnect(new AuthenticationFailedException("535")));
    assertEquals(Kind.TIMEOUT, SmtpMailTransport.classifyConnect(
        new MessagingException("connect timed out", new SocketTimeoutException())));
    assertEquals(Kind.CONNECT, SmtpMailTransport.classifyConnect(
        new MessagingException("refused", new ConnectException())));
  }

  @Test
  void classifiesSendFailures() {
    assertEquals(Kind.TIMEOUT, SmtpMailTransport.classifySend(
        new MessagingException("read timed out", new SocketTimeoutException())));
    assertEquals(Kind.DISCONNECTED, SmtpMailTransport.classifySend(
        new MessagingException("Can't send command", new SocketException("reset"))));
    assertEquals(Kind.DATA, SmtpMailTransport.classifySend(new MessagingException("452 too big")));
  }

  @Test
  void sessionPropertiesFollowSecurity() {
    SmtpSettings base = SmtpSettings.defaults().withServer("smtp.example.com", 465);

    Properties tls = SmtpMailTransport.sessionProperties(base.withSecurity(SmtpSettings.Security.TLS));
    Properties starttls = SmtpMailTransport.sessionProperties(base.withCredentials("user", "pw"));

    assertEquals("true", tls.getProperty("mail.smtp.ssl.enable"));
    assertEquals("false", tls.getProperty("mail.smtp.auth"));
    assertEquals("true", starttls.getProperty("mail.smtp.starttls.required"));
    assertEquals("true", starttls.getProperty("mail.smtp.auth"));
    assertEquals("465", starttls.getProperty("mail.smtp.port"));
  }

  private static SmtpSettings plainSettings(int port) {
    return SmtpSettings.defaults()
        .withServer("127.0.0.1", port)
        .withSecurity(SmtpSettings.Security.NONE)
        .withTimeouts(2_000, 2_000)
        .withReconnect(SLOW_RECONNECT);
  }
}
