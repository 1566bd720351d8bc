package mailrelay.notify;

import mailrelay.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Wire format of {@link Notification}: {@code {"outbox_id":"<uuid>"}} in UTF-8.
 *
 * <p>Decoding ignores any other member, whatever its type, so producers can extend the
 * payload without breaking running relays.
 */
public final class NotificationCodec {
  static final String OUTBOX_ID = "outbox_id";

  private final JsonCodec jsonCodec;

  public NotificationCodec() {
    this(JsonCodec.getDefault());
  }

  public NotificationCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public byte[] encode(Notification notification) {
    return jsonCodec.writeObject(Map.of(OUTBOX_ID, notification.outboxId()))
        .getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Decodes a broker payload.
   *
   * @throws MalformedNotificationException if the payload is not a JSON object or its
   *     {@code outbox_id} is missing or not a UUID
   */
  public Notification decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new MalformedNotificationException("Empty notification payload");
    }
    Map<String, String> fields;
    try {
      fields = jsonCodec.readObject(new String(payload, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      throw new MalformedNotificationException("Notification payload is not a JSON object", e);
    }
    String outboxId = fields.get(OUTBOX_ID);
    if (outboxId == null || outboxId.isBlank()) {
      throw new MalformedNotificationException("Notification payload has no " + OUTBOX_ID);
    }
    try {
      return new Notification(UUID.fromString(outboxId.trim()).toString());
    } catch (IllegalArgumentException e) {
      throw new MalformedNotificationException("Invalid " + OUTBOX_ID + ": " + outboxId, e);
    }
  }
}
