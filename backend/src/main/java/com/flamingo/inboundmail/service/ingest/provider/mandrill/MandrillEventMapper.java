package com.flamingo.inboundmail.service.ingest.provider.mandrill;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.inboundmail.exception.MalformedPayloadException;
import com.flamingo.inboundmail.service.ingest.model.AttachmentRef;
import com.flamingo.inboundmail.service.ingest.model.BodyRef;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import com.flamingo.inboundmail.service.ingest.provider.MimeEncodedWords;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Maps a single Mandrill event object to a {@link NormalizedEvent}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class MandrillEventMapper {

  static final String INBOUND_EVENT_TYPE = "inbound_email";
  private static final int MAX_SUBJECT_LENGTH = 998;
  private static final int MAX_ADDRESS_LENGTH = 320;
  private static final int MAX_NAME_LENGTH = 512;
  private static final List<String> PROVIDER_MESSAGE_ID_HEADERS =
      List.of("X-Mailgun-Message-Id", "X-Message-Id");
  private static final String MESSAGE_ID_HEADER = "Message-Id";

  private final Clock clock;

  /**
   * Maps the event, or returns empty for events without a message, such as delivery status
   * notifications.
   *
   * @throws MalformedPayloadException if the message has no usable identifier or an attachment
   *     cannot be decoded
   */
  public Optional<NormalizedEvent> map(JsonNode event, UUID organizationId) {
    JsonNode msg = event.path("msg");
    if (!msg.isObject()) {
      log.debug("Skipping Mandrill event without msg: type={}", event.path("event").asText());
      return Optional.empty();
    }

    String externalEventId = resolveMessageId(event, msg);
    String subject = truncate(MimeEncodedWords.decode(text(msg, "subject")), MAX_SUBJECT_LENGTH);

    return Optional.of(
        new NormalizedEvent(
            MandrillProviderAdapter.PROVIDER_ID,
            externalEventId,
            organizationId,
            eventType(event),
            receivedAt(event),
            truncate(text(msg, "from_email"), MAX_ADDRESS_LENGTH),
            truncate(MimeEncodedWords.decode(text(msg, "from_name")), MAX_NAME_LENGTH),
            recipients(msg),
            subject,
            bodies(msg),
            attachments(msg, externalEventId)));
  }

  private String eventType(JsonNode event) {
    String type = event.path("event").asText("");
    return type.isEmpty() || "inbound".equals(type) ? INBOUND_EVENT_TYPE : type;
  }

  private LocalDateTime receivedAt(JsonNode event) {
    JsonNode ts = event.get("ts");
    if (ts != null && ts.canConvertToLong() && ts.asLong() > 0) {
      return LocalDateTime.ofInstant(Instant.ofEpochSecond(ts.asLong()), ZoneOffset.UTC);
    }
    return LocalDateTime.now(clock);
  }

  private String resolveMessageId(JsonNode event, JsonNode msg) {
    JsonNode headers = msg.path("headers");
    for (String name : PROVIDER_MESSAGE_ID_HEADERS) {
      String value = header(headers, name);
      if (value != null) {
        return value;
      }
    }
    String messageId = header(headers, MESSAGE_ID_HEADER);
    if (messageId != null) {
      return stripAngleBrackets(messageId);
    }
    String id = text(msg, "_id");
    if (id == null) {
      id = text(event, "_id");
    }
    if (id == null) {
      throw new MalformedPayloadException(
          MandrillProviderAdapter.PROVIDER_ID, "Inbound message has no identifier");
    }
    return id;
  }

  private List<String> recipients(JsonNode msg) {
    List<String> recipients = new ArrayList<>();
    for (JsonNode to : msg.path("to")) {
      // [email, name] pairs; plain strings are accepted as well
      String address = to.isArray() ? to.path(0).asText(null) : to.asText(null);
      if (address != null && !address.isBlank()) {
        recipients.add(address.trim());
      }
    }
    if (recipients.isEmpty()) {
      String email = text(msg, "email");
      if (email != null) {
        recipients.add(email);
      }
    }
    return recipients;
  }

  private List<BodyRef> bodies(JsonNode msg) {
    List<BodyRef> bodies = new ArrayList<>();
    String plain = text(msg, "text");
    if (plain != null) {
      bodies.add(new BodyRef(BodyRef.TEXT_PLAIN, plain));
    }
    String html = text(msg, "html");
    if (html != null) {
      bodies.add(new BodyRef(BodyRef.TEXT_HTML, html));
    }
    return bodies;
  }

  private List<AttachmentRef> attachments(JsonNode msg, String externalEventId) {
    List<AttachmentRef> refs = new ArrayList<>();
    collectAttachments(msg.path("attachments"), refs, externalEventId);
    collectAttachments(msg.path("images"), refs, externalEventId);
    return refs;
  }

  private void collectAttachments(
      JsonNode container, List<AttachmentRef> refs, String externalEventId) {
    if (container.isArray()) {
      for (JsonNode node : container) {
        refs.add(toAttachment(null, node, refs.size(), externalEventId));
      }
    } else if (container.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        refs.add(toAttachment(field.getKey(), field.getValue(), refs.size(), externalEventId));
      }
    }
  }

  private AttachmentRef toAttachment(
      String key, JsonNode node, int ordinal, String externalEventId) {
    if (!node.isObject()) {
      throw new MalformedPayloadException(
          MandrillProviderAdapter.PROVIDER_ID,
          "Attachment " + ordinal + " of message " + externalEventId + " is not an object");
    }
    String name = text(node, "name");
    if (name == null) {
      name = key;
    }
    name = MimeEncodedWords.decode(name);
    if (name == null || name.isBlank()) {
      name = "attachment-" + ordinal;
    }

    String content = node.path("content").asText("");
    boolean base64 = node.path("base64").asBoolean(true);
    byte[] bytes;
    if (base64) {
      try {
        bytes = Base64.getMimeDecoder().decode(content);
      } catch (IllegalArgumentException e) {
        throw new MalformedPayloadException(
            MandrillProviderAdapter.PROVIDER_ID,
            "Attachment " + name + " of message " + externalEventId + " is not valid base64",
            e);
      }
    } else {
      bytes = content.getBytes(StandardCharsets.UTF_8);
    }
    return new AttachmentRef(name, text(node, "type"), bytes);
  }

  private static String header(JsonNode headers, String name) {
    if (!headers.isObject()) {
      return null;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equalsIgnoreCase(name)) {
        JsonNode value = field.getValue().isArray() ? field.getValue().path(0) : field.getValue();
        String text = value.asText("").trim();
        return text.isEmpty() ? null : text;
      }
    }
    return null;
  }

  private static String stripAngleBrackets(String value) {
    String trimmed = value.trim();
    if (trimmed.startsWith("<") && trimmed.endsWith(">") && trimmed.length() > 2) {
      return trimmed.substring(1, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static String truncate(String value, int maxLength) {
    return value != null && value.length() > maxLength ? value.substring(0, maxLength) : value;
  }
}
