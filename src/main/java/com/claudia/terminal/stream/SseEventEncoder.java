package com.claudia.terminal.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Encodes {@link StreamEvent}s as Server-Sent Events frames.
 *
 * <p>Events become {@code data: <json>\n\n}; keepalives become the comment frame
 * {@code : keepalive\n\n}, which clients ignore but which keeps proxies from timing out idle
 * connections. Output bytes are sent as UTF-8 text in {@code content}.
 *
 * <p>Output decoding is stateful: a character split across two chunks is held back until its
 * remaining bytes arrive. Use one encoder per viewer stream; instances are not shared between
 * viewers.
 *
 * @since 1.0
 */
public final class SseEventEncoder {

  public static final String KEEPALIVE_FRAME = ": keepalive\n\n";

  private final ObjectMapper objectMapper;
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPLACE)
      .onUnmappableCharacter(CodingErrorAction.REPLACE);
  private byte[] pending = ArrayUtils.EMPTY_BYTE_ARRAY;

  public SseEventEncoder() {
    this(new ObjectMapper());
  }

  public SseEventEncoder(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes one event as a complete SSE frame.
   *
   * @param event event
   * @return frame text
   */
  public String encode(final StreamEvent event) {
    if (event.type() == StreamEvent.Type.KEEPALIVE) {
      return KEEPALIVE_FRAME;
    }
    try {
      return "data: " + this.objectMapper.writeValueAsString(toJson(event)) + "\n\n";
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode " + event, e);
    }
  }

  /**
   * Builds the JSON payload of an event. Output events advance this stream's decoding state.
   *
   * @param event event
   * @return JSON object
   */
  public ObjectNode toJson(final StreamEvent event) {
    final ObjectNode node = this.objectMapper.createObjectNode();
    node.put("type", event.type().wireName());
    if (event.sessionId() != null) {
      node.put("sessionId", event.sessionId());
    }
    switch (event.type()) {
      case STATUS:
        node.put("status", event.status());
        break;
      case OUTPUT:
        node.put("content", decodeOutput(event.content()));
        if (event.replayed()) {
          node.put("replayed", true);
        }
        break;
      case RESUME_TOKEN_DISCOVERED:
        node.put("resumeToken", event.resumeToken());
        break;
      case EXIT:
        node.put("code", event.exitCode());
        if (event.signal() != null) {
          node.put("signal", event.signal());
        }
        break;
      case ERROR:
      case COMPLETE:
        if (event.message() != null) {
          node.put("message", event.message());
        }
        break;
      default:
        break;
    }
    return node;
  }

  /**
   * Decodes the next output chunk, prefixed with the bytes held back from the previous one. An
   * incomplete sequence at the end is kept for the next call.
   */
  synchronized String decodeOutput(final byte[] chunk) {
    final ByteBuffer in = ByteBuffer.wrap(ArrayUtils.addAll(this.pending, chunk));
    final CharBuffer out = CharBuffer.allocate(in.remaining());
    this.decoder.decode(in, out, false);
    this.pending = new byte[in.remaining()];
    in.get(this.pending);
    out.flip();
    return out.toString();
  }
}
