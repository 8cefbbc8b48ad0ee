package com.claudia.terminal.stream;

import java.util.Arrays;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Event delivered to a viewer attached to a session.
 */
public final class StreamEvent {

  public enum Type {
    CONNECTED("connected"),
    STATUS("status"),
    OUTPUT("output"),
    RESUME_TOKEN_DISCOVERED("resumeTokenDiscovered"),
    EXIT("exit"),
    ERROR("error"),
    COMPLETE("complete"),
    KEEPALIVE("keepalive");

    private final String wireName;

    Type(final String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }

  private final Type type;
  private final String sessionId;
  private final String status;
  private final byte[] content;
  private final boolean replayed;
  private final String resumeToken;
  private final Integer exitCode;
  private final Integer signal;
  private final String message;

  private StreamEvent(Type type, String sessionId, String status, byte[] content, boolean replayed,
      String resumeToken, Integer exitCode, Integer signal, String message) {
    this.type = type;
    this.sessionId = sessionId;
    this.status = status;
    this.content = content;
    this.replayed = replayed;
    this.resumeToken = resumeToken;
    this.exitCode = exitCode;
    this.signal = signal;
    this.message = message;
  }

  public static StreamEvent connected(String sessionId) {
    Validate.notNull(sessionId, "sessionId must not be null.");
    return new StreamEvent(Type.CONNECTED, sessionId, null, null, false, null, null, null, null);
  }

  public static StreamEvent status(String sessionId, String status) {
    Validate.notNull(status, "status must not be null.");
    return new StreamEvent(Type.STATUS, sessionId, status, null, false, null, null, null, null);
  }

  public static StreamEvent output(String sessionId, byte[] content, boolean replayed) {
    Validate.notNull(content, "content must not be null.");
    return new StreamEvent(Type.OUTPUT, sessionId, null, content, replayed, null, null, null, null);
  }

  public static StreamEvent resumeTokenDiscovered(String sessionId, String resumeToken) {
    Validate.notBlank(resumeToken, "resumeToken must not be blank.");
    return new StreamEvent(Type.RESUME_TOKEN_DISCOVERED, sessionId, null, null, false, resumeToken, null, null, null);
  }

  public static StreamEvent exit(String sessionId, int exitCode, Integer signal) {
    return new StreamEvent(Type.EXIT, sessionId, null, null, false, null, exitCode, signal, null);
  }

  public static StreamEvent error(String sessionId, String message) {
    return new StreamEvent(Type.ERROR, sessionId, null, null, false, null, null, null, message);
  }

  public static StreamEvent complete(String sessionId, String reason) {
    return new StreamEvent(Type.COMPLETE, sessionId, null, null, false, null, null, null, reason);
  }

  public static StreamEvent keepalive() {
    return new StreamEvent(Type.KEEPALIVE, null, null, null, false, null, null, null, null);
  }

  public Type type() {
    return type;
  }

  public String sessionId() {
    return sessionId;
  }

  public String status() {
    return status;
  }

  /**
   * Returns the raw output bytes of an {@link Type#OUTPUT} event.
   *
   * @return bytes, or null for other event types
   */
  public byte[] content() {
    return content;
  }

  public boolean replayed() {
    return replayed;
  }

  public String resumeToken() {
    return resumeToken;
  }

  public Integer exitCode() {
    return exitCode;
  }

  public Integer signal() {
    return signal;
  }

  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return "StreamEvent{" + type.wireName()
        + (content != null ? ", bytes=" + content.length : "")
        + (replayed ? ", replayed" : "")
        + (status != null ? ", status=" + status : "")
        + (exitCode != null ? ", code=" + exitCode : "")
        + (message != null ? ", message=" + message : "")
        + "}";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StreamEvent)) {
      return false;
    }
    StreamEvent other = (StreamEvent) o;
    return type == other.type
        && replayed == other.replayed
        && Objects.equals(sessionId, other.sessionId)
        && Objects.equals(status, other.status)
        && Arrays.equals(content, other.content)
        && Objects.equals(resumeToken, other.resumeToken)
        && Objects.equals(exitCode, other.exitCode)
        && Objects.equals(signal, other.signal)
        && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, sessionId, status, replayed, resumeToken, exitCode, signal, message)
        * 31 + Arrays.hashCode(content);
  }
}
