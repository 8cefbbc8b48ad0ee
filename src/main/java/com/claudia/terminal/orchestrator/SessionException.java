package com.claudia.terminal.orchestrator;

import org.apache.commons.lang3.Validate;

/**
 * Base class of every failure reported by {@link SessionOrchestrator}'s public operations.
 *
 * @since 1.0
 */
public class SessionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode code;
  private final String sessionId;

  public SessionException(final ErrorCode code, final String sessionId, final String message) {
    this(code, sessionId, message, null);
  }

  public SessionException(final ErrorCode code, final String sessionId, final String message,
      final Throwable cause) {
    super(message, cause);
    Validate.notNull(code, "code must not be null");
    this.code = code;
    this.sessionId = sessionId;
  }

  public ErrorCode getCode() {
    return this.code;
  }

  /**
   * Returns the session concerned.
   *
   * @return session id, or null when the failure happened before an id was assigned
   */
  public String getSessionId() {
    return this.sessionId;
  }
}
