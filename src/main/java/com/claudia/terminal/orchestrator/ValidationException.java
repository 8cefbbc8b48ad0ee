package com.claudia.terminal.orchestrator;

/**
 * A request was missing or had malformed fields. Nothing was changed.
 *
 * @since 1.0
 */
public class ValidationException extends SessionException {

  private static final long serialVersionUID = 1L;

  public ValidationException(final ErrorCode code, final String sessionId, final String message) {
    super(code, sessionId, message);
  }

  public ValidationException(final String sessionId, final String message) {
    this(ErrorCode.VALIDATION, sessionId, message);
  }
}
