package com.claudia.terminal.orchestrator;

/**
 * Spawning or talking to the session's process failed.
 *
 * @since 1.0
 */
public class ProcessFailureException extends SessionException {

  private static final long serialVersionUID = 1L;

  public ProcessFailureException(final ErrorCode code, final String sessionId, final String message,
      final Throwable cause) {
    super(code, sessionId, message, cause);
  }
}
