package com.claudia.terminal.orchestrator;

/**
 * No live session and no ledger entry exist for the id.
 *
 * @since 1.0
 */
public class SessionNotFoundException extends SessionException {

  private static final long serialVersionUID = 1L;

  public SessionNotFoundException(final String sessionId) {
    super(ErrorCode.NOT_FOUND, sessionId, "Session not found: " + sessionId);
  }
}
