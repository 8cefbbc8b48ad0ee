package com.claudia.terminal.orchestrator;

/**
 * The session is known to the ledger but has no live process. Callers may restart it, resuming
 * the conversation with {@link #getResumeToken()} when one was recorded.
 *
 * @since 1.0
 */
public class SessionGoneException extends SessionException {

  private static final long serialVersionUID = 1L;

  private final String resumeToken;

  public SessionGoneException(final String sessionId, final String resumeToken) {
    super(ErrorCode.GONE, sessionId, "Session has no running process: " + sessionId);
    this.resumeToken = resumeToken;
  }

  public String getResumeToken() {
    return this.resumeToken;
  }
}
