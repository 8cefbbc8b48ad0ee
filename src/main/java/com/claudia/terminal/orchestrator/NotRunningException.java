package com.claudia.terminal.orchestrator;

import com.claudia.terminal.session.SessionStatus;

/**
 * The session exists but its status does not accept the operation.
 *
 * @since 1.0
 */
public class NotRunningException extends SessionException {

  private static final long serialVersionUID = 1L;

  private final SessionStatus status;

  public NotRunningException(final String sessionId, final SessionStatus status) {
    super(ErrorCode.NOT_RUNNING, sessionId, "Session " + sessionId + " is not running (status "
        + (status == null ? "unknown" : status.wireName()) + ")");
    this.status = status;
  }

  /**
   * Returns the status at the time of the request.
   *
   * @return status, or null when only the ledger knew the session
   */
  public SessionStatus getStatus() {
    return this.status;
  }
}
