package com.claudia.terminal.orchestrator;

/**
 * The working directory was rejected by the path policy.
 *
 * @since 1.0
 */
public class PathDeniedException extends SessionException {

  private static final long serialVersionUID = 1L;

  public PathDeniedException(final String sessionId, final String message) {
    super(ErrorCode.PATH_DENIED, sessionId, message);
  }
}
