package com.claudia.terminal.orchestrator;

import com.claudia.terminal.driver.ExecutableNotFoundException;

/**
 * The wrapped CLI could not be located.
 *
 * @since 1.0
 */
public class BinaryNotFoundException extends SessionException {

  private static final long serialVersionUID = 1L;

  public BinaryNotFoundException(final String sessionId, final ExecutableNotFoundException cause) {
    super(ErrorCode.BINARY_NOT_FOUND, sessionId, cause.getMessage(), cause);
  }
}
