package com.claudia.terminal.pty;

/**
 * Raised when a PTY-attached process cannot be started.
 *
 * @since 1.0
 */
public class SpawnException extends Exception {

  private static final long serialVersionUID = 1L;

  public SpawnException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
