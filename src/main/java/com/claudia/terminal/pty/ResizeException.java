package com.claudia.terminal.pty;

/**
 * Raised when a PTY resize is refused, typically because the process already exited.
 *
 * @since 1.0
 */
public class ResizeException extends Exception {

  private static final long serialVersionUID = 1L;

  public ResizeException(final String message) {
    super(message);
  }

  public ResizeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
