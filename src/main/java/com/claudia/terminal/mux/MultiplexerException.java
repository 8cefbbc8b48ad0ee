package com.claudia.terminal.mux;

/**
 * Raised when a multiplexer command fails.
 *
 * @since 1.0
 */
public class MultiplexerException extends Exception {

  private static final long serialVersionUID = 1L;

  public MultiplexerException(final String message) {
    super(message);
  }

  public MultiplexerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
