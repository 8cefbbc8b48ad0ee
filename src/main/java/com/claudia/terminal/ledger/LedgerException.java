package com.claudia.terminal.ledger;

/**
 * Raised when the ledger's backing store cannot be read or written.
 *
 * @since 1.0
 */
public class LedgerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public LedgerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
