package com.claudia.terminal.orchestrator;

/**
 * What {@code stop} does to a multiplexer group when the ledger entry is kept.
 *
 * @since 1.0
 */
public enum MultiplexerStopPolicy {
  /** Detach the client; the group and the CLI keep running and can be re-attached. */
  DETACH,
  /** Kill the group together with the CLI. */
  KILL
}
