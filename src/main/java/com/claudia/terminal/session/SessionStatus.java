package com.claudia.terminal.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of a session's process pairing.
 *
 * <p>{@code starting -> (running | background) -> stopped}, with {@code error} reachable from any
 * non-terminal state. {@code stopped} and {@code error} are terminal.
 *
 * @since 1.0
 */
public enum SessionStatus {
  STARTING,
  RUNNING,
  BACKGROUND,
  STOPPED,
  ERROR;

  /**
   * Returns whether the lattice allows moving from this status to {@code next}.
   *
   * @param next candidate status
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(final SessionStatus next) {
    if (next == null || next == this || isTerminal()) {
      return false;
    }
    switch (next) {
      case RUNNING:
      case BACKGROUND:
        return this == STARTING;
      case STOPPED:
      case ERROR:
        return true;
      default:
        return false;
    }
  }

  public boolean isTerminal() {
    return this == STOPPED || this == ERROR;
  }

  /**
   * Input and resize are accepted while the process pairing is not terminal.
   *
   * @return true if input may be written
   */
  public boolean acceptsInput() {
    return !isTerminal();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SessionStatus fromWireName(final String value) {
    return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
