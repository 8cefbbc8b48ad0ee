package com.claudia.terminal.security;

/**
 * Severity of a matched injection pattern, lowest first.
 *
 * @since 1.0
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean atLeast(final Severity other) {
    return compareTo(other) >= 0;
  }
}
