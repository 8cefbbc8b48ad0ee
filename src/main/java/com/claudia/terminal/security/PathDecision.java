package com.claudia.terminal.security;

/**
 * Outcome of a {@link PathPolicy} check.
 *
 * @param allowed whether the path may be used
 * @param reason denial reason (null when allowed)
 * @since 1.0
 */
public record PathDecision(boolean allowed, String reason) {

  private static final PathDecision ALLOW = new PathDecision(true, null);

  public static PathDecision allow() {
    return ALLOW;
  }

  public static PathDecision deny(final String reason) {
    return new PathDecision(false, reason);
  }
}
