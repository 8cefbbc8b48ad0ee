package com.claudia.terminal.security;

/**
 * Decides whether a working directory may host a session.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PathPolicy {

  /**
   * Checks a requested working directory.
   *
   * @param requestedPath working directory as supplied by the caller
   * @param ownerId requesting user (may be null)
   * @return decision
   */
  PathDecision check(final String requestedPath, final String ownerId);

  static PathPolicy permitAll() {
    return (requestedPath, ownerId) -> PathDecision.allow();
  }
}
