package com.claudia.terminal.security;

/**
 * Receives rejected requests for later review. Implementations must not throw.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface AuditSink {

  void record(final AuditEvent event);
}
