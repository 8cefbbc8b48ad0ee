package com.claudia.terminal.security;

import java.time.Instant;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * Security-relevant event reported to an {@link AuditSink}.
 *
 * @param type event type
 * @param at time of the event
 * @param sessionId session concerned (may be null when no session was created)
 * @param ownerId requesting user (may be null)
 * @param detail short description, e.g. the denied path or a truncated input excerpt
 * @param categories matched injection categories (empty for non-input events)
 * @since 1.0
 */
public record AuditEvent(Type type, Instant at, String sessionId, String ownerId, String detail,
    Set<InjectionCategory> categories) {

  /** Audit event types. */
  public enum Type {
    INPUT_REJECTED,
    PATH_DENIED
  }

  public AuditEvent {
    Validate.notNull(type, "type must not be null");
    Validate.notNull(at, "at must not be null");
    categories = categories == null ? Set.of() : Set.copyOf(categories);
  }
}
