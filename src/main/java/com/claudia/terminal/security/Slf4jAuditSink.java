package com.claudia.terminal.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuditSink} writing to the dedicated {@code claudia.audit} logger, so the logging
 * configuration can route audit records to their own appender.
 *
 * @since 1.0
 */
public final class Slf4jAuditSink implements AuditSink {

  static final String LOGGER_NAME = "claudia.audit";

  private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

  @Override
  public void record(final AuditEvent event) {
    AUDIT.warn("{} session={} owner={} categories={} detail={}",
        event.type(), event.sessionId(), event.ownerId(), event.categories(), event.detail());
  }
}
