package com.claudia.terminal.orchestrator;

import com.claudia.terminal.session.SessionRecord;
import com.claudia.terminal.session.SessionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Expiry policy of the periodic cleanup sweep, separated from any timer so it can be evaluated
 * against an arbitrary instant.
 *
 * <p>Stopped and errored records expire after {@code stoppedTtl} without activity. Live records
 * expire after the idle time-to-live of their mode; background sessions are kept far longer than
 * foreground ones.
 *
 * @since 1.0
 */
public final class CleanupSweep {

  /**
   * Why a record expired.
   */
  public enum Reason {
    STOPPED_RETENTION,
    FOREGROUND_IDLE,
    BACKGROUND_IDLE
  }

  /**
   * A record selected for retirement.
   *
   * @param record expired record
   * @param reason reason
   */
  public record Expiry(SessionRecord record, Reason reason) {
  }

  private final OrchestratorConfig config;

  public CleanupSweep(final OrchestratorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
  }

  /**
   * Selects the records that must be retired at {@code now}.
   *
   * @param records records to inspect
   * @param now evaluation time
   * @return expired records with their reason
   */
  public List<Expiry> select(final Collection<SessionRecord> records, final Instant now) {
    Validate.notNull(records, "records must not be null");
    Validate.notNull(now, "now must not be null");
    final List<Expiry> expired = new ArrayList<>();
    for (final SessionRecord record : records) {
      final SessionStatus status = record.getStatus();
      final Duration idle = Duration.between(record.getLastActivityAt(), now);
      if (status.isTerminal()) {
        if (idle.compareTo(this.config.stoppedTtl()) > 0) {
          expired.add(new Expiry(record, Reason.STOPPED_RETENTION));
        }
      } else if (idle.compareTo(this.config.idleTtl(record.isBackground())) > 0) {
        expired.add(new Expiry(record, record.isBackground() ? Reason.BACKGROUND_IDLE : Reason.FOREGROUND_IDLE));
      }
    }
    return expired;
  }
}
