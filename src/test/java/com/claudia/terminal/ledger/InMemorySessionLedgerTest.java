package com.claudia.terminal.ledger;

import com.claudia.terminal.session.SessionStatus;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the in-memory ledger.
 *
 * @since 1.0
 */
public class InMemorySessionLedgerTest {

  @Test
  @DisplayName("Should save, update and remove entries")
  void save_UpdateRemove_Tracked() {
    final InMemorySessionLedger ledger = new InMemorySessionLedger();
    final Instant now = Instant.parse("2026-03-01T09:00:00Z");
    final LedgerEntry entry = new LedgerEntry("s1", "/w", false, now, SessionStatus.RUNNING, false, null, now,
        null, null, null);

    ledger.save(entry);
    ledger.save(entry.withStatus(SessionStatus.STOPPED, now.plusSeconds(5)));

    assertThat(ledger.find("s1").orElseThrow().status()).isEqualTo(SessionStatus.STOPPED);
    assertThat(ledger.find("s1").orElseThrow().lastActivityAt()).isEqualTo(now.plusSeconds(5));
    assertThat(ledger.remove("s1")).isTrue();
    assertThat(ledger.list()).isEmpty();
  }
}
