package com.claudia.terminal.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the status lattice.
 *
 * @since 1.0
 */
public class SessionStatusTest {

  @Test
  @DisplayName("Should only reach running or background from starting")
  void canTransitionTo_RunningFromBackground_Rejected() {
    assertThat(SessionStatus.STARTING.canTransitionTo(SessionStatus.RUNNING)).isTrue();
    assertThat(SessionStatus.STARTING.canTransitionTo(SessionStatus.BACKGROUND)).isTrue();
    assertThat(SessionStatus.BACKGROUND.canTransitionTo(SessionStatus.RUNNING)).isFalse();
    assertThat(SessionStatus.RUNNING.canTransitionTo(SessionStatus.STARTING)).isFalse();
  }

  @Test
  @DisplayName("Should reach stopped and error from every live status")
  void canTransitionTo_TerminalFromLive_Allowed() {
    for (final SessionStatus live : new SessionStatus[] {SessionStatus.STARTING, SessionStatus.RUNNING,
        SessionStatus.BACKGROUND}) {
      assertThat(live.canTransitionTo(SessionStatus.STOPPED)).isTrue();
      assertThat(live.canTransitionTo(SessionStatus.ERROR)).isTrue();
    }
  }

  @Test
  @DisplayName("Should never leave a terminal status")
  void canTransitionTo_FromTerminal_Rejected() {
    for (final SessionStatus next : SessionStatus.values()) {
      assertThat(SessionStatus.STOPPED.canTransitionTo(next)).isFalse();
      assertThat(SessionStatus.ERROR.canTransitionTo(next)).isFalse();
    }
  }

  @Test
  @DisplayName("Should round-trip the lowercase wire name")
  void fromWireName_Lowercase_Parsed() {
    assertThat(SessionStatus.BACKGROUND.wireName()).isEqualTo("background");
    assertThat(SessionStatus.fromWireName("stopped")).isEqualTo(SessionStatus.STOPPED);
  }
}
