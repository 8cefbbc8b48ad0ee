package com.claudia.terminal.session;

import com.claudia.terminal.MutableClock;
import com.claudia.terminal.capture.DefaultResumeTokenPolicy;
import com.claudia.terminal.capture.ResumeTokenScanner;
import com.claudia.terminal.pty.FakeProcessHandle;
import com.claudia.terminal.stream.BroadcastHub;
import com.claudia.terminal.stream.OutputRingBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for session record state changes.
 *
 * @since 1.0
 */
public class SessionRecordTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));

  @Test
  @DisplayName("Should move a foreground session to running on first output")
  void markFirstOutput_Foreground_Running() {
    final SessionRecord record = record(false, null);

    assertThat(record.getStatus()).isEqualTo(SessionStatus.STARTING);
    assertThat(record.markFirstOutput()).contains(SessionStatus.RUNNING);
    assertThat(record.markFirstOutput()).isEmpty();
    assertThat(record.getStatus()).isEqualTo(SessionStatus.RUNNING);
  }

  @Test
  @DisplayName("Should move a background session to background on first output")
  void markFirstOutput_Background_Background() {
    assertThat(record(true, null).markFirstOutput()).contains(SessionStatus.BACKGROUND);
  }

  @Test
  @DisplayName("Should update activity time on touch and on transitions")
  void touch_AfterAdvance_LastActivityMoves() {
    final SessionRecord record = record(false, null);
    final Instant created = record.getLastActivityAt();

    this.clock.advance(Duration.ofSeconds(30));
    record.touch();
    assertThat(record.getLastActivityAt()).isEqualTo(created.plusSeconds(30));

    this.clock.advance(Duration.ofSeconds(5));
    record.transitionTo(SessionStatus.STOPPED);
    assertThat(record.getLastActivityAt()).isEqualTo(created.plusSeconds(35));
  }

  @Test
  @DisplayName("Should keep a terminal status once reached")
  void transitionTo_AfterStopped_Ignored() {
    final SessionRecord record = record(false, null);
    record.transitionTo(SessionStatus.STOPPED);

    assertThat(record.transitionTo(SessionStatus.RUNNING)).isFalse();
    assertThat(record.markFirstOutput()).isEmpty();
    assertThat(record.getStatus()).isEqualTo(SessionStatus.STOPPED);
  }

  @Test
  @DisplayName("Should write the resume token only once")
  void scanForResumeToken_TwoHints_FirstKept() {
    final SessionRecord record = record(false, null);

    assertThat(record.scanForResumeToken(bytes("Session ID: firsttoken1\n"))).contains("firsttoken1");
    assertThat(record.scanForResumeToken(bytes("Session ID: secondtoken2\n"))).isEmpty();
    assertThat(record.getResumeToken()).isEqualTo("firsttoken1");
  }

  @Test
  @DisplayName("Should not scan when launched with a known token")
  void scanForResumeToken_KnownToken_NeverReplaced() {
    final SessionRecord record = record(false, "knowntoken1");

    assertThat(record.scanForResumeToken(bytes("Session ID: othertoken2\n"))).isEmpty();
    assertThat(record.getResumeToken()).isEqualTo("knowntoken1");
  }

  private SessionRecord record(final boolean background, final String token) {
    return SessionRecord.builder()
        .id("s1")
        .handle(new FakeProcessHandle(null))
        .hub(new BroadcastHub("s1", new OutputRingBuffer(10)))
        .tokenScanner(new ResumeTokenScanner(new DefaultResumeTokenPolicy()))
        .clock(this.clock)
        .workingDirectory(Path.of("/tmp/proj"))
        .background(background)
        .resumeToken(token)
        .build();
  }

  private static byte[] bytes(final String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
