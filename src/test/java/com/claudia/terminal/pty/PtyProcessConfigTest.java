package com.claudia.terminal.pty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for launch configuration validation and exit decoding.
 *
 * @since 1.0
 */
public class PtyProcessConfigTest {

  @Test
  @DisplayName("Should build the command line from executable and arguments")
  void commandLine_ExecutableAndArguments_ExecutableFirst() {
    final PtyProcessConfig config = new PtyProcessConfig("/usr/bin/claude", List.of("--continue"),
        Path.of("/tmp"), Map.of("TERM", "xterm-256color"), 120, 40);

    assertThat(config.commandLine()).containsExactly("/usr/bin/claude", "--continue");
  }

  @Test
  @DisplayName("Should copy arguments so later changes to the caller's list are not seen")
  void constructor_MutableArguments_Copied() {
    final List<String> args = new ArrayList<>(List.of("--resume", "abc12345"));
    final PtyProcessConfig config = new PtyProcessConfig("claude", args, Path.of("/tmp"), null, 80, 24);
    args.clear();

    assertThat(config.arguments()).containsExactly("--resume", "abc12345");
    assertThat(config.environment()).isEmpty();
  }

  @Test
  @DisplayName("Should reject non-positive terminal sizes")
  void constructor_ZeroColumns_Throws() {
    assertThatThrownBy(() -> new PtyProcessConfig("claude", List.of(), Path.of("/tmp"), Map.of(), 0, 24))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should report a code above 128 as a plain exit code")
  void fromStatus_Exit130_NoSignal() {
    assertThat(ProcessExit.fromStatus(130)).isEqualTo(new ProcessExit(130, null));
    assertThat(ProcessExit.fromStatus(0)).isEqualTo(new ProcessExit(0, null));
  }

  @Test
  @DisplayName("Should encode a known signal with the shell exit code")
  void signaled_Sigkill_CodeAndSignal() {
    assertThat(ProcessExit.signaled(9)).isEqualTo(new ProcessExit(137, 9));
    assertThat(ProcessExit.isSignalStatus(137)).isTrue();
    assertThat(ProcessExit.isSignalStatus(128)).isFalse();
    assertThat(ProcessExit.isSignalStatus(255)).isFalse();
  }
}
