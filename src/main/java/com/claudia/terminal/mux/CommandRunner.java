package com.claudia.terminal.mux;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs short-lived helper commands and captures their output.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Result of a finished command.
   *
   * @param exitCode exit code
   * @param output combined stdout and stderr
   */
  record Result(int exitCode, String output) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }

  /**
   * Runs a command to completion.
   *
   * @param command command line, executable first
   * @param timeout maximum run time; the process is killed when exceeded
   * @return result
   * @throws IOException if the command cannot be started or times out
   * @throws InterruptedException if interrupted while waiting
   */
  Result run(final List<String> command, final Duration timeout) throws IOException, InterruptedException;
}
