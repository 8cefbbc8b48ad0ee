package com.claudia.terminal.pty;

/**
 * Exit status of a PTY-attached process.
 *
 * <p>PTY backends report a single wait status. A status above 128 is ambiguous: the shell
 * convention encodes a terminating signal as {@code 128 + signal}, but a program may also exit
 * with such a code itself ({@code exit 130}). A signal is therefore only reported when the caller
 * knows one was delivered, through {@link #signaled(int)}.
 *
 * @param exitCode process exit code
 * @param signal terminating signal number, or null when no signal is known
 * @since 1.0
 */
public record ProcessExit(int exitCode, Integer signal) {

  static final int SIGNAL_BASE = 128;
  private static final int MAX_SIGNAL = 64;

  /**
   * Builds an exit value from a raw wait status without guessing a signal.
   *
   * @param status raw status returned by the process wait
   * @return exit value
   */
  public static ProcessExit fromStatus(final int status) {
    return new ProcessExit(status, null);
  }

  /**
   * Builds the exit value of a process known to be terminated by a signal.
   *
   * @param signal signal number
   * @return exit value with the shell-style {@code 128 + signal} code
   */
  public static ProcessExit signaled(final int signal) {
    return new ProcessExit(SIGNAL_BASE + signal, signal);
  }

  static boolean isSignalStatus(final int status) {
    return status > SIGNAL_BASE && status <= SIGNAL_BASE + MAX_SIGNAL;
  }
}
