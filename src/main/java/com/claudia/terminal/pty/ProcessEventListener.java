package com.claudia.terminal.pty;

/**
 * Receives output and exit notifications from a {@link ProcessHandle}.
 *
 * <p>Both callbacks run on the handle's own pump threads. {@link #onData(byte[])} calls are
 * serialized in the order the bytes were read; {@link #onExit(ProcessExit)} fires once, after the
 * last data chunk.
 *
 * @since 1.0
 */
public interface ProcessEventListener {

  /**
   * Called for every chunk read from the PTY.
   *
   * @param chunk raw bytes; the array is owned by the listener
   */
  void onData(byte[] chunk);

  /**
   * Called once when the process has exited and its output is drained.
   *
   * @param exit exit status
   */
  void onExit(ProcessExit exit);
}
