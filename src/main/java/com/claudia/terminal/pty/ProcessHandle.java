package com.claudia.terminal.pty;

import java.io.IOException;

/**
 * Thin handle over one PTY-attached child process.
 *
 * <p>Implementations must provide:
 * - byte input to the process
 * - resize support
 * - kill
 * - an output/exit event pump started by {@link #startEventPump(ProcessEventListener)}
 *
 * @since 1.0
 */
public interface ProcessHandle {

  /**
   * Returns the OS process id.
   *
   * @return pid
   */
  long pid();

  /**
   * Writes raw bytes to the PTY input.
   *
   * @param bytes bytes to write
   * @throws IOException if the PTY input is closed
   */
  void write(final byte[] bytes) throws IOException;

  /**
   * Resizes the PTY window.
   *
   * @param columns columns
   * @param rows rows
   * @throws ResizeException when the process has exited or the resize is refused
   */
  void resize(final int columns, final int rows) throws ResizeException;

  /**
   * Terminates the process. Safe to call more than once.
   */
  void kill();

  /**
   * Returns whether the process is still running.
   *
   * @return true while alive
   */
  boolean isAlive();

  /**
   * Starts delivering output and exit events. Output produced before this call is buffered by the
   * PTY and delivered once the pump starts. May only be called once.
   *
   * @param listener event listener
   */
  void startEventPump(final ProcessEventListener listener);
}
