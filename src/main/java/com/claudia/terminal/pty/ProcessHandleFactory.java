package com.claudia.terminal.pty;

/**
 * Spawns {@link ProcessHandle}s.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ProcessHandleFactory {

  /**
   * Spawns a PTY-attached process.
   *
   * @param config launch configuration
   * @return handle whose event pump has not been started yet
   * @throws SpawnException if the process cannot be started
   */
  ProcessHandle spawn(final PtyProcessConfig config) throws SpawnException;
}
