package com.claudia.terminal.pty;

/**
 * Default {@link ProcessHandleFactory} backed by pty4j.
 *
 * @since 1.0
 */
public final class Pty4jProcessHandleFactory implements ProcessHandleFactory {

  @Override
  public ProcessHandle spawn(final PtyProcessConfig config) throws SpawnException {
    return new PtyProcessHandle(config);
  }
}
