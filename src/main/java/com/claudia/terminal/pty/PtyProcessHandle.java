package com.claudia.terminal.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessHandle} implemented with pty4j.
 *
 * <p>Two daemon threads back each handle once the event pump is started: a reader that copies PTY
 * output into {@link ProcessEventListener#onData(byte[])}, and an exit monitor that waits for the
 * process, lets the reader drain, then fires {@link ProcessEventListener#onExit(ProcessExit)}.
 *
 * @since 1.0
 */
public final class PtyProcessHandle implements ProcessHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessHandle.class);

  private static final int READ_BUFFER_SIZE = 8192;
  private static final long READER_DRAIN_MILLIS = 2_000L;

  private final PtyProcess process;
  private final long pid;
  private final AtomicBoolean killRequested = new AtomicBoolean();
  private final AtomicBoolean pumpStarted = new AtomicBoolean();
  private final Object writeLock = new Object();

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws SpawnException if process cannot be started
   */
  public PtyProcessHandle(final PtyProcessConfig config) throws SpawnException {
    Validate.notNull(config, "config must not be null");

    final String[] cmd = config.commandLine().toArray(new String[0]);
    final PtyProcessBuilder builder = new PtyProcessBuilder(cmd)
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(config.environment())
        .setInitialColumns(config.initialColumns())
        .setInitialRows(config.initialRows())
        .setConsole(false)
        .setRedirectErrorStream(true);

    try {
      this.process = builder.start();
    } catch (final IOException e) {
      throw new SpawnException("Failed to spawn " + config.executable() + ": " + e.getMessage(), e);
    }
    this.pid = this.process.pid();
    LOGGER.info("Spawned PTY process pid={} command={} cwd={}", this.pid, config.commandLine(),
        config.workingDirectory());
  }

  @Override
  public long pid() {
    return this.pid;
  }

  @Override
  public void write(final byte[] bytes) throws IOException {
    Validate.notNull(bytes, "bytes must not be null");
    synchronized (this.writeLock) {
      final OutputStream in = this.process.getOutputStream();
      in.write(bytes);
      in.flush();
    }
  }

  @Override
  public void resize(final int columns, final int rows) throws ResizeException {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    if (!this.process.isAlive()) {
      throw new ResizeException("process " + this.pid + " has exited");
    }
    try {
      this.process.setWinSize(new WinSize(columns, rows));
    } catch (final RuntimeException e) {
      LOGGER.warn("PTY resize failed for pid={}: {}", this.pid, e.getMessage(), e);
      throw new ResizeException("resize failed for pid " + this.pid, e);
    }
  }

  @Override
  public void kill() {
    if (this.process.isAlive()) {
      LOGGER.info("Killing PTY process pid={}", this.pid);
      this.killRequested.set(true);
      this.process.destroy();
    }
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void startEventPump(final ProcessEventListener listener) {
    Validate.notNull(listener, "listener must not be null");
    Validate.validState(this.pumpStarted.compareAndSet(false, true), "event pump already started");

    final Thread reader = new Thread(() -> readLoop(listener), "pty-reader-" + this.pid);
    reader.setDaemon(true);
    reader.start();

    final Thread monitor = new Thread(() -> awaitExit(reader, listener), "pty-exit-" + this.pid);
    monitor.setDaemon(true);
    monitor.start();
  }

  private void readLoop(final ProcessEventListener listener) {
    final InputStream out = this.process.getInputStream();
    final byte[] buffer = new byte[READ_BUFFER_SIZE];
    while (true) {
      final int n;
      try {
        n = out.read(buffer);
      } catch (final IOException e) {
        // The PTY master reports EIO once the child side closes.
        LOGGER.debug("PTY read ended for pid={}: {}", this.pid, e.getMessage());
        return;
      }
      if (n < 0) {
        return;
      }
      if (n == 0) {
        continue;
      }
      final byte[] copy = new byte[n];
      System.arraycopy(buffer, 0, copy, 0, n);
      try {
        listener.onData(copy);
      } catch (final RuntimeException e) {
        LOGGER.warn("Output listener failed for pid={}", this.pid, e);
      }
    }
  }

  private void awaitExit(final Thread reader, final ProcessEventListener listener) {
    final ProcessExit exit;
    try {
      exit = toExit(this.process.waitFor());
      reader.join(READER_DRAIN_MILLIS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for pid={} to exit", this.pid);
      return;
    }
    LOGGER.info("PTY process pid={} exited code={} signal={}", this.pid, exit.exitCode(), exit.signal());
    try {
      listener.onExit(exit);
    } catch (final RuntimeException e) {
      LOGGER.warn("Exit listener failed for pid={}", this.pid, e);
    }
  }

  /**
   * A status of {@code 128 + n} is reported as signal {@code n} only after this handle sent the
   * kill; a program may exit with such a code on its own.
   */
  private ProcessExit toExit(final int status) {
    if (this.killRequested.get() && ProcessExit.isSignalStatus(status)) {
      return ProcessExit.signaled(status - ProcessExit.SIGNAL_BASE);
    }
    return ProcessExit.fromStatus(status);
  }
}
