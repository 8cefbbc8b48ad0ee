package com.claudia.terminal.mux;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * @since 1.0
 */
public final class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public Result run(final List<String> command, final Duration timeout) throws IOException, InterruptedException {
    LOGGER.debug("Executing command: {}", String.join(" ", command));
    final Process process = new ProcessBuilder(command)
        .redirectErrorStream(true)
        .start();
    process.getOutputStream().close();

    final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    final Thread drain = new Thread(() -> {
      try (InputStream in = process.getInputStream()) {
        in.transferTo(captured);
      } catch (final IOException e) {
        LOGGER.debug("Output drain ended for {}: {}", command.get(0), e.getMessage());
      }
    }, "command-drain");
    drain.setDaemon(true);
    drain.start();

    if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      throw new IOException("Command timed out after " + timeout + ": " + String.join(" ", command));
    }
    drain.join(timeout.toMillis());
    final String output;
    synchronized (captured) {
      output = captured.toString(StandardCharsets.UTF_8);
    }
    LOGGER.debug("Command finished with exit code {}: {}", process.exitValue(), command.get(0));
    return new Result(process.exitValue(), output);
  }
}
