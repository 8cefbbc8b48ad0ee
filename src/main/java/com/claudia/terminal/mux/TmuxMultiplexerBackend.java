package com.claudia.terminal.mux;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MultiplexerBackend} that drives the {@code tmux} command line.
 *
 * <p>Targets use the {@code =name} form so tmux matches the group name exactly rather than by
 * prefix.
 *
 * @since 1.0
 */
public final class TmuxMultiplexerBackend implements MultiplexerBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(TmuxMultiplexerBackend.class);

  static final String LIST_FORMAT = "#{session_name}\t#{session_created}\t#{session_attached}\t#{session_windows}";
  private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(10);

  private final String tmuxExecutable;
  private final CommandRunner runner;

  /**
   * Creates a backend using the {@code tmux} found on the {@code PATH}.
   */
  public TmuxMultiplexerBackend() {
    this("tmux", new ProcessCommandRunner());
  }

  /**
   * Creates a backend.
   *
   * @param tmuxExecutable tmux executable name or path
   * @param runner command runner
   */
  public TmuxMultiplexerBackend(final String tmuxExecutable, final CommandRunner runner) {
    Validate.notBlank(tmuxExecutable, "tmuxExecutable must not be blank");
    Validate.notNull(runner, "runner must not be null");
    this.tmuxExecutable = tmuxExecutable;
    this.runner = runner;
  }

  @Override
  public boolean isAvailable() {
    try {
      final CommandRunner.Result result = this.runner.run(List.of(this.tmuxExecutable, "-V"), COMMAND_TIMEOUT);
      return result.succeeded();
    } catch (final IOException e) {
      LOGGER.debug("tmux not available: {}", e.getMessage());
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public void createGroup(final String name, final Path workingDirectory, final List<String> command,
      final Map<String, String> environment, final int columns, final int rows) throws MultiplexerException {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.notEmpty(command, "command must not be empty");

    final List<String> line = new ArrayList<>();
    line.add(this.tmuxExecutable);
    line.add("new-session");
    line.add("-d");
    line.add("-s");
    line.add(name);
    line.add("-x");
    line.add(Integer.toString(columns));
    line.add("-y");
    line.add(Integer.toString(rows));
    line.add("-c");
    line.add(workingDirectory.toString());
    if (environment != null) {
      environment.forEach((key, value) -> {
        if (StringUtils.isNotEmpty(key) && value != null) {
          line.add("-e");
          line.add(key + "=" + value);
        }
      });
    }
    line.addAll(command);
    execute(line, "create group " + name);
    LOGGER.info("Created tmux group {} in {}", name, workingDirectory);
  }

  @Override
  public boolean hasGroup(final String name) {
    if (StringUtils.isBlank(name)) {
      return false;
    }
    try {
      return this.runner.run(List.of(this.tmuxExecutable, "has-session", "-t", target(name)), COMMAND_TIMEOUT)
          .succeeded();
    } catch (final IOException e) {
      LOGGER.debug("tmux has-session failed for {}: {}", name, e.getMessage());
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public List<String> attachCommand(final String name) {
    Validate.notBlank(name, "name must not be blank");
    return List.of(this.tmuxExecutable, "attach-session", "-t", target(name));
  }

  @Override
  public void detachClients(final String name) throws MultiplexerException {
    Validate.notBlank(name, "name must not be blank");
    execute(List.of(this.tmuxExecutable, "detach-client", "-s", target(name)), "detach group " + name);
    LOGGER.info("Detached clients from tmux group {}", name);
  }

  @Override
  public void killGroup(final String name) throws MultiplexerException {
    Validate.notBlank(name, "name must not be blank");
    execute(List.of(this.tmuxExecutable, "kill-session", "-t", target(name)), "kill group " + name);
    LOGGER.info("Killed tmux group {}", name);
  }

  @Override
  public List<MultiplexerGroup> listGroups() throws MultiplexerException {
    final CommandRunner.Result result = run(
        List.of(this.tmuxExecutable, "list-sessions", "-F", LIST_FORMAT), "list groups");
    if (!result.succeeded()) {
      if (isNoServer(result.output())) {
        return List.of();
      }
      throw new MultiplexerException("tmux list-sessions failed: " + StringUtils.trim(result.output()));
    }
    final List<MultiplexerGroup> groups = new ArrayList<>();
    for (final String line : StringUtils.split(result.output(), '\n')) {
      final MultiplexerGroup group = parseGroup(line);
      if (group != null) {
        groups.add(group);
      }
    }
    return groups;
  }

  static MultiplexerGroup parseGroup(final String line) {
    final String[] fields = StringUtils.splitPreserveAllTokens(StringUtils.stripEnd(line, "\r"), '\t');
    if (fields == null || fields.length < 4 || StringUtils.isBlank(fields[0])) {
      return null;
    }
    final long created = NumberUtils.toLong(fields[1], -1L);
    return new MultiplexerGroup(
        fields[0],
        created >= 0 ? Instant.ofEpochSecond(created) : null,
        NumberUtils.toInt(fields[2], 0) > 0,
        NumberUtils.toInt(fields[3], 0));
  }

  private static boolean isNoServer(final String output) {
    return StringUtils.containsIgnoreCase(output, "no server running")
        || StringUtils.containsIgnoreCase(output, "error connecting")
        || StringUtils.containsIgnoreCase(output, "no sessions");
  }

  private static String target(final String name) {
    return "=" + name;
  }

  private void execute(final List<String> command, final String action) throws MultiplexerException {
    final CommandRunner.Result result = run(command, action);
    if (!result.succeeded()) {
      throw new MultiplexerException("tmux failed to " + action + " (exit " + result.exitCode() + "): "
          + StringUtils.trim(result.output()));
    }
  }

  private CommandRunner.Result run(final List<String> command, final String action) throws MultiplexerException {
    try {
      return this.runner.run(command, COMMAND_TIMEOUT);
    } catch (final IOException e) {
      throw new MultiplexerException("tmux failed to " + action + ": " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MultiplexerException("Interrupted while trying to " + action, e);
    }
  }
}
