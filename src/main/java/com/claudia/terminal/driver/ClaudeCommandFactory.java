package com.claudia.terminal.driver;

import com.claudia.terminal.pty.PtyProcessConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Builds launch configurations for the Claude Code CLI.
 *
 * <p>
 * This class centralizes the decisions around:
 * <ul>
 * <li>CLI flags (permission bypass, resume by token, continue last conversation)</li>
 * <li>executable location</li>
 * <li>environment and initial PTY size</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class ClaudeCommandFactory {

  static final String FLAG_SKIP_PERMISSIONS = "--dangerously-skip-permissions";
  static final String FLAG_RESUME = "--resume";
  static final String FLAG_CONTINUE = "--continue";

  private final ExecutableLocator locator;
  private final Map<String, String> environment;
  private final int columns;
  private final int rows;

  /**
   * Creates a factory.
   *
   * @param locator executable locator
   * @param environment environment used for every launch (see {@link LaunchEnvironment})
   * @param columns initial PTY columns
   * @param rows initial PTY rows
   */
  public ClaudeCommandFactory(final ExecutableLocator locator, final Map<String, String> environment,
      final int columns, final int rows) {
    Validate.notNull(locator, "locator must not be null");
    Validate.notNull(environment, "environment must not be null");
    Validate.isTrue(columns > 0 && rows > 0, "columns/rows must be positive");
    this.locator = locator;
    this.environment = Map.copyOf(environment);
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Builds the CLI argument list.
   *
   * @param bypassPermissions skip the CLI's interactive permission prompts
   * @param resumeToken token of a prior conversation to resume (may be null)
   * @param continueLast continue the most recent conversation when no token is given
   * @return arguments
   */
  public List<String> cliArguments(final boolean bypassPermissions, final String resumeToken,
      final boolean continueLast) {
    final List<String> args = new ArrayList<>(3);
    if (bypassPermissions) {
      args.add(FLAG_SKIP_PERMISSIONS);
    }
    if (StringUtils.isNotBlank(resumeToken)) {
      args.add(FLAG_RESUME);
      args.add(resumeToken);
    } else if (continueLast) {
      args.add(FLAG_CONTINUE);
    }
    return args;
  }

  /**
   * Resolves the CLI executable.
   *
   * @return executable path
   * @throws ExecutableNotFoundException if not found
   */
  public Path resolveExecutable() throws ExecutableNotFoundException {
    return this.locator.locate();
  }

  /**
   * Builds a configuration that runs the CLI directly under the PTY.
   *
   * @param executable resolved executable
   * @param arguments CLI arguments
   * @param workingDirectory working directory
   * @return launch configuration
   */
  public PtyProcessConfig directLaunch(final Path executable, final List<String> arguments,
      final Path workingDirectory) {
    Validate.notNull(executable, "executable must not be null");
    return new PtyProcessConfig(executable.toString(), arguments, workingDirectory, this.environment,
        this.columns, this.rows);
  }

  /**
   * Builds a configuration that runs a multiplexer attach client under the PTY.
   *
   * @param attachCommand attach command line, executable first
   * @param workingDirectory working directory
   * @return launch configuration
   */
  public PtyProcessConfig attachLaunch(final List<String> attachCommand, final Path workingDirectory) {
    Validate.notEmpty(attachCommand, "attachCommand must not be empty");
    return new PtyProcessConfig(attachCommand.get(0), attachCommand.subList(1, attachCommand.size()),
        workingDirectory, this.environment, this.columns, this.rows);
  }

  public Map<String, String> getEnvironment() {
    return this.environment;
  }

  public int getColumns() {
    return this.columns;
  }

  public int getRows() {
    return this.rows;
  }
}
