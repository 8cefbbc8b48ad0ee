package com.claudia.terminal.pty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for spawning a PTY-attached process.
 *
 * @param executable executable to launch (absolute path or a name resolved through {@code PATH})
 * @param arguments arguments passed after the executable (never null, may be empty)
 * @param workingDirectory working directory for the spawned process
 * @param environment complete environment for the child process
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    String executable,
    List<String> arguments,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {

  public PtyProcessConfig {
    Validate.notBlank(executable, "executable must not be blank");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.isTrue(initialColumns > 0, "initialColumns must be positive");
    Validate.isTrue(initialRows > 0, "initialRows must be positive");
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Returns the full command line: executable followed by its arguments.
   *
   * @return command line
   */
  public List<String> commandLine() {
    final List<String> cmd = new ArrayList<>(this.arguments.size() + 1);
    cmd.add(this.executable);
    cmd.addAll(this.arguments);
    return cmd;
  }
}
