package com.claudia.terminal.driver;

import java.nio.file.Path;
import java.util.List;

/**
 * Raised when the CLI executable cannot be found at any candidate location or on the search path.
 *
 * @since 1.0
 */
public class ExecutableNotFoundException extends Exception {

  private static final long serialVersionUID = 1L;

  private final List<Path> probed;

  public ExecutableNotFoundException(final String executableName, final List<Path> probed) {
    super("Executable '" + executableName + "' not found; probed " + probed);
    this.probed = List.copyOf(probed);
  }

  public List<Path> getProbed() {
    return this.probed;
  }
}
