package com.claudia.terminal.driver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the CLI executable.
 *
 * <p>Candidate paths are probed in order and the first existing file wins. When none exists, each
 * directory of the search path is checked for an executable with the configured name.
 *
 * @since 1.0
 */
public final class ExecutableLocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutableLocator.class);

  private final String executableName;
  private final List<Path> candidates;
  private final List<Path> searchPath;

  /**
   * Creates a locator.
   *
   * @param executableName file name searched for on the search path (e.g. "claude")
   * @param candidates explicit candidate paths, probed first and in order
   * @param searchPath directories searched after the candidates
   */
  public ExecutableLocator(final String executableName, final List<Path> candidates,
      final List<Path> searchPath) {
    Validate.notBlank(executableName, "executableName must not be blank");
    Validate.notNull(candidates, "candidates must not be null");
    Validate.notNull(searchPath, "searchPath must not be null");
    this.executableName = executableName;
    this.candidates = List.copyOf(candidates);
    this.searchPath = List.copyOf(searchPath);
  }

  /**
   * Resolves the executable.
   *
   * @return absolute path of the executable
   * @throws ExecutableNotFoundException when no candidate exists and nothing is found on the path
   */
  public Path locate() throws ExecutableNotFoundException {
    final List<Path> probed = new ArrayList<>(this.candidates.size() + this.searchPath.size());
    for (final Path candidate : this.candidates) {
      probed.add(candidate);
      if (Files.isRegularFile(candidate)) {
        LOGGER.debug("Found {} at candidate {}", this.executableName, candidate);
        return candidate.toAbsolutePath();
      }
    }
    for (final Path dir : this.searchPath) {
      final Path resolved = dir.resolve(this.executableName);
      probed.add(resolved);
      if (Files.isRegularFile(resolved) && Files.isExecutable(resolved)) {
        LOGGER.debug("Found {} on search path at {}", this.executableName, resolved);
        return resolved.toAbsolutePath();
      }
    }
    throw new ExecutableNotFoundException(this.executableName, probed);
  }
}
