package com.claudia.terminal.driver;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Builds the environment handed to the wrapped CLI.
 *
 * <p>The parent environment is inherited, {@code PATH} is prefixed with known install locations,
 * and the terminal type and locale are forced so the CLI renders the same regardless of how the
 * host process was started.
 *
 * @since 1.0
 */
public final class LaunchEnvironment {

  public static final String TERM = "xterm-256color";
  public static final String LOCALE = "en_US.UTF-8";

  private LaunchEnvironment() {
  }

  /**
   * Builds the child environment.
   *
   * @param parent parent environment (usually {@link System#getenv()})
   * @param extraPathDirs directories placed in front of the inherited {@code PATH}
   * @return new mutable environment map
   */
  public static Map<String, String> build(final Map<String, String> parent, final List<Path> extraPathDirs) {
    Validate.notNull(parent, "parent must not be null");
    Validate.notNull(extraPathDirs, "extraPathDirs must not be null");

    final Map<String, String> env = new LinkedHashMap<>(parent);
    env.put("PATH", extendedPath(parent.get("PATH"), extraPathDirs));
    env.put("TERM", TERM);
    env.put("COLORTERM", "truecolor");
    env.put("FORCE_COLOR", "3");
    env.put("LANG", LOCALE);
    env.put("LC_ALL", LOCALE);
    return env;
  }

  /**
   * Returns the directories of an extended {@code PATH}, duplicates removed, order preserved.
   *
   * @param inheritedPath inherited {@code PATH} value (may be null)
   * @param extraPathDirs directories placed first
   * @return search directories
   */
  public static List<Path> searchDirectories(final String inheritedPath, final List<Path> extraPathDirs) {
    final List<Path> dirs = new ArrayList<>();
    for (final String entry : StringUtils.split(extendedPath(inheritedPath, extraPathDirs), File.pathSeparatorChar)) {
      dirs.add(Path.of(entry));
    }
    return dirs;
  }

  private static String extendedPath(final String inheritedPath, final List<Path> extraPathDirs) {
    final Set<String> entries = new LinkedHashSet<>();
    for (final Path dir : extraPathDirs) {
      entries.add(dir.toString());
    }
    if (StringUtils.isNotBlank(inheritedPath)) {
      for (final String entry : StringUtils.split(inheritedPath, File.pathSeparatorChar)) {
        entries.add(entry);
      }
    }
    return String.join(File.pathSeparator, entries);
  }
}
