package com.claudia.terminal.security;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * {@link PathPolicy} that confines sessions to a set of root directories and never allows a set
 * of protected locations (credentials, shell profiles, system configuration).
 *
 * <p>Relative segments ({@code ..}) are rejected outright. Protected paths win over allowed roots.
 * An empty root list allows any path that is not protected.
 *
 * @since 1.0
 */
public final class AllowedRootsPathPolicy implements PathPolicy {

  private final List<Path> allowedRoots;
  private final List<Path> protectedPaths;

  /**
   * Creates a policy.
   *
   * @param allowedRoots directories sessions may run in (including subdirectories)
   * @param protectedPaths directories that are always denied (including subdirectories)
   */
  public AllowedRootsPathPolicy(final List<Path> allowedRoots, final List<Path> protectedPaths) {
    Validate.notNull(allowedRoots, "allowedRoots must not be null");
    Validate.notNull(protectedPaths, "protectedPaths must not be null");
    this.allowedRoots = normalizeAll(allowedRoots);
    this.protectedPaths = normalizeAll(protectedPaths);
  }

  /**
   * Returns the default protected locations under the given home directory.
   *
   * @param home user home directory
   * @return protected paths
   */
  public static List<Path> defaultProtectedPaths(final Path home) {
    Validate.notNull(home, "home must not be null");
    return List.of(
        home.resolve(".ssh"),
        home.resolve(".gnupg"),
        home.resolve(".aws"),
        home.resolve(".config").resolve("gcloud"),
        home.resolve(".kube"),
        home.resolve(".docker"),
        home.resolve(".local").resolve("share"),
        Path.of("/etc"),
        Path.of("/root"),
        Path.of("/var"),
        Path.of("/usr/local/etc"));
  }

  @Override
  public PathDecision check(final String requestedPath, final String ownerId) {
    if (StringUtils.isBlank(requestedPath)) {
      return PathDecision.deny("Path is empty");
    }
    if (requestedPath.contains("..")) {
      return PathDecision.deny("Path traversal not allowed");
    }
    final Path path = Path.of(requestedPath).toAbsolutePath().normalize();
    for (final Path protectedPath : this.protectedPaths) {
      if (path.startsWith(protectedPath)) {
        return PathDecision.deny("Access to " + protectedPath + " is not allowed");
      }
    }
    if (this.allowedRoots.isEmpty()) {
      return PathDecision.allow();
    }
    for (final Path root : this.allowedRoots) {
      if (path.startsWith(root)) {
        return PathDecision.allow();
      }
    }
    return PathDecision.deny("Path must be within " + this.allowedRoots);
  }

  public List<Path> getAllowedRoots() {
    return this.allowedRoots;
  }

  private static List<Path> normalizeAll(final List<Path> paths) {
    final List<Path> normalized = new ArrayList<>(paths.size());
    for (final Path p : paths) {
      normalized.add(p.toAbsolutePath().normalize());
    }
    return List.copyOf(normalized);
  }
}
