package com.claudia.terminal.orchestrator;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrator configuration values.
 *
 * @param ringCapacity output chunks kept per session for replay
 * @param columns initial PTY columns
 * @param rows initial PTY rows
 * @param sweepInterval period of the cleanup sweep
 * @param foregroundTtl idle time after which a foreground session is retired
 * @param backgroundTtl idle time after which a background session is retired
 * @param stoppedTtl time a stopped session stays in memory
 * @param retireDelay delay between process exit and removal from memory, so late viewers still see
 *     the exit
 * @param keepaliveInterval period of viewer keepalives
 * @param stopPolicy multiplexer behavior on stop without ledger removal
 * @param sessionPrefix prefix of every multiplexer group name this server creates
 * @param executableName CLI file name searched on the {@code PATH}
 * @param executableCandidates explicit CLI locations probed before the {@code PATH}
 * @param extraPathDirs directories prepended to the child {@code PATH}
 * @since 1.0
 */
public record OrchestratorConfig(
    int ringCapacity,
    int columns,
    int rows,
    Duration sweepInterval,
    Duration foregroundTtl,
    Duration backgroundTtl,
    Duration stoppedTtl,
    Duration retireDelay,
    Duration keepaliveInterval,
    MultiplexerStopPolicy stopPolicy,
    String sessionPrefix,
    String executableName,
    List<Path> executableCandidates,
    List<Path> extraPathDirs) {

  private static final Logger LOGGER = LoggerFactory.getLogger(OrchestratorConfig.class);

  public static final String DEFAULT_RESOURCE = "claudia-terminal.properties";

  public OrchestratorConfig {
    Validate.isTrue(ringCapacity > 0, "ringCapacity must be positive");
    Validate.isTrue(columns > 0 && rows > 0, "columns/rows must be positive");
    requirePositive(sweepInterval, "sweepInterval");
    requirePositive(foregroundTtl, "foregroundTtl");
    requirePositive(backgroundTtl, "backgroundTtl");
    requirePositive(stoppedTtl, "stoppedTtl");
    Validate.notNull(retireDelay, "retireDelay must not be null");
    Validate.isTrue(!retireDelay.isNegative(), "retireDelay must not be negative");
    requirePositive(keepaliveInterval, "keepaliveInterval");
    Validate.notNull(stopPolicy, "stopPolicy must not be null");
    Validate.notBlank(sessionPrefix, "sessionPrefix must not be blank");
    Validate.notBlank(executableName, "executableName must not be blank");
    executableCandidates = executableCandidates == null ? List.of() : List.copyOf(executableCandidates);
    extraPathDirs = extraPathDirs == null ? List.of() : List.copyOf(extraPathDirs);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static OrchestratorConfig defaults() {
    final Path home = userHome();
    return new OrchestratorConfig(
        200,
        120,
        40,
        Duration.ofMinutes(1),
        Duration.ofHours(2),
        Duration.ofHours(24),
        Duration.ofMinutes(5),
        Duration.ofSeconds(5),
        Duration.ofSeconds(15),
        MultiplexerStopPolicy.DETACH,
        "claudia",
        "claude",
        List.of(
            home.resolve(".local/bin/claude"),
            Path.of("/usr/local/bin/claude"),
            Path.of("/usr/bin/claude"),
            Path.of("/opt/homebrew/bin/claude")),
        List.of(
            home.resolve(".local/bin"),
            Path.of("/usr/local/bin"),
            Path.of("/usr/bin")));
  }

  /**
   * Builds a configuration from properties, using {@link #defaults()} for missing keys.
   *
   * @param props properties
   * @return configuration
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static OrchestratorConfig fromProperties(final Properties props) {
    Validate.notNull(props, "props must not be null");
    final OrchestratorConfig d = defaults();
    return new OrchestratorConfig(
        intValue(props, "ring.capacity", d.ringCapacity()),
        intValue(props, "pty.columns", d.columns()),
        intValue(props, "pty.rows", d.rows()),
        durationValue(props, "sweep.interval", d.sweepInterval()),
        durationValue(props, "ttl.foreground", d.foregroundTtl()),
        durationValue(props, "ttl.background", d.backgroundTtl()),
        durationValue(props, "ttl.stopped", d.stoppedTtl()),
        durationValue(props, "retire.delay", d.retireDelay()),
        durationValue(props, "keepalive.interval", d.keepaliveInterval()),
        stopPolicyValue(props, "multiplexer.stop-policy", d.stopPolicy()),
        StringUtils.defaultIfBlank(StringUtils.trim(props.getProperty("multiplexer.session-prefix")),
            d.sessionPrefix()),
        StringUtils.defaultIfBlank(StringUtils.trim(props.getProperty("executable.name")), d.executableName()),
        pathList(props, "executable.candidates", d.executableCandidates()),
        pathList(props, "path.extra-dirs", d.extraPathDirs()));
  }

  /**
   * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults if absent.
   *
   * @return configuration
   */
  public static OrchestratorConfig loadDefault() {
    final Properties props = new Properties();
    try (InputStream in = OrchestratorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        LOGGER.debug("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
        return defaults();
      }
      props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new IllegalStateException("Unable to read " + DEFAULT_RESOURCE, e);
    }
    return fromProperties(props);
  }

  /**
   * Loads a properties file.
   *
   * @param file properties file
   * @return configuration
   * @throws IOException if the file cannot be read
   */
  public static OrchestratorConfig load(final Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    final Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    LOGGER.info("Loaded orchestrator configuration from {}", file);
    return fromProperties(props);
  }

  /**
   * Returns the idle time-to-live for a session mode.
   *
   * @param background whether the session is a background session
   * @return ttl
   */
  public Duration idleTtl(final boolean background) {
    return background ? this.backgroundTtl : this.foregroundTtl;
  }

  static Path expandHome(final String value) {
    final String trimmed = value.trim();
    if (trimmed.equals("~")) {
      return userHome();
    }
    if (trimmed.startsWith("~/")) {
      return userHome().resolve(trimmed.substring(2));
    }
    return Path.of(trimmed);
  }

  private static Path userHome() {
    return Path.of(System.getProperty("user.home", "/"));
  }

  private static void requirePositive(final Duration value, final String name) {
    Validate.notNull(value, "%s must not be null", name);
    Validate.isTrue(!value.isZero() && !value.isNegative(), "%s must be positive", name);
  }

  private static int intValue(final Properties props, final String key, final int fallback) {
    final String raw = StringUtils.trimToNull(props.getProperty(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }

  private static Duration durationValue(final Properties props, final String key, final Duration fallback) {
    final String raw = StringUtils.trimToNull(props.getProperty(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return Duration.parse(raw);
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 duration for " + key + ": " + raw, e);
    }
  }

  private static MultiplexerStopPolicy stopPolicyValue(final Properties props, final String key,
      final MultiplexerStopPolicy fallback) {
    final String raw = StringUtils.trimToNull(props.getProperty(key));
    if (raw == null) {
      return fallback;
    }
    try {
      return MultiplexerStopPolicy.valueOf(raw.toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
    }
  }

  private static List<Path> pathList(final Properties props, final String key, final List<Path> fallback) {
    final String raw = props.getProperty(key);
    if (raw == null) {
      return fallback;
    }
    final List<Path> paths = new ArrayList<>();
    for (final String entry : StringUtils.split(raw, ',')) {
      if (StringUtils.isNotBlank(entry)) {
        paths.add(expandHome(entry));
      }
    }
    return paths;
  }
}
