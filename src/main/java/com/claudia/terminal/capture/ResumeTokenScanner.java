package com.claudia.terminal.capture;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Per-session scanner that feeds output chunks through a {@link ResumeTokenPolicy} until a token
 * is found, then stops for good.
 *
 * <p>A short tail of the previous chunk is carried over so a hint split across two reads still
 * matches. Not thread-safe; callers feed chunks from the single PTY reader.
 *
 * @since 1.0
 */
public final class ResumeTokenScanner {

  private static final int CARRY_OVER_CHARS = 256;

  // CSI sequences, OSC sequences terminated by BEL or ST, and lone two-byte escapes.
  private static final Pattern ANSI = Pattern.compile(
      "\\u001B\\[[0-?]*[ -/]*[@-~]|\\u001B\\][^\\u0007\\u001B]*(?:\\u0007|\\u001B\\\\)|\\u001B[@-Z\\\\-_]");

  private final ResumeTokenPolicy policy;
  private String tail = "";
  private boolean finished;

  public ResumeTokenScanner(final ResumeTokenPolicy policy) {
    Validate.notNull(policy, "policy must not be null");
    this.policy = policy;
  }

  /**
   * Scans one output chunk.
   *
   * @param chunk raw PTY bytes
   * @return the token the first time one is found; empty otherwise and forever after
   */
  public Optional<String> scan(final byte[] chunk) {
    if (this.finished || chunk == null || chunk.length == 0) {
      return Optional.empty();
    }
    final String text = this.tail + stripAnsi(new String(chunk, StandardCharsets.UTF_8));
    final Optional<String> token = this.policy.extract(text);
    if (token.isPresent()) {
      this.finished = true;
      this.tail = "";
      return token;
    }
    this.tail = text.length() > CARRY_OVER_CHARS ? text.substring(text.length() - CARRY_OVER_CHARS) : text;
    return Optional.empty();
  }

  /**
   * Stops scanning, e.g. because the session already carries a token.
   */
  public void finish() {
    this.finished = true;
    this.tail = "";
  }

  public boolean isFinished() {
    return this.finished;
  }

  static String stripAnsi(final String s) {
    if (s.indexOf('\u001B') < 0) {
      return s;
    }
    return ANSI.matcher(s).replaceAll("");
  }
}
