package com.claudia.terminal.capture;

import java.util.Optional;

/**
 * Policy for recognizing the wrapped CLI's self-reported resume hint in its terminal output.
 *
 * <p>The CLI's output is human-readable and unversioned. Implementations are heuristic: a miss is
 * never an error, only a lost chance to resume later.
 *
 * @since 1.0
 */
public interface ResumeTokenPolicy {

  /**
   * Returns the first resume token found in the text.
   *
   * @param text decoded output with terminal escape sequences already removed
   * @return token, or empty when no rule matched
   */
  Optional<String> extract(final String text);
}
