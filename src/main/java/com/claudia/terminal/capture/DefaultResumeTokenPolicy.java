package com.claudia.terminal.capture;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Ordered list of matcher rules; the first rule that matches wins.
 *
 * <p>Default rules recognize:
 * <ul>
 * <li>{@code claude --resume <token>} (any tool name)</li>
 * <li>{@code session id: <token>}</li>
 * <li>{@code Resuming <token>} / {@code Resuming session <token>}</li>
 * </ul>
 * A token only counts once a delimiter follows it, so a token cut off at a chunk boundary is not
 * reported truncated.
 * </p>
 *
 * @since 1.0
 */
public final class DefaultResumeTokenPolicy implements ResumeTokenPolicy {

  private static final String TOKEN = "([A-Za-z0-9][A-Za-z0-9_-]{7,127})";
  private static final String TERMINATED = "(?=[\\s\"'`),.;\\]]|\\u001B)";

  /**
   * A single named extraction rule. Group 1 of the pattern captures the token.
   *
   * @param name rule name, used in logs
   * @param pattern pattern with the token in group 1
   */
  public record MatchRule(String name, Pattern pattern) {

    public MatchRule {
      Validate.notBlank(name, "name must not be blank");
      Validate.notNull(pattern, "pattern must not be null");
    }
  }

  public static final List<MatchRule> DEFAULT_RULES = List.of(
      new MatchRule("resume-flag",
          Pattern.compile("[\\w.-]+\\s+(?:--resume|-r)\\s+" + TOKEN + TERMINATED)),
      new MatchRule("session-id",
          Pattern.compile("session[ _-]?id\\s*[:=]\\s*" + TOKEN + TERMINATED, Pattern.CASE_INSENSITIVE)),
      new MatchRule("resuming",
          Pattern.compile("Resuming\\s+(?:session\\s+|conversation\\s+)?" + TOKEN + TERMINATED)));

  private final List<MatchRule> rules;

  public DefaultResumeTokenPolicy() {
    this(DEFAULT_RULES);
  }

  /**
   * Creates a policy with custom rules.
   *
   * @param rules rules in priority order
   */
  public DefaultResumeTokenPolicy(final List<MatchRule> rules) {
    Validate.notEmpty(rules, "rules must not be empty");
    this.rules = List.copyOf(rules);
  }

  @Override
  public Optional<String> extract(final String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    for (final MatchRule rule : this.rules) {
      final Matcher m = rule.pattern().matcher(text);
      if (m.find()) {
        return Optional.of(m.group(1));
      }
    }
    return Optional.empty();
  }
}
