package com.claudia.terminal.security;

import java.text.Normalizer;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regex-based prompt-injection gate.
 *
 * <p>Input is NFKC-normalized before matching so full-width and other compatibility characters
 * cannot slip past the ASCII patterns. The quick check only looks for the most common injection
 * markers; a hit there is reported as inconclusive and resolved by the full pattern table.
 *
 * <p>Critical and high severity matches block. Medium matches (including suspicious phrases)
 * block only in strict mode; otherwise they are reported as categories on a safe verdict.
 *
 * @since 1.0
 */
public final class PatternInputGate implements InputGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatternInputGate.class);

  /**
   * One entry of the pattern table.
   *
   * @param pattern compiled pattern
   * @param category category reported on a match
   * @param severity match severity
   * @param description human-readable description
   */
  public record Rule(Pattern pattern, InjectionCategory category, Severity severity, String description) {

    public Rule {
      Validate.notNull(pattern, "pattern must not be null");
      Validate.notNull(category, "category must not be null");
      Validate.notNull(severity, "severity must not be null");
    }

    static Rule of(final String regex, final InjectionCategory category, final Severity severity,
        final String description) {
      return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE), category, severity,
          description);
    }
  }

  static final List<Pattern> QUICK_PATTERNS = List.of(
      Pattern.compile("ignore\\s+(all\\s+)?previous", Pattern.CASE_INSENSITIVE),
      Pattern.compile("you\\s+are\\s+now", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^\\s*SYSTEM\\s*:", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
      Pattern.compile("^\\s*\\[SYSTEM\\]", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE),
      Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
      Pattern.compile("bypass\\s+(filter|security)", Pattern.CASE_INSENSITIVE));

  public static final List<Rule> DEFAULT_RULES = List.of(
      Rule.of("ignore\\s+(all\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|rules?|context)",
          InjectionCategory.INSTRUCTION_OVERRIDE, Severity.CRITICAL, "ignore previous instructions"),
      Rule.of("disregard\\s+(all\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|rules?)",
          InjectionCategory.INSTRUCTION_OVERRIDE, Severity.CRITICAL, "disregard prior context"),
      Rule.of("forget\\s+(everything|all|what)\\s+(you('ve)?\\s+)?(know|learned|been\\s+told)",
          InjectionCategory.INSTRUCTION_OVERRIDE, Severity.CRITICAL, "reset memory"),
      Rule.of("override\\s+(your\\s+)?(instructions?|programming|rules?|guidelines?)",
          InjectionCategory.INSTRUCTION_OVERRIDE, Severity.CRITICAL, "override instructions"),
      Rule.of("new\\s+instructions?:\\s*you\\s+(are|will|must|should)",
          InjectionCategory.INSTRUCTION_OVERRIDE, Severity.CRITICAL, "new instruction injection"),

      Rule.of("you\\s+are\\s+now\\s+(a\\s+)?(different|new|another)\\s+(ai|assistant|model|system)",
          InjectionCategory.AI_IMPERSONATION, Severity.CRITICAL, "identity change"),
      Rule.of("pretend\\s+(to\\s+be|you('re|\\s+are))\\s+(a\\s+)?(different|another|new)",
          InjectionCategory.AI_IMPERSONATION, Severity.HIGH, "pretend to be different"),
      Rule.of("from\\s+now\\s+on,?\\s+(you\\s+)?(are|will\\s+be|act\\s+as)",
          InjectionCategory.AI_IMPERSONATION, Severity.HIGH, "identity directive"),
      Rule.of("act\\s+as\\s+(if\\s+)?(you('re|\\s+are)\\s+)?(a\\s+)?different",
          InjectionCategory.AI_IMPERSONATION, Severity.HIGH, "act as different entity"),
      Rule.of("rolep?lay\\s+as\\s+(a\\s+)?(malicious|evil|unfiltered|jailbroken)",
          InjectionCategory.AI_IMPERSONATION, Severity.CRITICAL, "malicious roleplay"),

      Rule.of("(show|reveal|display|print|output)\\s+(me\\s+)?(your\\s+)?(system\\s+)?prompt",
          InjectionCategory.SYSTEM_PROMPT_ACCESS, Severity.HIGH, "system prompt extraction"),
      Rule.of("what\\s+(are|is)\\s+your\\s+(system\\s+)?(instructions?|prompt|rules?)",
          InjectionCategory.SYSTEM_PROMPT_ACCESS, Severity.MEDIUM, "system instruction query"),
      Rule.of("repeat\\s+(your\\s+)?(system\\s+)?(instructions?|prompt|rules?)",
          InjectionCategory.SYSTEM_PROMPT_ACCESS, Severity.HIGH, "system prompt repeat"),
      Rule.of("dump\\s+(your\\s+)?(system|initial|original)\\s+(prompt|instructions?)",
          InjectionCategory.SYSTEM_PROMPT_ACCESS, Severity.CRITICAL, "system prompt dump"),

      Rule.of("modify\\s+(claudia|this\\s+system|the\\s+admin|claudia\\s*code)",
          InjectionCategory.CLAUDIA_MODIFICATION, Severity.CRITICAL, "host modification"),
      Rule.of("(hack|bypass|break|disable)\\s+(claudia|security|restrictions?|filters?)",
          InjectionCategory.CLAUDIA_MODIFICATION, Severity.CRITICAL, "security bypass"),
      Rule.of("change\\s+(claudia'?s?|the\\s+system'?s?)\\s+(behavior|rules?|settings?)",
          InjectionCategory.CLAUDIA_MODIFICATION, Severity.CRITICAL, "behavior modification"),
      Rule.of("inject\\s+(code|script|command)\\s+into\\s+(claudia|system)",
          InjectionCategory.CLAUDIA_MODIFICATION, Severity.CRITICAL, "code injection into host"),

      Rule.of("^\\s*SYSTEM\\s*:", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "SYSTEM: prefix"),
      Rule.of("^\\s*\\[SYSTEM\\]", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "[SYSTEM] prefix"),
      Rule.of("^\\s*<system>", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "<system> tag"),
      Rule.of("^\\s*<<SYS>>", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "<<SYS>> prefix"),
      Rule.of("^\\s*###\\s*SYSTEM", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "### SYSTEM prefix"),
      Rule.of("^\\s*ADMIN\\s*:", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "ADMIN: prefix"),
      Rule.of("^\\s*ROOT\\s*:", InjectionCategory.SYSTEM_PREFIX, Severity.HIGH, "ROOT: prefix"),

      Rule.of("\\[\\s*new\\s*role\\s*\\]", InjectionCategory.ROLE_HIJACKING, Severity.HIGH, "role change bracket"),
      Rule.of("entering\\s+(developer|admin|root|sudo|god)\\s+mode",
          InjectionCategory.ROLE_HIJACKING, Severity.CRITICAL, "privileged mode entry"),
      Rule.of("activate\\s+(dan|jailbreak|unrestricted)\\s+mode",
          InjectionCategory.ROLE_HIJACKING, Severity.CRITICAL, "jailbreak mode activation"),
      Rule.of("developer\\s+mode\\s+enabled", InjectionCategory.ROLE_HIJACKING, Severity.CRITICAL,
          "developer mode claim"),

      Rule.of("end\\s+of\\s+(system\\s+)?(prompt|instructions?|context)",
          InjectionCategory.CONTEXT_MANIPULATION, Severity.MEDIUM, "context boundary"),
      Rule.of("---+\\s*end\\s+of\\s+context\\s*---+", InjectionCategory.CONTEXT_MANIPULATION, Severity.MEDIUM,
          "context delimiter"),
      Rule.of("\\]\\]\\s*>\\s*user\\s*:", InjectionCategory.CONTEXT_MANIPULATION, Severity.HIGH, "format escape"),

      Rule.of("eval\\s*\\(\\s*['\"`]", InjectionCategory.CODE_INJECTION, Severity.HIGH, "eval injection"),
      Rule.of("exec\\s*\\(\\s*['\"`]", InjectionCategory.CODE_INJECTION, Severity.HIGH, "exec injection"),
      Rule.of("import\\s+os\\s*;?\\s*os\\.(system|popen|exec)", InjectionCategory.CODE_INJECTION,
          Severity.CRITICAL, "python os command"),
      Rule.of("require\\s*\\(\\s*['\"]child_process['\"]\\s*\\)", InjectionCategory.CODE_INJECTION,
          Severity.CRITICAL, "node child_process"));

  public static final List<String> SUSPICIOUS_PHRASES = List.of(
      "jailbreak", "dan mode", "do anything now", "ignore ethics", "ignore safety", "bypass filter",
      "bypass moderation", "unlimited mode", "no restrictions", "without limits", "remove all restrictions",
      "disable safety", "hypothetically speaking", "in a fictional scenario", "for educational purposes only",
      "as an experiment");

  private final List<Rule> rules;
  private final boolean strict;

  /**
   * Creates a non-strict gate with the default rules.
   */
  public PatternInputGate() {
    this(DEFAULT_RULES, false);
  }

  /**
   * Creates a gate.
   *
   * @param rules pattern table
   * @param strict when true, medium severity matches and suspicious phrases also block
   */
  public PatternInputGate(final List<Rule> rules, final boolean strict) {
    Validate.notNull(rules, "rules must not be null");
    this.rules = List.copyOf(rules);
    this.strict = strict;
  }

  @Override
  public GateVerdict quickCheck(final String input) {
    if (StringUtils.isBlank(input)) {
      return GateVerdict.safe();
    }
    final String normalized = normalize(input);
    for (final Pattern pattern : QUICK_PATTERNS) {
      if (pattern.matcher(normalized).find()) {
        LOGGER.debug("Quick check hit {}; full analysis required", pattern.pattern());
        return GateVerdict.inconclusive();
      }
    }
    return GateVerdict.safe();
  }

  @Override
  public GateVerdict analyze(final String input) {
    if (StringUtils.isBlank(input)) {
      return GateVerdict.safe();
    }
    final String normalized = normalize(input);
    final Set<InjectionCategory> observed = EnumSet.noneOf(InjectionCategory.class);
    final Set<InjectionCategory> blocking = EnumSet.noneOf(InjectionCategory.class);
    for (final Rule rule : this.rules) {
      if (rule.pattern().matcher(normalized).find()) {
        observed.add(rule.category());
        if (rule.severity().atLeast(Severity.HIGH) || (this.strict && rule.severity() == Severity.MEDIUM)) {
          blocking.add(rule.category());
        }
        LOGGER.debug("Pattern matched: {} ({}, {})", rule.description(), rule.category(), rule.severity());
      }
    }
    final String lowered = normalized.toLowerCase(Locale.ROOT);
    for (final String phrase : SUSPICIOUS_PHRASES) {
      if (lowered.contains(phrase)) {
        observed.add(InjectionCategory.CONTEXT_MANIPULATION);
        if (this.strict) {
          blocking.add(InjectionCategory.CONTEXT_MANIPULATION);
        }
      }
    }
    if (!blocking.isEmpty()) {
      LOGGER.warn("Input blocked, categories {}", blocking);
      return GateVerdict.blocked(blocking);
    }
    return GateVerdict.safe(observed);
  }

  public boolean isStrict() {
    return this.strict;
  }

  static String normalize(final String input) {
    return Normalizer.normalize(input, Normalizer.Form.NFKC);
  }
}
