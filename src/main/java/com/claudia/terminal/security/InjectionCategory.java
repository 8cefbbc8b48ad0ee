package com.claudia.terminal.security;

import java.util.Locale;

/**
 * Categories of prompt-injection patterns reported by an {@link InputGate}.
 *
 * @since 1.0
 */
public enum InjectionCategory {
  INSTRUCTION_OVERRIDE,
  AI_IMPERSONATION,
  SYSTEM_PROMPT_ACCESS,
  SYSTEM_PREFIX,
  ROLE_HIJACKING,
  CONTEXT_MANIPULATION,
  CODE_INJECTION,
  CLAUDIA_MODIFICATION;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
