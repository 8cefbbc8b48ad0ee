package com.claudia.terminal.orchestrator;

import com.claudia.terminal.security.InjectionCategory;
import java.util.Set;

/**
 * Input to a sandboxed session was blocked by the input gate. Nothing was written to the process.
 *
 * @since 1.0
 */
public class InputRejectedException extends SessionException {

  private static final long serialVersionUID = 1L;

  private final Set<InjectionCategory> categories;

  public InputRejectedException(final String sessionId, final Set<InjectionCategory> categories) {
    super(ErrorCode.INPUT_REJECTED, sessionId, "Input rejected for session " + sessionId + ": " + categories);
    this.categories = Set.copyOf(categories);
  }

  public Set<InjectionCategory> getCategories() {
    return this.categories;
  }
}
