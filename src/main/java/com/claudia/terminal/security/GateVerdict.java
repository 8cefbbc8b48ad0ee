package com.claudia.terminal.security;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * Result of running input through an {@link InputGate}.
 *
 * @param outcome verdict
 * @param categories categories of every pattern that matched, including non-blocking ones
 * @since 1.0
 */
public record GateVerdict(Outcome outcome, Set<InjectionCategory> categories) {

  /**
   * Gate outcome.
   */
  public enum Outcome {
    /** Input may be delivered. */
    SAFE,
    /** Input must not be delivered. */
    BLOCKED,
    /** The fast path could not decide; a full analysis is required. */
    INCONCLUSIVE
  }

  public GateVerdict {
    Validate.notNull(outcome, "outcome must not be null");
    categories = categories == null || categories.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(categories));
  }

  public static GateVerdict safe() {
    return new GateVerdict(Outcome.SAFE, Set.of());
  }

  public static GateVerdict safe(final Collection<InjectionCategory> observed) {
    return new GateVerdict(Outcome.SAFE, observed == null ? Set.of() : Set.copyOf(observed));
  }

  public static GateVerdict blocked(final Collection<InjectionCategory> categories) {
    Validate.notEmpty(categories, "a blocked verdict needs at least one category");
    return new GateVerdict(Outcome.BLOCKED, Set.copyOf(categories));
  }

  public static GateVerdict inconclusive() {
    return new GateVerdict(Outcome.INCONCLUSIVE, Set.of());
  }

  public boolean isBlocked() {
    return this.outcome == Outcome.BLOCKED;
  }
}
