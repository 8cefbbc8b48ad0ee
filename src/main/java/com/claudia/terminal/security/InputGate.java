package com.claudia.terminal.security;

/**
 * Content filter applied to input for sandboxed sessions before it reaches the process.
 *
 * <p>{@link #quickCheck(String)} must be cheap and non-blocking. {@link #analyze(String)} may be
 * slower and is only consulted when the quick check returns {@link GateVerdict.Outcome#INCONCLUSIVE}.
 *
 * @since 1.0
 */
public interface InputGate {

  /**
   * Fast path check.
   *
   * @param input decoded input text
   * @return {@code SAFE}, {@code BLOCKED} or {@code INCONCLUSIVE}
   */
  GateVerdict quickCheck(final String input);

  /**
   * Full analysis.
   *
   * @param input decoded input text
   * @return {@code SAFE} or {@code BLOCKED}, never {@code INCONCLUSIVE}
   */
  GateVerdict analyze(final String input);

  /**
   * Runs the quick check and falls back to the full analysis when it is inconclusive.
   *
   * @param input decoded input text
   * @return final verdict
   */
  default GateVerdict evaluate(final String input) {
    final GateVerdict quick = quickCheck(input);
    if (quick.outcome() != GateVerdict.Outcome.INCONCLUSIVE) {
      return quick;
    }
    return analyze(input);
  }

  /**
   * Returns a gate that lets everything through.
   *
   * @return permissive gate
   */
  static InputGate permitAll() {
    return new InputGate() {
      @Override
      public GateVerdict quickCheck(final String input) {
        return GateVerdict.safe();
      }

      @Override
      public GateVerdict analyze(final String input) {
        return GateVerdict.safe();
      }
    };
  }
}
