package io.verbatim.analyze;

/** Kind of code action a rule offers. */
public enum ActionCategory {
  /** Fixes the reported problem. */
  QUICK_FIX,
  /** Rewrites working code into an equivalent form. */
  REFACTOR
}
