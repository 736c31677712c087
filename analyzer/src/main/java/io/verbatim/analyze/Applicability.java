package io.verbatim.analyze;

/** How safe it is to apply an action without review. */
public enum Applicability {
  ALWAYS,
  MAYBE_INCORRECT,
  UNSPECIFIED
}
