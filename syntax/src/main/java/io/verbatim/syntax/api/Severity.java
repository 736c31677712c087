package io.verbatim.syntax.api;

public enum Severity {
  HINT,
  INFORMATION,
  WARNING,
  ERROR
}
