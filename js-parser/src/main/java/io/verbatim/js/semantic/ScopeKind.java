package io.verbatim.js.semantic;

public enum ScopeKind {
  MODULE,
  FUNCTION,
  ARROW_FUNCTION,
  BLOCK,
  FOR;

  /** Whether {@code var} declarations and parameters land in scopes of this kind. */
  public boolean isFunctionLike() {
    return this == MODULE || this == FUNCTION || this == ARROW_FUNCTION;
  }
}
