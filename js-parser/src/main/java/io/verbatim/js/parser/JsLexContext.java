package io.verbatim.js.parser;

import io.verbatim.syntax.parser.LexContext;

public enum JsLexContext implements LexContext {
  /** {@code /} is a division operator. */
  REGULAR,
  /** {@code /} starts a regular expression literal; used where an expression may begin. */
  REGEX;

  @Override
  public boolean isRegular() {
    return this == REGULAR;
  }
}
