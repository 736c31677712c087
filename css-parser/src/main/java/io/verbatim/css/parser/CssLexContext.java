package io.verbatim.css.parser;

import io.verbatim.syntax.parser.LexContext;

public enum CssLexContext implements LexContext {
  /** Identifiers spelled like a keyword lex as that keyword. */
  REGULAR,
  /** Every identifier lexes as {@code IDENT}; used where a property name is expected. */
  NO_KEYWORD;

  @Override
  public boolean isRegular() {
    return this == REGULAR;
  }
}
