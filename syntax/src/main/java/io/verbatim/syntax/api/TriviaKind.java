package io.verbatim.syntax.api;

/** Categories of text attached to tokens that carries no syntactic meaning. */
public enum TriviaKind {
  WHITESPACE,
  NEWLINE,
  SINGLE_LINE_COMMENT,
  MULTI_LINE_COMMENT;

  public boolean isComment() {
    return this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT;
  }
}
