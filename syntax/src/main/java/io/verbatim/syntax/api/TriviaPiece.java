package io.verbatim.syntax.api;

import java.util.Objects;

/**
 * A single whitespace, newline or comment fragment attached to a token.
 *
 * @param kind the trivia category
 * @param text the exact source text of the fragment
 */
public record TriviaPiece(TriviaKind kind, String text) {

  public TriviaPiece {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
  }

  public boolean isComment() {
    return kind.isComment();
  }

  /**
   * A newline piece, or a multi-line comment spanning more than one line.
   *
   * @return {@code true} if this piece contains a line break
   */
  public boolean hasLineBreak() {
    return kind == TriviaKind.NEWLINE
        || (kind == TriviaKind.MULTI_LINE_COMMENT
            && (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0));
  }
}
