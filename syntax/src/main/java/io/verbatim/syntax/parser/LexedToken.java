package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TriviaKind;

/**
 * One raw lexeme: either a significant token ({@code kind} set) or a trivia piece ({@code trivia}
 * set).
 *
 * @param kind token kind, {@code null} for trivia
 * @param trivia trivia kind, {@code null} for significant tokens
 * @param start start offset, inclusive
 * @param end end offset, exclusive
 * @param error lexical error to report for this lexeme, or {@code null}
 */
public record LexedToken(SyntaxKind kind, TriviaKind trivia, int start, int end, String error) {

  public static LexedToken token(SyntaxKind kind, int start, int end) {
    return new LexedToken(kind, null, start, end, null);
  }

  public static LexedToken trivia(TriviaKind trivia, int start, int end) {
    return new LexedToken(null, trivia, start, end, null);
  }

  public static LexedToken error(SyntaxKind kind, int start, int end, String error) {
    return new LexedToken(kind, null, start, end, error);
  }

  public boolean isTrivia() {
    return trivia != null;
  }

  public LexedToken withError(String message) {
    return new LexedToken(kind, trivia, start, end, message);
  }
}
