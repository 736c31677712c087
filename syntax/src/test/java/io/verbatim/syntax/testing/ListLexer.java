package io.verbatim.syntax.testing;

import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.parser.LexContext;
import io.verbatim.syntax.parser.LexedToken;
import io.verbatim.syntax.parser.Lexer;

public final class ListLexer implements Lexer {
  public static final LexContext REGULAR = () -> true;

  private final String text;

  public ListLexer(String text) {
    this.text = text;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public LexContext regularContext() {
    return REGULAR;
  }

  @Override
  public LexedToken lex(int offset, LexContext context) {
    if (offset >= text.length()) {
      return LexedToken.token(ListKind.EOF, offset, offset);
    }
    char c = text.charAt(offset);
    int end = offset + 1;
    switch (c) {
      case ' ':
      case '\t':
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
          end++;
        }
        return LexedToken.trivia(TriviaKind.WHITESPACE, offset, end);
      case '\n':
        return LexedToken.trivia(TriviaKind.NEWLINE, offset, end);
      case '\r':
        if (end < text.length() && text.charAt(end) == '\n') {
          end++;
        }
        return LexedToken.trivia(TriviaKind.NEWLINE, offset, end);
      case '=':
        return LexedToken.token(ListKind.EQ, offset, end);
      case ',':
        return LexedToken.token(ListKind.COMMA, offset, end);
      case ';':
        return LexedToken.token(ListKind.SEMICOLON, offset, end);
      case '(':
        return LexedToken.token(ListKind.L_PAREN, offset, end);
      case ')':
        return LexedToken.token(ListKind.R_PAREN, offset, end);
      case '#':
        while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
          end++;
        }
        return LexedToken.trivia(TriviaKind.SINGLE_LINE_COMMENT, offset, end);
      default:
        break;
    }
    if (Character.isDigit(c)) {
      while (end < text.length() && Character.isDigit(text.charAt(end))) {
        end++;
      }
      return LexedToken.token(ListKind.NUMBER, offset, end);
    }
    if (Character.isLetter(c)) {
      while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
        end++;
      }
      return LexedToken.token(ListKind.NAME, offset, end);
    }
    return LexedToken.error(ListKind.ERROR_TOKEN, offset, end, "Unexpected character '" + c + "'");
  }
}
