package io.verbatim.css.parser;

import static io.verbatim.css.CssSyntaxKind.*;

import io.verbatim.css.CssSyntaxKind;
import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.parser.LexContext;
import io.verbatim.syntax.parser.LexedToken;
import io.verbatim.syntax.parser.Lexer;

/**
 * Lexer for the CSS subset. Whether identifiers lex as keywords depends on the {@link
 * CssLexContext}.
 */
public final class CssLexer implements Lexer {
  private final String text;

  public CssLexer(String text) {
    this.text = text;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public LexContext regularContext() {
    return CssLexContext.REGULAR;
  }

  @Override
  public LexedToken lex(int offset, LexContext context) {
    if (offset >= text.length()) {
      return LexedToken.token(EOF, offset, offset);
    }
    char c = text.charAt(offset);
    switch (c) {
      case '\n':
      case '\f':
        return LexedToken.trivia(TriviaKind.NEWLINE, offset, offset + 1);
      case '\r':
        return LexedToken.trivia(
            TriviaKind.NEWLINE, offset, offset + (peek(offset + 1) == '\n' ? 2 : 1));
      case ' ':
      case '\t':
        {
          int end = offset + 1;
          while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
          }
          return LexedToken.trivia(TriviaKind.WHITESPACE, offset, end);
        }
      case '"':
      case '\'':
        return lexString(offset, c);
      case '/':
        if (peek(offset + 1) == '*') {
          return lexComment(offset);
        }
        return LexedToken.token(SLASH, offset, offset + 1);
      case '#':
        if (isNameChar(peek(offset + 1))) {
          return LexedToken.token(CSS_HASH, offset, nameEnd(offset + 1));
        }
        break;
      default:
        break;
    }
    if (isNumberStart(offset)) {
      return lexNumber(offset);
    }
    if (isIdentStart(offset)) {
      int end = nameEnd(offset);
      CssSyntaxKind kind = IDENT;
      if (context == CssLexContext.REGULAR) {
        CssSyntaxKind keyword = CssSyntaxKind.keyword(text.substring(offset, end));
        if (keyword != null) {
          kind = keyword;
        }
      }
      return LexedToken.token(kind, offset, end);
    }
    CssSyntaxKind punct = punct(c);
    if (punct != null) {
      return LexedToken.token(punct, offset, offset + 1);
    }
    int end = offset + Character.charCount(text.codePointAt(offset));
    return LexedToken.error(
        ERROR_TOKEN, offset, end, "Unexpected character '" + text.substring(offset, end) + "'");
  }

  private static CssSyntaxKind punct(char c) {
    switch (c) {
      case '@':
        return AT;
      case '{':
        return L_CURLY;
      case '}':
        return R_CURLY;
      case '(':
        return L_PAREN;
      case ')':
        return R_PAREN;
      case '[':
        return L_BRACK;
      case ']':
        return R_BRACK;
      case ':':
        return COLON;
      case ';':
        return SEMICOLON;
      case ',':
        return COMMA;
      case '.':
        return DOT;
      case '*':
        return STAR;
      case '>':
        return GT;
      case '+':
        return PLUS;
      case '~':
        return TILDE;
      case '!':
        return BANG;
      case '=':
        return EQ;
      default:
        return null;
    }
  }

  private boolean isNumberStart(int offset) {
    char c = text.charAt(offset);
    int pos = offset;
    if (c == '+' || c == '-') {
      pos++;
    }
    if (Character.isDigit(peek(pos))) {
      return true;
    }
    return peek(pos) == '.' && Character.isDigit(peek(pos + 1));
  }

  private LexedToken lexNumber(int offset) {
    int pos = offset;
    if (text.charAt(pos) == '+' || text.charAt(pos) == '-') {
      pos++;
    }
    pos = digits(pos);
    if (peek(pos) == '.' && Character.isDigit(peek(pos + 1))) {
      pos = digits(pos + 1);
    }
    if (peek(pos) == 'e' || peek(pos) == 'E') {
      int exp = pos + 1;
      if (peek(exp) == '+' || peek(exp) == '-') {
        exp++;
      }
      if (Character.isDigit(peek(exp))) {
        pos = digits(exp);
      }
    }
    if (peek(pos) == '%') {
      return LexedToken.token(CSS_PERCENTAGE_LITERAL, offset, pos + 1);
    }
    if (pos < text.length() && isIdentStart(pos)) {
      return LexedToken.token(CSS_DIMENSION_LITERAL, offset, nameEnd(pos));
    }
    return LexedToken.token(CSS_NUMBER_LITERAL, offset, pos);
  }

  private int digits(int pos) {
    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  /** An identifier starts with a name-start character, or a hyphen followed by one or a hyphen. */
  private boolean isIdentStart(int offset) {
    char c = text.charAt(offset);
    if (isNameStart(c)) {
      return true;
    }
    return c == '-' && (isNameStart(peek(offset + 1)) || peek(offset + 1) == '-');
  }

  private int nameEnd(int pos) {
    while (pos < text.length() && isNameChar(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private static boolean isNameStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
  }

  private static boolean isNameChar(char c) {
    return isNameStart(c) || (c >= '0' && c <= '9') || c == '-';
  }

  private LexedToken lexString(int offset, char quote) {
    int pos = offset + 1;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == quote) {
        return LexedToken.token(CSS_STRING_LITERAL, offset, pos + 1);
      }
      if (c == '\\' && pos + 1 < text.length()) {
        pos += 2;
        continue;
      }
      if (c == '\n' || c == '\r' || c == '\f') {
        break;
      }
      pos++;
    }
    return LexedToken.error(ERROR_TOKEN, offset, pos, "Unterminated string");
  }

  private LexedToken lexComment(int offset) {
    int close = text.indexOf("*/", offset + 2);
    if (close < 0) {
      return LexedToken.trivia(TriviaKind.MULTI_LINE_COMMENT, offset, text.length())
          .withError("Unterminated block comment");
    }
    return LexedToken.trivia(TriviaKind.MULTI_LINE_COMMENT, offset, close + 2);
  }

  private char peek(int pos) {
    return pos < text.length() ? text.charAt(pos) : '\0';
  }
}
