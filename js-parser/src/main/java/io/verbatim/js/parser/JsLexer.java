package io.verbatim.js.parser;

import static io.verbatim.js.JsSyntaxKind.*;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.parser.LexContext;
import io.verbatim.syntax.parser.LexedToken;
import io.verbatim.syntax.parser.Lexer;

/** Lexer for the JavaScript subset. Never fails: malformed input becomes {@code ERROR_TOKEN}. */
public final class JsLexer implements Lexer {
  private final String text;

  public JsLexer(String text) {
    this.text = text;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public LexContext regularContext() {
    return JsLexContext.REGULAR;
  }

  @Override
  public LexedToken lex(int offset, LexContext context) {
    if (offset >= text.length()) {
      return LexedToken.token(EOF, offset, offset);
    }
    char c = text.charAt(offset);
    switch (c) {
      case '\n':
      case '\u2028':
      case '\u2029':
        return LexedToken.trivia(TriviaKind.NEWLINE, offset, offset + 1);
      case '\r':
        return LexedToken.trivia(
            TriviaKind.NEWLINE, offset, offset + (peek(offset + 1) == '\n' ? 2 : 1));
      case '"':
      case '\'':
        return lexString(offset, c);
      case '/':
        if (peek(offset + 1) == '/') {
          return LexedToken.trivia(TriviaKind.SINGLE_LINE_COMMENT, offset, lineEnd(offset));
        }
        if (peek(offset + 1) == '*') {
          return lexBlockComment(offset);
        }
        if (context == JsLexContext.REGEX) {
          return lexRegex(offset);
        }
        return punct(offset, peek(offset + 1) == '=' ? SLASH_EQ : SLASH);
      default:
        break;
    }
    if (isWhitespace(c)) {
      int end = offset + 1;
      while (end < text.length() && isWhitespace(text.charAt(end))) {
        end++;
      }
      return LexedToken.trivia(TriviaKind.WHITESPACE, offset, end);
    }
    if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(offset + 1)))) {
      return lexNumber(offset);
    }
    if (Character.isJavaIdentifierStart(c)) {
      int end = offset + 1;
      while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
        end++;
      }
      JsSyntaxKind keyword = JsSyntaxKind.keyword(text.substring(offset, end));
      return LexedToken.token(keyword != null ? keyword : IDENT, offset, end);
    }
    JsSyntaxKind punct = lexPunct(offset, c);
    if (punct != null) {
      return punct(offset, punct);
    }
    int end = offset + Character.charCount(text.codePointAt(offset));
    return LexedToken.error(
        ERROR_TOKEN, offset, end, "Unexpected character '" + text.substring(offset, end) + "'");
  }

  private JsSyntaxKind lexPunct(int offset, char c) {
    char n = peek(offset + 1);
    char n2 = peek(offset + 2);
    switch (c) {
      case '(':
        return L_PAREN;
      case ')':
        return R_PAREN;
      case '{':
        return L_CURLY;
      case '}':
        return R_CURLY;
      case '[':
        return L_BRACK;
      case ']':
        return R_BRACK;
      case ';':
        return SEMICOLON;
      case ',':
        return COMMA;
      case '.':
        return DOT;
      case ':':
        return COLON;
      case '~':
        return TILDE;
      case '?':
        return n == '?' ? QUESTION2 : QUESTION;
      case '=':
        if (n == '>') return FAT_ARROW;
        if (n == '=') return n2 == '=' ? EQ3 : EQ2;
        return EQ;
      case '!':
        if (n == '=') return n2 == '=' ? NEQ2 : NEQ;
        return BANG;
      case '+':
        if (n == '+') return PLUS2;
        return n == '=' ? PLUS_EQ : PLUS;
      case '-':
        if (n == '-') return MINUS2;
        return n == '=' ? MINUS_EQ : MINUS;
      case '*':
        return n == '=' ? STAR_EQ : STAR;
      case '%':
        return n == '=' ? PERCENT_EQ : PERCENT;
      case '<':
        return n == '=' ? LTEQ : LT;
      case '>':
        return n == '=' ? GTEQ : GT;
      case '&':
        return n == '&' ? AMP2 : null;
      case '|':
        return n == '|' ? PIPE2 : null;
      default:
        return null;
    }
  }

  private LexedToken punct(int offset, JsSyntaxKind kind) {
    return LexedToken.token(kind, offset, offset + kind.tokenText().length());
  }

  private LexedToken lexString(int offset, char quote) {
    int pos = offset + 1;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == quote) {
        return LexedToken.token(JS_STRING_LITERAL, offset, pos + 1);
      }
      if (c == '\\' && pos + 1 < text.length()) {
        pos += 2;
        continue;
      }
      if (c == '\n' || c == '\r') {
        break;
      }
      pos++;
    }
    return LexedToken.error(ERROR_TOKEN, offset, pos, "Unterminated string literal");
  }

  private LexedToken lexNumber(int offset) {
    int pos = offset;
    if (text.charAt(pos) == '0' && (peek(pos + 1) == 'x' || peek(pos + 1) == 'X')) {
      pos += 2;
      while (pos < text.length() && Character.digit(text.charAt(pos), 16) >= 0) {
        pos++;
      }
    } else {
      pos = digits(pos);
      if (peek(pos) == '.') {
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
    }
    if (pos < text.length() && Character.isJavaIdentifierStart(text.charAt(pos))) {
      int end = pos;
      while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
        end++;
      }
      return LexedToken.error(
          ERROR_TOKEN, offset, end, "An identifier cannot immediately follow a numeric literal");
    }
    return LexedToken.token(JS_NUMBER_LITERAL, offset, pos);
  }

  private int digits(int pos) {
    while (pos < text.length()
        && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
      pos++;
    }
    return pos;
  }

  private LexedToken lexBlockComment(int offset) {
    int close = text.indexOf("*/", offset + 2);
    if (close < 0) {
      return LexedToken.trivia(TriviaKind.MULTI_LINE_COMMENT, offset, text.length())
          .withError("Unterminated block comment");
    }
    return LexedToken.trivia(TriviaKind.MULTI_LINE_COMMENT, offset, close + 2);
  }

  private LexedToken lexRegex(int offset) {
    int pos = offset + 1;
    boolean inClass = false;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\n' || c == '\r') {
        break;
      }
      if (c == '\\') {
        pos += 2;
        continue;
      }
      if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        pos++;
        while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
          pos++;
        }
        return LexedToken.token(JS_REGEX_LITERAL, offset, pos);
      }
      pos++;
    }
    return LexedToken.error(
        ERROR_TOKEN, offset, Math.min(pos, text.length()), "Unterminated regex literal");
  }

  private int lineEnd(int offset) {
    int pos = offset;
    while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private char peek(int pos) {
    return pos < text.length() ? text.charAt(pos) : '\0';
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
  }

  private static boolean isWhitespace(char c) {
    return c == ' '
        || c == '\t'
        || c == '\u000B'
        || c == '\f'
        || c == '\u00A0'
        || c == '\uFEFF'
        || (Character.getType(c) == Character.SPACE_SEPARATOR);
  }
}
