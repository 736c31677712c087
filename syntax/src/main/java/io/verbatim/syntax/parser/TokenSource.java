package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TextRange;
import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.api.TriviaPiece;
import io.verbatim.syntax.green.GreenToken;
import java.util.ArrayList;
import java.util.List;

/**
 * Lazy token stream over a {@link Lexer} that folds trivia into the surrounding tokens.
 *
 * <p>Trivia on the same line after a token, up to but excluding the next line break, is the
 * token's trailing trivia. Everything else before a token is its leading trivia. The end-of-file
 * token collects the trivia at the end of the text, so concatenating all tokens reproduces the
 * source exactly.
 *
 * <p>The current token is lexed in the context the parser asked for when it consumed the previous
 * token. Lookahead tokens are lexed in the regular context and reused only when the parser
 * advances in that context.
 */
public final class TokenSource {

  /** A token together with its position information. */
  record Lexed(
      GreenToken token,
      int start,
      int tokenStart,
      int end,
      boolean precedingLineBreak,
      List<Diagnostic> errors) {

    SyntaxKind kind() {
      return token.kind();
    }

    TextRange range() {
      return TextRange.of(tokenStart, tokenStart + token.text().length());
    }
  }

  private final Lexer lexer;
  private final String text;
  private final List<Lexed> ahead = new ArrayList<>();
  private Lexed current;

  public TokenSource(Lexer lexer) {
    this.lexer = lexer;
    this.text = lexer.text();
    this.current = lexAt(0, lexer.regularContext());
  }

  public String text() {
    return text;
  }

  public SyntaxKind current() {
    return current.kind();
  }

  /** Range of the current token's significant text. */
  public TextRange currentRange() {
    return current.range();
  }

  public String currentText() {
    return current.token().text();
  }

  public boolean hasPrecedingLineBreak() {
    return current.precedingLineBreak();
  }

  /** Kind of the {@code n}-th token after the current one; {@code nth(0)} is the current kind. */
  public SyntaxKind nth(int n) {
    if (n == 0) {
      return current.kind();
    }
    while (ahead.size() < n) {
      Lexed last = ahead.isEmpty() ? current : ahead.get(ahead.size() - 1);
      if (last.kind().isEof()) {
        return last.kind();
      }
      ahead.add(lexAt(last.end(), lexer.regularContext()));
    }
    return ahead.get(n - 1).kind();
  }

  /** Whether a line break precedes the {@code n}-th token after the current one. */
  public boolean nthHasPrecedingLineBreak(int n) {
    if (n == 0) {
      return current.precedingLineBreak();
    }
    nth(n);
    return ahead.size() >= n && ahead.get(n - 1).precedingLineBreak();
  }

  /**
   * Consumes the current token and lexes the next one in {@code nextContext}.
   *
   * @return the consumed token
   */
  Lexed bump(LexContext nextContext) {
    Lexed consumed = current;
    if (nextContext.isRegular() && !ahead.isEmpty()) {
      current = ahead.remove(0);
    } else {
      ahead.clear();
      current = lexAt(consumed.end(), nextContext);
    }
    return consumed;
  }

  /** Lexes the current token again, starting from its leading trivia, in another context. */
  void reLex(LexContext context) {
    ahead.clear();
    current = lexAt(current.start(), context);
  }

  Lexed checkpoint() {
    return current;
  }

  void rewind(Lexed token) {
    ahead.clear();
    current = token;
  }

  private Lexed lexAt(int offset, LexContext context) {
    List<TriviaPiece> leading = new ArrayList<>();
    List<Diagnostic> errors = new ArrayList<>();
    boolean lineBreak = false;
    int pos = offset;
    LexedToken raw;
    while (true) {
      raw = lexChecked(pos, context);
      if (raw.error() != null) {
        errors.add(Diagnostic.error(TextRange.of(raw.start(), raw.end()), raw.error()));
      }
      if (!raw.isTrivia()) {
        break;
      }
      TriviaPiece piece = new TriviaPiece(raw.trivia(), text.substring(raw.start(), raw.end()));
      lineBreak |= piece.hasLineBreak();
      leading.add(piece);
      pos = raw.end();
    }
    int tokenStart = raw.start();
    int tokenEnd = raw.end();
    SyntaxKind kind = raw.kind();

    List<TriviaPiece> trailing = new ArrayList<>();
    pos = tokenEnd;
    while (!kind.isEof() && pos < text.length()) {
      LexedToken next = lexChecked(pos, context);
      if (!next.isTrivia() || next.trivia() == TriviaKind.NEWLINE) {
        break;
      }
      TriviaPiece piece = new TriviaPiece(next.trivia(), text.substring(next.start(), next.end()));
      if (piece.hasLineBreak()) {
        break;
      }
      if (next.error() != null) {
        errors.add(Diagnostic.error(TextRange.of(next.start(), next.end()), next.error()));
      }
      trailing.add(piece);
      pos = next.end();
    }
    GreenToken token =
        new GreenToken(kind, text.substring(tokenStart, tokenEnd), leading, trailing);
    return new Lexed(token, offset, tokenStart, pos, lineBreak, List.copyOf(errors));
  }

  private LexedToken lexChecked(int pos, LexContext context) {
    LexedToken raw = lexer.lex(pos, context);
    boolean eof = !raw.isTrivia() && raw.kind().isEof();
    if (raw.start() != pos || (raw.end() <= pos && !eof)) {
      throw SyntaxContractException.noProgress("lexer", TextRange.empty(pos));
    }
    return raw;
  }
}
