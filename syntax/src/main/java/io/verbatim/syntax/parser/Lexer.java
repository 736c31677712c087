package io.verbatim.syntax.parser;

/**
 * Grammar-specific scanner over one source text.
 *
 * <p>A lexer is stateless with respect to position: {@link TokenSource} asks it for the lexeme at
 * an offset, which makes the stream restartable at any earlier token. Lexers never fail; invalid
 * input becomes an error token carrying a message.
 */
public interface Lexer {

  /** The full source text being lexed. */
  String text();

  /** Context used for lookahead and for every token the parser did not ask for explicitly. */
  LexContext regularContext();

  /**
   * Lexes the single token or trivia piece starting at {@code offset}. At the end of input returns
   * a zero-length end-of-file token. Every other result is at least one character long.
   */
  LexedToken lex(int offset, LexContext context);
}
