package io.verbatim.syntax.parser;

/**
 * Grammar-specific lexing mode. The parser passes a context when it asks for the next token; the
 * context decides how ambiguous character sequences are classified (a keyword or a plain
 * identifier, a division operator or a regular expression).
 */
public interface LexContext {

  /** Whether this is the grammar's default context, used for lookahead. */
  boolean isRegular();
}
