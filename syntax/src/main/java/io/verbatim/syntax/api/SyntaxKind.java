package io.verbatim.syntax.api;

/**
 * A kind of token or node in a grammar.
 *
 * <p>Each grammar provides an enum implementing this interface. Kinds are compared by identity,
 * so implementations are expected to be enum constants.
 */
public interface SyntaxKind {

  /**
   * @return the kind's name, as used in tree dumps
   */
  String name();

  /**
   * Whether nodes of this kind wrap an unparseable span.
   *
   * @return {@code true} for bogus (error) node kinds
   */
  boolean isBogus();

  /**
   * Whether nodes of this kind hold a homogeneous list, optionally separated by delimiter tokens.
   *
   * @return {@code true} for list node kinds
   */
  boolean isList();

  /**
   * @return {@code true} for the end-of-file token kind
   */
  boolean isEof();

  /**
   * How the kind reads in a diagnostic, e.g. {@code `;`} for a punctuation token. Defaults to the
   * kind's name.
   *
   * @return the display text
   */
  default String displayText() {
    return name();
  }
}
