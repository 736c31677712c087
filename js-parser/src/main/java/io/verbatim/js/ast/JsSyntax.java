package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

/** Helpers shared by the typed views. */
public final class JsSyntax {

  private JsSyntax() {}

  /**
   * Strips any number of enclosing parentheses: {@code ((a.b))} yields {@code a.b}. An empty
   * {@code ()} is returned as is.
   */
  public static SyntaxNode omitParentheses(SyntaxNode expression) {
    SyntaxNode current = expression;
    while (current.kind() == JsSyntaxKind.JS_PARENTHESIZED_EXPRESSION) {
      Optional<SyntaxNode> inner = current.childNodes().stream().findFirst();
      if (inner.isEmpty()) {
        return current;
      }
      current = inner.get();
    }
    return current;
  }

  /** The text between the quotes of a string literal token, escapes left as written. */
  public static String innerStringText(String literal) {
    if (literal.length() >= 2
        && (literal.charAt(0) == '"' || literal.charAt(0) == '\'')
        && literal.charAt(literal.length() - 1) == literal.charAt(0)) {
      return literal.substring(1, literal.length() - 1);
    }
    return literal.isEmpty() ? literal : literal.substring(1);
  }

  static Optional<SyntaxNode> ofKind(SyntaxNode node, JsSyntaxKind kind) {
    return node.kind() == kind ? Optional.of(node) : Optional.empty();
  }
}
