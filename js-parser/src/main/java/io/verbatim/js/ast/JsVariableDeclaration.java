package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.List;
import java.util.Optional;

/**
 * {@code const a = 1, b = 2} without the statement's semicolon. Also views the single-declarator
 * declaration of a for-in/of header.
 */
public record JsVariableDeclaration(SyntaxNode syntax) {

  public static Optional<JsVariableDeclaration> cast(SyntaxNode node) {
    if (node.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATION
        || node.kind() == JsSyntaxKind.JS_FOR_VARIABLE_DECLARATION) {
      return Optional.of(new JsVariableDeclaration(node));
    }
    return Optional.empty();
  }

  /** {@code CONST_KW}, {@code LET_KW} or {@code VAR_KW}. */
  public SyntaxKind keyword() {
    return syntax.childTokens().get(0).kind();
  }

  public boolean isConst() {
    return keyword() == JsSyntaxKind.CONST_KW;
  }

  public boolean isForHeader() {
    return syntax.kind() == JsSyntaxKind.JS_FOR_VARIABLE_DECLARATION;
  }

  public List<JsVariableDeclarator> declarators() {
    if (isForHeader()) {
      return syntax.childNode(JsSyntaxKind.JS_VARIABLE_DECLARATOR)
          .map(d -> List.of(new JsVariableDeclarator(d)))
          .orElse(List.of());
    }
    return syntax
        .childNode(JsSyntaxKind.JS_VARIABLE_DECLARATOR_LIST)
        .map(
            list ->
                list.childNodes().stream()
                    .filter(n -> n.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATOR)
                    .map(JsVariableDeclarator::new)
                    .toList())
        .orElse(List.of());
  }
}
