package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

public record JsVariableStatement(SyntaxNode syntax) {

  public static Optional<JsVariableStatement> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_VARIABLE_STATEMENT)
        .map(JsVariableStatement::new);
  }

  public JsVariableDeclaration declaration() {
    return new JsVariableDeclaration(
        syntax.childNode(JsSyntaxKind.JS_VARIABLE_DECLARATION).orElseThrow());
  }
}
