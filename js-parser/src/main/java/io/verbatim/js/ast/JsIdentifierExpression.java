package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

/** A name read as a value. */
public record JsIdentifierExpression(SyntaxNode syntax) {

  public static Optional<JsIdentifierExpression> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_IDENTIFIER_EXPRESSION)
        .map(JsIdentifierExpression::new);
  }

  public JsReferenceIdentifier name() {
    return new JsReferenceIdentifier(
        syntax.childNode(JsSyntaxKind.JS_REFERENCE_IDENTIFIER).orElseThrow());
  }
}
