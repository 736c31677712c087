package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

/** {@code = expression}. */
public record JsInitializerClause(SyntaxNode syntax) {

  public static Optional<JsInitializerClause> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_INITIALIZER_CLAUSE).map(JsInitializerClause::new);
  }

  /** Empty when the expression after {@code =} is missing. */
  public Optional<SyntaxNode> expression() {
    return syntax.childNodes().stream().findFirst();
  }
}
