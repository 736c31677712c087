package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import java.util.Optional;

public record JsReferenceIdentifier(SyntaxNode syntax) {

  public static Optional<JsReferenceIdentifier> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_REFERENCE_IDENTIFIER)
        .map(JsReferenceIdentifier::new);
  }

  public SyntaxToken nameToken() {
    return syntax.childToken(JsSyntaxKind.IDENT).orElseThrow();
  }

  public String name() {
    return nameToken().text();
  }
}
