package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import java.util.Optional;

/** A name introduced by a declaration or a parameter. */
public record JsIdentifierBinding(SyntaxNode syntax) {

  public static Optional<JsIdentifierBinding> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_IDENTIFIER_BINDING).map(JsIdentifierBinding::new);
  }

  public SyntaxToken nameToken() {
    return syntax.childToken(JsSyntaxKind.IDENT).orElseThrow();
  }

  public String name() {
    return nameToken().text();
  }
}
