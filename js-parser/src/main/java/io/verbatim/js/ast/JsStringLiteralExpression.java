package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import java.util.Optional;

public record JsStringLiteralExpression(SyntaxNode syntax) {

  public static Optional<JsStringLiteralExpression> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_STRING_LITERAL_EXPRESSION)
        .map(JsStringLiteralExpression::new);
  }

  public SyntaxToken valueToken() {
    return syntax.childToken(JsSyntaxKind.JS_STRING_LITERAL).orElseThrow();
  }

  /** The literal without its quotes. */
  public String innerStringText() {
    return JsSyntax.innerStringText(valueToken().text());
  }
}
