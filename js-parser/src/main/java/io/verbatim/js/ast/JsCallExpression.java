package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.List;
import java.util.Optional;

/** {@code callee(arguments)}. */
public record JsCallExpression(SyntaxNode syntax) {

  public static Optional<JsCallExpression> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_CALL_EXPRESSION).map(JsCallExpression::new);
  }

  public SyntaxNode callee() {
    return syntax.childNodes().get(0);
  }

  /** Argument expressions, without the separating commas. */
  public List<SyntaxNode> arguments() {
    return syntax
        .childNode(JsSyntaxKind.JS_CALL_ARGUMENTS)
        .flatMap(args -> args.childNode(JsSyntaxKind.JS_CALL_ARGUMENT_LIST))
        .map(SyntaxNode::childNodes)
        .orElse(List.of());
  }
}
