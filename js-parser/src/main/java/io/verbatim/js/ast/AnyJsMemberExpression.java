package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import java.util.List;
import java.util.Optional;

/** A static ({@code a.b}) or computed ({@code a[b]}) member access. */
public record AnyJsMemberExpression(SyntaxNode syntax) {

  public static Optional<AnyJsMemberExpression> cast(SyntaxNode node) {
    if (node.kind() == JsSyntaxKind.JS_STATIC_MEMBER_EXPRESSION
        || node.kind() == JsSyntaxKind.JS_COMPUTED_MEMBER_EXPRESSION) {
      return Optional.of(new AnyJsMemberExpression(node));
    }
    return Optional.empty();
  }

  public boolean isComputed() {
    return syntax.kind() == JsSyntaxKind.JS_COMPUTED_MEMBER_EXPRESSION;
  }

  public SyntaxNode object() {
    return syntax.childNodes().get(0);
  }

  /**
   * Name of the accessed member: the identifier of a static member, the inner text of a string
   * literal used as computed member. Empty for any other computed member.
   */
  public Optional<String> memberName() {
    List<SyntaxNode> nodes = syntax.childNodes();
    if (nodes.size() < 2) {
      return Optional.empty();
    }
    SyntaxNode member = nodes.get(1);
    if (!isComputed()) {
      return member.childToken(JsSyntaxKind.IDENT).map(SyntaxToken::text);
    }
    return JsStringLiteralExpression.cast(JsSyntax.omitParentheses(member))
        .map(JsStringLiteralExpression::innerStringText);
  }
}
