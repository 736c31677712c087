package io.verbatim.js.semantic;

import io.verbatim.js.ast.JsReferenceIdentifier;
import io.verbatim.syntax.api.SyntaxNode;

/**
 * A use of a name.
 *
 * @param node the {@code JS_REFERENCE_IDENTIFIER} node
 * @param bindingId the binding the name resolves to, {@code -1} if it resolves to none
 * @param write whether the use assigns the name
 */
public record Reference(SyntaxNode node, int bindingId, boolean write) {

  public boolean isRead() {
    return !write;
  }

  public boolean isResolved() {
    return bindingId >= 0;
  }

  public JsReferenceIdentifier identifier() {
    return new JsReferenceIdentifier(node);
  }
}
