package io.verbatim.js.semantic;

import io.verbatim.js.ast.JsIdentifierBinding;
import io.verbatim.syntax.api.SyntaxNode;

/**
 * A declared name.
 *
 * @param declaration the {@code JS_IDENTIFIER_BINDING} node introducing the name
 * @param scopeId the scope the name is visible in
 */
public record Binding(int id, String name, SyntaxNode declaration, int scopeId) {

  public JsIdentifierBinding identifier() {
    return new JsIdentifierBinding(declaration);
  }
}
