package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SeparatedList;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.List;
import java.util.Optional;

public record JsVariableDeclaratorList(SyntaxNode syntax) {

  public static Optional<JsVariableDeclaratorList> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_VARIABLE_DECLARATOR_LIST)
        .map(JsVariableDeclaratorList::new);
  }

  /** Declarators paired with their trailing commas. */
  public List<SeparatedList.Element> elements() {
    return SeparatedList.elements(syntax, JsSyntaxKind.COMMA);
  }

  public int size() {
    return syntax.childNodes().size();
  }
}
