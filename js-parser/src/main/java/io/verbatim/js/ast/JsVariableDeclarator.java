package io.verbatim.js.ast;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

/** One {@code name = value} entry of a variable declaration. */
public record JsVariableDeclarator(SyntaxNode syntax) {

  public static Optional<JsVariableDeclarator> cast(SyntaxNode node) {
    return JsSyntax.ofKind(node, JsSyntaxKind.JS_VARIABLE_DECLARATOR)
        .map(JsVariableDeclarator::new);
  }

  /** Empty when the binding is missing or bogus. */
  public Optional<JsIdentifierBinding> id() {
    return syntax.childNode(JsSyntaxKind.JS_IDENTIFIER_BINDING).map(JsIdentifierBinding::new);
  }

  public Optional<JsInitializerClause> initializer() {
    return syntax.childNode(JsSyntaxKind.JS_INITIALIZER_CLAUSE).map(JsInitializerClause::new);
  }

  /** The enclosing declarator list, absent for the declarator of a for-in/of header. */
  public Optional<JsVariableDeclaratorList> parentList() {
    return syntax.parent().flatMap(JsVariableDeclaratorList::cast);
  }

  /** The declaration this declarator belongs to. */
  public Optional<SyntaxNode> declaration() {
    return syntax
        .parent()
        .flatMap(
            p ->
                p.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATOR_LIST
                    ? p.parent()
                    : Optional.of(p))
        .filter(
            d ->
                d.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATION
                    || d.kind() == JsSyntaxKind.JS_FOR_VARIABLE_DECLARATION);
  }
}
