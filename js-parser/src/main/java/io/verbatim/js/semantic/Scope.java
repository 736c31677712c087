package io.verbatim.js.semantic;

import io.verbatim.syntax.api.SyntaxNode;
import java.util.OptionalInt;

/**
 * A lexical scope.
 *
 * @param id index of the scope in its model, in order of the scope nodes' start
 * @param parentId id of the enclosing scope, {@code -1} for the module scope
 * @param node the node opening the scope
 */
public record Scope(int id, ScopeKind kind, int parentId, SyntaxNode node) {

  public OptionalInt parent() {
    return parentId < 0 ? OptionalInt.empty() : OptionalInt.of(parentId);
  }
}
