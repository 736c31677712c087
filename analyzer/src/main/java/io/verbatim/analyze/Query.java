package io.verbatim.analyze;

import io.verbatim.syntax.api.SyntaxKind;
import java.util.Set;

/**
 * What a rule matches: the node kinds it is invoked for, and whether it reads the semantic model.
 *
 * @param kinds node kinds dispatched to the rule
 * @param semantic whether {@link RuleContext#semanticModel()} may be called
 */
public record Query(Set<SyntaxKind> kinds, boolean semantic) {

  public Query {
    if (kinds.isEmpty()) {
      throw new IllegalArgumentException("a query needs at least one node kind");
    }
    kinds = Set.copyOf(kinds);
  }

  public static Query syntax(SyntaxKind... kinds) {
    return new Query(Set.of(kinds), false);
  }

  public static Query semantic(SyntaxKind... kinds) {
    return new Query(Set.of(kinds), true);
  }
}
