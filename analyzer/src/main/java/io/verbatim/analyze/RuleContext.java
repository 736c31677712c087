package io.verbatim.analyze;

import io.verbatim.js.semantic.SemanticModel;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.function.Supplier;

/** What a rule sees while it runs on one node. */
public final class RuleContext {
  private final SyntaxNode node;
  private final RuleMetadata rule;
  private final Query query;
  private final Supplier<SemanticModel> model;

  RuleContext(SyntaxNode node, RuleMetadata rule, Query query, Supplier<SemanticModel> model) {
    this.node = node;
    this.rule = rule;
    this.query = query;
    this.model = model;
  }

  /** The matched node, of one of the kinds in the rule's {@link Query}. */
  public SyntaxNode node() {
    return node;
  }

  public SyntaxNode root() {
    return node.root();
  }

  public RuleMetadata rule() {
    return rule;
  }

  /**
   * The semantic model of the analyzed tree, built on first use and shared by all rules of the
   * pass.
   *
   * @throws SyntaxContractException if the rule declared a syntax-only query
   */
  public SemanticModel semanticModel() {
    if (!query.semantic()) {
      throw SyntaxContractException.semanticModelUnavailable(rule.category());
    }
    return model.get();
  }
}
