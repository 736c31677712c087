package io.verbatim.analyze;

import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.mutation.BatchMutation;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies rule actions to the tree they were computed on. */
public final class Fixes {
  private static final Logger log = LoggerFactory.getLogger(Fixes.class);

  private Fixes() {}

  /**
   * Merges the mutations of {@code actions} into one batch and commits it.
   *
   * <p>The returned tree carries no diagnostics: the positions of the old ones no longer apply.
   * Parse its text again for fresh diagnostics.
   *
   * @return the edited tree, or {@code tree} itself if there is nothing to apply
   * @throws SyntaxContractException if an action belongs to another tree or two actions edit the
   *     same element
   */
  public static SyntaxTree apply(SyntaxTree tree, Collection<RuleAction> actions) {
    if (actions.isEmpty()) {
      return tree;
    }
    BatchMutation batch = BatchMutation.begin(tree.root());
    for (RuleAction action : actions) {
      batch.merge(action.mutation());
    }
    SyntaxNode root = batch.commit();
    log.debug("Applied {} actions ({} edits)", actions.size(), batch.size());
    return new SyntaxTree(root, List.of());
  }

  /** Applies every fix offered in {@code result}. */
  public static SyntaxTree applyAll(AnalysisResult result) {
    return apply(result.tree(), result.actions());
  }
}
