package io.verbatim.analyze;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxNode;
import java.util.Optional;

/**
 * One rule matching one node.
 *
 * @param rule the rule that matched
 * @param node the matched node
 * @param diagnostic what to report, categorized with {@link RuleMetadata#category()}
 * @param action the offered fix, {@code null} if the rule has none for this match
 */
public record AnalyzerSignal(
    RuleMetadata rule, SyntaxNode node, Diagnostic diagnostic, RuleAction action) {

  public Optional<RuleAction> fix() {
    return Optional.ofNullable(action);
  }
}
