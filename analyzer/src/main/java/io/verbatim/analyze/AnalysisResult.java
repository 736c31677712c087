package io.verbatim.analyze;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxTree;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Signals of one analysis pass over one tree.
 *
 * @param tree the analyzed tree
 * @param signals signals in tree order
 * @param aborted whether a {@link SignalVisitor} stopped the pass early
 */
public record AnalysisResult(SyntaxTree tree, List<AnalyzerSignal> signals, boolean aborted) {

  public AnalysisResult {
    signals = List.copyOf(signals);
  }

  public List<Diagnostic> diagnostics() {
    return signals.stream().map(AnalyzerSignal::diagnostic).collect(Collectors.toList());
  }

  /** The fixes offered by the signals, in tree order. */
  public List<RuleAction> actions() {
    return signals.stream()
        .map(AnalyzerSignal::fix)
        .flatMap(Optional::stream)
        .collect(Collectors.toList());
  }

  public List<AnalyzerSignal> signalsOf(String category) {
    return signals.stream()
        .filter(s -> s.rule().category().equals(category))
        .collect(Collectors.toList());
  }
}
