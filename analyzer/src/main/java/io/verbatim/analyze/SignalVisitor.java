package io.verbatim.analyze;

/** Receives the signals of an analysis pass in tree order. */
@FunctionalInterface
public interface SignalVisitor {

  void visit(AnalyzerSignal signal, AnalysisControl control);
}
