package io.verbatim.analyze;

/** Handed to a {@link SignalVisitor} to steer the running pass. */
public interface AnalysisControl {

  /** Stops the pass after the current signal. */
  void abort();

  boolean isAborted();
}
