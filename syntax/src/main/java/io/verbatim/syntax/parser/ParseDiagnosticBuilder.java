package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.TextRange;

/** Builds the diagnostic for a missing element at {@code range}, usually the current token. */
@FunctionalInterface
public interface ParseDiagnosticBuilder {
  Diagnostic build(Parser p, TextRange range);
}
