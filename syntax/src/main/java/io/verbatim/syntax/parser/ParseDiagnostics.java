package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TextRange;

/** Message templates shared by the grammars. */
public final class ParseDiagnostics {

  private ParseDiagnostics() {}

  /**
   * "Expected {@code what} but instead found '...'", or "... but instead the file ends" when
   * {@code range} is empty at the end of the text.
   */
  public static Diagnostic expected(Parser p, String what, TextRange range) {
    String message;
    if (range.isEmpty() && p.atEof()) {
      message = "Expected " + what + " but instead the file ends";
    } else {
      message = "Expected " + what + " but instead found '" + p.sourceText(range) + "'";
    }
    return Diagnostic.error(range, message).withSecondary(range, "Expected " + what + " here");
  }

  /** Deferred form of {@link #expected(Parser, String, TextRange)} for {@link ParsedSyntax}. */
  public static ParseDiagnosticBuilder expectedNode(String what) {
    return (p, range) -> expected(p, what, range);
  }

  /** "Expected a statement, or an expression but instead ..." */
  public static ParseDiagnosticBuilder expectedAny(String... alternatives) {
    StringBuilder what = new StringBuilder();
    for (int i = 0; i < alternatives.length; i++) {
      if (i > 0) {
        what.append(i == alternatives.length - 1 ? ", or " : ", ");
      }
      what.append(alternatives[i]);
    }
    return expectedNode(what.toString());
  }

  /** Diagnostic for a missing token of {@code kind} at the current position. */
  public static Diagnostic expectedToken(Parser p, SyntaxKind kind) {
    return expected(p, kind.displayText(), p.curRange());
  }
}
