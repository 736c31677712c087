package io.verbatim.syntax.api;

import java.util.List;
import java.util.Objects;

/**
 * The result of parsing one source text: the root node and every diagnostic reported while
 * lexing and parsing it.
 *
 * <p>A tree is immutable and safe to share between threads. A file with syntax errors still
 * yields a complete tree in which the malformed regions are kept inside bogus nodes.
 */
public final class SyntaxTree {
  private final SyntaxNode root;
  private final List<Diagnostic> diagnostics;

  public SyntaxTree(SyntaxNode root, List<Diagnostic> diagnostics) {
    this.root = Objects.requireNonNull(root, "root");
    this.diagnostics = List.copyOf(diagnostics);
  }

  public SyntaxNode root() {
    return root;
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        return true;
      }
    }
    return false;
  }

  /** Verbatim rendering: the exact source text the tree was built from. */
  public String text() {
    return root.text();
  }

  @Override
  public String toString() {
    return "SyntaxTree{"
        + root.kind().name()
        + ", "
        + root.textRange()
        + ", diagnostics="
        + diagnostics.size()
        + "}";
  }
}
