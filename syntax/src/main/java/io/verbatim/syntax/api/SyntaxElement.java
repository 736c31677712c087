package io.verbatim.syntax.api;

import io.verbatim.syntax.green.GreenElement;
import java.util.Optional;

/** A positioned node or token of a concrete syntax tree. */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

  SyntaxKind kind();

  GreenElement green();

  /** Range of the full text, trivia included. */
  TextRange textRange();

  /** Range without the leading trivia of the first token and the trailing trivia of the last. */
  TextRange textTrimmedRange();

  Optional<SyntaxNode> parent();

  /** Position among the parent's children, {@code 0} for the root. */
  int indexInParent();

  /** The root node of the tree this element belongs to. */
  SyntaxNode root();
}
