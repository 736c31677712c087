package io.verbatim.syntax.green;

import io.verbatim.syntax.api.SyntaxKind;

/**
 * Position-independent, immutable tree element. Green elements carry no parent pointer and no
 * offset, which lets an edited tree share every untouched subtree with the tree it came from.
 */
public sealed interface GreenElement permits GreenNode, GreenToken {

  SyntaxKind kind();

  /** Length of the full text, trivia included. */
  int textLength();

  void appendText(StringBuilder sb);
}
