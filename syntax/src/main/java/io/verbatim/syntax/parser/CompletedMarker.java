package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TextRange;

/** A node already finalized in the output buffer. */
public final class CompletedMarker {
  final int pos;
  private final SyntaxKind kind;
  private final int startOffset;
  private final int endOffset;

  CompletedMarker(int pos, SyntaxKind kind, int startOffset, int endOffset) {
    this.pos = pos;
    this.kind = kind;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public SyntaxKind kind() {
    return kind;
  }

  /** Range from the node's first to its last significant token, trivia excluded. */
  public TextRange range() {
    return TextRange.of(startOffset, Math.max(startOffset, endOffset));
  }

  /**
   * Opens a new marker that will become the parent of this node. Used for left-recursive
   * constructs: {@code a.b} is only known to be a member expression after {@code a} is complete.
   */
  public Marker precede(Parser p) {
    return p.precedeMarker(this, startOffset);
  }

  /** Reclassifies this node, e.g. as its bogus counterpart. */
  public CompletedMarker changeKind(Parser p, SyntaxKind newKind) {
    p.changeMarkerKind(this, newKind);
    return new CompletedMarker(pos, newKind, startOffset, endOffset);
  }

  @Override
  public String toString() {
    return kind.name() + "@" + range();
  }
}
