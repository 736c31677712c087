package io.verbatim.syntax.api;

import io.verbatim.syntax.green.GreenToken;
import java.util.List;
import java.util.Optional;

/** Positioned view of a {@link GreenToken}. Tokens always live inside a node. */
public final class SyntaxToken implements SyntaxElement {
  private final GreenToken green;
  private final SyntaxNode parent;
  private final int offset;
  private final int index;

  SyntaxToken(GreenToken green, SyntaxNode parent, int offset, int index) {
    this.green = green;
    this.parent = parent;
    this.offset = offset;
    this.index = index;
  }

  @Override
  public SyntaxKind kind() {
    return green.kind();
  }

  @Override
  public GreenToken green() {
    return green;
  }

  /** Significant text, trivia excluded. */
  public String text() {
    return green.text();
  }

  /** Text including leading and trailing trivia. */
  public String fullText() {
    StringBuilder sb = new StringBuilder(green.textLength());
    green.appendText(sb);
    return sb.toString();
  }

  public List<TriviaPiece> leadingTrivia() {
    return green.leadingTrivia();
  }

  public List<TriviaPiece> trailingTrivia() {
    return green.trailingTrivia();
  }

  public boolean hasLeadingNewline() {
    for (TriviaPiece piece : green.leadingTrivia()) {
      if (piece.hasLineBreak()) {
        return true;
      }
    }
    return false;
  }

  public boolean hasLeadingComments() {
    for (TriviaPiece piece : green.leadingTrivia()) {
      if (piece.isComment()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public TextRange textRange() {
    return TextRange.of(offset, offset + green.textLength());
  }

  @Override
  public TextRange textTrimmedRange() {
    int start = offset + green.leadingLength();
    return TextRange.of(start, start + green.text().length());
  }

  @Override
  public Optional<SyntaxNode> parent() {
    return Optional.of(parent);
  }

  @Override
  public int indexInParent() {
    return index;
  }

  @Override
  public SyntaxNode root() {
    return parent.root();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SyntaxToken other)) return false;
    return green == other.green && offset == other.offset && parent.equals(other.parent);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(green) + offset;
  }

  @Override
  public String toString() {
    return kind().name() + "@" + textTrimmedRange() + " \"" + text() + "\"";
  }
}
