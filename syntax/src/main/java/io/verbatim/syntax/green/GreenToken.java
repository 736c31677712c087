package io.verbatim.syntax.green;

import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TriviaPiece;
import java.util.List;
import java.util.Objects;

/**
 * Immutable token: kind, significant text and the trivia around it.
 *
 * <p>Identity matters: two tokens with the same text are distinct elements of a tree, so this
 * class keeps {@link Object#equals(Object)} identity based.
 */
public final class GreenToken implements GreenElement {
  private final SyntaxKind kind;
  private final String text;
  private final List<TriviaPiece> leading;
  private final List<TriviaPiece> trailing;
  private final int leadingLength;
  private final int trailingLength;

  public GreenToken(
      SyntaxKind kind, String text, List<TriviaPiece> leading, List<TriviaPiece> trailing) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.text = Objects.requireNonNull(text, "text");
    this.leading = List.copyOf(leading);
    this.trailing = List.copyOf(trailing);
    this.leadingLength = length(this.leading);
    this.trailingLength = length(this.trailing);
  }

  public GreenToken(SyntaxKind kind, String text) {
    this(kind, text, List.of(), List.of());
  }

  private static int length(List<TriviaPiece> pieces) {
    int len = 0;
    for (TriviaPiece piece : pieces) {
      len += piece.text().length();
    }
    return len;
  }

  @Override
  public SyntaxKind kind() {
    return kind;
  }

  /** Significant text, trivia excluded. */
  public String text() {
    return text;
  }

  public List<TriviaPiece> leadingTrivia() {
    return leading;
  }

  public List<TriviaPiece> trailingTrivia() {
    return trailing;
  }

  public int leadingLength() {
    return leadingLength;
  }

  public int trailingLength() {
    return trailingLength;
  }

  @Override
  public int textLength() {
    return leadingLength + text.length() + trailingLength;
  }

  public GreenToken withKind(SyntaxKind newKind) {
    return new GreenToken(newKind, text, leading, trailing);
  }

  public GreenToken withLeadingTrivia(List<TriviaPiece> pieces) {
    return new GreenToken(kind, text, pieces, trailing);
  }

  public GreenToken withTrailingTrivia(List<TriviaPiece> pieces) {
    return new GreenToken(kind, text, leading, pieces);
  }

  @Override
  public void appendText(StringBuilder sb) {
    for (TriviaPiece piece : leading) {
      sb.append(piece.text());
    }
    sb.append(text);
    for (TriviaPiece piece : trailing) {
      sb.append(piece.text());
    }
  }

  @Override
  public String toString() {
    return kind.name() + "@\"" + text + "\"";
  }
}
