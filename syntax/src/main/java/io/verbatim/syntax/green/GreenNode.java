package io.verbatim.syntax.green;

import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.TriviaPiece;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable interior node. Children are shared by reference, so every modification builds a new
 * node along one path and keeps all other subtrees.
 */
public final class GreenNode implements GreenElement {
  private final SyntaxKind kind;
  private final List<GreenElement> children;
  private final int textLength;

  public GreenNode(SyntaxKind kind, List<? extends GreenElement> children) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.children = List.copyOf(children);
    int len = 0;
    for (GreenElement child : this.children) {
      len += child.textLength();
    }
    this.textLength = len;
  }

  @Override
  public SyntaxKind kind() {
    return kind;
  }

  public List<GreenElement> children() {
    return children;
  }

  public int childCount() {
    return children.size();
  }

  public GreenElement child(int index) {
    return children.get(index);
  }

  @Override
  public int textLength() {
    return textLength;
  }

  public GreenNode withKind(SyntaxKind newKind) {
    return new GreenNode(newKind, children);
  }

  public GreenNode withChildren(List<? extends GreenElement> newChildren) {
    return new GreenNode(kind, newChildren);
  }

  public GreenNode replaceChild(int index, GreenElement replacement) {
    List<GreenElement> copy = new ArrayList<>(children);
    copy.set(index, replacement);
    return new GreenNode(kind, copy);
  }

  /** First token in document order, or {@code null} for a node without tokens. */
  public GreenToken firstToken() {
    for (GreenElement child : children) {
      if (child instanceof GreenToken token) {
        return token;
      }
      GreenToken nested = ((GreenNode) child).firstToken();
      if (nested != null) {
        return nested;
      }
    }
    return null;
  }

  /** Last token in document order, or {@code null} for a node without tokens. */
  public GreenToken lastToken() {
    for (int i = children.size() - 1; i >= 0; i--) {
      GreenElement child = children.get(i);
      if (child instanceof GreenToken token) {
        return token;
      }
      GreenToken nested = ((GreenNode) child).lastToken();
      if (nested != null) {
        return nested;
      }
    }
    return null;
  }

  /** Copy whose first token carries {@code pieces} as leading trivia. */
  public GreenNode withLeadingTrivia(List<TriviaPiece> pieces) {
    for (int i = 0; i < children.size(); i++) {
      GreenElement child = children.get(i);
      if (child instanceof GreenToken token) {
        return replaceChild(i, token.withLeadingTrivia(pieces));
      }
      GreenNode node = (GreenNode) child;
      if (node.firstToken() != null) {
        return replaceChild(i, node.withLeadingTrivia(pieces));
      }
    }
    return this;
  }

  /** Copy whose last token carries {@code pieces} as trailing trivia. */
  public GreenNode withTrailingTrivia(List<TriviaPiece> pieces) {
    for (int i = children.size() - 1; i >= 0; i--) {
      GreenElement child = children.get(i);
      if (child instanceof GreenToken token) {
        return replaceChild(i, token.withTrailingTrivia(pieces));
      }
      GreenNode node = (GreenNode) child;
      if (node.lastToken() != null) {
        return replaceChild(i, node.withTrailingTrivia(pieces));
      }
    }
    return this;
  }

  @Override
  public void appendText(StringBuilder sb) {
    for (GreenElement child : children) {
      child.appendText(sb);
    }
  }

  public String text() {
    StringBuilder sb = new StringBuilder(textLength);
    appendText(sb);
    return sb.toString();
  }

  @Override
  public String toString() {
    return kind.name() + "(" + children.size() + ")";
  }
}
