package io.verbatim.syntax.api;

import io.verbatim.syntax.green.GreenElement;
import io.verbatim.syntax.green.GreenNode;
import io.verbatim.syntax.green.GreenToken;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Positioned view of a {@link GreenNode}.
 *
 * <p>Views are created on demand and are cheap; two views are equal when they wrap the same green
 * node at the same offset of the same tree. Views never change: an edited tree is a different tree
 * with new views.
 */
public final class SyntaxNode implements SyntaxElement {
  private final GreenNode green;
  private final SyntaxNode parent;
  private final int offset;
  private final int index;
  private final GreenNode rootGreen;

  private SyntaxNode(GreenNode green, SyntaxNode parent, int offset, int index) {
    this.green = green;
    this.parent = parent;
    this.offset = offset;
    this.index = index;
    this.rootGreen = parent == null ? green : parent.rootGreen;
  }

  public static SyntaxNode newRoot(GreenNode green) {
    return new SyntaxNode(Objects.requireNonNull(green, "green"), null, 0, 0);
  }

  @Override
  public SyntaxKind kind() {
    return green.kind();
  }

  @Override
  public GreenNode green() {
    return green;
  }

  @Override
  public Optional<SyntaxNode> parent() {
    return Optional.ofNullable(parent);
  }

  @Override
  public int indexInParent() {
    return index;
  }

  @Override
  public SyntaxNode root() {
    SyntaxNode current = this;
    while (current.parent != null) {
      current = current.parent;
    }
    return current;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public boolean isBogus() {
    return green.kind().isBogus();
  }

  /** Number of ancestors; {@code 0} for the root. */
  public int depth() {
    int depth = 0;
    for (SyntaxNode p = parent; p != null; p = p.parent) {
      depth++;
    }
    return depth;
  }

  @Override
  public TextRange textRange() {
    return TextRange.of(offset, offset + green.textLength());
  }

  @Override
  public TextRange textTrimmedRange() {
    Optional<SyntaxToken> first = firstToken();
    if (first.isEmpty()) {
      return TextRange.empty(offset);
    }
    int start = first.get().textTrimmedRange().start();
    int end = lastToken().orElseThrow().textTrimmedRange().end();
    return TextRange.of(start, end);
  }

  /** Full text of this node, trivia included. */
  public String text() {
    return green.text();
  }

  public String textTrimmed() {
    TextRange full = textRange();
    TextRange trimmed = textTrimmedRange();
    return text().substring(trimmed.start() - full.start(), trimmed.end() - full.start());
  }

  public int childCount() {
    return green.childCount();
  }

  public SyntaxElement childAt(int childIndex) {
    int childOffset = offset;
    List<GreenElement> greens = green.children();
    for (int i = 0; i < childIndex; i++) {
      childOffset += greens.get(i).textLength();
    }
    return wrap(greens.get(childIndex), childOffset, childIndex);
  }

  private SyntaxElement wrap(GreenElement child, int childOffset, int childIndex) {
    if (child instanceof GreenToken token) {
      return new SyntaxToken(token, this, childOffset, childIndex);
    }
    return new SyntaxNode((GreenNode) child, this, childOffset, childIndex);
  }

  public List<SyntaxElement> children() {
    List<GreenElement> greens = green.children();
    List<SyntaxElement> result = new ArrayList<>(greens.size());
    int childOffset = offset;
    for (int i = 0; i < greens.size(); i++) {
      GreenElement child = greens.get(i);
      result.add(wrap(child, childOffset, i));
      childOffset += child.textLength();
    }
    return result;
  }

  public List<SyntaxNode> childNodes() {
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxNode node) {
        result.add(node);
      }
    }
    return result;
  }

  public List<SyntaxToken> childTokens() {
    List<SyntaxToken> result = new ArrayList<>();
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxToken token) {
        result.add(token);
      }
    }
    return result;
  }

  /** First direct child node of the given kind. */
  public Optional<SyntaxNode> childNode(SyntaxKind kind) {
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxNode node && node.kind() == kind) {
        return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  /** First direct child token of the given kind. */
  public Optional<SyntaxToken> childToken(SyntaxKind kind) {
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxToken token && token.kind() == kind) {
        return Optional.of(token);
      }
    }
    return Optional.empty();
  }

  public Optional<SyntaxToken> firstToken() {
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxToken token) {
        return Optional.of(token);
      }
      Optional<SyntaxToken> nested = ((SyntaxNode) child).firstToken();
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  public Optional<SyntaxToken> lastToken() {
    List<SyntaxElement> all = children();
    for (int i = all.size() - 1; i >= 0; i--) {
      SyntaxElement child = all.get(i);
      if (child instanceof SyntaxToken token) {
        return Optional.of(token);
      }
      Optional<SyntaxToken> nested = ((SyntaxNode) child).lastToken();
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  /** Ancestors from the parent up to the root. */
  public Stream<SyntaxNode> ancestors() {
    return Stream.iterate(parent, Objects::nonNull, p -> p.parent);
  }

  /** Whether {@code other} is this node or lies inside it. */
  public boolean isAncestorOrSelf(SyntaxElement other) {
    for (Optional<SyntaxNode> p =
            other instanceof SyntaxNode node ? Optional.of(node) : other.parent();
        p.isPresent();
        p = p.get().parent()) {
      if (p.get().equals(this)) {
        return true;
      }
    }
    return false;
  }

  /** This node and all descendant nodes in preorder. */
  public Stream<SyntaxNode> descendants() {
    List<SyntaxNode> nodes = new ArrayList<>();
    for (WalkEvent event : preorder()) {
      if (event instanceof WalkEvent.Enter enter) {
        nodes.add(enter.node());
      }
    }
    return nodes.stream();
  }

  /** All tokens of this node in document order. */
  public List<SyntaxToken> tokens() {
    List<SyntaxToken> tokens = new ArrayList<>();
    Deque<SyntaxElement> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      SyntaxElement element = stack.pop();
      if (element instanceof SyntaxToken token) {
        tokens.add(token);
      } else {
        List<SyntaxElement> children = ((SyntaxNode) element).children();
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(children.get(i));
        }
      }
    }
    return tokens;
  }

  /**
   * Lazy preorder walk over this subtree. Iterative, so arbitrarily deep trees do not exhaust the
   * call stack.
   */
  public Iterable<WalkEvent> preorder() {
    return PreorderIterator::new;
  }

  private final class PreorderIterator implements Iterator<WalkEvent> {
    private final Deque<Iterator<SyntaxNode>> pending = new ArrayDeque<>();
    private final Deque<SyntaxNode> open = new ArrayDeque<>();
    private WalkEvent next = new WalkEvent.Enter(SyntaxNode.this);

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public WalkEvent next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      WalkEvent current = next;
      if (current instanceof WalkEvent.Enter enter) {
        open.push(enter.node());
        pending.push(enter.node().childNodes().iterator());
      } else {
        open.pop();
        pending.pop();
      }
      next = advance();
      return current;
    }

    private WalkEvent advance() {
      if (pending.isEmpty()) {
        return null;
      }
      Iterator<SyntaxNode> siblings = pending.peek();
      if (siblings.hasNext()) {
        return new WalkEvent.Enter(siblings.next());
      }
      return new WalkEvent.Leave(open.peek());
    }
  }

  /**
   * Indented dump of node kinds and token texts, trivia excluded. Two trees with the same dump
   * have the same shape.
   */
  public String debugTree() {
    StringBuilder sb = new StringBuilder();
    debugTree(sb, 0);
    return sb.toString();
  }

  private void debugTree(StringBuilder sb, int indent) {
    sb.append("  ".repeat(indent)).append(kind().name()).append('\n');
    for (SyntaxElement child : children()) {
      if (child instanceof SyntaxNode node) {
        node.debugTree(sb, indent + 1);
      } else {
        SyntaxToken token = (SyntaxToken) child;
        sb.append("  ".repeat(indent + 1))
            .append(token.kind().name())
            .append(" \"")
            .append(token.text())
            .append("\"\n");
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SyntaxNode other)) return false;
    return green == other.green && offset == other.offset && rootGreen == other.rootGreen;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(green) + offset;
  }

  @Override
  public String toString() {
    return text();
  }
}
