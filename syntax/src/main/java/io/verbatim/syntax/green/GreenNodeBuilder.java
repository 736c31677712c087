package io.verbatim.syntax.green;

import io.verbatim.syntax.api.Internal;
import io.verbatim.syntax.api.SyntaxKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Builds a green tree from a flat sequence of start / token / finish calls. */
@Internal
public final class GreenNodeBuilder {
  private record Frame(SyntaxKind kind, int firstChild) {}

  private final Deque<Frame> parents = new ArrayDeque<>();
  private final List<GreenElement> children = new ArrayList<>();

  public void startNode(SyntaxKind kind) {
    parents.push(new Frame(kind, children.size()));
  }

  public void token(GreenToken token) {
    children.add(token);
  }

  public void finishNode() {
    Frame frame = parents.pop();
    List<GreenElement> slice = children.subList(frame.firstChild, children.size());
    GreenNode node = new GreenNode(frame.kind, slice);
    slice.clear();
    children.add(node);
  }

  /**
   * @return the single root node built so far
   * @throws IllegalStateException if nodes are still open or more than one root was produced
   */
  public GreenNode finish() {
    if (!parents.isEmpty() || children.size() != 1 || !(children.get(0) instanceof GreenNode)) {
      throw new IllegalStateException(
          "Unbalanced tree: " + parents.size() + " open node(s), " + children.size() + " root(s)");
    }
    return (GreenNode) children.get(0);
  }
}
