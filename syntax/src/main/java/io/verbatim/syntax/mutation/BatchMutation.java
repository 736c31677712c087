package io.verbatim.syntax.mutation;

import io.verbatim.syntax.api.SeparatedList;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxElement;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import io.verbatim.syntax.green.GreenElement;
import io.verbatim.syntax.green.GreenNode;
import io.verbatim.syntax.green.GreenToken;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A set of structural edits against one tree, applied together by {@link #commit()}.
 *
 * <p>Edits address elements of the tree the batch was started on. Commit validates the whole set
 * before building anything:
 *
 * <ul>
 *   <li>every target belongs to the batch's tree,
 *   <li>an element is removed or replaced at most once (repeating an identical edit is allowed),
 *   <li>no edit lies inside a subtree that is removed or replaced.
 * </ul>
 *
 * A violation throws {@link SyntaxContractException} with error code {@code MUTATION} and no tree
 * is produced. The new tree reuses every untouched green subtree of the old one.
 *
 * <p>Removals from separated lists ({@link #removeListElement}) are repaired together, so batches
 * merged from independent fixes never leave a dangling separator or an empty list behind.
 *
 * <p>Not thread-safe; the trees themselves are immutable and unaffected by a batch.
 */
public final class BatchMutation {
  private static final Logger log = LoggerFactory.getLogger(BatchMutation.class);

  private final SyntaxNode root;
  private final Set<Edit> edits = new LinkedHashSet<>();

  private BatchMutation(SyntaxNode root) {
    this.root = root;
  }

  /** Starts an empty batch against the tree containing {@code node}. */
  public static BatchMutation begin(SyntaxNode node) {
    return new BatchMutation(Objects.requireNonNull(node, "node").root());
  }

  public SyntaxNode root() {
    return root;
  }

  public boolean isEmpty() {
    return edits.isEmpty();
  }

  /** Number of distinct edits. */
  public int size() {
    return edits.size();
  }

  public BatchMutation removeNode(SyntaxNode node) {
    edits.add(new Edit.Remove(node));
    return this;
  }

  public BatchMutation removeToken(SyntaxToken token) {
    edits.add(new Edit.Remove(token));
    return this;
  }

  /** Removes a node or a token. */
  public BatchMutation removeElement(SyntaxElement element) {
    edits.add(new Edit.Remove(element));
    return this;
  }

  /**
   * Removes {@code element} from the separated list it belongs to, along with the separator that
   * no longer separates anything. Resolved at commit together with every other removal from the
   * same list:
   *
   * <ul>
   *   <li>a removed element takes its trailing separator with it;
   *   <li>if the list's last element is removed, the separator after the last remaining element
   *       goes too, unless the list had a trailing separator;
   *   <li>if no element remains, {@code whenEmpty} (e.g. the enclosing statement) is removed
   *       instead of the list's content.
   * </ul>
   */
  public BatchMutation removeListElement(
      SyntaxNode element, SyntaxKind separator, SyntaxNode whenEmpty) {
    if (element.parent().isEmpty()) {
      throw SyntaxContractException.conflictingEdits(
          "list element without a parent list", element.textRange());
    }
    edits.add(new Edit.RemoveListElement(element, separator, whenEmpty));
    return this;
  }

  /**
   * Replaces {@code prev} by {@code next}. The leading trivia of {@code prev}'s first token and the
   * trailing trivia of its last token move to {@code next}, so comments and indentation around the
   * replaced node survive.
   */
  public BatchMutation replaceNode(SyntaxNode prev, GreenNode next) {
    GreenNode replacement = next;
    GreenToken first = prev.green().firstToken();
    GreenToken last = prev.green().lastToken();
    if (first != null && next.firstToken() != null) {
      replacement = replacement.withLeadingTrivia(first.leadingTrivia());
      replacement = replacement.withTrailingTrivia(last.trailingTrivia());
    }
    edits.add(new Edit.Replace(prev, replacement));
    return this;
  }

  /** Replaces {@code prev} by {@code next} exactly as given. */
  public BatchMutation replaceNodeDiscardTrivia(SyntaxNode prev, GreenNode next) {
    edits.add(new Edit.Replace(prev, next));
    return this;
  }

  /** Replaces {@code prev} by {@code next}, which takes over {@code prev}'s trivia. */
  public BatchMutation replaceToken(SyntaxToken prev, GreenToken next) {
    GreenToken replacement =
        next.withLeadingTrivia(prev.leadingTrivia()).withTrailingTrivia(prev.trailingTrivia());
    edits.add(new Edit.Replace(prev, replacement));
    return this;
  }

  public BatchMutation replaceTokenDiscardTrivia(SyntaxToken prev, GreenToken next) {
    edits.add(new Edit.Replace(prev, next));
    return this;
  }

  public BatchMutation insertBefore(SyntaxElement anchor, GreenElement element) {
    edits.add(new Edit.InsertBefore(anchor, element));
    return this;
  }

  public BatchMutation insertAfter(SyntaxElement anchor, GreenElement element) {
    edits.add(new Edit.InsertAfter(anchor, element));
    return this;
  }

  /** Adds {@code element} as the last child of {@code parent}. */
  public BatchMutation append(SyntaxNode parent, GreenElement element) {
    edits.add(new Edit.Append(parent, element));
    return this;
  }

  /**
   * Adds all edits of {@code other} to this batch.
   *
   * @throws SyntaxContractException if {@code other} was started on a different tree
   */
  public BatchMutation merge(BatchMutation other) {
    if (!other.root.equals(root)) {
      throw SyntaxContractException.foreignElement(other.root.textRange());
    }
    edits.addAll(other.edits);
    return this;
  }

  /**
   * Validates and applies all edits.
   *
   * @return the root of the new tree; the batch's own tree is unchanged
   * @throws SyntaxContractException if the edits are invalid, see the class description
   */
  public SyntaxNode commit() {
    Set<Edit> edits = resolveListRemovals();
    Set<SyntaxElement> replacedOrRemoved = validate(edits);
    if (edits.isEmpty()) {
      return root;
    }
    for (Edit edit : edits) {
      if (edit instanceof Edit.Replace replace && replace.target().equals(root)) {
        return SyntaxNode.newRoot((GreenNode) replace.replacement());
      }
    }

    Map<SyntaxNode, List<Edit>> byLocation = new LinkedHashMap<>();
    for (Edit edit : edits) {
      byLocation.computeIfAbsent(edit.location(), k -> new ArrayList<>()).add(edit);
    }
    PriorityQueue<SyntaxNode> pending =
        new PriorityQueue<>(Comparator.comparingInt(SyntaxNode::depth).reversed());
    pending.addAll(byLocation.keySet());

    // rebuilt children of nodes not yet processed, keyed by slot index
    Map<SyntaxNode, Map<Integer, GreenNode>> rebuiltChildren = new HashMap<>();
    GreenNode newRoot = null;
    while (!pending.isEmpty()) {
      SyntaxNode node = pending.poll();
      GreenNode rebuilt =
          rebuild(
              node,
              byLocation.getOrDefault(node, List.of()),
              rebuiltChildren.getOrDefault(node, Map.of()));
      Optional<SyntaxNode> parent = node.parent();
      if (parent.isEmpty()) {
        newRoot = rebuilt;
        continue;
      }
      Map<Integer, GreenNode> siblings = rebuiltChildren.get(parent.get());
      if (siblings == null) {
        siblings = new HashMap<>();
        rebuiltChildren.put(parent.get(), siblings);
        if (!byLocation.containsKey(parent.get())) {
          pending.add(parent.get());
        }
      }
      siblings.put(node.indexInParent(), rebuilt);
    }
    log.debug(
        "Committed {} edits ({} removed or replaced) in {} nodes",
        edits.size(),
        replacedOrRemoved.size(),
        byLocation.size());
    return SyntaxNode.newRoot(newRoot);
  }

  private Set<Edit> resolveListRemovals() {
    Set<Edit> resolved = new LinkedHashSet<>();
    Map<SyntaxNode, List<Edit.RemoveListElement>> byList = new LinkedHashMap<>();
    for (Edit edit : edits) {
      if (edit instanceof Edit.RemoveListElement remove) {
        byList.computeIfAbsent(remove.location(), k -> new ArrayList<>()).add(remove);
      } else {
        resolved.add(edit);
      }
    }
    byList.forEach((list, removals) -> resolveList(list, removals, resolved));
    return resolved;
  }

  private static void resolveList(
      SyntaxNode list, List<Edit.RemoveListElement> removals, Set<Edit> out) {
    Edit.RemoveListElement first = removals.get(0);
    Set<SyntaxNode> removed = new HashSet<>();
    for (Edit.RemoveListElement removal : removals) {
      if (!removal.whenEmpty().equals(first.whenEmpty())
          || removal.separator() != first.separator()) {
        throw SyntaxContractException.conflictingEdits(
            "list removals disagree on how to repair the list", list.textRange());
      }
      removed.add(removal.target());
    }
    List<SeparatedList.Element> elements = SeparatedList.elements(list, first.separator());
    int lastKept = -1;
    for (int i = 0; i < elements.size(); i++) {
      if (!removed.contains(elements.get(i).node())) {
        lastKept = i;
      }
    }
    if (lastKept < 0) {
      out.add(new Edit.Remove(first.whenEmpty()));
      return;
    }
    boolean trailingSeparator = elements.get(elements.size() - 1).separator().isPresent();
    for (int i = 0; i < elements.size(); i++) {
      SeparatedList.Element element = elements.get(i);
      if (removed.contains(element.node())) {
        out.add(new Edit.Remove(element.node()));
        element.separator().ifPresent(sep -> out.add(new Edit.Remove(sep)));
      } else if (i == lastKept && lastKept < elements.size() - 1 && !trailingSeparator) {
        element.separator().ifPresent(sep -> out.add(new Edit.Remove(sep)));
      }
    }
  }

  private Set<SyntaxElement> validate(Set<Edit> edits) {
    Map<SyntaxElement, Edit> slotEdits = new HashMap<>();
    for (Edit edit : edits) {
      SyntaxElement target = edit.target();
      if (!target.root().equals(root)) {
        throw SyntaxContractException.foreignElement(target.textRange());
      }
      if (target.equals(root) && !(edit instanceof Edit.Replace || edit instanceof Edit.Append)) {
        throw SyntaxContractException.conflictingEdits(
            "the root can only be replaced or appended to", target.textRange());
      }
      if (edit.isSlotEdit()) {
        Edit previous = slotEdits.putIfAbsent(target, edit);
        if (previous != null) {
          throw SyntaxContractException.conflictingEdits(
              "element is removed or replaced more than once", target.textRange());
        }
      }
    }
    Set<SyntaxElement> replacedOrRemoved = new HashSet<>(slotEdits.keySet());
    for (Edit edit : edits) {
      if (edit.target().equals(root)) {
        if (edit instanceof Edit.Replace && edits.size() > 1) {
          throw SyntaxContractException.conflictingEdits(
              "edit inside a replaced root", root.textRange());
        }
        continue;
      }
      SyntaxNode location = edit.location();
      for (SyntaxNode n = location; n != null; n = n.parent().orElse(null)) {
        if (replacedOrRemoved.contains(n)) {
          throw SyntaxContractException.conflictingEdits(
              "edit inside a removed or replaced subtree", edit.target().textRange());
        }
      }
    }
    return replacedOrRemoved;
  }

  private static GreenNode rebuild(
      SyntaxNode node, List<Edit> edits, Map<Integer, GreenNode> rebuiltChildren) {
    GreenNode green = node.green();
    int count = green.childCount();
    List<List<GreenElement>> before = new ArrayList<>(count);
    List<List<GreenElement>> after = new ArrayList<>(count);
    GreenElement[] slots = new GreenElement[count];
    boolean[] removed = new boolean[count];
    for (int i = 0; i < count; i++) {
      before.add(new ArrayList<>(0));
      after.add(new ArrayList<>(0));
      GreenNode rebuilt = rebuiltChildren.get(i);
      slots[i] = rebuilt != null ? rebuilt : green.child(i);
    }
    List<GreenElement> appended = new ArrayList<>();
    for (Edit edit : edits) {
      if (edit instanceof Edit.Remove remove) {
        removed[remove.target().indexInParent()] = true;
      } else if (edit instanceof Edit.Replace replace) {
        slots[replace.target().indexInParent()] = replace.replacement();
      } else if (edit instanceof Edit.InsertBefore insert) {
        before.get(insert.target().indexInParent()).add(insert.element());
      } else if (edit instanceof Edit.InsertAfter insert) {
        after.get(insert.target().indexInParent()).add(insert.element());
      } else if (edit instanceof Edit.Append append) {
        appended.add(append.element());
      }
    }
    List<GreenElement> children = new ArrayList<>(count + appended.size());
    for (int i = 0; i < count; i++) {
      children.addAll(before.get(i));
      if (!removed[i]) {
        children.add(slots[i]);
      }
      children.addAll(after.get(i));
    }
    children.addAll(appended);
    return green.withChildren(children);
  }

  @Override
  public String toString() {
    return "BatchMutation{" + root.kind().name() + ", " + edits.size() + " edits}";
  }
}
