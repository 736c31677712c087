package io.verbatim.syntax.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Reads a list node whose elements are separated by delimiter tokens, e.g. {@code a, b, c}. */
public final class SeparatedList {

  /**
   * One list element with the separator that follows it, if any.
   *
   * @param node the element
   * @param trailingSeparator the separator after the element, {@code null} for the last element of
   *     a list without a trailing separator
   */
  public record Element(SyntaxNode node, SyntaxToken trailingSeparator) {
    public Optional<SyntaxToken> separator() {
      return Optional.ofNullable(trailingSeparator);
    }
  }

  private SeparatedList() {}

  /**
   * Pairs every child node of {@code list} with the separator token following it. Tokens other
   * than {@code separator} are ignored.
   */
  public static List<Element> elements(SyntaxNode list, SyntaxKind separator) {
    List<Element> elements = new ArrayList<>();
    SyntaxNode pending = null;
    for (SyntaxElement child : list.children()) {
      if (child instanceof SyntaxNode node) {
        if (pending != null) {
          elements.add(new Element(pending, null));
        }
        pending = node;
      } else if (child.kind() == separator && pending != null) {
        elements.add(new Element(pending, (SyntaxToken) child));
        pending = null;
      }
    }
    if (pending != null) {
      elements.add(new Element(pending, null));
    }
    return elements;
  }
}
