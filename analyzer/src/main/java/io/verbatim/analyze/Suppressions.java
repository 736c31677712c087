package io.verbatim.analyze;

import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxToken;
import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.api.TriviaPiece;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suppression comments: {@code // verbatim-ignore lint/style/noShoutyConstants: reason}, or the
 * same text in a block comment. A comment in the leading trivia of a node suppresses the named
 * rules for that node and everything inside it. A category without a rule name ({@code
 * lint/style}) suppresses the whole group.
 *
 * <p>The root node is never consulted: its leading trivia is the file header. List nodes are
 * skipped too. A list shares its first token with its first element, so a comment there belongs
 * to that element and must not reach the element's siblings.
 */
public final class Suppressions {
  static final String MARKER = "verbatim-ignore";

  private Suppressions() {}

  /** Whether {@code node} or a non-root, non-list ancestor suppresses {@code rule}. */
  public static boolean isSuppressed(SyntaxNode node, RuleMetadata rule) {
    for (SyntaxNode n = node; n != null && !n.isRoot(); n = n.parent().orElse(null)) {
      if (n.kind().isList()) {
        continue;
      }
      Optional<SyntaxToken> first = n.firstToken();
      if (first.isEmpty()) {
        continue;
      }
      for (TriviaPiece piece : first.get().leadingTrivia()) {
        if (piece.isComment() && suppresses(categories(piece), rule)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean suppresses(List<String> categories, RuleMetadata rule) {
    for (String category : categories) {
      if (category.equals(rule.category()) || category.equals(rule.groupCategory())) {
        return true;
      }
    }
    return false;
  }

  /** Categories named by a suppression comment, empty for any other comment. */
  static List<String> categories(TriviaPiece comment) {
    String text = comment.text();
    if (comment.kind() == TriviaKind.SINGLE_LINE_COMMENT) {
      text = text.substring(2);
    } else if (text.length() >= 4 && text.endsWith("*/")) {
      text = text.substring(2, text.length() - 2);
    } else {
      text = text.substring(2);
    }
    text = text.trim();
    if (!text.startsWith(MARKER)) {
      return List.of();
    }
    String rest = text.substring(MARKER.length());
    int colon = rest.indexOf(':');
    if (colon >= 0) {
      rest = rest.substring(0, colon);
    }
    List<String> categories = new ArrayList<>();
    for (String part : rest.trim().split("\\s+")) {
      if (part.startsWith(RuleMetadata.CATEGORY_PREFIX + "/")) {
        categories.add(part);
      }
    }
    return categories;
  }
}
