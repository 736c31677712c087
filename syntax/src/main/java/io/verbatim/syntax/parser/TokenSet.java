package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import it.unimi.dsi.fastutil.objects.ReferenceSet;
import it.unimi.dsi.fastutil.objects.ReferenceSets;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Immutable set of token kinds, compared by identity. */
public final class TokenSet {
  public static final TokenSet EMPTY = new TokenSet(new ReferenceOpenHashSet<>());

  private final ReferenceSet<SyntaxKind> kinds;

  private TokenSet(ReferenceSet<SyntaxKind> kinds) {
    this.kinds = ReferenceSets.unmodifiable(kinds);
  }

  public static TokenSet of(SyntaxKind... kinds) {
    return new TokenSet(new ReferenceOpenHashSet<>(Arrays.asList(kinds)));
  }

  public boolean contains(SyntaxKind kind) {
    return kinds.contains(kind);
  }

  public TokenSet union(TokenSet other) {
    ReferenceOpenHashSet<SyntaxKind> merged = new ReferenceOpenHashSet<>(kinds);
    merged.addAll(other.kinds);
    return new TokenSet(merged);
  }

  public TokenSet with(SyntaxKind... more) {
    return union(of(more));
  }

  public boolean isEmpty() {
    return kinds.isEmpty();
  }

  @Override
  public String toString() {
    return kinds.stream()
        .map(SyntaxKind::name)
        .sorted()
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
