package io.verbatim.analyze;

import io.verbatim.syntax.api.SyntaxKind;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The rules of an analyzer, indexed by the node kinds they query. Immutable once built; safe to
 * share across threads.
 */
public final class RuleRegistry {
  private final List<Rule<?>> rules;
  private final Reference2ObjectOpenHashMap<SyntaxKind, List<Rule<?>>> byKind;
  private final boolean semantic;

  private RuleRegistry(List<Rule<?>> rules) {
    this.rules = List.copyOf(rules);
    this.byKind = new Reference2ObjectOpenHashMap<>();
    boolean anySemantic = false;
    for (Rule<?> rule : this.rules) {
      for (SyntaxKind kind : rule.query().kinds()) {
        byKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(rule);
      }
      anySemantic |= rule.query().semantic();
    }
    this.semantic = anySemantic;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Rule<?>> rules() {
    return rules;
  }

  /** Rules querying {@code kind}, in registration order. */
  public List<Rule<?>> rulesFor(SyntaxKind kind) {
    List<Rule<?>> found = byKind.get(kind);
    return found != null ? found : List.of();
  }

  /** Whether any rule reads the semantic model. */
  public boolean needsSemanticModel() {
    return semantic;
  }

  /** A registry with only the rules {@code options} leaves enabled. */
  public RuleRegistry filter(AnalyzerOptions options) {
    List<Rule<?>> enabled = new ArrayList<>(rules.size());
    for (Rule<?> rule : rules) {
      if (options.isEnabled(rule.metadata())) {
        enabled.add(rule);
      }
    }
    return enabled.size() == rules.size() ? this : new RuleRegistry(enabled);
  }

  @Override
  public String toString() {
    return "RuleRegistry{" + rules.size() + " rules, " + byKind.size() + " kinds}";
  }

  public static final class Builder {
    private final List<Rule<?>> rules = new ArrayList<>();
    private final Set<String> categories = new HashSet<>();

    private Builder() {}

    /**
     * @throws IllegalArgumentException if a rule of the same category is already registered
     */
    public Builder register(Rule<?> rule) {
      if (!categories.add(rule.metadata().category())) {
        throw new IllegalArgumentException(
            "Rule already registered: " + rule.metadata().category());
      }
      rules.add(rule);
      return this;
    }

    public RuleRegistry build() {
      return new RuleRegistry(rules);
    }
  }
}
