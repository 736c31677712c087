package io.verbatim.analyze.rules;

import io.verbatim.analyze.Rule;
import io.verbatim.analyze.RuleRegistry;
import java.util.List;

/** The JavaScript lint rules. */
public final class JsRules {

  private JsRules() {}

  public static List<Rule<?>> all() {
    return List.of(new NoForEach(), new NoShoutyConstants());
  }

  /** A registry of the rules marked recommended. */
  public static RuleRegistry recommended() {
    RuleRegistry.Builder builder = RuleRegistry.builder();
    for (Rule<?> rule : all()) {
      if (rule.metadata().recommended()) {
        builder.register(rule);
      }
    }
    return builder.build();
  }
}
