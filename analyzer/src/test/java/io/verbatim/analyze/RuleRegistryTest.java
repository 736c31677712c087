package io.verbatim.analyze;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.verbatim.analyze.rules.JsRules;
import io.verbatim.analyze.rules.NoForEach;
import io.verbatim.analyze.rules.NoShoutyConstants;
import io.verbatim.js.JsSyntaxKind;
import org.junit.jupiter.api.Test;

public class RuleRegistryTest {

  @Test
  void indexesRulesByQueriedKind() {
    RuleRegistry registry = JsRules.recommended();

    assertEquals(2, registry.rules().size());
    assertThat(registry.rulesFor(JsSyntaxKind.JS_CALL_EXPRESSION))
        .singleElement()
        .isInstanceOf(NoForEach.class);
    assertThat(registry.rulesFor(JsSyntaxKind.JS_VARIABLE_DECLARATOR))
        .singleElement()
        .isInstanceOf(NoShoutyConstants.class);
    assertThat(registry.rulesFor(JsSyntaxKind.JS_MODULE)).isEmpty();
    assertTrue(registry.needsSemanticModel());
  }

  @Test
  void keepsRegistrationOrderPerKind() {
    Rule<?> first = AnalyzerTest.testRule("first", JsSyntaxKind.JS_MODULE, false, false);
    Rule<?> second = AnalyzerTest.testRule("second", JsSyntaxKind.JS_MODULE, false, false);

    RuleRegistry registry = RuleRegistry.builder().register(second).register(first).build();

    assertThat(registry.rulesFor(JsSyntaxKind.JS_MODULE)).containsExactly(second, first);
    assertFalse(registry.needsSemanticModel());
  }

  @Test
  void rejectsDuplicateCategories() {
    RuleRegistry.Builder builder = RuleRegistry.builder().register(new NoForEach());

    assertThatThrownBy(() -> builder.register(new NoForEach()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Rule already registered: lint/complexity/noForEach");
  }

  @Test
  void filterDropsDisabledRules() {
    RuleRegistry registry = JsRules.recommended();

    assertSame(registry, registry.filter(AnalyzerOptions.defaults()));
    RuleRegistry filtered =
        registry.filter(AnalyzerOptions.defaults().withDisabledRules("lint/complexity"));
    assertThat(filtered.rules()).singleElement().isInstanceOf(NoShoutyConstants.class);
    assertThat(filtered.rulesFor(JsSyntaxKind.JS_CALL_EXPRESSION)).isEmpty();
  }
}
