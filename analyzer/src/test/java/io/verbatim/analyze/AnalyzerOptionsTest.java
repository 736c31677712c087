package io.verbatim.analyze;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class AnalyzerOptionsTest {
  private static final RuleMetadata RULE =
      new RuleMetadata("style", "noShoutyConstants", "0.7.0", true);

  @AfterEach
  void clearProperties() {
    System.clearProperty(AnalyzerOptions.PROP_DISABLED_RULES);
    System.clearProperty(AnalyzerOptions.PROP_IGNORE_SUPPRESSIONS);
  }

  @Test
  void defaultsEnableEverything() {
    AnalyzerOptions options = AnalyzerOptions.defaults();

    assertTrue(options.isEnabled(RULE));
    assertFalse(options.ignoreSuppressions());
  }

  @Test
  void readsSystemProperties() {
    System.setProperty(AnalyzerOptions.PROP_DISABLED_RULES, " noForEach, lint/style ,,");
    System.setProperty(AnalyzerOptions.PROP_IGNORE_SUPPRESSIONS, "true");

    AnalyzerOptions options = AnalyzerOptions.fromSystemProperties();

    assertEquals(Set.of("noForEach", "lint/style"), options.disabledRules());
    assertTrue(options.ignoreSuppressions());
    assertFalse(options.isEnabled(RULE));
  }

  @Test
  void missingPropertiesMeanDefaults() {
    assertEquals(AnalyzerOptions.defaults(), AnalyzerOptions.fromSystemProperties());
  }

  @Test
  void disablesByNameCategoryOrGroup() {
    for (String disabled : new String[] {"noShoutyConstants", "lint/style/noShoutyConstants"}) {
      assertFalse(AnalyzerOptions.defaults().withDisabledRules(disabled).isEnabled(RULE));
    }
    assertFalse(AnalyzerOptions.defaults().withDisabledRules("lint/style").isEnabled(RULE));
    assertTrue(AnalyzerOptions.defaults().withDisabledRules("style").isEnabled(RULE));
    assertTrue(AnalyzerOptions.defaults().withDisabledRules("lint/styles").isEnabled(RULE));
  }
}
