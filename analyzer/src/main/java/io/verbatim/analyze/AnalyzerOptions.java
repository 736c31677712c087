package io.verbatim.analyze;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analyzer settings.
 *
 * <p>Recognized system properties:
 *
 * <ul>
 *   <li>{@code verbatim.analyzer.disabledRules} - comma separated rule names ({@code noForEach})
 *       or categories ({@code lint/style}, {@code lint/style/noShoutyConstants})
 *   <li>{@code verbatim.analyzer.ignoreSuppressions} - report signals even where a suppression
 *       comment silences them
 * </ul>
 *
 * @param disabledRules rule names or categories that are not run
 * @param ignoreSuppressions whether suppression comments are ignored
 */
public record AnalyzerOptions(Set<String> disabledRules, boolean ignoreSuppressions) {
  static final String PROP_DISABLED_RULES = "verbatim.analyzer.disabledRules";
  static final String PROP_IGNORE_SUPPRESSIONS = "verbatim.analyzer.ignoreSuppressions";

  public AnalyzerOptions {
    disabledRules = Set.copyOf(disabledRules);
  }

  public static AnalyzerOptions defaults() {
    return new AnalyzerOptions(Set.of(), false);
  }

  public static AnalyzerOptions fromSystemProperties() {
    return new AnalyzerOptions(
        parseList(System.getProperty(PROP_DISABLED_RULES, "")),
        Boolean.getBoolean(PROP_IGNORE_SUPPRESSIONS));
  }

  static Set<String> parseList(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }

  public AnalyzerOptions withDisabledRules(String... rules) {
    return new AnalyzerOptions(Set.of(rules), ignoreSuppressions);
  }

  public AnalyzerOptions withIgnoreSuppressions(boolean ignore) {
    return new AnalyzerOptions(disabledRules, ignore);
  }

  public boolean isEnabled(RuleMetadata rule) {
    return !disabledRules.contains(rule.name())
        && !disabledRules.contains(rule.category())
        && !disabledRules.contains(rule.groupCategory());
  }
}
