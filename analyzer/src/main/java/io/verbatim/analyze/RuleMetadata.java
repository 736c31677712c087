package io.verbatim.analyze;

import java.util.Objects;

/**
 * Identity of a rule.
 *
 * @param group rule group, e.g. {@code style}
 * @param name rule name, e.g. {@code noShoutyConstants}
 * @param version release that introduced the rule
 * @param recommended whether the rule is enabled by the recommended rule set
 */
public record RuleMetadata(String group, String name, String version, boolean recommended) {
  public static final String CATEGORY_PREFIX = "lint";

  public RuleMetadata {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
  }

  /** Full category, e.g. {@code lint/style/noShoutyConstants}. */
  public String category() {
    return CATEGORY_PREFIX + "/" + group + "/" + name;
  }

  /** {@code lint/<group>}. */
  public String groupCategory() {
    return CATEGORY_PREFIX + "/" + group;
  }
}
