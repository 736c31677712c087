package io.verbatim.analyze;

import io.verbatim.syntax.mutation.BatchMutation;
import java.util.Objects;

/**
 * A fix offered with a signal. The mutation is not committed; see {@link Fixes}.
 *
 * @param category quick fix or refactoring
 * @param applicability whether the fix can be applied unattended
 * @param message short description shown to the user
 * @param mutation the edits, started on the analyzed tree
 */
public record RuleAction(
    ActionCategory category, Applicability applicability, String message, BatchMutation mutation) {

  public RuleAction {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(applicability, "applicability");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(mutation, "mutation");
  }
}
