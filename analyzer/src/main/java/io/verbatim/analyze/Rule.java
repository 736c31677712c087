package io.verbatim.analyze;

import io.verbatim.syntax.api.Diagnostic;
import java.util.List;
import java.util.Optional;

/**
 * A lint rule. Rules are stateless: every method is a pure function of its arguments, so one
 * instance serves any number of concurrent analyses.
 *
 * @param <S> what {@link #run} found at a node, passed back to {@link #diagnostic} and {@link
 *     #action}
 */
public interface Rule<S> {

  RuleMetadata metadata();

  Query query();

  /** Inspects the queried node. Each returned state becomes one signal. */
  List<S> run(RuleContext ctx);

  /** The diagnostic for one match; empty to emit no diagnostic. */
  Optional<Diagnostic> diagnostic(RuleContext ctx, S state);

  /** The fix for one match, if the rule offers one. */
  default Optional<RuleAction> action(RuleContext ctx, S state) {
    return Optional.empty();
  }
}
