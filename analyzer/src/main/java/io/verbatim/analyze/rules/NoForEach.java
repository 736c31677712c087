package io.verbatim.analyze.rules;

import io.verbatim.analyze.Query;
import io.verbatim.analyze.Rule;
import io.verbatim.analyze.RuleContext;
import io.verbatim.analyze.RuleMetadata;
import io.verbatim.js.JsSyntaxKind;
import io.verbatim.js.ast.AnyJsMemberExpression;
import io.verbatim.js.ast.JsCallExpression;
import io.verbatim.js.ast.JsSyntax;
import io.verbatim.syntax.api.Diagnostic;
import java.util.List;
import java.util.Optional;

/**
 * Prefer {@code for...of} over {@code Array.forEach}.
 *
 * <p>{@code forEach} callbacks are often chained with {@code filter} or {@code map}, iterating the
 * same array several times, and they hide the iteration from a debugger. A {@code for...of} loop
 * keeps it explicit.
 *
 * <p>Any call of a member named {@code forEach} is reported, whatever the receiver: every object
 * with a {@code forEach} method is taken to be iterable. Both {@code els.forEach(...)} and {@code
 * els['forEach'](...)} match.
 */
public final class NoForEach implements Rule<AnyJsMemberExpression> {
  static final RuleMetadata METADATA = new RuleMetadata("complexity", "noForEach", "1.0.0", true);
  static final String MESSAGE = "Prefer for...of instead of Array.forEach";
  static final String NOTE =
      "forEach could lead to performance issues when working with large arrays. When combined"
          + " with functions like .filter or .map, this causes multiple iterations over the same"
          + " type.";

  private static final Query QUERY = Query.syntax(JsSyntaxKind.JS_CALL_EXPRESSION);

  @Override
  public RuleMetadata metadata() {
    return METADATA;
  }

  @Override
  public Query query() {
    return QUERY;
  }

  @Override
  public List<AnyJsMemberExpression> run(RuleContext ctx) {
    return JsCallExpression.cast(ctx.node())
        .map(call -> JsSyntax.omitParentheses(call.callee()))
        .flatMap(AnyJsMemberExpression::cast)
        .filter(member -> member.memberName().filter("forEach"::equals).isPresent())
        .map(member -> List.of(member))
        .orElse(List.of());
  }

  @Override
  public Optional<Diagnostic> diagnostic(RuleContext ctx, AnyJsMemberExpression member) {
    return Optional.of(
        Diagnostic.error(ctx.node().textTrimmedRange(), MESSAGE).withFooterNote(NOTE));
  }
}
