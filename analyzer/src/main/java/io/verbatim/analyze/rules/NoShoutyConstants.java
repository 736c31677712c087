package io.verbatim.analyze.rules;

import io.verbatim.analyze.ActionCategory;
import io.verbatim.analyze.Applicability;
import io.verbatim.analyze.Query;
import io.verbatim.analyze.Rule;
import io.verbatim.analyze.RuleAction;
import io.verbatim.analyze.RuleContext;
import io.verbatim.analyze.RuleMetadata;
import io.verbatim.js.JsSyntaxKind;
import io.verbatim.js.ast.JsIdentifierBinding;
import io.verbatim.js.ast.JsIdentifierExpression;
import io.verbatim.js.ast.JsInitializerClause;
import io.verbatim.js.ast.JsStringLiteralExpression;
import io.verbatim.js.ast.JsVariableDeclaration;
import io.verbatim.js.ast.JsVariableDeclarator;
import io.verbatim.js.ast.JsVariableDeclaratorList;
import io.verbatim.js.semantic.Reference;
import io.verbatim.js.semantic.SemanticModel;
import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.mutation.BatchMutation;
import java.util.List;
import java.util.Optional;

/**
 * Disallows constants whose value is a string equal to their own name.
 *
 * <pre>
 * const FOO = "FOO";
 * console.log(FOO);
 * </pre>
 *
 * The fix inlines the literal at every use and removes the declarator.
 */
public final class NoShoutyConstants implements Rule<NoShoutyConstants.State> {
  static final RuleMetadata METADATA =
      new RuleMetadata("style", "noShoutyConstants", "0.7.0", true);
  static final String MESSAGE = "Redundant constant declaration.";
  static final String USED_HERE = "Used here.";
  static final String NOTE =
      "You should avoid declaring constants with a string that's the same value as the variable"
          + " name. It introduces a level of unnecessary indirection when it's only two additional"
          + " characters to inline.";
  static final String ACTION_MESSAGE = "Use the constant value directly";

  private static final Query QUERY = Query.semantic(JsSyntaxKind.JS_VARIABLE_DECLARATOR);

  /**
   * A matched declarator.
   *
   * @param literal the string initializer
   * @param references every use of the constant, in source order
   */
  public record State(JsStringLiteralExpression literal, List<Reference> references) {}

  @Override
  public RuleMetadata metadata() {
    return METADATA;
  }

  @Override
  public Query query() {
    return QUERY;
  }

  @Override
  public List<State> run(RuleContext ctx) {
    Optional<JsVariableDeclarator> declarator = JsVariableDeclarator.cast(ctx.node());
    if (declarator.isEmpty() || declarator.get().parentList().isEmpty()) {
      return List.of();
    }
    boolean isConst =
        declarator
            .get()
            .declaration()
            .flatMap(JsVariableDeclaration::cast)
            .map(JsVariableDeclaration::isConst)
            .orElse(false);
    if (!isConst) {
      return List.of();
    }
    Optional<JsIdentifierBinding> id = declarator.get().id();
    Optional<JsStringLiteralExpression> literal =
        declarator
            .get()
            .initializer()
            .flatMap(JsInitializerClause::expression)
            .flatMap(JsStringLiteralExpression::cast);
    if (id.isEmpty()
        || literal.isEmpty()
        || !id.get().name().equals(literal.get().innerStringText())) {
      return List.of();
    }
    SemanticModel model = ctx.semanticModel();
    return model
        .bindingOf(id.get())
        .map(binding -> List.of(new State(literal.get(), model.allReferences(binding))))
        .orElse(List.of());
  }

  @Override
  public Optional<Diagnostic> diagnostic(RuleContext ctx, State state) {
    Diagnostic diagnostic = Diagnostic.warning(ctx.node().textTrimmedRange(), MESSAGE);
    for (Reference reference : state.references()) {
      diagnostic = diagnostic.withSecondary(reference.node().textTrimmedRange(), USED_HERE);
    }
    return Optional.of(diagnostic.withFooterNote(NOTE));
  }

  /**
   * Removes the declarator and replaces every use by the literal. No action if a use is not a
   * plain read, or the declaration is not a statement of its own.
   */
  @Override
  public Optional<RuleAction> action(RuleContext ctx, State state) {
    JsVariableDeclarator declarator = new JsVariableDeclarator(ctx.node());
    BatchMutation batch = BatchMutation.begin(ctx.root());
    if (!removeDeclarator(batch, declarator)) {
      return Optional.empty();
    }
    for (Reference reference : state.references()) {
      Optional<JsIdentifierExpression> use =
          reference.node().parent().flatMap(JsIdentifierExpression::cast);
      if (use.isEmpty()) {
        return Optional.empty();
      }
      batch.replaceNode(use.get().syntax(), state.literal().syntax().green());
    }
    return Optional.of(
        new RuleAction(
            ActionCategory.REFACTOR, Applicability.UNSPECIFIED, ACTION_MESSAGE, batch));
  }

  /**
   * Removes {@code declarator} keeping its list well formed. Commas are repaired at commit
   * together with other declarators removed by the same batch, and the statement goes away once
   * no declarator is left.
   */
  static boolean removeDeclarator(BatchMutation batch, JsVariableDeclarator declarator) {
    Optional<JsVariableDeclaratorList> list = declarator.parentList();
    Optional<SyntaxNode> statement =
        declarator
            .declaration()
            .flatMap(SyntaxNode::parent)
            .filter(p -> p.kind() == JsSyntaxKind.JS_VARIABLE_STATEMENT);
    if (list.isEmpty() || statement.isEmpty()) {
      return false;
    }
    batch.removeListElement(declarator.syntax(), JsSyntaxKind.COMMA, statement.get());
    return true;
  }
}
