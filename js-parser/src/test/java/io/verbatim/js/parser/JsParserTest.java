package io.verbatim.js.parser;

import static io.verbatim.js.JsSyntaxKind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxTree;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class JsParserTest {

  static SyntaxTree parseClean(String text) {
    SyntaxTree tree = JsParser.parse(text);
    assertEquals(List.of(), tree.diagnostics(), () -> "diagnostics for " + text);
    assertEquals(text, tree.text());
    return tree;
  }

  static SyntaxNode first(SyntaxTree tree, SyntaxKind kind) {
    return tree.root()
        .descendants()
        .filter(n -> n.kind() == kind)
        .findFirst()
        .orElseThrow(
            () -> new AssertionError("no " + kind.name() + " in\n" + tree.root().debugTree()));
  }

  static List<SyntaxKind> childKinds(SyntaxNode node) {
    return node.childNodes().stream().map(SyntaxNode::kind).collect(Collectors.toList());
  }

  static List<SyntaxKind> statementKinds(SyntaxTree tree) {
    return childKinds(first(tree, JS_MODULE_ITEM_LIST));
  }

  @Test
  void parsesVariableStatement() {
    SyntaxTree tree = parseClean("const a = 1;");

    assertEquals(
        "JS_MODULE\n"
            + "  JS_MODULE_ITEM_LIST\n"
            + "    JS_VARIABLE_STATEMENT\n"
            + "      JS_VARIABLE_DECLARATION\n"
            + "        CONST_KW \"const\"\n"
            + "        JS_VARIABLE_DECLARATOR_LIST\n"
            + "          JS_VARIABLE_DECLARATOR\n"
            + "            JS_IDENTIFIER_BINDING\n"
            + "              IDENT \"a\"\n"
            + "            JS_INITIALIZER_CLAUSE\n"
            + "              EQ \"=\"\n"
            + "              JS_NUMBER_LITERAL_EXPRESSION\n"
            + "                JS_NUMBER_LITERAL \"1\"\n"
            + "      SEMICOLON \";\"\n"
            + "  EOF \"\"\n",
        tree.root().debugTree());
  }

  @Test
  void declaratorListKeepsSeparators() {
    SyntaxTree tree = parseClean("let a = 1, b, c = \"x\";");

    SyntaxNode list = first(tree, JS_VARIABLE_DECLARATOR_LIST);
    assertEquals(
        List.of(JS_VARIABLE_DECLARATOR, JS_VARIABLE_DECLARATOR, JS_VARIABLE_DECLARATOR),
        childKinds(list));
    assertEquals(2, list.childTokens().size());
  }

  @Test
  void insertsSemicolonsAtLineBreaksAndBeforeClosingBrace() {
    SyntaxTree tree = parseClean("a\nb = 2\n{ c }");

    assertEquals(
        List.of(JS_EXPRESSION_STATEMENT, JS_EXPRESSION_STATEMENT, JS_BLOCK_STATEMENT),
        statementKinds(tree));
  }

  @Test
  void binaryOperatorsFollowPrecedence() {
    SyntaxTree tree = parseClean("a + b * c;");

    SyntaxNode sum = first(tree, JS_BINARY_EXPRESSION);
    assertEquals("a + b * c", sum.textTrimmed());
    assertEquals(List.of(JS_IDENTIFIER_EXPRESSION, JS_BINARY_EXPRESSION), childKinds(sum));
    assertEquals("b * c", sum.childNodes().get(1).textTrimmed());
  }

  @Test
  void binaryOperatorsAssociateLeft() {
    SyntaxTree tree = parseClean("a - b - c;");

    SyntaxNode outer = first(tree, JS_BINARY_EXPRESSION);
    assertEquals("a - b", outer.childNodes().get(0).textTrimmed());
  }

  @Test
  void logicalOperatorsGetTheirOwnKind() {
    SyntaxTree tree = parseClean("a || b && c ?? d;");

    SyntaxNode outer = first(tree, JS_LOGICAL_EXPRESSION);
    assertEquals("a || b && c ?? d", outer.textTrimmed());
    assertEquals("a || b && c", outer.childNodes().get(0).textTrimmed());
  }

  @Test
  void parsesMemberAccessAndCallChains() {
    SyntaxTree tree = parseClean("a.b(c)[d].if;");

    SyntaxNode outer = first(tree, JS_STATIC_MEMBER_EXPRESSION);
    assertEquals("a.b(c)[d].if", outer.textTrimmed());
    assertEquals(List.of(JS_COMPUTED_MEMBER_EXPRESSION, JS_NAME), childKinds(outer));
    SyntaxNode name = outer.childNodes().get(1);
    assertEquals(IDENT, name.childTokens().get(0).kind());
    SyntaxNode call = first(tree, JS_CALL_EXPRESSION);
    assertEquals(List.of(JS_STATIC_MEMBER_EXPRESSION, JS_CALL_ARGUMENTS), childKinds(call));
  }

  @Test
  void assignmentTargetsAreReclassified() {
    SyntaxTree tree = parseClean("a = 1; a.b += 2; a[0] = 3; i++; --j;");

    assertThat(tree.root().descendants().map(SyntaxNode::kind))
        .contains(
            JS_IDENTIFIER_ASSIGNMENT,
            JS_STATIC_MEMBER_ASSIGNMENT,
            JS_COMPUTED_MEMBER_ASSIGNMENT,
            JS_POST_UPDATE_EXPRESSION,
            JS_PRE_UPDATE_EXPRESSION)
        .doesNotContain(JS_BOGUS_ASSIGNMENT);
  }

  @Test
  void invalidAssignmentTargetBecomesBogus() {
    SyntaxTree tree = JsParser.parse("1 = a;");

    assertEquals("1 = a;", tree.text());
    assertEquals("Invalid assignment to `1`", tree.diagnostics().get(0).message());
    assertEquals("1", first(tree, JS_BOGUS_ASSIGNMENT).textTrimmed());
  }

  @Test
  void parsesArrowFunctions() {
    SyntaxTree tree = parseClean("els.forEach(el => { el });\nconst add = (a, b = 1) => a + b;");

    List<SyntaxNode> arrows =
        tree.root()
            .descendants()
            .filter(n -> n.kind() == JS_ARROW_FUNCTION_EXPRESSION)
            .collect(Collectors.toList());
    assertEquals(2, arrows.size());
    assertEquals(List.of(JS_IDENTIFIER_BINDING, JS_FUNCTION_BODY), childKinds(arrows.get(0)));
    assertEquals(List.of(JS_PARAMETERS, JS_BINARY_EXPRESSION), childKinds(arrows.get(1)));
  }

  @Test
  void parenthesizedExpressionIsNotAnArrow() {
    SyntaxTree tree = parseClean("(a + b) * c;\n(a, b);");

    assertThat(tree.root().descendants().map(SyntaxNode::kind))
        .contains(JS_PARENTHESIZED_EXPRESSION, JS_SEQUENCE_EXPRESSION)
        .doesNotContain(JS_ARROW_FUNCTION_EXPRESSION, JS_PARAMETERS);
  }

  @Test
  void slashStartsRegexOnlyInOperandPosition() {
    SyntaxTree tree = parseClean("const r = /ab+c/g;\nx = a / b / c;");

    SyntaxNode regex = first(tree, JS_REGEX_LITERAL_EXPRESSION);
    assertEquals("/ab+c/g", regex.textTrimmed());
    assertEquals(JS_REGEX_LITERAL, regex.childTokens().get(0).kind());
    assertEquals(
        1, tree.root().descendants().filter(n -> n.kind() == JS_REGEX_LITERAL_EXPRESSION).count());
  }

  @Test
  void parsesControlFlow() {
    SyntaxTree tree =
        parseClean(
            "if (a) b(); else { c(); }\n"
                + "for (let i = 0; i < n; i++) {}\n"
                + "for (const el of els) { el }\n"
                + "for (k in o) ;\n"
                + "function f(a, b = 1) { return a + b; }\n");

    assertEquals(
        List.of(
            JS_IF_STATEMENT,
            JS_FOR_STATEMENT,
            JS_FOR_OF_STATEMENT,
            JS_FOR_IN_STATEMENT,
            JS_FUNCTION_DECLARATION),
        statementKinds(tree));
    SyntaxNode forOf = first(tree, JS_FOR_OF_STATEMENT);
    assertEquals(JS_FOR_VARIABLE_DECLARATION, forOf.childNodes().get(0).kind());
    assertTrue(forOf.childToken(OF_KW).isPresent());
    assertEquals(
        JS_IDENTIFIER_ASSIGNMENT, first(tree, JS_FOR_IN_STATEMENT).childNodes().get(0).kind());
    assertEquals(
        List.of(JS_IDENTIFIER_BINDING, JS_PARAMETERS, JS_FUNCTION_BODY),
        childKinds(first(tree, JS_FUNCTION_DECLARATION)));
  }

  @Test
  void inInsideForInitializerParenthesesIsBinary() {
    SyntaxTree tree = parseClean("for (x = (a in b); x; ) {}");

    assertEquals(JS_FOR_STATEMENT, statementKinds(tree).get(0));
    assertEquals("a in b", first(tree, JS_BINARY_EXPRESSION).textTrimmed());
  }

  @Test
  void parsesLiterals() {
    SyntaxTree tree =
        parseClean("x = [1, , 'two', true, null, this];\ny = { a, b: 1, \"c\": 2, if: 3 };");

    assertEquals(5, first(tree, JS_ARRAY_ELEMENT_LIST).childNodes().size());
    assertEquals(
        List.of(
            JS_SHORTHAND_PROPERTY_OBJECT_MEMBER,
            JS_PROPERTY_OBJECT_MEMBER,
            JS_PROPERTY_OBJECT_MEMBER,
            JS_PROPERTY_OBJECT_MEMBER),
        childKinds(first(tree, JS_OBJECT_MEMBER_LIST)));
  }

  @Test
  void keepsTriviaOnTokens() {
    String text = "// header\nconst a = 1; // trailing\n\n/* tail */\n";
    SyntaxTree tree = parseClean(text);

    SyntaxNode statement = first(tree, JS_VARIABLE_STATEMENT);
    assertEquals("// header\nconst a = 1; // trailing", statement.text());
    assertEquals("const a = 1;", statement.textTrimmed());
    assertEquals("\n\n/* tail */\n", tree.root().lastToken().orElseThrow().fullText());
  }
}
