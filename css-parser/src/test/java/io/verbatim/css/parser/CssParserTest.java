package io.verbatim.css.parser;

import static io.verbatim.css.CssSyntaxKind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.api.TextRange;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class CssParserTest {

  private static SyntaxTree parseClean(String text) {
    SyntaxTree tree = CssParser.parse(text);
    assertEquals(List.of(), tree.diagnostics(), () -> "diagnostics for " + text);
    assertEquals(text, tree.text());
    return tree;
  }

  private static SyntaxNode first(SyntaxTree tree, SyntaxKind kind) {
    return tree.root()
        .descendants()
        .filter(n -> n.kind() == kind)
        .findFirst()
        .orElseThrow(
            () -> new AssertionError("no " + kind.name() + " in\n" + tree.root().debugTree()));
  }

  private static List<SyntaxKind> ruleKinds(SyntaxTree tree) {
    return first(tree, CSS_RULE_LIST).childNodes().stream()
        .map(SyntaxNode::kind)
        .collect(Collectors.toList());
  }

  @Test
  void colorProfileWithNumberNameBecomesBogusAtRule() {
    SyntaxTree tree = CssParser.parse("@color-profile 123 { }");

    assertEquals("@color-profile 123 { }", tree.text());
    assertEquals(
        "CSS_ROOT\n"
            + "  CSS_RULE_LIST\n"
            + "    CSS_BOGUS_AT_RULE\n"
            + "      AT \"@\"\n"
            + "      COLOR_PROFILE_KW \"color-profile\"\n"
            + "      CSS_BOGUS\n"
            + "        CSS_NUMBER_LITERAL \"123\"\n"
            + "      CSS_DECLARATION_LIST_BLOCK\n"
            + "        L_CURLY \"{\"\n"
            + "        CSS_DECLARATION_LIST\n"
            + "        R_CURLY \"}\"\n"
            + "  EOF \"\"\n",
        tree.root().debugTree());
    assertEquals(1, tree.diagnostics().size());
    Diagnostic diagnostic = tree.diagnostics().get(0);
    assertEquals(
        "Expected a non-CSS-wide keyword identifier but instead found '123'",
        diagnostic.message());
    assertEquals(TextRange.of(15, 18), diagnostic.range());
  }

  @Test
  void colorProfileRejectsCssWideKeywords() {
    List<String> keywords =
        List.of("inherit", "initial", "unset", "revert", "revert-layer", "default");
    for (String keyword : keywords) {
      SyntaxTree tree = CssParser.parse("@color-profile " + keyword + " {}");

      assertEquals(List.of(CSS_BOGUS_AT_RULE), ruleKinds(tree), keyword);
      assertEquals(keyword, first(tree, CSS_BOGUS).textTrimmed());
      assertEquals(
          "Expected a non-CSS-wide keyword identifier but instead found '" + keyword + "'",
          tree.diagnostics().get(0).message());
    }
  }

  @Test
  void colorProfileWithoutNameKeepsBlock() {
    SyntaxTree tree = CssParser.parse("@color-profile { src: x }");

    assertEquals(List.of(CSS_BOGUS_AT_RULE), ruleKinds(tree));
    assertThat(tree.root().descendants().map(SyntaxNode::kind))
        .contains(CSS_DECLARATION_LIST_BLOCK, CSS_GENERIC_PROPERTY)
        .doesNotContain(CSS_BOGUS);
    assertEquals(
        "Expected a non-CSS-wide keyword identifier but instead found '{'",
        tree.diagnostics().get(0).message());
  }

  @Test
  void parsesValidColorProfile() {
    SyntaxTree tree =
        parseClean(
            "@color-profile --swop5c {\n"
                + "  src: url(\"https://example.org/SWOP2006_Coated5v2.icc\");\n"
                + "  rendering-intent: relative-colorimetric;\n"
                + "}\n");

    SyntaxNode rule = first(tree, CSS_COLOR_PROFILE_AT_RULE);
    assertEquals("--swop5c", first(tree, CSS_CUSTOM_IDENTIFIER).textTrimmed());
    assertEquals(2, first(tree, CSS_DECLARATION_LIST).childNodes().size());
    SyntaxNode function = first(tree, CSS_FUNCTION);
    assertEquals("url(\"https://example.org/SWOP2006_Coated5v2.icc\")", function.textTrimmed());
    assertEquals(CSS_STRING, first(tree, CSS_PARAMETER_LIST).childNodes().get(0).kind());
    assertTrue(rule.childToken(COLOR_PROFILE_KW).isPresent());
  }

  @Test
  void colorProfileNameMayBeANonCssWideKeyword() {
    SyntaxTree tree = parseClean("@color-profile important {}");

    assertEquals(List.of(CSS_COLOR_PROFILE_AT_RULE), ruleKinds(tree));
    assertEquals(IDENT, first(tree, CSS_CUSTOM_IDENTIFIER).childTokens().get(0).kind());
  }

  @Test
  void parsesCharset() {
    SyntaxTree tree = parseClean("@charset \"utf-8\";\na {}");

    assertEquals(List.of(CSS_CHARSET_AT_RULE, CSS_QUALIFIED_RULE), ruleKinds(tree));
  }

  @Test
  void charsetWithoutStringIsBogus() {
    SyntaxTree tree = CssParser.parse("@charset utf;");

    assertEquals(List.of(CSS_BOGUS_AT_RULE), ruleKinds(tree));
    assertEquals("Expected a string but instead found 'utf'", tree.diagnostics().get(0).message());
    assertEquals("@charset utf;", tree.text());
  }

  @Test
  void unknownAtRuleIsKeptVerbatim() {
    String text = "@media screen { a { color: red } }\nb {}";
    SyntaxTree tree = CssParser.parse(text);

    assertEquals(text, tree.text());
    assertEquals(List.of(CSS_BOGUS_AT_RULE, CSS_QUALIFIED_RULE), ruleKinds(tree));
    assertEquals("Unknown at-rule '@media'", tree.diagnostics().get(0).message());
    assertEquals(1, tree.diagnostics().size());
  }

  @Test
  void parsesSelectors() {
    SyntaxTree tree = parseClean("a.link:hover, #main > .item * {}");

    SyntaxNode list = first(tree, CSS_SELECTOR_LIST);
    assertEquals(
        List.of(CSS_COMPOUND_SELECTOR, CSS_COMPLEX_SELECTOR),
        list.childNodes().stream().map(SyntaxNode::kind).collect(Collectors.toList()));
    assertEquals(
        List.of(CSS_TYPE_SELECTOR, CSS_CLASS_SELECTOR, CSS_PSEUDO_CLASS_SELECTOR),
        list.childNodes().get(0).childNodes().stream()
            .map(SyntaxNode::kind)
            .collect(Collectors.toList()));
    SyntaxNode complex = list.childNodes().get(1);
    assertEquals("#main > .item *", complex.textTrimmed());
    assertEquals(3, complex.childNodes().size());
  }

  @Test
  void parsesDeclarations() {
    SyntaxTree tree =
        parseClean(
            "a { color: #fff; margin: 0 auto !important; width: 50%; font: 12px/1.5 serif }");

    SyntaxNode declarations = first(tree, CSS_DECLARATION_LIST);
    assertEquals(4, declarations.childNodes().size());
    assertThat(tree.root().descendants().map(SyntaxNode::kind))
        .contains(CSS_COLOR, CSS_NUMBER, CSS_PERCENTAGE, CSS_DIMENSION, CSS_DECLARATION_IMPORTANT);
    SyntaxNode last = declarations.childNodes().get(3);
    assertFalse(last.childToken(SEMICOLON).isPresent());
  }

  @Test
  void cssWideKeywordIsAPlainValue() {
    SyntaxTree tree = parseClean("a { color: inherit; }");

    SyntaxNode value = first(tree, CSS_GENERIC_COMPONENT_VALUE_LIST).childNodes().get(0);
    assertEquals(CSS_IDENTIFIER, value.kind());
    assertEquals(IDENT, value.childTokens().get(0).kind());
  }

  @Test
  void recoversFromBrokenDeclaration() {
    SyntaxTree tree = CssParser.parse("a { 12: red; color: blue }");

    assertEquals("a { 12: red; color: blue }", tree.text());
    SyntaxNode declarations = first(tree, CSS_DECLARATION_LIST);
    assertEquals(
        List.of(CSS_BOGUS_DECLARATION_ITEM, CSS_DECLARATION_WITH_SEMICOLON),
        declarations.childNodes().stream().map(SyntaxNode::kind).collect(Collectors.toList()));
    assertEquals("12: red", declarations.childNodes().get(0).textTrimmed());
    assertEquals(
        "Expected a declaration item but instead found '12'",
        tree.diagnostics().get(0).message());
  }

  @Test
  void strayClosingBraceBecomesBogusRule() {
    SyntaxTree tree = CssParser.parse("} a {}");

    assertEquals(List.of(CSS_BOGUS_RULE, CSS_QUALIFIED_RULE), ruleKinds(tree));
    assertEquals(
        "Expected a qualified rule, or an at rule but instead found '}'",
        tree.diagnostics().get(0).message());
  }

  @Test
  void missingBlockMakesRuleBogus() {
    SyntaxTree tree = CssParser.parse("a");

    assertEquals(List.of(CSS_BOGUS_RULE), ruleKinds(tree));
    assertEquals(
        "Expected a declaration block but instead the file ends",
        tree.diagnostics().get(0).message());
  }
}
