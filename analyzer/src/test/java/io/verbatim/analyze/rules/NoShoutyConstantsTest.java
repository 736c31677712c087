package io.verbatim.analyze.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.verbatim.analyze.ActionCategory;
import io.verbatim.analyze.AnalysisResult;
import io.verbatim.analyze.Analyzer;
import io.verbatim.analyze.AnalyzerOptions;
import io.verbatim.analyze.AnalyzerSignal;
import io.verbatim.analyze.Applicability;
import io.verbatim.analyze.Fixes;
import io.verbatim.analyze.RuleAction;
import io.verbatim.analyze.RuleErrorHandler;
import io.verbatim.analyze.RuleRegistry;
import io.verbatim.js.parser.JsParser;
import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.Severity;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.api.TextRange;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class NoShoutyConstantsTest {

  private static AnalysisResult analyze(String source) {
    SyntaxTree tree = JsParser.parse(source);
    assertEquals(List.of(), tree.diagnostics(), () -> "parse errors in " + source);
    RuleRegistry registry = RuleRegistry.builder().register(new NoShoutyConstants()).build();
    return new Analyzer(registry, AnalyzerOptions.defaults(), RuleErrorHandler.DEFAULT)
        .analyze(tree);
  }

  private static String fix(String source) {
    AnalysisResult result = analyze(source);
    assertEquals(1, result.signals().size(), () -> "signals for " + source);
    SyntaxTree fixed = Fixes.applyAll(result);
    assertEquals(List.of(), fixed.diagnostics());
    return fixed.text();
  }

  @Test
  void reportsConstantNamedAfterItsValue() {
    String source = "const FOO = \"FOO\";\nconsole.log(FOO);\nfoo(FOO);";
    AnalysisResult result = analyze(source);

    assertEquals(1, result.signals().size());
    Diagnostic diagnostic = result.diagnostics().get(0);
    assertEquals(Severity.WARNING, diagnostic.severity());
    assertEquals("lint/style/noShoutyConstants", diagnostic.category());
    assertEquals("Redundant constant declaration.", diagnostic.message());
    assertEquals(TextRange.of(6, 17), diagnostic.range());
    assertEquals(
        List.of(
            new Diagnostic.Label(TextRange.of(31, 34), "Used here."),
            new Diagnostic.Label(TextRange.of(41, 44), "Used here.")),
        diagnostic.secondary());
    assertEquals(NoShoutyConstants.NOTE, diagnostic.footerNote());
  }

  @Test
  void offersRefactoring() {
    AnalyzerSignal signal = analyze("const FOO = \"FOO\";\nfoo(FOO);").signals().get(0);

    RuleAction action = signal.fix().orElseThrow();
    assertEquals(ActionCategory.REFACTOR, action.category());
    assertEquals(Applicability.UNSPECIFIED, action.applicability());
    assertEquals("Use the constant value directly", action.message());
  }

  @Test
  void fixInlinesEveryUse() {
    assertEquals(
        "\nconsole.log(\"FOO\");\nfoo( \"FOO\" , 1);",
        fix("const FOO = \"FOO\";\nconsole.log(FOO);\nfoo( FOO , 1);"));
  }

  @Test
  void fixRemovesStatementOfOnlyDeclarator() {
    assertEquals("", fix("const FOO = \"FOO\";"));
  }

  @Test
  void fixRemovesTrailingCommaOfFirstDeclarator() {
    assertEquals("const BAR = 1;", fix("const FOO = \"FOO\", BAR = 1;"));
  }

  @Test
  void fixRemovesPreviousCommaOfLastDeclarator() {
    assertEquals("const BAR = 1;", fix("const BAR = 1, FOO = \"FOO\";"));
  }

  @Test
  void fixRemovesTrailingCommaOfMiddleDeclarator() {
    assertEquals("const A = 1, B = 2;", fix("const A = 1, FOO = \"FOO\", B = 2;"));
  }

  @Test
  void acceptsSingleQuotes() {
    assertEquals("bar('FOO');", fix("const FOO = 'FOO';bar(FOO);"));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "let FOO = \"FOO\";",
        "var FOO = \"FOO\";",
        "const FOO = \"BAR\";",
        "const FOO = \"foo\";",
        "const FOO = FOO2;",
        "for (const FOO of foos) {}"
      })
  void ignoresOtherDeclarations(String source) {
    assertEquals(List.of(), analyze(source).signals());
  }

  @Test
  void referencesAreListedInSourceOrder() {
    AnalysisResult result =
        analyze("function f() { return FOO; }\nconst FOO = \"FOO\";\nf(FOO, () => FOO);");

    List<TextRange> labels =
        result.diagnostics().get(0).secondary().stream().map(Diagnostic.Label::range).toList();
    assertEquals(3, labels.size());
    assertTrue(labels.get(0).start() < labels.get(1).start());
    assertTrue(labels.get(1).start() < labels.get(2).start());
  }

  @Test
  void shadowedNameIsNotAReference() {
    AnalysisResult result = analyze("const FOO = \"FOO\";\n{ let FOO = 1; FOO; }\nFOO;");

    assertEquals(1, result.diagnostics().get(0).secondary().size());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"const FOO = \"FOO\"; FOO = 2;", "for (const FOO = \"FOO\"; FOO; ) {}"})
  void noActionWhenFixWouldBreakCode(String source) {
    AnalysisResult result = analyze(source);

    assertEquals(1, result.signals().size());
    assertTrue(result.signals().get(0).fix().isEmpty());
  }
}
