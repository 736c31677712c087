package io.verbatim.analyze;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.verbatim.analyze.rules.JsRules;
import io.verbatim.js.parser.JsParser;
import io.verbatim.syntax.api.TriviaKind;
import io.verbatim.syntax.api.TriviaPiece;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SuppressionsTest {

  private static List<String> categories(String source, AnalyzerOptions options) {
    Analyzer analyzer = new Analyzer(JsRules.recommended(), options, RuleErrorHandler.DEFAULT);
    return analyzer.analyze(JsParser.parse(source)).signals().stream()
        .map(s -> s.rule().category())
        .collect(Collectors.toList());
  }

  private static List<String> categories(String source) {
    return categories(source, AnalyzerOptions.defaults());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "// verbatim-ignore lint/style/noShoutyConstants: the name is the protocol\n",
        "/* verbatim-ignore lint/style/noShoutyConstants */\n",
        "/* verbatim-ignore lint/style/noShoutyConstants */ ",
        "// verbatim-ignore lint/style\n",
        "// verbatim-ignore lint/complexity/noForEach lint/style/noShoutyConstants\n"
      })
  void commentSuppressesRuleOnFollowingStatement(String comment) {
    assertEquals(List.of(), categories("x;\n" + comment + "const FOO = \"FOO\";\nf(FOO);"));
  }

  @Test
  void suppressionOfAnotherRuleDoesNotApply() {
    assertEquals(
        List.of("lint/style/noShoutyConstants"),
        categories("// verbatim-ignore lint/complexity/noForEach\nconst FOO = \"FOO\";"));
  }

  @Test
  void suppressionCoversNestedNodes() {
    String source =
        "// verbatim-ignore lint/complexity: legacy\nfunction f() {\n  a.forEach(g);\n}";

    assertEquals(List.of(), categories(source));
  }

  @Test
  void suppressionDoesNotLeakToNextStatement() {
    String source =
        "// verbatim-ignore lint/style/noShoutyConstants\n"
            + "const FOO = \"FOO\";\n"
            + "const BAR = \"BAR\";\n"
            + "f(FOO, BAR);";

    assertEquals(List.of("lint/style/noShoutyConstants"), categories(source));
  }

  @Test
  void suppressionInsideBlockCoversOnlyFirstStatement() {
    String source =
        "function f() {\n"
            + "  // verbatim-ignore lint/complexity\n"
            + "  a.forEach(g);\n"
            + "  b.forEach(g);\n"
            + "}";

    assertEquals(List.of("lint/complexity/noForEach"), categories(source));
  }

  @Test
  void ordinaryCommentsDoNotSuppress() {
    assertEquals(
        List.of("lint/complexity/noForEach"), categories("// loop over items\nitems.forEach(f);"));
  }

  @Test
  void ignoreSuppressionsReportsEverything() {
    String source = "// verbatim-ignore lint/complexity/noForEach\nitems.forEach(f);";

    assertEquals(
        List.of("lint/complexity/noForEach"),
        categories(source, AnalyzerOptions.defaults().withIgnoreSuppressions(true)));
  }

  @Test
  void parsesCategoriesFromComments() {
    assertEquals(
        List.of("lint/style/noShoutyConstants", "lint/complexity"),
        Suppressions.categories(
            new TriviaPiece(
                TriviaKind.SINGLE_LINE_COMMENT,
                "// verbatim-ignore lint/style/noShoutyConstants  lint/complexity: why")));
    assertEquals(
        List.of("lint/style"),
        Suppressions.categories(
            new TriviaPiece(
                TriviaKind.MULTI_LINE_COMMENT, "/*verbatim-ignore lint/style not-a-category*/")));
    assertEquals(
        List.of(),
        Suppressions.categories(
            new TriviaPiece(TriviaKind.SINGLE_LINE_COMMENT, "// verbatim-ignore: nothing named")));
    assertEquals(
        List.of(),
        Suppressions.categories(new TriviaPiece(TriviaKind.MULTI_LINE_COMMENT, "/*/")));
    assertEquals(
        List.of(),
        Suppressions.categories(
            new TriviaPiece(TriviaKind.SINGLE_LINE_COMMENT, "// see lint/style/noForEach")));
  }
}
