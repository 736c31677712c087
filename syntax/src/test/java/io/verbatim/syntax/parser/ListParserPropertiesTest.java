package io.verbatim.syntax.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.testing.ListParser;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.Provide;

/** Any input, however malformed, parses to a tree that reproduces it. */
@PropertyDefaults(tries = 500)
public class ListParserPropertiesTest {

  @Provide
  Arbitrary<String> sources() {
    return Arbitraries.strings().withChars("ab12=,;()#$ \t\n\r").ofMaxLength(60);
  }

  @Property
  void treeTextEqualsInput(@ForAll("sources") String source) {
    assertEquals(source, ListParser.parse(source).text());
  }

  @Property
  void reparsingTreeTextYieldsSameShape(@ForAll("sources") String source) {
    SyntaxTree first = ListParser.parse(source);
    SyntaxTree second = ListParser.parse(first.text());
    assertEquals(first.root().debugTree(), second.root().debugTree());
    assertEquals(first.diagnostics(), second.diagnostics());
  }
}
