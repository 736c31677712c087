package io.verbatim.syntax.testing;

import static io.verbatim.syntax.testing.ListKind.*;

import io.verbatim.syntax.api.ParseOptions;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.parser.CompletedMarker;
import io.verbatim.syntax.parser.Marker;
import io.verbatim.syntax.parser.ParseDiagnostics;
import io.verbatim.syntax.parser.ParseRecovery;
import io.verbatim.syntax.parser.ParsedSyntax;
import io.verbatim.syntax.parser.Parser;
import io.verbatim.syntax.parser.ParserProgress;
import io.verbatim.syntax.parser.TokenSet;

/**
 * Parser for {@code name = value, value; ...} where a value is a name, a number or a
 * parenthesized value. Statements recover at {@code ;}, values at {@code ,} and {@code ;}.
 */
public final class ListParser extends Parser {
  static final TokenSet STATEMENT_RECOVERY = TokenSet.of(SEMICOLON);
  static final TokenSet VALUE_RECOVERY = TokenSet.of(COMMA, SEMICOLON, R_PAREN);

  public ListParser(String text) {
    this(text, ParseOptions.defaults());
  }

  public ListParser(String text, ParseOptions options) {
    super(new ListLexer(text), options);
  }

  public static SyntaxTree parse(String text) {
    return new ListParser(text).parseRoot();
  }

  public SyntaxTree parseRoot() {
    Marker root = open();
    Marker list = open();
    ParserProgress progress = new ParserProgress("statement list");
    while (!atEof()) {
      progress.assertProgressing(this);
      parseStatement()
          .orRecover(
              this,
              new ParseRecovery(BOGUS_STATEMENT, STATEMENT_RECOVERY),
              ParseDiagnostics.expectedNode("an assignment"));
      bump(SEMICOLON);
    }
    list.complete(this, STATEMENT_LIST);
    expect(EOF);
    root.complete(this, ROOT);
    return buildTree();
  }

  /** Exposes tree building to tests that drive the marker API directly. */
  public SyntaxTree finish() {
    return buildTree();
  }

  public ParsedSyntax parseStatement() {
    if (!at(NAME)) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    bump(NAME);
    expect(EQ);
    Marker values = open();
    ParserProgress progress = new ParserProgress("value list");
    while (!atEof() && !at(SEMICOLON)) {
      progress.assertProgressing(this);
      if (parseValue()
          .orRecover(
              this,
              new ParseRecovery(BOGUS_VALUE, VALUE_RECOVERY).enableRecoveryOnLineBreak(),
              ParseDiagnostics.expectedNode("a value"))
          .isErr()) {
        break;
      }
      if (!bump(COMMA)) {
        break;
      }
    }
    values.complete(this, VALUE_LIST);
    expect(SEMICOLON);
    return ParsedSyntax.present(m.complete(this, ASSIGNMENT));
  }

  public ParsedSyntax parseValue() {
    if (at(NAME)) {
      Marker m = open();
      bump(NAME);
      return ParsedSyntax.present(m.complete(this, NAME_VALUE));
    }
    if (at(NUMBER)) {
      Marker m = open();
      bump(NUMBER);
      return ParsedSyntax.present(m.complete(this, NUMBER_VALUE));
    }
    if (at(L_PAREN)) {
      if (!enterNesting()) {
        Marker m = open();
        error(curRange(), "Nesting too deep");
        bumpAny();
        return ParsedSyntax.present(m.complete(this, BOGUS_VALUE));
      }
      try {
        Marker m = open();
        bump(L_PAREN);
        parseValue().orAddDiagnostic(this, ParseDiagnostics.expectedNode("a value"));
        expect(R_PAREN);
        return ParsedSyntax.present(m.complete(this, GROUP));
      } finally {
        exitNesting();
      }
    }
    return ParsedSyntax.absent();
  }

  /** Wraps the value just parsed into a group, for exercising {@link CompletedMarker#precede}. */
  public CompletedMarker wrapInGroup(CompletedMarker value) {
    return value.precede(this).complete(this, GROUP);
  }
}
