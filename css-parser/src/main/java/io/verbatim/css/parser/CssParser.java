package io.verbatim.css.parser;

import static io.verbatim.css.CssSyntaxKind.*;
import static io.verbatim.syntax.parser.ParseDiagnostics.expectedAny;
import static io.verbatim.syntax.parser.ParseDiagnostics.expectedNode;

import io.verbatim.css.CssSyntaxKind;
import io.verbatim.syntax.api.ParseOptions;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.api.TextRange;
import io.verbatim.syntax.parser.Marker;
import io.verbatim.syntax.parser.ParseRecovery;
import io.verbatim.syntax.parser.ParsedSyntax;
import io.verbatim.syntax.parser.Parser;
import io.verbatim.syntax.parser.ParserProgress;
import io.verbatim.syntax.parser.RecoveryResult;
import io.verbatim.syntax.parser.TokenSet;

/**
 * Recursive-descent parser for the CSS subset: qualified rules with simple selectors and
 * declaration blocks, {@code @color-profile}, {@code @charset}. Other at-rules are kept verbatim
 * as {@code CSS_BOGUS_AT_RULE}.
 */
public final class CssParser extends Parser {
  static final TokenSet SELECTOR_RECOVERY_SET = TokenSet.of(COMMA, L_CURLY, R_CURLY);
  static final TokenSet DECLARATION_RECOVERY_SET = TokenSet.of(SEMICOLON, R_CURLY);
  static final TokenSet VALUE_RECOVERY_SET = TokenSet.of(SEMICOLON, R_CURLY, R_PAREN, BANG, COMMA);
  static final TokenSet COLOR_PROFILE_RECOVERY_SET = TokenSet.of(L_CURLY);
  static final TokenSet BLOCK_RECOVERY_SET = TokenSet.of(AT, R_CURLY);

  private CssParser(String text, ParseOptions options) {
    super(new CssLexer(text), options);
  }

  /** Parses {@code text} with options read from system properties. */
  public static SyntaxTree parse(String text) {
    return parse(text, ParseOptions.fromSystemProperties());
  }

  public static SyntaxTree parse(String text, ParseOptions options) {
    return new CssParser(text, options).parseRoot();
  }

  private SyntaxTree parseRoot() {
    Marker m = open();
    parseRuleList();
    expect(EOF);
    m.complete(this, CSS_ROOT);
    return buildTree();
  }

  private void parseRuleList() {
    Marker list = open();
    ParserProgress progress = new ParserProgress("rule list");
    while (!atEof()) {
      progress.assertProgressing(this);
      if (at(AT)) {
        parseAtRule();
      } else if (at(R_CURLY)) {
        error(expectedAny("a qualified rule", "an at rule").build(this, curRange()));
        Marker bogus = open();
        bumpAny();
        bogus.complete(this, CSS_BOGUS_RULE);
      } else {
        parseQualifiedRule();
      }
    }
    list.complete(this, CSS_RULE_LIST);
  }

  // ==================== Qualified rules ====================

  /** {@code selector, selector { declarations }}. Called anywhere but at {@code @} or {@code }}. */
  private void parseQualifiedRule() {
    Marker m = open();
    parseSelectorList();
    if (parseOrRecoverDeclarationBlock().isErr()) {
      m.complete(this, CSS_BOGUS_RULE);
      return;
    }
    m.complete(this, CSS_QUALIFIED_RULE);
  }

  private void parseSelectorList() {
    Marker list = open();
    ParseRecovery recovery = new ParseRecovery(CSS_BOGUS_SELECTOR, SELECTOR_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("selector list");
    while (!atEof() && !at(L_CURLY)) {
      progress.assertProgressing(this);
      if (parseComplexSelector().orRecover(this, recovery, expectedNode("a selector")).isErr()) {
        break;
      }
      if (!bump(COMMA)) {
        break;
      }
    }
    list.complete(this, CSS_SELECTOR_LIST);
  }

  /** Compound selectors joined by {@code >}, {@code +}, {@code ~} or whitespace. */
  private ParsedSyntax parseComplexSelector() {
    ParsedSyntax first = parseCompoundSelector();
    if (first.isAbsent() || !(isAtCombinator() || isAtSimpleSelector())) {
      return first;
    }
    Marker m = first.ok().get().precede(this);
    ParserProgress progress = new ParserProgress("complex selector");
    while (isAtCombinator() || isAtSimpleSelector()) {
      progress.assertProgressing(this);
      if (isAtCombinator()) {
        bumpAny();
      }
      if (parseCompoundSelector().isAbsent()) {
        error(expectedNode("a selector").build(this, curRange()));
        break;
      }
    }
    return ParsedSyntax.present(m.complete(this, CSS_COMPLEX_SELECTOR));
  }

  private boolean isAtCombinator() {
    return at(GT) || at(PLUS) || at(TILDE);
  }

  /** Simple selectors written without whitespace between them, e.g. {@code a.link:hover}. */
  private ParsedSyntax parseCompoundSelector() {
    if (!isAtSimpleSelector()) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    parseSimpleSelector();
    while (isAtSimpleSelector() && curRange().start() == lastTokenEnd()) {
      if (at(IDENT) || at(STAR) || kind().isKeyword()) {
        // a type selector may only come first
        break;
      }
      parseSimpleSelector();
    }
    return ParsedSyntax.present(m.complete(this, CSS_COMPOUND_SELECTOR));
  }

  private boolean isAtSimpleSelector() {
    CssSyntaxKind kind = kind();
    return kind == IDENT
        || kind.isKeyword()
        || kind == STAR
        || kind == DOT
        || kind == CSS_HASH
        || kind == COLON;
  }

  private void parseSimpleSelector() {
    Marker m = open();
    CssSyntaxKind kind = kind();
    if (kind == STAR) {
      bump(STAR);
      m.complete(this, CSS_UNIVERSAL_SELECTOR);
    } else if (kind == CSS_HASH) {
      bump(CSS_HASH);
      m.complete(this, CSS_ID_SELECTOR);
    } else if (kind == DOT || kind == COLON) {
      bumpAny();
      parseIdentifier("a name");
      m.complete(this, kind == DOT ? CSS_CLASS_SELECTOR : CSS_PSEUDO_CLASS_SELECTOR);
    } else {
      parseIdentifier("a name");
      m.complete(this, CSS_TYPE_SELECTOR);
    }
  }

  /** Any identifier, keywords included, as {@code CSS_IDENTIFIER}. */
  private boolean parseIdentifier(String what) {
    if (!at(IDENT) && !kind().isKeyword()) {
      error(expectedNode(what).build(this, curRange()));
      return false;
    }
    Marker m = open();
    bumpRemap(IDENT);
    m.complete(this, CSS_IDENTIFIER);
    return true;
  }

  // ==================== Declarations ====================

  private RecoveryResult parseOrRecoverDeclarationBlock() {
    return parseDeclarationBlock()
        .orRecover(
            this,
            new ParseRecovery(CSS_BOGUS_BLOCK, BLOCK_RECOVERY_SET),
            expectedNode("a declaration block"));
  }

  private ParsedSyntax parseDeclarationBlock() {
    if (!at(L_CURLY)) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    bumpWithContext(L_CURLY, CssLexContext.NO_KEYWORD);
    Marker list = open();
    ParseRecovery recovery =
        new ParseRecovery(CSS_BOGUS_DECLARATION_ITEM, DECLARATION_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("declaration list");
    while (!atEof() && !at(R_CURLY)) {
      progress.assertProgressing(this);
      if (bumpWithContext(SEMICOLON, CssLexContext.NO_KEYWORD)) {
        continue;
      }
      RecoveryResult result =
          parseDeclarationWithSemicolon()
              .orRecover(this, recovery, expectedNode("a declaration item"));
      if (result.isErr()) {
        break;
      }
    }
    list.complete(this, CSS_DECLARATION_LIST);
    expect(R_CURLY);
    return ParsedSyntax.present(m.complete(this, CSS_DECLARATION_LIST_BLOCK));
  }

  /** {@code name: value !important;}; the semicolon is optional before {@code }}. */
  private ParsedSyntax parseDeclarationWithSemicolon() {
    if (!at(IDENT) && !kind().isKeyword()) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    Marker declaration = open();
    Marker property = open();
    parseIdentifier("a property name");
    expect(COLON);
    parseComponentValueList(CSS_GENERIC_COMPONENT_VALUE_LIST);
    property.complete(this, CSS_GENERIC_PROPERTY);
    if (at(BANG)) {
      Marker important = open();
      bump(BANG);
      expect(IMPORTANT_KW);
      important.complete(this, CSS_DECLARATION_IMPORTANT);
    }
    declaration.complete(this, CSS_DECLARATION);
    if (!bumpWithContext(SEMICOLON, CssLexContext.NO_KEYWORD) && !at(R_CURLY)) {
      error(expectedNode("`;`").build(this, curRange()));
    }
    return ParsedSyntax.present(m.complete(this, CSS_DECLARATION_WITH_SEMICOLON));
  }

  private void parseComponentValueList(CssSyntaxKind listKind) {
    Marker list = open();
    ParseRecovery recovery = new ParseRecovery(CSS_BOGUS_PROPERTY_VALUE, VALUE_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("component value list");
    int values = 0;
    while (!atEof() && !at(SEMICOLON) && !at(R_CURLY) && !at(R_PAREN) && !at(BANG)) {
      progress.assertProgressing(this);
      if (bump(COMMA) || bump(SLASH)) {
        continue;
      }
      RecoveryResult result =
          parseComponentValue().orRecover(this, recovery, expectedNode("a component value"));
      if (result.isErr()) {
        break;
      }
      values++;
    }
    if (values == 0 && listKind == CSS_GENERIC_COMPONENT_VALUE_LIST) {
      error(expectedNode("a component value").build(this, curRange()));
    }
    list.complete(this, listKind);
  }

  private ParsedSyntax parseComponentValue() {
    CssSyntaxKind kind = kind();
    switch (kind) {
      case CSS_STRING_LITERAL:
        return value(CSS_STRING);
      case CSS_NUMBER_LITERAL:
        return value(CSS_NUMBER);
      case CSS_PERCENTAGE_LITERAL:
        return value(CSS_PERCENTAGE);
      case CSS_DIMENSION_LITERAL:
        return value(CSS_DIMENSION);
      case CSS_HASH:
        return value(CSS_COLOR);
      default:
        break;
    }
    if (kind != IDENT && !kind.isKeyword()) {
      return ParsedSyntax.absent();
    }
    if (nthAt(1, L_PAREN)) {
      return parseFunction();
    }
    Marker m = open();
    bumpRemap(IDENT);
    return ParsedSyntax.present(m.complete(this, CSS_IDENTIFIER));
  }

  private ParsedSyntax value(CssSyntaxKind nodeKind) {
    Marker m = open();
    bumpAny();
    return ParsedSyntax.present(m.complete(this, nodeKind));
  }

  /** {@code name(arguments)}, e.g. {@code url("a.icc")} or {@code rgb(0 0 0 / 50%)}. */
  private ParsedSyntax parseFunction() {
    if (!enterNesting()) {
      Marker m = open();
      error(
          curRange(),
          "Nesting is too deep to parse; raise verbatim.parser.maxNestingDepth to accept this"
              + " input");
      bumpAny();
      return ParsedSyntax.present(m.complete(this, CSS_BOGUS_PROPERTY_VALUE));
    }
    try {
      Marker m = open();
      Marker name = open();
      bumpRemap(IDENT);
      name.complete(this, CSS_IDENTIFIER);
      bump(L_PAREN);
      parseComponentValueList(CSS_PARAMETER_LIST);
      expect(R_PAREN);
      return ParsedSyntax.present(m.complete(this, CSS_FUNCTION));
    } finally {
      exitNesting();
    }
  }

  // ==================== At-rules ====================

  private void parseAtRule() {
    Marker m = open();
    bump(AT);
    switch (kind()) {
      case COLOR_PROFILE_KW:
        parseColorProfileAtRule(m);
        break;
      case CHARSET_KW:
        parseCharsetAtRule(m);
        break;
      default:
        parseUnknownAtRule(m);
        break;
    }
  }

  /**
   * {@code @color-profile <custom-ident> { descriptors }}. An invalid name makes the whole rule
   * bogus, but its block is still parsed.
   */
  private void parseColorProfileAtRule(Marker m) {
    bump(COLOR_PROFILE_KW);
    ParsedSyntax name = parseCustomIdentifier();
    name.orRecover(
        this,
        new ParseRecovery(CSS_BOGUS, COLOR_PROFILE_RECOVERY_SET).enableRecoveryOnLineBreak(),
        expectedNode("a non-CSS-wide keyword identifier"));
    CssSyntaxKind kind = name.isPresent() ? CSS_COLOR_PROFILE_AT_RULE : CSS_BOGUS_AT_RULE;
    if (parseOrRecoverDeclarationBlock().isErr()) {
      kind = CSS_BOGUS_AT_RULE;
    }
    m.complete(this, kind);
  }

  /** An identifier usable as a name: anything but a CSS-wide keyword. */
  private ParsedSyntax parseCustomIdentifier() {
    CssSyntaxKind kind = kind();
    if (kind != IDENT && !(kind.isKeyword() && !kind.isCssWideKeyword())) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    bumpRemap(IDENT);
    return ParsedSyntax.present(m.complete(this, CSS_CUSTOM_IDENTIFIER));
  }

  /** {@code @charset "utf-8";} */
  private void parseCharsetAtRule(Marker m) {
    bump(CHARSET_KW);
    CssSyntaxKind kind = CSS_CHARSET_AT_RULE;
    if (at(CSS_STRING_LITERAL)) {
      Marker encoding = open();
      bump(CSS_STRING_LITERAL);
      encoding.complete(this, CSS_STRING);
    } else {
      RecoveryResult recovered =
          ParsedSyntax.absent()
              .orRecover(
                  this,
                  new ParseRecovery(CSS_BOGUS, TokenSet.of(SEMICOLON)).enableRecoveryOnLineBreak(),
                  expectedNode("a string"));
      kind = CSS_BOGUS_AT_RULE;
      if (recovered.isErr() && !at(SEMICOLON)) {
        m.complete(this, kind);
        return;
      }
    }
    expect(SEMICOLON);
    m.complete(this, kind);
  }

  /** Keeps the prelude and a balanced block of an at-rule this grammar does not know. */
  private void parseUnknownAtRule(Marker m) {
    TextRange nameRange = curRange();
    if (at(IDENT) || kind().isKeyword()) {
      bumpRemap(IDENT);
      error(nameRange, "Unknown at-rule '@" + sourceText(nameRange) + "'");
    } else {
      error(expectedNode("an at-rule name").build(this, curRange()));
    }
    ParserProgress progress = new ParserProgress("at-rule prelude");
    while (!atEof() && !at(SEMICOLON) && !at(L_CURLY) && !at(R_CURLY)) {
      progress.assertProgressing(this);
      bumpAny();
    }
    if (at(L_CURLY)) {
      int depth = 0;
      do {
        if (at(L_CURLY)) {
          depth++;
        } else if (at(R_CURLY)) {
          depth--;
        }
        bumpAny();
      } while (depth > 0 && !atEof());
    } else {
      bump(SEMICOLON);
    }
    m.complete(this, CSS_BOGUS_AT_RULE);
  }

  private CssSyntaxKind kind() {
    return (CssSyntaxKind) cur();
  }
}
