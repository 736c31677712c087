package io.verbatim.js.parser;

import static io.verbatim.js.JsSyntaxKind.*;
import static io.verbatim.syntax.parser.ParseDiagnostics.expectedNode;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.ParseOptions;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.parser.Checkpoint;
import io.verbatim.syntax.parser.CompletedMarker;
import io.verbatim.syntax.parser.Marker;
import io.verbatim.syntax.parser.ParseDiagnostics;
import io.verbatim.syntax.parser.ParseRecovery;
import io.verbatim.syntax.parser.ParsedSyntax;
import io.verbatim.syntax.parser.Parser;
import io.verbatim.syntax.parser.ParserProgress;
import io.verbatim.syntax.parser.RecoveryResult;
import io.verbatim.syntax.parser.TokenSet;
import java.util.Optional;

/**
 * Recursive-descent parser for the JavaScript subset.
 *
 * <p>Every {@code parseX} method returns {@link ParsedSyntax#absent()} without consuming anything
 * when the parser is not at an X. Lists recover by wrapping unexpected tokens into bogus nodes,
 * so the resulting tree always contains the complete input.
 */
public final class JsParser extends Parser {
  static final TokenSet STATEMENT_RECOVERY_SET =
      TokenSet.of(
          SEMICOLON, L_CURLY, R_CURLY, CONST_KW, LET_KW, VAR_KW, FUNCTION_KW, RETURN_KW, IF_KW,
          FOR_KW);
  static final TokenSet MODULE_RECOVERY_SET =
      TokenSet.of(
          SEMICOLON, L_CURLY, CONST_KW, LET_KW, VAR_KW, FUNCTION_KW, RETURN_KW, IF_KW, FOR_KW);
  static final TokenSet BINDING_RECOVERY_SET =
      TokenSet.of(EQ, COMMA, SEMICOLON, R_PAREN, L_CURLY, R_CURLY);
  static final TokenSet PARAMETER_RECOVERY_SET =
      TokenSet.of(COMMA, R_PAREN, L_CURLY, FAT_ARROW, SEMICOLON);
  static final TokenSet ARGUMENT_RECOVERY_SET = TokenSet.of(COMMA, R_PAREN, SEMICOLON, R_CURLY);
  static final TokenSet ELEMENT_RECOVERY_SET = TokenSet.of(COMMA, R_BRACK, SEMICOLON, R_CURLY);
  static final TokenSet MEMBER_RECOVERY_SET = TokenSet.of(COMMA, R_CURLY, SEMICOLON);
  static final TokenSet ASSIGNMENT_OPERATORS =
      TokenSet.of(EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ, PERCENT_EQ);
  static final TokenSet UNARY_OPERATORS = TokenSet.of(BANG, TILDE, PLUS, MINUS, TYPEOF_KW);

  /** Whether {@code in} is a for-in separator rather than a binary operator. */
  private boolean noIn;

  private JsParser(String text, ParseOptions options) {
    super(new JsLexer(text), options);
  }

  /** Parses {@code text} with options read from system properties. */
  public static SyntaxTree parse(String text) {
    return parse(text, ParseOptions.fromSystemProperties());
  }

  public static SyntaxTree parse(String text, ParseOptions options) {
    return new JsParser(text, options).parseModule();
  }

  private SyntaxTree parseModule() {
    Marker m = open();
    parseStatementList(JS_MODULE_ITEM_LIST, MODULE_RECOVERY_SET, false);
    expect(EOF);
    m.complete(this, JS_MODULE);
    return buildTree();
  }

  // ==================== Statements ====================

  private void parseStatementList(SyntaxKind listKind, TokenSet recoverySet, boolean inBlock) {
    Marker list = open();
    ParseRecovery recovery =
        new ParseRecovery(JS_BOGUS_STATEMENT, recoverySet).enableRecoveryOnLineBreak();
    ParserProgress progress = new ParserProgress("statement list");
    while (!atEof() && !(inBlock && at(R_CURLY))) {
      progress.assertProgressing(this);
      RecoveryResult result =
          parseStatement().orRecover(this, recovery, expectedNode("a statement"));
      if (result.isErr() && !atEof()) {
        // at a line break or recovery token that no statement starts with
        Marker bogus = open();
        bumpAny();
        bogus.complete(this, JS_BOGUS_STATEMENT);
      }
    }
    list.complete(this, listKind);
  }

  ParsedSyntax parseStatement() {
    if (!enterNesting()) {
      return nestingTooDeep(JS_BOGUS_STATEMENT);
    }
    try {
      switch (kind()) {
        case L_CURLY:
          return parseBlockStatement();
        case SEMICOLON:
          {
            Marker m = open();
            bump(SEMICOLON);
            return ParsedSyntax.present(m.complete(this, JS_EMPTY_STATEMENT));
          }
        case CONST_KW:
        case LET_KW:
        case VAR_KW:
          return parseVariableStatement();
        case IF_KW:
          return parseIfStatement();
        case FOR_KW:
          return parseForStatement();
        case RETURN_KW:
          return parseReturnStatement();
        case FUNCTION_KW:
          return parseFunctionDeclaration();
        default:
          return parseExpressionStatement();
      }
    } finally {
      exitNesting();
    }
  }

  private ParsedSyntax nestingTooDeep(SyntaxKind bogusKind) {
    Marker m = open();
    error(
        curRange(),
        "Nesting is too deep to parse; raise verbatim.parser.maxNestingDepth to accept this input");
    bumpAny();
    return ParsedSyntax.present(m.complete(this, bogusKind));
  }

  private ParsedSyntax parseBlockStatement() {
    Marker m = open();
    bump(L_CURLY);
    parseStatementList(JS_STATEMENT_LIST, STATEMENT_RECOVERY_SET, true);
    expect(R_CURLY);
    return ParsedSyntax.present(m.complete(this, JS_BLOCK_STATEMENT));
  }

  private ParsedSyntax parseVariableStatement() {
    Marker m = open();
    parseVariableDeclaration(false);
    semicolon();
    return ParsedSyntax.present(m.complete(this, JS_VARIABLE_STATEMENT));
  }

  /**
   * {@code const a = 1, b}. In a for header a single declarator followed by {@code of} or {@code
   * in} becomes a {@code JS_FOR_VARIABLE_DECLARATION} without a declarator list.
   */
  private CompletedMarker parseVariableDeclaration(boolean forHeader) {
    Marker m = open();
    JsSyntaxKind keyword = kind();
    bumpAny();
    ParsedSyntax first = parseVariableDeclarator(keyword, forHeader);
    if (forHeader && first.isPresent() && (at(IN_KW) || atContextualOf())) {
      return m.complete(this, JS_FOR_VARIABLE_DECLARATION);
    }
    Optional<CompletedMarker> firstDeclarator = first.ok();
    Marker list = firstDeclarator.isPresent() ? firstDeclarator.get().precede(this) : open();
    if (firstDeclarator.isPresent()) {
      ParserProgress progress = new ParserProgress("declarator list");
      while (at(COMMA)) {
        progress.assertProgressing(this);
        bump(COMMA);
        if (parseVariableDeclarator(keyword, forHeader).isAbsent()) {
          break;
        }
      }
    }
    list.complete(this, JS_VARIABLE_DECLARATOR_LIST);
    return m.complete(this, JS_VARIABLE_DECLARATION);
  }

  private ParsedSyntax parseVariableDeclarator(JsSyntaxKind keyword, boolean forHeader) {
    Marker m = open();
    RecoveryResult id =
        parseIdentifierBinding()
            .orRecover(
                this,
                new ParseRecovery(JS_BOGUS_BINDING, BINDING_RECOVERY_SET)
                    .enableRecoveryOnLineBreak(),
                expectedNode("an identifier"));
    if (id.isErr() && !at(EQ)) {
      m.abandon(this);
      return ParsedSyntax.absent();
    }
    boolean initialized = at(EQ);
    if (initialized) {
      Marker init = open();
      bump(EQ);
      parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
      init.complete(this, JS_INITIALIZER_CLAUSE);
    }
    CompletedMarker declarator = m.complete(this, JS_VARIABLE_DECLARATOR);
    boolean forInOrOf = forHeader && (at(IN_KW) || atContextualOf());
    if (keyword == CONST_KW && !initialized && !forInOrOf && id.isOk()) {
      error(declarator.range(), "Const declarations must have an initialized value");
    }
    return ParsedSyntax.present(declarator);
  }

  private ParsedSyntax parseIdentifierBinding() {
    if (!at(IDENT)) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    bump(IDENT);
    return ParsedSyntax.present(m.complete(this, JS_IDENTIFIER_BINDING));
  }

  private ParsedSyntax parseIfStatement() {
    Marker m = open();
    bump(IF_KW);
    parseParenthesizedCondition();
    parseStatement().orAddDiagnostic(this, expectedNode("a statement"));
    if (at(ELSE_KW)) {
      Marker elseClause = open();
      bump(ELSE_KW);
      parseStatement().orAddDiagnostic(this, expectedNode("a statement"));
      elseClause.complete(this, JS_ELSE_CLAUSE);
    }
    return ParsedSyntax.present(m.complete(this, JS_IF_STATEMENT));
  }

  private void parseParenthesizedCondition() {
    expect(L_PAREN);
    parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
    expect(R_PAREN);
  }

  private ParsedSyntax parseForStatement() {
    Marker m = open();
    bump(FOR_KW);
    expect(L_PAREN);

    boolean savedNoIn = noIn;
    noIn = true;
    CompletedMarker init = null;
    if (at(CONST_KW) || at(LET_KW) || at(VAR_KW)) {
      init = parseVariableDeclaration(true);
    } else if (!at(SEMICOLON)) {
      init = parseExpression().ok().orElse(null);
    }
    noIn = savedNoIn;

    JsSyntaxKind kind;
    if (init != null && (at(IN_KW) || atContextualOf())) {
      boolean isOf = !at(IN_KW);
      if (init.kind() == JS_VARIABLE_DECLARATION) {
        error(
            init.range(),
            "Only a single declaration is allowed in a for...of or for...in statement");
      } else if (init.kind() != JS_FOR_VARIABLE_DECLARATION) {
        toAssignmentTarget(init);
      }
      if (isOf) {
        bumpRemap(OF_KW);
        parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
      } else {
        bump(IN_KW);
        parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
      }
      kind = isOf ? JS_FOR_OF_STATEMENT : JS_FOR_IN_STATEMENT;
    } else {
      expect(SEMICOLON);
      if (!at(SEMICOLON)) {
        parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
      }
      expect(SEMICOLON);
      if (!at(R_PAREN)) {
        parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
      }
      kind = JS_FOR_STATEMENT;
    }
    expect(R_PAREN);
    parseStatement().orAddDiagnostic(this, expectedNode("a statement"));
    return ParsedSyntax.present(m.complete(this, kind));
  }

  private ParsedSyntax parseReturnStatement() {
    Marker m = open();
    bump(RETURN_KW);
    if (!at(SEMICOLON) && !at(R_CURLY) && !atEof() && !hasPrecedingLineBreak()) {
      parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
    }
    semicolon();
    return ParsedSyntax.present(m.complete(this, JS_RETURN_STATEMENT));
  }

  private ParsedSyntax parseFunctionDeclaration() {
    Marker m = open();
    bump(FUNCTION_KW);
    parseIdentifierBinding().orAddDiagnostic(this, expectedNode("a function name"));
    parseParameters();
    parseFunctionBody();
    return ParsedSyntax.present(m.complete(this, JS_FUNCTION_DECLARATION));
  }

  private CompletedMarker parseParameters() {
    Marker m = open();
    expect(L_PAREN);
    Marker list = open();
    ParseRecovery recovery =
        new ParseRecovery(JS_BOGUS_PARAMETER, PARAMETER_RECOVERY_SET).enableRecoveryOnLineBreak();
    ParserProgress progress = new ParserProgress("parameter list");
    while (!atEof() && !at(R_PAREN)) {
      progress.assertProgressing(this);
      if (parseFormalParameter().orRecover(this, recovery, expectedNode("a parameter")).isErr()) {
        break;
      }
      if (!at(R_PAREN) && !expect(COMMA)) {
        break;
      }
    }
    list.complete(this, JS_PARAMETER_LIST);
    expect(R_PAREN);
    return m.complete(this, JS_PARAMETERS);
  }

  private ParsedSyntax parseFormalParameter() {
    if (!at(IDENT)) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    parseIdentifierBinding();
    if (at(EQ)) {
      Marker init = open();
      bump(EQ);
      parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
      init.complete(this, JS_INITIALIZER_CLAUSE);
    }
    return ParsedSyntax.present(m.complete(this, JS_FORMAL_PARAMETER));
  }

  private CompletedMarker parseFunctionBody() {
    Marker m = open();
    if (!expect(L_CURLY)) {
      return m.complete(this, JS_FUNCTION_BODY);
    }
    boolean savedNoIn = noIn;
    noIn = false;
    parseStatementList(JS_STATEMENT_LIST, STATEMENT_RECOVERY_SET, true);
    noIn = savedNoIn;
    expect(R_CURLY);
    return m.complete(this, JS_FUNCTION_BODY);
  }

  private ParsedSyntax parseExpressionStatement() {
    ParsedSyntax expression = parseExpression();
    if (expression.isAbsent()) {
      return expression;
    }
    Marker m = expression.ok().get().precede(this);
    semicolon();
    return ParsedSyntax.present(m.complete(this, JS_EXPRESSION_STATEMENT));
  }

  /** Consumes {@code ;} or accepts its automatic insertion. */
  private void semicolon() {
    if (bump(SEMICOLON) || at(R_CURLY) || atEof() || hasPrecedingLineBreak()) {
      return;
    }
    error(ParseDiagnostics.expectedToken(this, SEMICOLON));
  }

  // ==================== Expressions ====================

  ParsedSyntax parseExpression() {
    ParsedSyntax first = parseAssignmentExpression();
    if (first.isAbsent() || !at(COMMA)) {
      return first;
    }
    CompletedMarker lhs = first.ok().get();
    while (at(COMMA)) {
      Marker m = lhs.precede(this);
      bump(COMMA);
      parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
      lhs = m.complete(this, JS_SEQUENCE_EXPRESSION);
    }
    return ParsedSyntax.present(lhs);
  }

  ParsedSyntax parseAssignmentExpression() {
    if (!enterNesting()) {
      return nestingTooDeep(JS_BOGUS_EXPRESSION);
    }
    try {
      if (isAtArrowFunction()) {
        return parseArrowFunction();
      }
      ParsedSyntax target = parseConditionalExpression();
      if (target.isAbsent() || !atAny(ASSIGNMENT_OPERATORS)) {
        return target;
      }
      Marker m = toAssignmentTarget(target.ok().get()).precede(this);
      bumpAny();
      parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
      return ParsedSyntax.present(m.complete(this, JS_ASSIGNMENT_EXPRESSION));
    } finally {
      exitNesting();
    }
  }

  private CompletedMarker toAssignmentTarget(CompletedMarker expression) {
    switch ((JsSyntaxKind) expression.kind()) {
      case JS_IDENTIFIER_EXPRESSION:
        return expression.changeKind(this, JS_IDENTIFIER_ASSIGNMENT);
      case JS_STATIC_MEMBER_EXPRESSION:
        return expression.changeKind(this, JS_STATIC_MEMBER_ASSIGNMENT);
      case JS_COMPUTED_MEMBER_EXPRESSION:
        return expression.changeKind(this, JS_COMPUTED_MEMBER_ASSIGNMENT);
      default:
        error(
            expression.range(),
            "Invalid assignment to `" + sourceText(expression.range()) + "`");
        return expression.changeKind(this, JS_BOGUS_ASSIGNMENT);
    }
  }

  /** {@code x =>} or a parenthesized parameter list followed by {@code =>}. */
  private boolean isAtArrowFunction() {
    if (at(IDENT)) {
      return nthAt(1, FAT_ARROW) && !nthHasPrecedingLineBreak(1);
    }
    if (!at(L_PAREN)) {
      return false;
    }
    Checkpoint checkpoint = checkpoint();
    boolean arrow =
        speculate(
            () -> {
              parseParameters();
              return errorsSince(checkpoint) == 0 && at(FAT_ARROW) && !hasPrecedingLineBreak();
            });
    rewind(checkpoint);
    return arrow;
  }

  private ParsedSyntax parseArrowFunction() {
    Marker m = open();
    if (at(IDENT)) {
      parseIdentifierBinding();
    } else {
      parseParameters();
    }
    expect(FAT_ARROW);
    if (at(L_CURLY)) {
      parseFunctionBody();
    } else {
      parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
    }
    return ParsedSyntax.present(m.complete(this, JS_ARROW_FUNCTION_EXPRESSION));
  }

  private ParsedSyntax parseConditionalExpression() {
    ParsedSyntax test = parseBinaryExpression(0);
    if (test.isAbsent() || !at(QUESTION)) {
      return test;
    }
    Marker m = test.ok().get().precede(this);
    bump(QUESTION);
    boolean savedNoIn = noIn;
    noIn = false;
    parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
    noIn = savedNoIn;
    expect(COLON);
    parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
    return ParsedSyntax.present(m.complete(this, JS_CONDITIONAL_EXPRESSION));
  }

  /** Precedence climbing; operators bind to the left. */
  private ParsedSyntax parseBinaryExpression(int minPrecedence) {
    ParsedSyntax left = parseUnaryExpression();
    if (left.isAbsent()) {
      return left;
    }
    CompletedMarker lhs = left.ok().get();
    while (true) {
      JsSyntaxKind operator = kind();
      int precedence = precedence(operator);
      if (precedence <= minPrecedence) {
        break;
      }
      Marker m = lhs.precede(this);
      bumpAny();
      parseBinaryExpression(precedence).orAddDiagnostic(this, expectedNode("an expression"));
      boolean logical = operator == AMP2 || operator == PIPE2 || operator == QUESTION2;
      lhs = m.complete(this, logical ? JS_LOGICAL_EXPRESSION : JS_BINARY_EXPRESSION);
    }
    return ParsedSyntax.present(lhs);
  }

  private int precedence(JsSyntaxKind operator) {
    switch (operator) {
      case QUESTION2:
        return 1;
      case PIPE2:
        return 2;
      case AMP2:
        return 3;
      case EQ2:
      case EQ3:
      case NEQ:
      case NEQ2:
        return 6;
      case LT:
      case GT:
      case LTEQ:
      case GTEQ:
        return 7;
      case IN_KW:
        return noIn ? 0 : 7;
      case PLUS:
      case MINUS:
        return 9;
      case STAR:
      case SLASH:
      case PERCENT:
        return 10;
      default:
        return 0;
    }
  }

  private ParsedSyntax parseUnaryExpression() {
    if (atAny(UNARY_OPERATORS)) {
      if (!enterNesting()) {
        return nestingTooDeep(JS_BOGUS_EXPRESSION);
      }
      try {
        Marker m = open();
        bumpAny();
        parseUnaryExpression().orAddDiagnostic(this, expectedNode("an expression"));
        return ParsedSyntax.present(m.complete(this, JS_UNARY_EXPRESSION));
      } finally {
        exitNesting();
      }
    }
    if (at(PLUS2) || at(MINUS2)) {
      Marker m = open();
      bumpAny();
      parseUnaryExpression()
          .orAddDiagnostic(this, expectedNode("an expression"))
          .ifPresent(this::toAssignmentTarget);
      return ParsedSyntax.present(m.complete(this, JS_PRE_UPDATE_EXPRESSION));
    }
    ParsedSyntax lhs = parseLeftHandSideExpression();
    if (lhs.isPresent() && (at(PLUS2) || at(MINUS2)) && !hasPrecedingLineBreak()) {
      Marker m = toAssignmentTarget(lhs.ok().get()).precede(this);
      bumpAny();
      return ParsedSyntax.present(m.complete(this, JS_POST_UPDATE_EXPRESSION));
    }
    return lhs;
  }

  /** A primary expression followed by member accesses and calls. */
  private ParsedSyntax parseLeftHandSideExpression() {
    ParsedSyntax primary = parsePrimaryExpression();
    if (primary.isAbsent()) {
      return primary;
    }
    CompletedMarker lhs = primary.ok().get();
    while (true) {
      if (at(DOT)) {
        Marker m = lhs.precede(this);
        bump(DOT);
        parseMemberName();
        lhs = m.complete(this, JS_STATIC_MEMBER_EXPRESSION);
      } else if (at(L_BRACK)) {
        Marker m = lhs.precede(this);
        bump(L_BRACK);
        boolean savedNoIn = noIn;
        noIn = false;
        parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
        noIn = savedNoIn;
        expect(R_BRACK);
        lhs = m.complete(this, JS_COMPUTED_MEMBER_EXPRESSION);
      } else if (at(L_PAREN)) {
        Marker m = lhs.precede(this);
        parseCallArguments();
        lhs = m.complete(this, JS_CALL_EXPRESSION);
      } else {
        return ParsedSyntax.present(lhs);
      }
    }
  }

  private void parseMemberName() {
    if (at(IDENT) || kind().isKeyword()) {
      Marker m = open();
      bumpRemap(IDENT);
      m.complete(this, JS_NAME);
    } else {
      error(ParseDiagnostics.expected(this, "a member name", curRange()));
    }
  }

  private void parseCallArguments() {
    Marker m = open();
    bump(L_PAREN);
    boolean savedNoIn = noIn;
    noIn = false;
    Marker list = open();
    ParseRecovery recovery = new ParseRecovery(JS_BOGUS_EXPRESSION, ARGUMENT_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("argument list");
    while (!atEof() && !at(R_PAREN)) {
      progress.assertProgressing(this);
      if (parseAssignmentExpression()
          .orRecover(this, recovery, expectedNode("an expression"))
          .isErr()) {
        break;
      }
      if (!at(R_PAREN) && !expect(COMMA)) {
        break;
      }
    }
    list.complete(this, JS_CALL_ARGUMENT_LIST);
    noIn = savedNoIn;
    expect(R_PAREN);
    m.complete(this, JS_CALL_ARGUMENTS);
  }

  private ParsedSyntax parsePrimaryExpression() {
    switch (kind()) {
      case IDENT:
        {
          Marker m = open();
          Marker name = open();
          bump(IDENT);
          name.complete(this, JS_REFERENCE_IDENTIFIER);
          return ParsedSyntax.present(m.complete(this, JS_IDENTIFIER_EXPRESSION));
        }
      case THIS_KW:
        return literal(JS_THIS_EXPRESSION);
      case JS_STRING_LITERAL:
        return literal(JS_STRING_LITERAL_EXPRESSION);
      case JS_NUMBER_LITERAL:
        return literal(JS_NUMBER_LITERAL_EXPRESSION);
      case TRUE_KW:
      case FALSE_KW:
        return literal(JS_BOOLEAN_LITERAL_EXPRESSION);
      case NULL_KW:
        return literal(JS_NULL_LITERAL_EXPRESSION);
      case SLASH:
      case SLASH_EQ:
        reLex(JsLexContext.REGEX);
        return literal(at(JS_REGEX_LITERAL) ? JS_REGEX_LITERAL_EXPRESSION : JS_BOGUS_EXPRESSION);
      case L_PAREN:
        return parseParenthesizedExpression();
      case L_BRACK:
        return parseArrayExpression();
      case L_CURLY:
        return parseObjectExpression();
      default:
        return ParsedSyntax.absent();
    }
  }

  private ParsedSyntax literal(JsSyntaxKind kind) {
    Marker m = open();
    bumpAny();
    return ParsedSyntax.present(m.complete(this, kind));
  }

  private ParsedSyntax parseParenthesizedExpression() {
    Marker m = open();
    bump(L_PAREN);
    boolean savedNoIn = noIn;
    noIn = false;
    parseExpression().orAddDiagnostic(this, expectedNode("an expression"));
    noIn = savedNoIn;
    expect(R_PAREN);
    return ParsedSyntax.present(m.complete(this, JS_PARENTHESIZED_EXPRESSION));
  }

  private ParsedSyntax parseArrayExpression() {
    Marker m = open();
    bump(L_BRACK);
    Marker list = open();
    ParseRecovery recovery = new ParseRecovery(JS_BOGUS_EXPRESSION, ELEMENT_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("array element list");
    while (!atEof() && !at(R_BRACK)) {
      progress.assertProgressing(this);
      if (bump(COMMA)) {
        continue;
      }
      if (parseAssignmentExpression()
          .orRecover(this, recovery, expectedNode("an expression"))
          .isErr()) {
        break;
      }
      if (!at(R_BRACK) && !expect(COMMA)) {
        break;
      }
    }
    list.complete(this, JS_ARRAY_ELEMENT_LIST);
    expect(R_BRACK);
    return ParsedSyntax.present(m.complete(this, JS_ARRAY_EXPRESSION));
  }

  private ParsedSyntax parseObjectExpression() {
    Marker m = open();
    bump(L_CURLY);
    Marker list = open();
    ParseRecovery recovery = new ParseRecovery(JS_BOGUS_MEMBER, MEMBER_RECOVERY_SET);
    ParserProgress progress = new ParserProgress("object member list");
    while (!atEof() && !at(R_CURLY)) {
      progress.assertProgressing(this);
      if (parseObjectMember().orRecover(this, recovery, expectedNode("a property")).isErr()) {
        break;
      }
      if (!at(R_CURLY) && !expect(COMMA)) {
        break;
      }
    }
    list.complete(this, JS_OBJECT_MEMBER_LIST);
    expect(R_CURLY);
    return ParsedSyntax.present(m.complete(this, JS_OBJECT_EXPRESSION));
  }

  private ParsedSyntax parseObjectMember() {
    if (at(IDENT) && !nthAt(1, COLON)) {
      Marker m = open();
      Marker name = open();
      bump(IDENT);
      name.complete(this, JS_REFERENCE_IDENTIFIER);
      return ParsedSyntax.present(m.complete(this, JS_SHORTHAND_PROPERTY_OBJECT_MEMBER));
    }
    boolean keyword = kind().isKeyword();
    if (!at(IDENT) && !keyword && !at(JS_STRING_LITERAL) && !at(JS_NUMBER_LITERAL)) {
      return ParsedSyntax.absent();
    }
    Marker m = open();
    Marker name = open();
    if (keyword) {
      bumpRemap(IDENT);
    } else {
      bumpAny();
    }
    name.complete(this, JS_LITERAL_MEMBER_NAME);
    expect(COLON);
    parseAssignmentExpression().orAddDiagnostic(this, expectedNode("an expression"));
    return ParsedSyntax.present(m.complete(this, JS_PROPERTY_OBJECT_MEMBER));
  }

  private JsSyntaxKind kind() {
    return (JsSyntaxKind) cur();
  }

  private boolean atContextualOf() {
    return at(IDENT) && "of".equals(curText());
  }
}
