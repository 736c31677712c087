package io.verbatim.js;

import io.verbatim.syntax.api.SyntaxKind;
import java.util.HashMap;
import java.util.Map;

/** Token and node kinds of the JavaScript grammar. */
public enum JsSyntaxKind implements SyntaxKind {
  // ==================== Tokens ====================
  EOF("the end of the file"),
  ERROR_TOKEN("an invalid token"),
  IDENT("an identifier"),
  JS_STRING_LITERAL("a string literal"),
  JS_NUMBER_LITERAL("a number literal"),
  JS_REGEX_LITERAL("a regular expression"),

  L_PAREN("`(`"),
  R_PAREN("`)`"),
  L_CURLY("`{`"),
  R_CURLY("`}`"),
  L_BRACK("`[`"),
  R_BRACK("`]`"),
  SEMICOLON("`;`"),
  COMMA("`,`"),
  DOT("`.`"),
  QUESTION("`?`"),
  QUESTION2("`??`"),
  COLON("`:`"),
  FAT_ARROW("`=>`"),
  EQ("`=`"),
  EQ2("`==`"),
  EQ3("`===`"),
  NEQ("`!=`"),
  NEQ2("`!==`"),
  BANG("`!`"),
  TILDE("`~`"),
  PLUS("`+`"),
  MINUS("`-`"),
  STAR("`*`"),
  SLASH("`/`"),
  PERCENT("`%`"),
  PLUS2("`++`"),
  MINUS2("`--`"),
  PLUS_EQ("`+=`"),
  MINUS_EQ("`-=`"),
  STAR_EQ("`*=`"),
  SLASH_EQ("`/=`"),
  PERCENT_EQ("`%=`"),
  LT("`<`"),
  GT("`>`"),
  LTEQ("`<=`"),
  GTEQ("`>=`"),
  AMP2("`&&`"),
  PIPE2("`||`"),

  CONST_KW("`const`"),
  LET_KW("`let`"),
  VAR_KW("`var`"),
  FUNCTION_KW("`function`"),
  RETURN_KW("`return`"),
  IF_KW("`if`"),
  ELSE_KW("`else`"),
  FOR_KW("`for`"),
  IN_KW("`in`"),
  OF_KW("`of`"),
  THIS_KW("`this`"),
  TRUE_KW("`true`"),
  FALSE_KW("`false`"),
  NULL_KW("`null`"),
  TYPEOF_KW("`typeof`"),

  // ==================== Nodes ====================
  JS_MODULE,
  JS_MODULE_ITEM_LIST,
  JS_STATEMENT_LIST,

  JS_VARIABLE_STATEMENT,
  JS_VARIABLE_DECLARATION,
  JS_VARIABLE_DECLARATOR_LIST,
  JS_VARIABLE_DECLARATOR,
  JS_FOR_VARIABLE_DECLARATION,
  JS_IDENTIFIER_BINDING,
  JS_INITIALIZER_CLAUSE,
  JS_EXPRESSION_STATEMENT,
  JS_BLOCK_STATEMENT,
  JS_EMPTY_STATEMENT,
  JS_IF_STATEMENT,
  JS_ELSE_CLAUSE,
  JS_FOR_STATEMENT,
  JS_FOR_OF_STATEMENT,
  JS_FOR_IN_STATEMENT,
  JS_RETURN_STATEMENT,
  JS_FUNCTION_DECLARATION,
  JS_PARAMETERS,
  JS_PARAMETER_LIST,
  JS_FORMAL_PARAMETER,
  JS_FUNCTION_BODY,

  JS_IDENTIFIER_EXPRESSION,
  JS_REFERENCE_IDENTIFIER,
  JS_THIS_EXPRESSION,
  JS_STRING_LITERAL_EXPRESSION,
  JS_NUMBER_LITERAL_EXPRESSION,
  JS_BOOLEAN_LITERAL_EXPRESSION,
  JS_NULL_LITERAL_EXPRESSION,
  JS_REGEX_LITERAL_EXPRESSION,
  JS_ARRAY_EXPRESSION,
  JS_ARRAY_ELEMENT_LIST,
  JS_OBJECT_EXPRESSION,
  JS_OBJECT_MEMBER_LIST,
  JS_PROPERTY_OBJECT_MEMBER,
  JS_SHORTHAND_PROPERTY_OBJECT_MEMBER,
  JS_LITERAL_MEMBER_NAME,
  JS_PARENTHESIZED_EXPRESSION,
  JS_ARROW_FUNCTION_EXPRESSION,
  JS_STATIC_MEMBER_EXPRESSION,
  JS_COMPUTED_MEMBER_EXPRESSION,
  JS_NAME,
  JS_CALL_EXPRESSION,
  JS_CALL_ARGUMENTS,
  JS_CALL_ARGUMENT_LIST,
  JS_UNARY_EXPRESSION,
  JS_PRE_UPDATE_EXPRESSION,
  JS_POST_UPDATE_EXPRESSION,
  JS_BINARY_EXPRESSION,
  JS_LOGICAL_EXPRESSION,
  JS_CONDITIONAL_EXPRESSION,
  JS_SEQUENCE_EXPRESSION,
  JS_ASSIGNMENT_EXPRESSION,
  JS_IDENTIFIER_ASSIGNMENT,
  JS_STATIC_MEMBER_ASSIGNMENT,
  JS_COMPUTED_MEMBER_ASSIGNMENT,

  JS_BOGUS,
  JS_BOGUS_STATEMENT,
  JS_BOGUS_EXPRESSION,
  JS_BOGUS_BINDING,
  JS_BOGUS_MEMBER,
  JS_BOGUS_ASSIGNMENT,
  JS_BOGUS_PARAMETER;

  private static final Map<String, JsSyntaxKind> KEYWORDS = new HashMap<>();

  static {
    for (JsSyntaxKind kind : values()) {
      if (kind.isKeyword() && kind != OF_KW) {
        KEYWORDS.put(kind.tokenText(), kind);
      }
    }
  }

  private final String display;

  JsSyntaxKind() {
    this.display = null;
  }

  JsSyntaxKind(String display) {
    this.display = display;
  }

  /**
   * Reserved word spelled {@code text}, or {@code null}. {@code of} is contextual and lexes as an
   * identifier.
   */
  public static JsSyntaxKind keyword(String text) {
    return KEYWORDS.get(text);
  }

  public boolean isKeyword() {
    return name().endsWith("_KW");
  }

  /** Fixed source spelling of a punctuator or keyword, {@code null} for other kinds. */
  public String tokenText() {
    if (display == null || !display.startsWith("`")) {
      return null;
    }
    return display.substring(1, display.length() - 1);
  }

  public boolean isToken() {
    return ordinal() < JS_MODULE.ordinal();
  }

  @Override
  public boolean isBogus() {
    return name().startsWith("JS_BOGUS");
  }

  @Override
  public boolean isList() {
    return name().endsWith("_LIST");
  }

  @Override
  public boolean isEof() {
    return this == EOF;
  }

  @Override
  public String displayText() {
    return display != null ? display : name();
  }
}
