package io.verbatim.css;

import io.verbatim.syntax.api.SyntaxKind;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Token and node kinds of the CSS grammar. */
public enum CssSyntaxKind implements SyntaxKind {
  // ==================== Tokens ====================
  EOF("the end of the file"),
  ERROR_TOKEN("an invalid token"),
  IDENT("an identifier"),
  CSS_STRING_LITERAL("a string"),
  CSS_NUMBER_LITERAL("a number"),
  CSS_PERCENTAGE_LITERAL("a percentage"),
  CSS_DIMENSION_LITERAL("a dimension"),
  CSS_HASH("a hash"),

  AT("`@`"),
  L_CURLY("`{`"),
  R_CURLY("`}`"),
  L_PAREN("`(`"),
  R_PAREN("`)`"),
  L_BRACK("`[`"),
  R_BRACK("`]`"),
  COLON("`:`"),
  SEMICOLON("`;`"),
  COMMA("`,`"),
  DOT("`.`"),
  STAR("`*`"),
  GT("`>`"),
  PLUS("`+`"),
  TILDE("`~`"),
  BANG("`!`"),
  SLASH("`/`"),
  EQ("`=`"),

  COLOR_PROFILE_KW("`color-profile`"),
  CHARSET_KW("`charset`"),
  IMPORTANT_KW("`important`"),
  INHERIT_KW("`inherit`"),
  INITIAL_KW("`initial`"),
  UNSET_KW("`unset`"),
  REVERT_KW("`revert`"),
  REVERT_LAYER_KW("`revert-layer`"),
  DEFAULT_KW("`default`"),

  // ==================== Nodes ====================
  CSS_ROOT,
  CSS_RULE_LIST,
  CSS_QUALIFIED_RULE,
  CSS_SELECTOR_LIST,
  CSS_COMPLEX_SELECTOR,
  CSS_COMPOUND_SELECTOR,
  CSS_TYPE_SELECTOR,
  CSS_UNIVERSAL_SELECTOR,
  CSS_CLASS_SELECTOR,
  CSS_ID_SELECTOR,
  CSS_PSEUDO_CLASS_SELECTOR,
  CSS_IDENTIFIER,
  CSS_CUSTOM_IDENTIFIER,
  CSS_DECLARATION_LIST_BLOCK,
  CSS_DECLARATION_LIST,
  CSS_DECLARATION_WITH_SEMICOLON,
  CSS_DECLARATION,
  CSS_GENERIC_PROPERTY,
  CSS_DECLARATION_IMPORTANT,
  CSS_GENERIC_COMPONENT_VALUE_LIST,
  CSS_STRING,
  CSS_NUMBER,
  CSS_PERCENTAGE,
  CSS_DIMENSION,
  CSS_COLOR,
  CSS_FUNCTION,
  CSS_PARAMETER_LIST,
  CSS_COLOR_PROFILE_AT_RULE,
  CSS_CHARSET_AT_RULE,

  CSS_BOGUS,
  CSS_BOGUS_RULE,
  CSS_BOGUS_AT_RULE,
  CSS_BOGUS_SELECTOR,
  CSS_BOGUS_BLOCK,
  CSS_BOGUS_DECLARATION_ITEM,
  CSS_BOGUS_PROPERTY_VALUE;

  private static final Map<String, CssSyntaxKind> KEYWORDS = new HashMap<>();

  static {
    for (CssSyntaxKind kind : values()) {
      if (kind.isKeyword()) {
        KEYWORDS.put(kind.tokenText(), kind);
      }
    }
  }

  private final String display;

  CssSyntaxKind() {
    this.display = null;
  }

  CssSyntaxKind(String display) {
    this.display = display;
  }

  /** Keyword spelled {@code text}, ignoring ASCII case, or {@code null}. */
  public static CssSyntaxKind keyword(String text) {
    return KEYWORDS.get(text.toLowerCase(Locale.ROOT));
  }

  public boolean isKeyword() {
    return name().endsWith("_KW");
  }

  /**
   * The keywords a property accepts in every declaration. They cannot name anything, e.g. a color
   * profile.
   */
  public boolean isCssWideKeyword() {
    switch (this) {
      case INHERIT_KW:
      case INITIAL_KW:
      case UNSET_KW:
      case REVERT_KW:
      case REVERT_LAYER_KW:
      case DEFAULT_KW:
        return true;
      default:
        return false;
    }
  }

  /** Fixed source spelling of a punctuator or keyword, {@code null} for other kinds. */
  public String tokenText() {
    if (display == null || !display.startsWith("`")) {
      return null;
    }
    return display.substring(1, display.length() - 1);
  }

  public boolean isToken() {
    return ordinal() < CSS_ROOT.ordinal();
  }

  @Override
  public boolean isBogus() {
    return name().startsWith("CSS_BOGUS");
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
