package io.verbatim.syntax.api;

/**
 * Parser settings.
 *
 * <p>Recognized system properties:
 *
 * <ul>
 *   <li>{@code verbatim.parser.maxNestingDepth} - how deep constructs may nest before the parser
 *       stops descending and reports a diagnostic (default {@value #DEFAULT_MAX_NESTING_DEPTH})
 *   <li>{@code verbatim.parser.trace} - log every parser event at debug level
 * </ul>
 *
 * @param maxNestingDepth nesting limit for recursive constructs
 * @param trace whether to log parser events
 */
public record ParseOptions(int maxNestingDepth, boolean trace) {
  public static final int DEFAULT_MAX_NESTING_DEPTH = 512;
  static final String PROP_MAX_DEPTH = "verbatim.parser.maxNestingDepth";
  static final String PROP_TRACE = "verbatim.parser.trace";

  public ParseOptions {
    if (maxNestingDepth < 1) {
      throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
    }
  }

  public static ParseOptions defaults() {
    return new ParseOptions(DEFAULT_MAX_NESTING_DEPTH, false);
  }

  public static ParseOptions fromSystemProperties() {
    return new ParseOptions(
        Integer.getInteger(PROP_MAX_DEPTH, DEFAULT_MAX_NESTING_DEPTH),
        Boolean.getBoolean(PROP_TRACE));
  }

  public ParseOptions withMaxNestingDepth(int depth) {
    return new ParseOptions(depth, trace);
  }
}
