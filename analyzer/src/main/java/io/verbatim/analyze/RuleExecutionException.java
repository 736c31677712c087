package io.verbatim.analyze;

/** A rule threw while running on a node. Wraps the rule's exception as the cause. */
public class RuleExecutionException extends RuntimeException {
  public static final String RULE = "RULE";

  private final String context;
  private final String errorCode;

  public RuleExecutionException(String message, Throwable cause, String context) {
    super(formatMessage(message, context, RULE), cause);
    this.context = context;
    this.errorCode = RULE;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }

  static RuleExecutionException of(RuleMetadata rule, String phase, Throwable cause) {
    return new RuleExecutionException(
        "Rule failed during " + phase + ": " + cause, cause, rule.category());
  }
}
