package io.verbatim.syntax.api;

/**
 * Thrown when a grammar or rule implementation violates a structural contract of the core:
 * markers resolved out of order, a list loop that stops making progress, conflicting batch edits.
 *
 * <p>These failures indicate a defect in the calling code, never malformed user input, which is
 * always reported as a {@link Diagnostic}.
 */
public class SyntaxContractException extends RuntimeException {
  public static final String MARKER = "MARKER";
  public static final String PROGRESS = "PROGRESS";
  public static final String MUTATION = "MUTATION";
  public static final String QUERY = "QUERY";

  private final String context;
  private final String errorCode;

  public SyntaxContractException(String message, String context, String errorCode) {
    super(formatMessage(message, context, errorCode));
    this.context = context;
    this.errorCode = errorCode;
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

  public static SyntaxContractException markerOutOfOrder(int marker, int top) {
    return new SyntaxContractException(
        "Marker resolved while a later marker is still open",
        "marker@" + marker + ", innermost open marker@" + top,
        MARKER);
  }

  public static SyntaxContractException markerNotOpen(int marker) {
    return new SyntaxContractException(
        "Marker is not open; it was already resolved or discarded by a rewind",
        "marker@" + marker,
        MARKER);
  }

  public static SyntaxContractException unresolvedMarkers(int count) {
    return new SyntaxContractException(
        "Cannot build a tree while markers are still open", count + " open marker(s)", MARKER);
  }

  public static SyntaxContractException noProgress(String construct, TextRange at) {
    return new SyntaxContractException(
        "Parser did not advance between two iterations", construct + " at " + at, PROGRESS);
  }

  public static SyntaxContractException conflictingEdits(String reason, TextRange at) {
    return new SyntaxContractException(
        "Conflicting edits in batch mutation: " + reason, String.valueOf(at), MUTATION);
  }

  public static SyntaxContractException foreignElement(TextRange at) {
    return new SyntaxContractException(
        "Edit targets an element that does not belong to the mutated tree",
        String.valueOf(at),
        MUTATION);
  }

  public static SyntaxContractException semanticModelUnavailable(String rule) {
    return new SyntaxContractException(
        "Semantic model requested by a rule that declared a syntax-only query", rule, QUERY);
  }
}
