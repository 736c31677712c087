package io.verbatim.syntax.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A message about a range of source text, produced by the lexer, the parser or an analysis rule.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 *
 * @param severity how serious the finding is
 * @param category the producer of the diagnostic, e.g. {@code parse} or {@code
 *     lint/complexity/noForEach}
 * @param range the primary range
 * @param message the human-readable message
 * @param secondary additional annotated ranges
 * @param footerNote optional note appended after the message, may be {@code null}
 */
public record Diagnostic(
    Severity severity,
    String category,
    TextRange range,
    String message,
    List<Label> secondary,
    String footerNote) {

  public static final String PARSE_CATEGORY = "parse";

  /**
   * An annotated secondary range.
   *
   * @param range the annotated range
   * @param message the annotation text
   */
  public record Label(TextRange range, String message) {}

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(message, "message");
    secondary = secondary == null ? List.of() : List.copyOf(secondary);
  }

  public static Diagnostic error(TextRange range, String message) {
    return new Diagnostic(Severity.ERROR, PARSE_CATEGORY, range, message, List.of(), null);
  }

  public static Diagnostic warning(TextRange range, String message) {
    return new Diagnostic(Severity.WARNING, null, range, message, List.of(), null);
  }

  public Diagnostic withSeverity(Severity severity) {
    return new Diagnostic(severity, category, range, message, secondary, footerNote);
  }

  public Diagnostic withCategory(String category) {
    return new Diagnostic(severity, category, range, message, secondary, footerNote);
  }

  public Diagnostic withSecondary(TextRange range, String message) {
    List<Label> labels = new ArrayList<>(secondary.size() + 1);
    labels.addAll(secondary);
    labels.add(new Label(range, message));
    return new Diagnostic(severity, category, this.range, this.message, labels, footerNote);
  }

  public Diagnostic withFooterNote(String note) {
    return new Diagnostic(severity, category, range, message, secondary, note);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + (category == null ? "" : "[" + category + "]") + "@" + range + ": " + message;
  }
}
