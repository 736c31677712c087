package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a parse function: the completed node, or {@link Absent} when the parser is not at
 * the construct. An absent result never consumed any input.
 */
public sealed interface ParsedSyntax permits ParsedSyntax.Present, ParsedSyntax.Absent {

  static ParsedSyntax present(CompletedMarker marker) {
    return new Present(marker);
  }

  static ParsedSyntax absent() {
    return Absent.INSTANCE;
  }

  record Present(CompletedMarker marker) implements ParsedSyntax {}

  record Absent() implements ParsedSyntax {
    static final Absent INSTANCE = new Absent();
  }

  default boolean isPresent() {
    return this instanceof Present;
  }

  default boolean isAbsent() {
    return this instanceof Absent;
  }

  default Optional<CompletedMarker> ok() {
    return this instanceof Present present ? Optional.of(present.marker()) : Optional.empty();
  }

  default Optional<SyntaxKind> kind() {
    return ok().map(CompletedMarker::kind);
  }

  default ParsedSyntax map(Function<CompletedMarker, CompletedMarker> mapper) {
    return this instanceof Present present ? present(mapper.apply(present.marker())) : this;
  }

  default ParsedSyntax changeKind(Parser p, SyntaxKind kind) {
    return map(m -> m.changeKind(p, kind));
  }

  /** Wraps a present node into a new parent node of {@code kind}. */
  default ParsedSyntax precede(Parser p, SyntaxKind kind) {
    return map(m -> m.precede(p).complete(p, kind));
  }

  /**
   * Reports {@code error} at the current token if absent.
   *
   * @return the present node
   */
  default Optional<CompletedMarker> orAddDiagnostic(Parser p, ParseDiagnosticBuilder error) {
    if (this instanceof Present present) {
      return Optional.of(present.marker());
    }
    p.error(error.build(p, p.curRange()));
    return Optional.empty();
  }

  /**
   * Returns the present node, or reports {@code error} at the current token and runs {@code
   * recovery}. The diagnostic is reported whether or not recovery consumes anything.
   */
  default RecoveryResult orRecover(Parser p, ParseRecovery recovery, ParseDiagnosticBuilder error) {
    if (this instanceof Present present) {
      return RecoveryResult.ok(present.marker());
    }
    p.error(error.build(p, p.curRange()));
    return recovery.recover(p);
  }
}
