package io.verbatim.syntax.parser;

import java.util.Optional;

/**
 * Outcome of parsing an element with recovery: the element or the bogus node wrapping the
 * skipped tokens, or the reason nothing was consumed.
 */
public sealed interface RecoveryResult permits RecoveryResult.Ok, RecoveryResult.Err {

  static RecoveryResult ok(CompletedMarker node) {
    return new Ok(node);
  }

  static RecoveryResult err(RecoveryError error) {
    return new Err(error);
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  default boolean isErr() {
    return this instanceof Err;
  }

  default Optional<CompletedMarker> node() {
    return this instanceof Ok ok ? Optional.of(ok.marker()) : Optional.empty();
  }

  record Ok(CompletedMarker marker) implements RecoveryResult {}

  record Err(RecoveryError error) implements RecoveryResult {}
}
