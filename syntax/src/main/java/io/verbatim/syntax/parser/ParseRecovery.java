package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;
import java.util.Objects;

/**
 * Skips unexpected tokens until the parser reaches a point where the enclosing construct can
 * continue.
 *
 * <p>The skipped tokens are wrapped into one node of the bogus kind. Recovery either consumes at
 * least one token or fails without consuming anything, so a caller looping on it always
 * terminates.
 */
public final class ParseRecovery {
  private final SyntaxKind bogusKind;
  private final TokenSet recoverySet;
  private final boolean recoverOnLineBreak;

  public ParseRecovery(SyntaxKind bogusKind, TokenSet recoverySet) {
    this(bogusKind, recoverySet, false);
  }

  private ParseRecovery(SyntaxKind bogusKind, TokenSet recoverySet, boolean recoverOnLineBreak) {
    this.bogusKind = Objects.requireNonNull(bogusKind, "bogusKind");
    this.recoverySet = Objects.requireNonNull(recoverySet, "recoverySet");
    this.recoverOnLineBreak = recoverOnLineBreak;
  }

  /** Also treats a token preceded by a line break as a recovery point. */
  public ParseRecovery enableRecoveryOnLineBreak() {
    return new ParseRecovery(bogusKind, recoverySet, true);
  }

  public SyntaxKind bogusKind() {
    return bogusKind;
  }

  public TokenSet recoverySet() {
    return recoverySet;
  }

  public boolean recoversOnLineBreak() {
    return recoverOnLineBreak;
  }

  public RecoveryResult recover(Parser p) {
    if (p.atEof()) {
      return RecoveryResult.err(RecoveryError.EOF);
    }
    if (isAtRecoveryPoint(p)) {
      return RecoveryResult.err(RecoveryError.ALREADY_RECOVERED);
    }
    if (p.isSpeculative()) {
      return RecoveryResult.err(RecoveryError.RECOVERY_DISABLED);
    }
    Marker m = p.open();
    do {
      p.bumpAny();
    } while (!p.atEof() && !isAtRecoveryPoint(p));
    return RecoveryResult.ok(m.complete(p, bogusKind));
  }

  private boolean isAtRecoveryPoint(Parser p) {
    return p.atAny(recoverySet) || (recoverOnLineBreak && p.hasPrecedingLineBreak());
  }

  @Override
  public String toString() {
    return "ParseRecovery{"
        + bogusKind.name()
        + ", "
        + recoverySet
        + (recoverOnLineBreak ? ", line break" : "")
        + "}";
  }
}
