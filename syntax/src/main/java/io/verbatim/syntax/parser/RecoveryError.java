package io.verbatim.syntax.parser;

/** Why {@link ParseRecovery} did not consume anything. */
public enum RecoveryError {
  /** The parser is at the end of the file. */
  EOF,
  /** The current token already is a recovery point; the enclosing construct can continue. */
  ALREADY_RECOVERED,
  /** The parser is speculating, recovery would commit to a parse that may be rewound. */
  RECOVERY_DISABLED
}
