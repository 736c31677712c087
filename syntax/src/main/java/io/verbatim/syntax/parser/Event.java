package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.Internal;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.green.GreenToken;

/**
 * Entry of the parser's append-only output buffer. Node boundaries are recorded as start and
 * finish events so that a node's kind can be decided, or changed, after its children are known.
 */
@Internal
sealed interface Event permits Event.Start, Event.Token, Event.Finish {

  /**
   * Opens a node.
   *
   * @param kind the node kind, {@code null} while the marker is open or after it was abandoned
   * @param forwardParent relative offset to the start event of a node that was opened later but
   *     wraps this one, {@code 0} if none
   */
  record Start(SyntaxKind kind, int forwardParent) implements Event {
    static final Start TOMBSTONE = new Start(null, 0);

    boolean isTombstone() {
      return kind == null;
    }
  }

  record Token(GreenToken token) implements Event {}

  record Finish() implements Event {
    static final Finish INSTANCE = new Finish();
  }
}
