package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.TextRange;

/**
 * Guards list loops against spinning in place. Call {@link #assertProgressing(Parser)} once per
 * iteration, before parsing the next element.
 */
public final class ParserProgress {
  private final String construct;
  private int lastPosition = -1;

  public ParserProgress(String construct) {
    this.construct = construct;
  }

  /** Whether the current token lies after the one seen in the previous call. */
  public boolean hasProgressed(Parser p) {
    return lastPosition < 0 || p.curRange().start() > lastPosition;
  }

  /**
   * @throws SyntaxContractException if the parser is still at the token seen in the previous call
   */
  public void assertProgressing(Parser p) {
    TextRange at = p.curRange();
    if (!hasProgressed(p)) {
      throw SyntaxContractException.noProgress(construct, at);
    }
    lastPosition = at.start();
  }
}
