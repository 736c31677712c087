package io.verbatim.syntax.parser;

/** Parser state captured before a speculative parse; see {@link Parser#rewind(Checkpoint)}. */
public final class Checkpoint {
  final TokenSource.Lexed token;
  final int eventCount;
  final int diagnosticCount;
  final int[] openMarkers;
  final int[] openPositions;
  final int undoCount;
  final int lastTokenEnd;
  final int nesting;

  Checkpoint(
      TokenSource.Lexed token,
      int eventCount,
      int diagnosticCount,
      int[] openMarkers,
      int[] openPositions,
      int undoCount,
      int lastTokenEnd,
      int nesting) {
    this.token = token;
    this.eventCount = eventCount;
    this.diagnosticCount = diagnosticCount;
    this.openMarkers = openMarkers;
    this.openPositions = openPositions;
    this.undoCount = undoCount;
    this.lastTokenEnd = lastTokenEnd;
    this.nesting = nesting;
  }
}
