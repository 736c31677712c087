package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.SyntaxKind;

/**
 * Handle to an open node in the parser's output buffer.
 *
 * <p>Markers nest strictly: only the most recently opened marker that is still open may be
 * completed or abandoned. {@link Parser} rejects any other order with a {@link
 * io.verbatim.syntax.api.SyntaxContractException}.
 */
public final class Marker {
  final int serial;
  final int pos;
  final int startOffset;
  final int precededPos;

  Marker(int serial, int pos, int startOffset, int precededPos) {
    this.serial = serial;
    this.pos = pos;
    this.startOffset = startOffset;
    this.precededPos = precededPos;
  }

  /** Finalizes everything buffered since this marker as one node of {@code kind}. */
  public CompletedMarker complete(Parser p, SyntaxKind kind) {
    return p.completeMarker(this, kind);
  }

  /** Discards this marker; its children become children of the enclosing node. */
  public void abandon(Parser p) {
    p.abandonMarker(this);
  }

  @Override
  public String toString() {
    return "Marker@" + pos;
  }
}
