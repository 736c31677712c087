package io.verbatim.syntax.parser;

import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.ParseOptions;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.api.TextRange;
import io.verbatim.syntax.green.GreenNode;
import io.verbatim.syntax.green.GreenNodeBuilder;
import io.verbatim.syntax.green.GreenToken;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the recursive-descent parsers. Owns the token stream, the append-only event
 * buffer, the stack of open markers and the diagnostics collected so far.
 *
 * <p>Grammar code opens a marker, consumes tokens or completes nested markers, then completes the
 * marker with a node kind:
 *
 * <pre>{@code
 * Marker m = p.open();
 * p.bump(AT);
 * parseName(p);
 * CompletedMarker rule = m.complete(p, AT_RULE);
 * }</pre>
 *
 * A parser instance parses one text once and is not thread-safe.
 */
public abstract class Parser {
  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private final TokenSource source;
  private final LexContext regular;
  private final ParseOptions options;
  private final List<Event> events = new ArrayList<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final IntArrayList openMarkers = new IntArrayList();
  private final IntArrayList openPositions = new IntArrayList();
  // Overwritten start events that a rewind must restore: (position, previous event) pairs.
  private final IntArrayList undoPositions = new IntArrayList();
  private final List<Event> undoEvents = new ArrayList<>();
  private int checkpointHorizon;
  private int nextSerial;
  private int speculation;
  private int lastTokenEnd;
  private int nesting;

  protected Parser(Lexer lexer, ParseOptions options) {
    this.source = new TokenSource(lexer);
    this.regular = lexer.regularContext();
    this.options = options;
  }

  public ParseOptions options() {
    return options;
  }

  // ==================== Token access ====================

  /** Kind of the current token. */
  public SyntaxKind cur() {
    return source.current();
  }

  public boolean at(SyntaxKind kind) {
    return source.current() == kind;
  }

  public boolean atAny(TokenSet set) {
    return set.contains(source.current());
  }

  public boolean atEof() {
    return source.current().isEof();
  }

  public SyntaxKind nth(int n) {
    return source.nth(n);
  }

  public boolean nthAt(int n, SyntaxKind kind) {
    return source.nth(n) == kind;
  }

  public boolean nthHasPrecedingLineBreak(int n) {
    return source.nthHasPrecedingLineBreak(n);
  }

  /** Range of the current token's significant text. */
  public TextRange curRange() {
    return source.currentRange();
  }

  public String curText() {
    return source.currentText();
  }

  public boolean hasPrecedingLineBreak() {
    return source.hasPrecedingLineBreak();
  }

  /** Source text of {@code range}. */
  public String sourceText(TextRange range) {
    return range.slice(source.text());
  }

  /** End offset of the last consumed token's significant text. */
  public int lastTokenEnd() {
    return lastTokenEnd;
  }

  // ==================== Consuming ====================

  /**
   * Consumes the current token if it is of {@code kind}.
   *
   * @return {@code false}, without consuming anything, if the current token is of another kind
   */
  public boolean bump(SyntaxKind kind) {
    if (!at(kind)) {
      return false;
    }
    doBump(kind, regular);
    return true;
  }

  /** Like {@link #bump(SyntaxKind)}, lexing the following token in {@code context}. */
  public boolean bumpWithContext(SyntaxKind kind, LexContext context) {
    if (!at(kind)) {
      return false;
    }
    doBump(kind, context);
    return true;
  }

  /** Consumes the current token, whatever its kind. Does nothing at end of file. */
  public void bumpAny() {
    if (!atEof()) {
      doBump(cur(), regular);
    }
  }

  /** Consumes the current token as {@code kind}, e.g. a keyword used as an identifier. */
  public void bumpRemap(SyntaxKind kind) {
    doBump(kind, regular);
  }

  public void bumpRemapWithContext(SyntaxKind kind, LexContext context) {
    doBump(kind, context);
  }

  /**
   * Consumes a token of {@code kind} or reports that it is missing. Never consumes anything else.
   *
   * @return whether the token was present
   */
  public boolean expect(SyntaxKind kind) {
    if (bump(kind)) {
      return true;
    }
    error(ParseDiagnostics.expectedToken(this, kind));
    return false;
  }

  /** Lexes the current token again in {@code context}. */
  public void reLex(LexContext context) {
    source.reLex(context);
  }

  private void doBump(SyntaxKind kind, LexContext next) {
    TokenSource.Lexed lexed = source.bump(next);
    GreenToken token = lexed.token();
    if (token.kind() != kind) {
      token = token.withKind(kind);
    }
    events.add(new Event.Token(token));
    diagnostics.addAll(lexed.errors());
    lastTokenEnd = lexed.range().end();
    if (options.trace()) {
      log.debug("bump {} {} '{}'", kind.name(), lexed.range(), token.text());
    }
  }

  // ==================== Diagnostics ====================

  public void error(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public void error(TextRange range, String message) {
    diagnostics.add(Diagnostic.error(range, message));
  }

  public List<Diagnostic> diagnostics() {
    return List.copyOf(diagnostics);
  }

  // ==================== Markers ====================

  /** Opens a marker at the current position. */
  public Marker open() {
    return openAt(curRange().start(), -1);
  }

  private Marker openAt(int startOffset, int precededPos) {
    int pos = events.size();
    int serial = nextSerial++;
    events.add(Event.Start.TOMBSTONE);
    openMarkers.add(serial);
    openPositions.add(pos);
    if (options.trace()) {
      log.debug("open marker@{}", pos);
    }
    return new Marker(serial, pos, startOffset, precededPos);
  }

  CompletedMarker completeMarker(Marker marker, SyntaxKind kind) {
    requireInnermost(marker);
    popMarker();
    Event.Start start = (Event.Start) events.get(marker.pos);
    setStart(marker.pos, new Event.Start(kind, start.forwardParent()));
    events.add(Event.Finish.INSTANCE);
    if (options.trace()) {
      log.debug("complete marker@{} as {}", marker.pos, kind.name());
    }
    int end = lastTokenEnd < marker.startOffset ? marker.startOffset : lastTokenEnd;
    return new CompletedMarker(marker.pos, kind, marker.startOffset, end);
  }

  void abandonMarker(Marker marker) {
    requireInnermost(marker);
    popMarker();
    if (marker.precededPos >= 0) {
      Event.Start child = (Event.Start) events.get(marker.precededPos);
      setStart(marker.precededPos, new Event.Start(child.kind(), 0));
    }
    // The start event stays in place as a tombstone so that positions never get reused.
    setStart(marker.pos, Event.Start.TOMBSTONE);
  }

  Marker precedeMarker(CompletedMarker completed, int startOffset) {
    Marker parent = openAt(startOffset, completed.pos);
    Event.Start start = (Event.Start) events.get(completed.pos);
    setStart(completed.pos, new Event.Start(start.kind(), parent.pos - completed.pos));
    return parent;
  }

  void changeMarkerKind(CompletedMarker completed, SyntaxKind kind) {
    Event.Start start = (Event.Start) events.get(completed.pos);
    setStart(completed.pos, new Event.Start(kind, start.forwardParent()));
  }

  private void setStart(int pos, Event.Start start) {
    Event previous = events.set(pos, start);
    if (pos < checkpointHorizon) {
      undoPositions.add(pos);
      undoEvents.add(previous);
    }
  }

  private void popMarker() {
    openMarkers.popInt();
    openPositions.popInt();
  }

  private void requireInnermost(Marker marker) {
    int index = openMarkers.lastIndexOf(marker.serial);
    if (index < 0) {
      throw SyntaxContractException.markerNotOpen(marker.pos);
    }
    if (index != openMarkers.size() - 1) {
      throw SyntaxContractException.markerOutOfOrder(
          marker.pos, openPositions.getInt(openPositions.size() - 1));
    }
  }

  // ==================== Speculation ====================

  public Checkpoint checkpoint() {
    checkpointHorizon = Math.max(checkpointHorizon, events.size());
    return new Checkpoint(
        source.checkpoint(),
        events.size(),
        diagnostics.size(),
        openMarkers.toIntArray(),
        openPositions.toIntArray(),
        undoPositions.size(),
        lastTokenEnd,
        nesting);
  }

  /**
   * Restores the state captured by {@code checkpoint}, dropping everything parsed since. Markers
   * opened after the checkpoint are no longer open; completing or abandoning them is rejected.
   * Nodes completed before the checkpoint get back the kind and parent links they had then.
   */
  public void rewind(Checkpoint checkpoint) {
    source.rewind(checkpoint.token);
    for (int i = undoPositions.size() - 1; i >= checkpoint.undoCount; i--) {
      events.set(undoPositions.getInt(i), undoEvents.get(i));
    }
    undoPositions.size(checkpoint.undoCount);
    undoEvents.subList(checkpoint.undoCount, undoEvents.size()).clear();
    events.subList(checkpoint.eventCount, events.size()).clear();
    diagnostics.subList(checkpoint.diagnosticCount, diagnostics.size()).clear();
    openMarkers.clear();
    openMarkers.addElements(0, checkpoint.openMarkers);
    openPositions.clear();
    openPositions.addElements(0, checkpoint.openPositions);
    lastTokenEnd = checkpoint.lastTokenEnd;
    nesting = checkpoint.nesting;
  }

  /** Number of diagnostics reported since {@code checkpoint} was taken. */
  public int errorsSince(Checkpoint checkpoint) {
    return diagnostics.size() - checkpoint.diagnosticCount;
  }

  /** Runs {@code attempt} with error recovery disabled. The caller decides whether to rewind. */
  public <T> T speculate(Supplier<T> attempt) {
    speculation++;
    try {
      return attempt.get();
    } finally {
      speculation--;
    }
  }

  public boolean isSpeculative() {
    return speculation > 0;
  }

  // ==================== Nesting ====================

  /**
   * Enters one level of a recursive construct.
   *
   * @return {@code false} if the configured nesting limit is reached; the level is not entered
   */
  public boolean enterNesting() {
    if (nesting >= options.maxNestingDepth()) {
      return false;
    }
    nesting++;
    return true;
  }

  public void exitNesting() {
    nesting--;
  }

  // ==================== Tree building ====================

  /**
   * Turns the event buffer into a tree. Grammars call this once, after completing the root marker
   * with the end-of-file token inside it.
   */
  protected SyntaxTree buildTree() {
    if (!openMarkers.isEmpty()) {
      throw SyntaxContractException.unresolvedMarkers(openMarkers.size());
    }
    GreenNodeBuilder builder = new GreenNodeBuilder();
    Event[] buffer = events.toArray(new Event[0]);
    List<SyntaxKind> kinds = new ArrayList<>();
    for (int i = 0; i < buffer.length; i++) {
      Event event = buffer[i];
      if (event instanceof Event.Start start) {
        if (start.isTombstone()) {
          continue;
        }
        kinds.clear();
        kinds.add(start.kind());
        int idx = i;
        int forward = start.forwardParent();
        while (forward != 0) {
          idx += forward;
          Event.Start parent = (Event.Start) buffer[idx];
          buffer[idx] = Event.Start.TOMBSTONE;
          if (!parent.isTombstone()) {
            kinds.add(parent.kind());
          }
          forward = parent.forwardParent();
        }
        for (int k = kinds.size() - 1; k >= 0; k--) {
          builder.startNode(kinds.get(k));
        }
      } else if (event instanceof Event.Token token) {
        builder.token(token.token());
      } else {
        builder.finishNode();
      }
    }
    GreenNode root = builder.finish();
    log.debug(
        "Built {} tree: {} chars, {} events, {} diagnostics",
        root.kind().name(),
        root.textLength(),
        buffer.length,
        diagnostics.size());
    return new SyntaxTree(SyntaxNode.newRoot(root), diagnostics);
  }
}
