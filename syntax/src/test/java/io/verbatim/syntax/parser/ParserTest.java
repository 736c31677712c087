package io.verbatim.syntax.parser;

import static io.verbatim.syntax.testing.ListKind.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.verbatim.syntax.api.ParseOptions;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.testing.ListParser;
import org.junit.jupiter.api.Test;

public class ParserTest {

  @Test
  void bumpOfOtherKindConsumesNothing() {
    ListParser p = new ListParser("a = 1;");
    assertFalse(p.bump(NUMBER));
    assertTrue(p.at(NAME));
    assertTrue(p.bump(NAME));
    assertTrue(p.at(EQ));
  }

  @Test
  void completingOuterMarkerFirstIsRejected() {
    ListParser p = new ListParser("a");
    Marker outer = p.open();
    Marker inner = p.open();
    p.bump(NAME);

    SyntaxContractException e =
        assertThrows(SyntaxContractException.class, () -> outer.complete(p, ROOT));
    assertEquals(SyntaxContractException.MARKER, e.getErrorCode());

    inner.complete(p, NAME_VALUE);
    outer.complete(p, ROOT);
  }

  @Test
  void completingTwiceIsRejected() {
    ListParser p = new ListParser("a");
    Marker m = p.open();
    m.complete(p, ROOT);
    assertThrows(SyntaxContractException.class, () -> m.complete(p, ROOT));
    assertThrows(SyntaxContractException.class, () -> m.abandon(p));
  }

  @Test
  void buildingWithOpenMarkersIsRejected() {
    ListParser p = new ListParser("a");
    p.open();
    p.bump(NAME);
    SyntaxContractException e = assertThrows(SyntaxContractException.class, p::finish);
    assertEquals(SyntaxContractException.MARKER, e.getErrorCode());
  }

  @Test
  void abandonedMarkerReparentsChildren() {
    ListParser p = new ListParser("a b");
    Marker root = p.open();
    Marker abandoned = p.open();
    Marker value = p.open();
    p.bump(NAME);
    value.complete(p, NAME_VALUE);
    abandoned.abandon(p);
    p.bump(NAME);
    p.bump(EOF);
    root.complete(p, ROOT);

    SyntaxTree tree = p.finish();
    assertEquals(
        "ROOT\n  NAME_VALUE\n    NAME \"a\"\n  NAME \"b\"\n  EOF \"\"\n", tree.root().debugTree());
    assertEquals("a b", tree.text());
  }

  @Test
  void precedeWrapsCompletedNode() {
    ListParser p = new ListParser("a");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker completed = value.complete(p, NAME_VALUE);
    CompletedMarker group = p.wrapInGroup(completed);
    p.bump(EOF);
    root.complete(p, ROOT);

    assertEquals(GROUP, group.kind());
    assertEquals(completed.range(), group.range());
    assertEquals(
        "ROOT\n  GROUP\n    NAME_VALUE\n      NAME \"a\"\n  EOF \"\"\n",
        p.finish().root().debugTree());
  }

  @Test
  void precedeTwiceNestsInOrder() {
    ListParser p = new ListParser("a");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker inner = value.complete(p, NAME_VALUE);
    CompletedMarker middle = inner.precede(p).complete(p, GROUP);
    middle.precede(p).complete(p, ASSIGNMENT);
    root.complete(p, ROOT);

    assertEquals(
        "ROOT\n  ASSIGNMENT\n    GROUP\n      NAME_VALUE\n        NAME \"a\"\n",
        p.finish().root().debugTree());
  }

  @Test
  void abandoningPrecedingMarkerKeepsChild() {
    ListParser p = new ListParser("a");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker completed = value.complete(p, NAME_VALUE);
    completed.precede(p).abandon(p);
    root.complete(p, ROOT);

    assertEquals("ROOT\n  NAME_VALUE\n    NAME \"a\"\n", p.finish().root().debugTree());
  }

  @Test
  void changeKindReclassifiesNode() {
    ListParser p = new ListParser("a");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker bogus = value.complete(p, NAME_VALUE).changeKind(p, BOGUS_VALUE);
    root.complete(p, ROOT);

    assertEquals(BOGUS_VALUE, bogus.kind());
    assertTrue(p.finish().root().childNodes().get(0).isBogus());
  }

  @Test
  void expectReportsMissingToken() {
    ListParser p = new ListParser("a 1");
    p.bump(NAME);
    assertFalse(p.expect(EQ));
    assertEquals(
        "Expected `=` but instead found '1'", p.diagnostics().get(0).message());
    assertTrue(p.at(NUMBER));
  }

  @Test
  void expectAtEndOfFile() {
    ListParser p = new ListParser("a");
    p.bump(NAME);
    p.expect(EQ);
    assertEquals("Expected `=` but instead the file ends", p.diagnostics().get(0).message());
  }

  @Test
  void rewindRestoresEventsAndDiagnostics() {
    ListParser p = new ListParser("a = 1;");
    Marker root = p.open();
    Checkpoint checkpoint = p.checkpoint();
    Marker m = p.open();
    p.bump(NAME);
    p.expect(SEMICOLON);
    m.complete(p, BOGUS);
    assertEquals(1, p.diagnostics().size());

    p.rewind(checkpoint);
    assertTrue(p.at(NAME));
    assertTrue(p.diagnostics().isEmpty());
    while (!p.atEof()) {
      p.bumpAny();
    }
    p.bump(EOF);
    root.complete(p, ROOT);
    SyntaxTree tree = p.finish();
    assertEquals("a = 1;", tree.text());
    assertTrue(tree.root().childNodes().isEmpty());
  }

  @Test
  void staleMarkerCannotCompleteLaterMarkerAtSamePosition() {
    ListParser p = new ListParser("a");
    Marker stale = p.open();
    stale.abandon(p);
    Marker fresh = p.open();
    p.bump(NAME);

    SyntaxContractException e =
        assertThrows(SyntaxContractException.class, () -> stale.complete(p, ROOT));
    assertEquals(SyntaxContractException.MARKER, e.getErrorCode());
    assertThrows(SyntaxContractException.class, () -> stale.abandon(p));

    fresh.complete(p, ROOT);
    assertEquals("ROOT\n  NAME \"a\"\n", p.finish().root().debugTree());
  }

  @Test
  void rewindClosesMarkersOpenedSinceCheckpoint() {
    ListParser p = new ListParser("a b");
    Marker root = p.open();
    Checkpoint checkpoint = p.checkpoint();
    Marker dropped = p.open();
    p.bump(NAME);
    p.rewind(checkpoint);

    Marker value = p.open();
    assertThrows(SyntaxContractException.class, () -> dropped.complete(p, NAME_VALUE));
    p.bump(NAME);
    value.complete(p, NAME_VALUE);
    p.bump(NAME);
    p.bump(EOF);
    root.complete(p, ROOT);

    assertEquals(
        "ROOT\n  NAME_VALUE\n    NAME \"a\"\n  NAME \"b\"\n  EOF \"\"\n",
        p.finish().root().debugTree());
  }

  @Test
  void rewindUndoesPrecedeOfNodeCompletedBeforeCheckpoint() {
    ListParser p = new ListParser("a b");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker completed = value.complete(p, NAME_VALUE);
    Checkpoint checkpoint = p.checkpoint();
    p.wrapInGroup(completed);
    p.rewind(checkpoint);

    p.bumpAny();
    p.bump(EOF);
    root.complete(p, ROOT);

    assertEquals(
        "ROOT\n  NAME_VALUE\n    NAME \"a\"\n  NAME \"b\"\n  EOF \"\"\n",
        p.finish().root().debugTree());
  }

  @Test
  void rewindUndoesChangeKindAndCompletionOfEarlierMarkers() {
    ListParser p = new ListParser("a b");
    Marker root = p.open();
    Marker value = p.open();
    p.bump(NAME);
    CompletedMarker completed = value.complete(p, NAME_VALUE);
    Checkpoint checkpoint = p.checkpoint();
    completed.changeKind(p, BOGUS_VALUE);
    p.bump(NAME);
    root.complete(p, BOGUS);
    p.rewind(checkpoint);

    p.bump(NAME);
    p.bump(EOF);
    root.complete(p, ROOT);

    SyntaxTree tree = p.finish();
    assertEquals(ROOT, tree.root().kind());
    assertEquals(NAME_VALUE, tree.root().childNodes().get(0).kind());
    assertEquals("a b", tree.text());
  }

  @Test
  void recoveryIsDisabledWhileSpeculating() {
    ListParser p = new ListParser("= 1;");
    ParseRecovery recovery = new ParseRecovery(BOGUS, TokenSet.of(SEMICOLON));
    RecoveryResult result = p.speculate(() -> recovery.recover(p));

    assertEquals(RecoveryResult.err(RecoveryError.RECOVERY_DISABLED), result);
    assertFalse(p.isSpeculative());
    assertTrue(p.at(EQ));
  }

  @Test
  void progressGuardDetectsStall() {
    ListParser p = new ListParser("a b");
    ParserProgress progress = new ParserProgress("names");
    progress.assertProgressing(p);
    SyntaxContractException e =
        assertThrows(SyntaxContractException.class, () -> progress.assertProgressing(p));
    assertEquals(SyntaxContractException.PROGRESS, e.getErrorCode());

    p.bump(NAME);
    progress.assertProgressing(p);
  }

  @Test
  void nestingLimitBecomesDiagnostic() {
    String text = "a = ((((((1))))));";
    SyntaxTree tree =
        new ListParser(text, ParseOptions.defaults().withMaxNestingDepth(3)).parseRoot();

    assertEquals(text, tree.text());
    assertTrue(tree.hasErrors());
    assertTrue(
        tree.diagnostics().stream().anyMatch(d -> d.message().equals("Nesting too deep")));
    assertTrue(tree.root().descendants().anyMatch(n -> n.kind() == BOGUS_VALUE));
  }
}
