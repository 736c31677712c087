package io.verbatim.syntax.mutation;

import io.verbatim.syntax.api.SyntaxElement;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.green.GreenElement;

/** One primitive edit of a {@link BatchMutation}. Equal edits are applied once. */
sealed interface Edit {

  /** The element whose slot changes, or the node whose children grow for {@link Append}. */
  SyntaxElement target();

  /** Node whose child list is rewritten by this edit. */
  SyntaxNode location();

  /** Whether the edit consumes the target's slot, as opposed to adding elements next to it. */
  default boolean isSlotEdit() {
    return false;
  }

  record Remove(SyntaxElement target) implements Edit {
    @Override
    public SyntaxNode location() {
      return target.parent().orElseThrow();
    }

    @Override
    public boolean isSlotEdit() {
      return true;
    }
  }

  /**
   * Removal of one element of a separated list. Resolved into plain removals at commit, once all
   * removals from the same list are known.
   */
  record RemoveListElement(SyntaxNode target, SyntaxKind separator, SyntaxNode whenEmpty)
      implements Edit {
    @Override
    public SyntaxNode location() {
      return target.parent().orElseThrow();
    }

    @Override
    public boolean isSlotEdit() {
      return true;
    }
  }

  record Replace(SyntaxElement target, GreenElement replacement) implements Edit {
    @Override
    public SyntaxNode location() {
      return target.parent().orElseThrow();
    }

    @Override
    public boolean isSlotEdit() {
      return true;
    }
  }

  record InsertBefore(SyntaxElement target, GreenElement element) implements Edit {
    @Override
    public SyntaxNode location() {
      return target.parent().orElseThrow();
    }
  }

  record InsertAfter(SyntaxElement target, GreenElement element) implements Edit {
    @Override
    public SyntaxNode location() {
      return target.parent().orElseThrow();
    }
  }

  record Append(SyntaxNode target, GreenElement element) implements Edit {
    @Override
    public SyntaxNode location() {
      return target;
    }
  }
}
