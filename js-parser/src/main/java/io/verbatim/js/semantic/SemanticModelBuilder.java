package io.verbatim.js.semantic;

import io.verbatim.js.JsSyntaxKind;
import io.verbatim.syntax.api.SyntaxKind;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.WalkEvent;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One preorder pass collecting scopes and declarations. References are resolved when their scope
 * is left, so a declaration later in the same scope still resolves an earlier use.
 */
final class SemanticModelBuilder {
  private static final Logger log = LoggerFactory.getLogger(SemanticModelBuilder.class);

  private final SyntaxNode root;
  private final List<Scope> scopes = new ArrayList<>();
  private final List<Binding> bindings = new ArrayList<>();
  private final List<PendingReference> resolved = new ArrayList<>();
  private final List<PendingReference> unresolved = new ArrayList<>();
  private final Object2IntOpenHashMap<SyntaxNode> scopeByNode = new Object2IntOpenHashMap<>();
  private final Deque<OpenScope> stack = new ArrayDeque<>();

  SemanticModelBuilder(SyntaxNode root) {
    this.root = root;
    scopeByNode.defaultReturnValue(-1);
  }

  SemanticModel build() {
    for (WalkEvent event : root.preorder()) {
      SyntaxNode node = event.node();
      if (event instanceof WalkEvent.Enter) {
        enter(node);
      } else if (scopeKind(node.kind()) != null) {
        leaveScope();
      }
    }
    return finish();
  }

  private void enter(SyntaxNode node) {
    SyntaxKind kind = node.kind();
    ScopeKind scopeKind = scopeKind(kind);
    if (scopeKind != null) {
      int id = scopes.size();
      int parentId = stack.isEmpty() ? -1 : stack.peek().id;
      scopes.add(new Scope(id, scopeKind, parentId, node));
      scopeByNode.put(node, id);
      stack.push(new OpenScope(id, scopeKind));
    } else if (kind == JsSyntaxKind.JS_IDENTIFIER_BINDING) {
      declare(node);
    } else if (kind == JsSyntaxKind.JS_REFERENCE_IDENTIFIER) {
      reference(node);
    }
  }

  private static ScopeKind scopeKind(SyntaxKind kind) {
    if (!(kind instanceof JsSyntaxKind jsKind)) {
      return null;
    }
    switch (jsKind) {
      case JS_MODULE:
        return ScopeKind.MODULE;
      case JS_FUNCTION_DECLARATION:
        return ScopeKind.FUNCTION;
      case JS_ARROW_FUNCTION_EXPRESSION:
        return ScopeKind.ARROW_FUNCTION;
      case JS_BLOCK_STATEMENT:
        return ScopeKind.BLOCK;
      case JS_FOR_STATEMENT:
      case JS_FOR_IN_STATEMENT:
      case JS_FOR_OF_STATEMENT:
        return ScopeKind.FOR;
      default:
        return null;
    }
  }

  private void declare(SyntaxNode node) {
    Optional<String> name = node.childToken(JsSyntaxKind.IDENT).map(t -> t.text());
    if (name.isEmpty() || stack.isEmpty()) {
      return;
    }
    OpenScope target = declaringScope(node);
    int id = bindings.size();
    bindings.add(new Binding(id, name.get(), node, target.id));
    target.declared.putIfAbsent(name.get(), id);
  }

  private OpenScope declaringScope(SyntaxNode binding) {
    SyntaxNode parent = binding.parent().orElseThrow();
    if (parent.kind() == JsSyntaxKind.JS_FUNCTION_DECLARATION) {
      // the function's own scope is on top; its name belongs to the enclosing one
      Iterator<OpenScope> it = stack.iterator();
      OpenScope top = it.next();
      return it.hasNext() ? it.next() : top;
    }
    if (parent.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATOR && isVar(parent)) {
      for (OpenScope scope : stack) {
        if (scope.kind.isFunctionLike()) {
          return scope;
        }
      }
    }
    return stack.peek();
  }

  private static boolean isVar(SyntaxNode declarator) {
    return declarator.ancestors()
        .filter(
            n ->
                n.kind() == JsSyntaxKind.JS_VARIABLE_DECLARATION
                    || n.kind() == JsSyntaxKind.JS_FOR_VARIABLE_DECLARATION)
        .findFirst()
        .map(d -> d.childToken(JsSyntaxKind.VAR_KW).isPresent())
        .orElse(false);
  }

  private void reference(SyntaxNode node) {
    if (stack.isEmpty() || node.childToken(JsSyntaxKind.IDENT).isEmpty()) {
      return;
    }
    boolean write =
        node.parent().map(p -> p.kind() == JsSyntaxKind.JS_IDENTIFIER_ASSIGNMENT).orElse(false);
    stack.peek().pending.add(new PendingReference(node, write));
  }

  private void leaveScope() {
    OpenScope scope = stack.pop();
    OpenScope parent = stack.peek();
    for (PendingReference ref : scope.pending) {
      String name = ref.node.childToken(JsSyntaxKind.IDENT).orElseThrow().text();
      int bindingId = scope.declared.getInt(name);
      if (bindingId >= 0) {
        ref.bindingId = bindingId;
        resolved.add(ref);
      } else if (parent != null) {
        parent.pending.add(ref);
      } else {
        unresolved.add(ref);
      }
    }
  }

  private SemanticModel finish() {
    List<PendingReference> all = new ArrayList<>(resolved.size() + unresolved.size());
    all.addAll(resolved);
    all.addAll(unresolved);
    all.sort(Comparator.comparingInt(r -> r.node.textTrimmedRange().start()));

    Int2IntOpenHashMap referenceByOffset = new Int2IntOpenHashMap(all.size());
    referenceByOffset.defaultReturnValue(-1);
    List<Reference> references = new ArrayList<>(all.size());
    List<IntList> byBinding = new ArrayList<>(bindings.size());
    for (int i = 0; i < bindings.size(); i++) {
      byBinding.add(new IntArrayList());
    }
    List<Reference> unresolvedReferences = new ArrayList<>();
    for (PendingReference pending : all) {
      Reference reference = new Reference(pending.node, pending.bindingId, pending.write);
      referenceByOffset.put(pending.node.textTrimmedRange().start(), references.size());
      if (reference.isResolved()) {
        byBinding.get(reference.bindingId()).add(references.size());
      } else {
        unresolvedReferences.add(reference);
      }
      references.add(reference);
    }
    List<List<Reference>> referencesByBinding = new ArrayList<>(bindings.size());
    for (IntList indices : byBinding) {
      List<Reference> refs = new ArrayList<>(indices.size());
      for (int i = 0; i < indices.size(); i++) {
        refs.add(references.get(indices.getInt(i)));
      }
      referencesByBinding.add(Collections.unmodifiableList(refs));
    }

    Int2IntOpenHashMap bindingByOffset = new Int2IntOpenHashMap(bindings.size());
    bindingByOffset.defaultReturnValue(-1);
    for (Binding binding : bindings) {
      bindingByOffset.put(binding.declaration().textTrimmedRange().start(), binding.id());
    }
    log.debug(
        "Built semantic model: {} scopes, {} bindings, {} references ({} unresolved)",
        scopes.size(),
        bindings.size(),
        references.size(),
        unresolvedReferences.size());
    return new SemanticModel(
        root,
        scopes,
        bindings,
        references,
        referencesByBinding,
        unresolvedReferences,
        bindingByOffset,
        referenceByOffset,
        scopeByNode);
  }

  private static final class OpenScope {
    final int id;
    final ScopeKind kind;
    final Object2IntOpenHashMap<String> declared = new Object2IntOpenHashMap<>();
    final List<PendingReference> pending = new ArrayList<>();

    OpenScope(int id, ScopeKind kind) {
      this.id = id;
      this.kind = kind;
      declared.defaultReturnValue(-1);
    }
  }

  private static final class PendingReference {
    final SyntaxNode node;
    final boolean write;
    int bindingId = -1;

    PendingReference(SyntaxNode node, boolean write) {
      this.node = node;
      this.write = write;
    }
  }
}
