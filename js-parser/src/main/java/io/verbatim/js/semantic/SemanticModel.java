package io.verbatim.js.semantic;

import io.verbatim.js.ast.JsIdentifierBinding;
import io.verbatim.js.ast.JsReferenceIdentifier;
import io.verbatim.syntax.api.SyntaxNode;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Scopes, bindings and references of one JavaScript tree.
 *
 * <p>Built once by {@link #build(SyntaxNode)} and immutable afterwards. Scopes, bindings and
 * references are addressed by integer ids into the model; nodes of another tree, including an
 * edited copy of this one, are never found.
 */
public final class SemanticModel {
  private final SyntaxNode root;
  private final List<Scope> scopes;
  private final List<Binding> bindings;
  private final List<Reference> references;
  // per binding id, its references in source order
  private final List<List<Reference>> referencesByBinding;
  private final List<Reference> unresolved;
  private final Int2IntOpenHashMap bindingByOffset;
  private final Int2IntOpenHashMap referenceByOffset;
  private final Object2IntOpenHashMap<SyntaxNode> scopeByNode;

  SemanticModel(
      SyntaxNode root,
      List<Scope> scopes,
      List<Binding> bindings,
      List<Reference> references,
      List<List<Reference>> referencesByBinding,
      List<Reference> unresolved,
      Int2IntOpenHashMap bindingByOffset,
      Int2IntOpenHashMap referenceByOffset,
      Object2IntOpenHashMap<SyntaxNode> scopeByNode) {
    this.root = root;
    this.scopes = List.copyOf(scopes);
    this.bindings = List.copyOf(bindings);
    this.references = List.copyOf(references);
    this.referencesByBinding = List.copyOf(referencesByBinding);
    this.unresolved = List.copyOf(unresolved);
    this.bindingByOffset = bindingByOffset;
    this.referenceByOffset = referenceByOffset;
    this.scopeByNode = scopeByNode;
  }

  /** Builds the model of the tree containing {@code node}. */
  public static SemanticModel build(SyntaxNode node) {
    return new SemanticModelBuilder(node.root()).build();
  }

  public SyntaxNode root() {
    return root;
  }

  public List<Scope> scopes() {
    return scopes;
  }

  public Scope scope(int id) {
    return scopes.get(id);
  }

  /** The module scope. */
  public Scope globalScope() {
    return scopes.get(0);
  }

  public List<Binding> bindings() {
    return bindings;
  }

  public Binding binding(int id) {
    return bindings.get(id);
  }

  /** All references of the tree in source order. */
  public List<Reference> references() {
    return references;
  }

  /** References that no declaration of the tree resolves, in source order. */
  public List<Reference> unresolvedReferences() {
    return unresolved;
  }

  public Optional<Binding> bindingOf(JsIdentifierBinding declaration) {
    return bindingOf(declaration.syntax());
  }

  /** Binding introduced by a {@code JS_IDENTIFIER_BINDING} node of this tree. */
  public Optional<Binding> bindingOf(SyntaxNode declaration) {
    if (!contains(declaration)) {
      return Optional.empty();
    }
    int id = bindingByOffset.get(declaration.textTrimmedRange().start());
    if (id < 0 || !bindings.get(id).declaration().equals(declaration)) {
      return Optional.empty();
    }
    return Optional.of(bindings.get(id));
  }

  public Optional<Reference> referenceOf(JsReferenceIdentifier identifier) {
    return referenceOf(identifier.syntax());
  }

  /** Reference made by a {@code JS_REFERENCE_IDENTIFIER} node of this tree. */
  public Optional<Reference> referenceOf(SyntaxNode identifier) {
    if (!contains(identifier)) {
      return Optional.empty();
    }
    int index = referenceByOffset.get(identifier.textTrimmedRange().start());
    if (index < 0 || !references.get(index).node().equals(identifier)) {
      return Optional.empty();
    }
    return Optional.of(references.get(index));
  }

  /** The binding {@code reference} resolves to, empty for an unresolved reference. */
  public Optional<Binding> declarationOf(Reference reference) {
    if (!reference.isResolved()) {
      return Optional.empty();
    }
    return Optional.of(bindings.get(reference.bindingId()));
  }

  /** All references to {@code binding} in source order. The same list on every call. */
  public List<Reference> allReferences(Binding binding) {
    return referencesByBinding.get(binding.id());
  }

  public List<Reference> readReferences(Binding binding) {
    return allReferences(binding).stream().filter(Reference::isRead).toList();
  }

  public List<Reference> writeReferences(Binding binding) {
    return allReferences(binding).stream().filter(Reference::write).toList();
  }

  /** The innermost scope containing {@code node}. */
  public Optional<Scope> scopeOf(SyntaxNode node) {
    if (!contains(node)) {
      return Optional.empty();
    }
    for (SyntaxNode n = node; n != null; n = n.parent().orElse(null)) {
      int id = scopeByNode.getInt(n);
      if (id >= 0) {
        return Optional.of(scopes.get(id));
      }
    }
    return Optional.empty();
  }

  private boolean contains(SyntaxNode node) {
    return node.root().equals(root);
  }

  @Override
  public String toString() {
    return "SemanticModel{"
        + scopes.size()
        + " scopes, "
        + bindings.size()
        + " bindings, "
        + references.size()
        + " references}";
  }
}
