package io.verbatim.syntax.api;

/** Preorder traversal step: entering a node before its children, leaving it after them. */
public sealed interface WalkEvent permits WalkEvent.Enter, WalkEvent.Leave {

  SyntaxNode node();

  record Enter(SyntaxNode node) implements WalkEvent {}

  record Leave(SyntaxNode node) implements WalkEvent {}
}
