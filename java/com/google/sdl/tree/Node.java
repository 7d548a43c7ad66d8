/*
 * Copyright 2026 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.sdl.tree;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.Span;
import java.util.Optional;

/**
 * An interior node of the concrete syntax tree.
 *
 * <p>A node's children are its sub-nodes and tokens in source order, including any whitespace,
 * comma and comment tokens that appear between its first and last significant token. Nodes are
 * immutable and have no parent pointers; see {@link ParentIndex}.
 */
public final class Node implements SyntaxElement {

  private final NodeKind kind;
  private final ImmutableList<SyntaxElement> children;
  private final Span span;

  public Node(NodeKind kind, ImmutableList<SyntaxElement> children, Span span) {
    this.kind = requireNonNull(kind);
    this.children = requireNonNull(children);
    this.span = requireNonNull(span);
  }

  public NodeKind kind() {
    return kind;
  }

  /** All children, nodes and tokens, in source order. */
  public ImmutableList<SyntaxElement> children() {
    return children;
  }

  @Override
  public Span span() {
    return span;
  }

  /** The child nodes, in source order. */
  public ImmutableList<Node> childNodes() {
    return children.stream()
        .filter(Node.class::isInstance)
        .map(Node.class::cast)
        .collect(toImmutableList());
  }

  /** The child tokens, in source order. */
  public ImmutableList<SyntaxToken> tokens() {
    return children.stream()
        .filter(SyntaxToken.class::isInstance)
        .map(SyntaxToken.class::cast)
        .collect(toImmutableList());
  }

  /** The first child node of the given kind. */
  public Optional<Node> childOfKind(NodeKind kind) {
    for (SyntaxElement child : children) {
      if (child instanceof Node && ((Node) child).kind() == kind) {
        return Optional.of((Node) child);
      }
    }
    return Optional.empty();
  }

  /** The child nodes of the given kind, in source order. */
  public ImmutableList<Node> childrenOfKind(NodeKind kind) {
    return childNodes().stream().filter(n -> n.kind() == kind).collect(toImmutableList());
  }

  /** The first child token of the given kind. */
  public Optional<SyntaxToken> tokenOfKind(TokenKind kind) {
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxToken && ((SyntaxToken) child).kind() == kind) {
        return Optional.of((SyntaxToken) child);
      }
    }
    return Optional.empty();
  }

  @Override
  public String text() {
    StringBuilder sb = new StringBuilder(span.length());
    for (SyntaxToken leaf : Trees.leaves(this)) {
      sb.append(leaf.text());
    }
    return sb.toString();
  }

  @Override
  public <I, O> O accept(Visitor<I, O> visitor, I input) {
    return visitor.visitNode(this, input);
  }

  @Override
  public String toString() {
    return SexpPrinter.print(this);
  }
}
