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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Predicate;

/** Static utilities for navigating syntax trees. */
public final class Trees {

  /** All nodes of the tree rooted at {@code root}, in preorder, starting with {@code root}. */
  public static ImmutableList<Node> preorder(Node root) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      result.add(node);
      ImmutableList<Node> children = node.childNodes();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result.build();
  }

  /** The tokens of the tree rooted at {@code root}, in source order. */
  public static ImmutableList<SyntaxToken> leaves(Node root) {
    ImmutableList.Builder<SyntaxToken> result = ImmutableList.builder();
    Deque<SyntaxElement> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      SyntaxElement element = stack.pop();
      if (element instanceof SyntaxToken) {
        result.add((SyntaxToken) element);
        continue;
      }
      ImmutableList<SyntaxElement> children = ((Node) element).children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result.build();
  }

  /** The first node in preorder, {@code root} included, that satisfies the predicate. */
  public static Optional<Node> findDescendant(Node root, Predicate<Node> predicate) {
    return preorder(root).stream().filter(predicate).findFirst();
  }

  /**
   * The name of a node: the text of its {@code name} child, or for nodes that wrap a name
   * ({@code named_type}, {@code enum_value}, {@code variable}) the text of the wrapped name.
   */
  public static Optional<String> nameOf(Node node) {
    Optional<Node> name = node.childOfKind(NodeKind.NAME);
    if (name.isEmpty()) {
      return Optional.empty();
    }
    return name.get().tokenOfKind(TokenKind.NAME).map(SyntaxToken::text);
  }

  /** The innermost node of the tree rooted at {@code root} whose span contains {@code offset}. */
  public static Optional<Node> namedNodeAt(Node root, int offset) {
    if (!root.span().contains(offset)) {
      return Optional.empty();
    }
    Node current = root;
    OUTER:
    while (true) {
      for (Node child : current.childNodes()) {
        if (child.span().contains(offset)) {
          current = child;
          continue OUTER;
        }
      }
      return Optional.of(current);
    }
  }

  private Trees() {}
}
