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
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parent lookup for a syntax tree. Nodes do not point to their parents, so consumers that need to
 * walk upwards build an index once per tree.
 */
public final class ParentIndex {

  private final Node root;
  private final Map<Node, Node> parents = new IdentityHashMap<>();

  private ParentIndex(Node root) {
    this.root = root;
  }

  public static ParentIndex create(Node root) {
    ParentIndex index = new ParentIndex(root);
    for (Node node : Trees.preorder(root)) {
      for (Node child : node.childNodes()) {
        index.parents.put(child, node);
      }
    }
    return index;
  }

  /** The root the index was built for. */
  public Node root() {
    return root;
  }

  /** The parent of the given node, or empty for the root. */
  public Optional<Node> parent(Node node) {
    return Optional.ofNullable(parents.get(node));
  }

  /** The ancestors of the given node, innermost first. */
  public ImmutableList<Node> parents(Node node) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node parent = parents.get(node); parent != null; parent = parents.get(parent)) {
      result.add(parent);
    }
    return result.build();
  }

  /** The innermost ancestor of the given kind. */
  public Optional<Node> parentOfKind(Node node, NodeKind kind) {
    return parents(node).stream().filter(p -> p.kind() == kind).findFirst();
  }

  public boolean hasParentOfKind(Node node, NodeKind kind) {
    return parentOfKind(node, kind).isPresent();
  }
}
