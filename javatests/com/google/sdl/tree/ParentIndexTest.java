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

import static com.google.common.truth.Truth.assertThat;

import com.google.sdl.parse.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParentIndexTest {

  private final Node root = Parser.parseOrThrow("type User { id: ID! }");
  private final ParentIndex index = ParentIndex.create(root);

  @Test
  public void parents() {
    Node name = Trees.namedNodeAt(root, 16).get();

    assertThat(index.parents(name).stream().map(Node::kind))
        .containsExactly(
            NodeKind.NAMED_TYPE,
            NodeKind.NON_NULL_TYPE,
            NodeKind.TYPE,
            NodeKind.FIELD_DEFINITION,
            NodeKind.FIELDS_DEFINITION,
            NodeKind.OBJECT_TYPE_DEFINITION,
            NodeKind.DOCUMENT)
        .inOrder();
    assertThat(index.parent(name).get().kind()).isEqualTo(NodeKind.NAMED_TYPE);
  }

  @Test
  public void parentOfKind() {
    Node name = Trees.namedNodeAt(root, 16).get();

    Node field = index.parentOfKind(name, NodeKind.FIELD_DEFINITION).get();
    assertThat(Trees.nameOf(field)).hasValue("id");
    assertThat(index.hasParentOfKind(name, NodeKind.DIRECTIVES)).isFalse();
    assertThat(index.hasParentOfKind(name, NodeKind.OBJECT_TYPE_DEFINITION)).isTrue();
  }

  @Test
  public void root() {
    assertThat(index.root()).isSameInstanceAs(root);
    assertThat(index.parent(root)).isEmpty();
    assertThat(index.parents(root)).isEmpty();
  }
}
