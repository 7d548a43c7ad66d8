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
import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.sdl.parse.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreesTest {

  private static final String INPUT = "type User { id: ID! }";

  private final Node root = Parser.parseOrThrow(INPUT);

  @Test
  public void preorder() {
    assertThat(Trees.preorder(root).stream().map(n -> n.kind().ruleName()))
        .containsExactly(
            "document",
            "object_type_definition",
            "name",
            "fields_definition",
            "field_definition",
            "name",
            "type",
            "non_null_type",
            "named_type",
            "name")
        .inOrder();
  }

  @Test
  public void leaves() {
    assertThat(Joiner.on("").join(Trees.leaves(root).stream().map(SyntaxToken::text).iterator()))
        .isEqualTo(INPUT);
    assertThat(Trees.leaves(root).get(Trees.leaves(root).size() - 1).kind())
        .isEqualTo(TokenKind.EOF);
  }

  @Test
  public void nameOf() {
    Node field = Trees.findDescendant(root, n -> n.kind() == NodeKind.FIELD_DEFINITION).get();

    assertThat(Trees.nameOf(field)).hasValue("id");
    assertThat(Trees.nameOf(root.childNodes().get(0))).hasValue("User");
    assertThat(Trees.nameOf(root)).isEmpty();
  }

  @Test
  public void findDescendant() {
    assertThat(Trees.findDescendant(root, n -> n.kind() == NodeKind.DIRECTIVES)).isEmpty();
    assertThat(Trees.findDescendant(root, n -> n.kind() == NodeKind.DOCUMENT)).hasValue(root);
  }

  @Test
  public void namedNodeAt() {
    Node node = Trees.namedNodeAt(root, INPUT.indexOf("ID")).get();

    assertThat(node.kind()).isEqualTo(NodeKind.NAME);
    assertThat(node.text()).isEqualTo("ID");
    assertThat(Trees.namedNodeAt(root, INPUT.indexOf("{")).get().kind())
        .isEqualTo(NodeKind.FIELDS_DEFINITION);
    assertThat(Trees.namedNodeAt(root, 100)).isEmpty();
  }

  @Test
  public void children() {
    Node type = root.childNodes().get(0);

    assertThat(type.tokens().stream().map(SyntaxToken::kind).collect(toImmutableList()))
        .containsExactly(TokenKind.NAME, TokenKind.WHITESPACE, TokenKind.WHITESPACE)
        .inOrder();
    assertThat(type.childrenOfKind(NodeKind.NAME)).hasSize(1);
    assertThat(type.tokenOfKind(TokenKind.NAME).get().text()).isEqualTo("type");
    assertThat(type.tokenOfKind(TokenKind.COMMENT)).isEmpty();
    assertThat(type.span().toString()).isEqualTo("1:0-1:21");
  }

  @Test
  public void itemsAndSpans() {
    Node document = Parser.parseOrThrow("scalar A\nextend type B @d\ndirective @c on FIELD");

    for (Node item : document.childNodes()) {
      assertThat(item.kind().isItem()).isTrue();
      assertThat(document.span().encloses(item.span())).isTrue();
      for (Node child : item.childNodes()) {
        assertThat(child.kind().isItem()).isFalse();
        assertThat(item.span().encloses(child.span())).isTrue();
      }
    }
    assertThat(document.childNodes().get(0).span().encloses(document.span())).isFalse();
  }

  @Test
  public void print() {
    assertThat(SexpPrinter.print(root.childNodes().get(0).childNodes().get(0)))
        .isEqualTo("(name User)");
    assertThat(SexpPrinter.print(Trees.leaves(root).get(0))).isEqualTo("type");
  }
}
