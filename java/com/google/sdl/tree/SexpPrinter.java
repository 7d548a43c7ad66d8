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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Prints a syntax tree as an S-expression, e.g. {@code (document (scalar_type_definition (name
 * Date)))}.
 *
 * <p>Trivia is omitted. Names and literals are printed only for nodes without child nodes, which
 * is where they carry information that the node kinds do not. Punctuators are printed only inside
 * error nodes, e.g. {@code (error a : [ Int)}, to show exactly what recovery skipped.
 */
public class SexpPrinter implements SyntaxElement.Visitor<Void, Void> {

  private static final ImmutableSet<TokenKind> PRINTED =
      Sets.immutableEnumSet(
          TokenKind.NAME,
          TokenKind.INT_VALUE,
          TokenKind.FLOAT_VALUE,
          TokenKind.STRING_VALUE,
          TokenKind.BLOCK_STRING_VALUE,
          TokenKind.ERROR);

  public static String print(SyntaxElement element) {
    SexpPrinter printer = new SexpPrinter();
    element.accept(printer, null);
    return printer.sb.toString();
  }

  private final StringBuilder sb = new StringBuilder();

  @Override
  public Void visitNode(Node node, Void input) {
    sb.append('(').append(node.kind().ruleName());
    boolean leaf = node.childNodes().isEmpty();
    boolean error = node.kind() == NodeKind.ERROR;
    for (SyntaxElement child : node.children()) {
      if (child instanceof Node) {
        sb.append(' ');
        child.accept(this, null);
      } else if (leaf && printed(((SyntaxToken) child).kind(), error)) {
        sb.append(' ');
        child.accept(this, null);
      }
    }
    sb.append(')');
    return null;
  }

  private static boolean printed(TokenKind kind, boolean error) {
    if (PRINTED.contains(kind)) {
      return true;
    }
    // commas are insignificant, like whitespace
    return error && kind.punctuator() != null && kind != TokenKind.COMMA;
  }

  @Override
  public Void visitToken(SyntaxToken token, Void input) {
    sb.append(token.text());
    return null;
  }
}
