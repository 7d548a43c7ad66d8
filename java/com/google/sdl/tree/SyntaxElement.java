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

import com.google.sdl.diag.Span;

/** A concrete syntax tree element: either a {@link Node} or a {@link SyntaxToken}. */
public interface SyntaxElement {

  /** The source range covered by this element. */
  Span span();

  /** The exact source text covered by this element, including any interior trivia. */
  String text();

  <I, O> O accept(Visitor<I, O> visitor, I input);

  /** A visitor for {@link SyntaxElement}s. */
  interface Visitor<I, O> {

    O visitNode(Node node, I input);

    O visitToken(SyntaxToken token, I input);
  }
}
