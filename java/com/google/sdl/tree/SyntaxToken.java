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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.sdl.diag.Span;

/** A leaf of the syntax tree: a significant token, a trivia item, or unlexable input. */
public final class SyntaxToken implements SyntaxElement {

  private final TokenKind kind;
  private final String text;
  private final Span span;

  public SyntaxToken(TokenKind kind, String text, Span span) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.span = requireNonNull(span);
    checkArgument(text.length() == span.length(), "%s does not match %s", text, span);
  }

  public TokenKind kind() {
    return kind;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public Span span() {
    return span;
  }

  @Override
  public <I, O> O accept(Visitor<I, O> visitor, I input) {
    return visitor.visitToken(this, input);
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", kind.name(), text);
  }
}
