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

package com.google.sdl.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import com.google.sdl.tree.SyntaxToken;
import com.google.sdl.tree.TokenKind;

/**
 * A cursor over the significant tokens of a token list. Extras and lexical error tokens are
 * stepped over, but keep their place in the underlying list so the tree builder can attach them.
 */
final class TokenCursor {

  private final ImmutableList<SyntaxToken> tokens;

  /** The indices of the significant tokens in {@link #tokens}; the last one is EOF. */
  private final ImmutableIntArray significant;

  private int pos = 0;
  private int lastConsumed = -1;

  TokenCursor(ImmutableList<SyntaxToken> tokens) {
    checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == TokenKind.EOF,
        "token list must end with EOF");
    this.tokens = tokens;
    ImmutableIntArray.Builder builder = ImmutableIntArray.builder();
    for (int i = 0; i < tokens.size(); i++) {
      if (!Extras.isSkipped(tokens.get(i).kind())) {
        builder.add(i);
      }
    }
    this.significant = builder.build();
  }

  ImmutableList<SyntaxToken> tokens() {
    return tokens;
  }

  SyntaxToken current() {
    return tokens.get(index());
  }

  TokenKind kind() {
    return current().kind();
  }

  String text() {
    return current().text();
  }

  /** The index of the current token in the underlying token list. */
  int index() {
    return significant.get(pos);
  }

  boolean at(TokenKind kind) {
    return kind() == kind;
  }

  /** Returns true if the current token is a name spelled {@code keyword}. */
  boolean atName(String keyword) {
    return at(TokenKind.NAME) && text().equals(keyword);
  }

  boolean atEof() {
    return at(TokenKind.EOF);
  }

  /** The significant token {@code n} positions ahead; EOF once past the end. */
  SyntaxToken peek(int n) {
    checkArgument(n >= 0);
    return tokens.get(significant.get(Math.min(pos + n, significant.length() - 1)));
  }

  /** Consumes the current token. Advancing at EOF is a no-op. */
  void advance() {
    if (atEof()) {
      return;
    }
    lastConsumed = index();
    pos++;
    verify(pos < significant.length());
  }

  /** The cursor state, for a later {@link #reset}. */
  int mark() {
    return pos;
  }

  /** Moves the cursor back to a state returned by {@link #mark}. */
  void reset(int mark) {
    checkArgument(mark >= 0 && mark <= pos, "cannot reset forward: %s > %s", mark, pos);
    pos = mark;
    lastConsumed = mark == 0 ? -1 : significant.get(mark - 1);
  }

  /** The index of the most recently consumed token, or -1. */
  int lastConsumed() {
    return lastConsumed;
  }

  /** The source offset just past the most recently consumed token. */
  int endOfLastConsumed() {
    return lastConsumed < 0 ? 0 : tokens.get(lastConsumed).span().end();
  }
}
