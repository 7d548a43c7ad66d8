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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.sdl.tree.TokenKind;

/** The token kinds that may appear between any two significant tokens. */
public final class Extras {

  public static final ImmutableSet<TokenKind> KINDS =
      Sets.immutableEnumSet(TokenKind.WHITESPACE, TokenKind.COMMA, TokenKind.COMMENT);

  /** Returns true for whitespace, commas and comments. */
  public static boolean isExtra(TokenKind kind) {
    return KINDS.contains(kind);
  }

  /**
   * Returns true for the tokens the grammar never sees: the extras, and the error tokens left
   * behind by lexical recovery, whose diagnostics have already been reported.
   */
  static boolean isSkipped(TokenKind kind) {
    return kind == TokenKind.ERROR || isExtra(kind);
  }

  private Extras() {}
}
