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

import com.google.sdl.tree.NodeKind;
import com.google.sdl.tree.TokenKind;

/**
 * Decides between the alternatives that the grammar leaves open at a few choice points.
 *
 * <ul>
 *   <li>A definition or extension header may be followed by an optional body. Once the optional
 *       middle parts have been parsed, a body-starting token always commits to the alternative
 *       with a body, so a body never dangles as a separate item.
 *   <li>The {@code &} and {@code |} separated lists accept an optional leading separator, and
 *       continue for as long as a separator follows.
 * </ul>
 */
final class AmbiguityResolver {

  private final TokenCursor cursor;

  AmbiguityResolver(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /** The token that starts the body of a definition or extension of the given kind, if any. */
  static TokenKind bodyStart(NodeKind kind) {
    return switch (kind) {
      case UNION_TYPE_DEFINITION, UNION_TYPE_EXTENSION -> TokenKind.EQ;
      case SCALAR_TYPE_DEFINITION, SCALAR_TYPE_EXTENSION, DIRECTIVE_DEFINITION -> TokenKind.EOF;
      default -> TokenKind.LBRACE;
    };
  }

  /** Returns true if the current token starts the body of a definition of the given kind. */
  boolean bodyFollows(NodeKind kind) {
    TokenKind start = bodyStart(kind);
    return start != TokenKind.EOF && cursor.at(start);
  }

  /** Consumes an optional leading separator of a separated list. */
  void skipLeadingSeparator(TokenKind separator) {
    if (cursor.at(separator)) {
      cursor.advance();
    }
  }

  /**
   * Consumes the separator between two list elements, and returns false if the list has ended.
   */
  boolean anotherElementFollows(TokenKind separator) {
    if (!cursor.at(separator)) {
      return false;
    }
    cursor.advance();
    return true;
  }
}
