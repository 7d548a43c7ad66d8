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

import com.google.sdl.tree.SyntaxToken;
import com.google.sdl.tree.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resynchronization after a syntax error. */
final class Recovery {

  private static final Logger logger = LoggerFactory.getLogger(Recovery.class);

  private final TokenCursor cursor;

  Recovery(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /**
   * Returns true if a top-level definition plausibly starts at the current token: a definition
   * keyword, optionally preceded by a description, followed by what that keyword requires next.
   * A name alone is not enough, since {@code type} is also a valid field name.
   */
  boolean definitionStartsHere() {
    int offset = 0;
    boolean described = false;
    if (isString(cursor.peek(0).kind())) {
      described = true;
      offset = 1;
    }
    SyntaxToken keyword = cursor.peek(offset);
    if (keyword.kind() != TokenKind.NAME) {
      return false;
    }
    SyntaxToken next = cursor.peek(offset + 1);
    switch (keyword.text()) {
      case Keywords.SCHEMA:
        return next.kind() == TokenKind.AT || next.kind() == TokenKind.LBRACE;
      case Keywords.DIRECTIVE:
        return next.kind() == TokenKind.AT;
      case Keywords.EXTEND:
        return !described
            && next.kind() == TokenKind.NAME
            && Keywords.EXTENSION_TARGETS.contains(next.text());
      case Keywords.SCALAR:
      case Keywords.TYPE:
      case Keywords.INTERFACE:
      case Keywords.UNION:
      case Keywords.ENUM:
      case Keywords.INPUT:
        return next.kind() == TokenKind.NAME;
      default:
        return false;
    }
  }

  /**
   * Skips the remainder of a malformed item: up to the next definition at brace depth zero, past
   * the brace that closes a block opened while skipping, or to the end of input. Something is
   * always skipped unless the item already consumed a token or the input is exhausted.
   */
  void skipToItemBoundary(int itemStart) {
    int from = cursor.index();
    int depth = 0;
    while (!cursor.atEof()) {
      if (depth == 0 && cursor.lastConsumed() >= itemStart && definitionStartsHere()) {
        break;
      }
      TokenKind kind = cursor.kind();
      cursor.advance();
      if (kind == TokenKind.LBRACE) {
        depth++;
      } else if (kind == TokenKind.RBRACE && depth > 0) {
        depth--;
        if (depth == 0) {
          break;
        }
      }
    }
    logResync(from);
  }

  /**
   * Skips the remainder of a malformed block member, stopping before the token that closes the
   * block. The start of the next definition also stops the skip, which handles a block whose
   * closing brace is missing.
   */
  void skipToBlockEnd(TokenKind close, int memberStart) {
    int from = cursor.index();
    int depth = 0;
    while (!cursor.atEof()) {
      TokenKind kind = cursor.kind();
      if (depth == 0 && kind == close) {
        break;
      }
      if (depth == 0 && cursor.lastConsumed() >= memberStart && definitionStartsHere()) {
        break;
      }
      cursor.advance();
      if (kind == TokenKind.LBRACE) {
        depth++;
      } else if (kind == TokenKind.RBRACE && depth > 0) {
        depth--;
      }
    }
    logResync(from);
  }

  private void logResync(int from) {
    if (logger.isDebugEnabled()) {
      SyntaxToken at = cursor.current();
      logger.debug(
          "skipped {} tokens, resuming at {}:{} ({})",
          cursor.index() - from,
          at.span().startLine(),
          at.span().startColumn(),
          at);
    }
  }

  static boolean isString(TokenKind kind) {
    return kind == TokenKind.STRING_VALUE || kind == TokenKind.BLOCK_STRING_VALUE;
  }
}
