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

import org.jspecify.annotations.Nullable;

/**
 * GraphQL lexical tokens.
 *
 * <p>There are no keyword tokens: {@code type}, {@code extend}, {@code on} and friends are all
 * {@link #NAME}s, and the parser decides from the grammar position whether a name must have a
 * particular spelling.
 */
public enum TokenKind {
  NAME,
  INT_VALUE,
  FLOAT_VALUE,
  STRING_VALUE,
  BLOCK_STRING_VALUE,
  LBRACE("{"),
  RBRACE("}"),
  LPAREN("("),
  RPAREN(")"),
  LBRACK("["),
  RBRACK("]"),
  COLON(":"),
  EQ("="),
  AT("@"),
  BANG("!"),
  DOLLAR("$"),
  AMP("&"),
  PIPE("|"),
  /** Spaces, tabs, line terminators and the byte order mark. */
  WHITESPACE,
  COMMA(","),
  /** A {@code #} comment, up to but excluding the line terminator. */
  COMMENT,
  /** Input that could not be tokenized; the tokenizer reports a diagnostic for it. */
  ERROR,
  /** The zero-width end of input. */
  EOF;

  private final @Nullable String value;

  TokenKind() {
    this(null);
  }

  TokenKind(@Nullable String value) {
    this.value = value;
  }

  /** The fixed spelling of a punctuator, or {@code null} for other tokens. */
  public @Nullable String punctuator() {
    return value;
  }

  @Override
  public String toString() {
    if (value != null) {
      return String.format("%s(%s)", name(), value);
    }
    return name();
  }
}
