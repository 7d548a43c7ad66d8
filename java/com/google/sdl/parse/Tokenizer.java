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

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.LineMap;
import com.google.sdl.diag.SdlError;
import com.google.sdl.diag.SdlLog;
import com.google.sdl.diag.SourceFile;
import com.google.sdl.tree.SyntaxToken;
import com.google.sdl.tree.TokenKind;

/**
 * Splits a source file into tokens.
 *
 * <p>The result covers the input without gaps: trivia is kept, input that cannot be lexed becomes
 * an {@link TokenKind#ERROR} token, and the last token is a zero-width {@link TokenKind#EOF}.
 */
public final class Tokenizer {

  /** Tokenizes the given source, reporting lexical errors to the log. */
  public static ImmutableList<SyntaxToken> tokenize(SourceFile source, SdlLog log) {
    StreamLexer lexer = new StreamLexer(source);
    LineMap lineMap = source.lineMap();
    String input = source.source();
    ImmutableList.Builder<SyntaxToken> tokens = ImmutableList.builder();
    TokenKind kind;
    do {
      try {
        kind = lexer.next();
      } catch (SdlError e) {
        log.report(e);
        lexer.recover(e.kind());
        kind = TokenKind.ERROR;
      }
      int start = lexer.position();
      int end = lexer.cursor();
      if (kind == TokenKind.ERROR && start == end) {
        // an error at the end of input, the EOF token follows
        continue;
      }
      tokens.add(new SyntaxToken(kind, input.substring(start, end), lineMap.span(start, end)));
    } while (kind != TokenKind.EOF);
    return tokens.build();
  }

  /** Tokenizes the given source, discarding diagnostics. */
  public static ImmutableList<SyntaxToken> tokenize(String source) {
    SourceFile file = new SourceFile(null, source);
    return tokenize(file, new SdlLog(file));
  }

  private Tokenizer() {}
}
