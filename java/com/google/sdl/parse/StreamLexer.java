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

import static java.lang.Math.min;

import com.google.sdl.diag.SdlError;
import com.google.sdl.diag.SdlError.ErrorKind;
import com.google.sdl.diag.SourceFile;
import com.google.sdl.tree.TokenKind;

/**
 * A GraphQL lexer that scans one token at a time, trivia included.
 *
 * <p>Lexical errors are thrown as {@link SdlError}s, leaving the lexer at the point of failure.
 * After an error, {@link #recover} skips the offending input so that scanning can resume.
 */
public class StreamLexer {

  private static final int EOF = -1;

  private final SourceFile source;
  private final String input;

  /** The index of the current input character. */
  private int idx = -1;

  /** The current input character, or {@link #EOF}. */
  private int ch;

  /** The start position of the current token. */
  private int position;

  public StreamLexer(SourceFile source) {
    this.source = source;
    this.input = source.source();
    eat();
  }

  /** Consumes an input character. */
  private void eat() {
    if (idx < input.length()) {
      idx++;
    }
    ch = idx < input.length() ? input.charAt(idx) : EOF;
  }

  /** The start position of the most recently scanned token. */
  public int position() {
    return position;
  }

  /** The position of the next unscanned character, which is the end of the most recent token. */
  public int cursor() {
    return idx;
  }

  public SourceFile source() {
    return source;
  }

  public TokenKind next() {
    position = idx;
    switch (ch) {
      case EOF -> {
        return TokenKind.EOF;
      }
      case '\uFEFF', ' ', '\t', '\n', '\r' -> {
        do {
          eat();
        } while (isWhitespace(ch));
        return TokenKind.WHITESPACE;
      }
      case ',' -> {
        eat();
        return TokenKind.COMMA;
      }
      case '#' -> {
        do {
          eat();
        } while (ch != '\n' && ch != '\r' && ch != EOF);
        return TokenKind.COMMENT;
      }
      case '{' -> {
        eat();
        return TokenKind.LBRACE;
      }
      case '}' -> {
        eat();
        return TokenKind.RBRACE;
      }
      case '(' -> {
        eat();
        return TokenKind.LPAREN;
      }
      case ')' -> {
        eat();
        return TokenKind.RPAREN;
      }
      case '[' -> {
        eat();
        return TokenKind.LBRACK;
      }
      case ']' -> {
        eat();
        return TokenKind.RBRACK;
      }
      case ':' -> {
        eat();
        return TokenKind.COLON;
      }
      case '=' -> {
        eat();
        return TokenKind.EQ;
      }
      case '@' -> {
        eat();
        return TokenKind.AT;
      }
      case '!' -> {
        eat();
        return TokenKind.BANG;
      }
      case '$' -> {
        eat();
        return TokenKind.DOLLAR;
      }
      case '&' -> {
        eat();
        return TokenKind.AMP;
      }
      case '|' -> {
        eat();
        return TokenKind.PIPE;
      }
      case '"' -> {
        return string();
      }
      case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> {
        return number();
      }
      default -> {
        if (isNameStart(ch)) {
          return name();
        }
        throw inputError();
      }
    }
  }

  private TokenKind name() {
    do {
      eat();
    } while (isNamePart(ch));
    return TokenKind.NAME;
  }

  private TokenKind string() {
    eat();
    if (ch == '"') {
      eat();
      if (ch != '"') {
        // the empty string, `""`
        return TokenKind.STRING_VALUE;
      }
      eat();
      return blockString();
    }
    while (true) {
      switch (ch) {
        case '"' -> {
          eat();
          return TokenKind.STRING_VALUE;
        }
        case '\\' -> escape();
        case '\n', '\r', EOF -> throw error(ErrorKind.UNTERMINATED_STRING);
        default -> eat();
      }
    }
  }

  private void escape() {
    int start = idx;
    eat();
    switch (ch) {
      case '"', '\\', '/', 'b', 'f', 'n', 'r', 't' -> eat();
      case 'u' -> {
        eat();
        for (int i = 0; i < 4; i++) {
          if (!isHexDigit(ch)) {
            throw error(ErrorKind.INVALID_ESCAPE, input.substring(start, idx));
          }
          eat();
        }
      }
      case '\n', '\r', EOF -> throw error(ErrorKind.UNTERMINATED_STRING);
      default -> throw error(ErrorKind.INVALID_ESCAPE, input.substring(start, idx + 1));
    }
  }

  private TokenKind blockString() {
    while (true) {
      switch (ch) {
        case '"' -> {
          eat();
          if (ch == '"') {
            eat();
            if (ch == '"') {
              eat();
              return TokenKind.BLOCK_STRING_VALUE;
            }
          }
        }
        case '\\' -> {
          eat();
          // an escaped delimiter, `\"""`, does not close the string
          if (input.startsWith("\"\"\"", idx)) {
            eat();
            eat();
            eat();
          }
        }
        case EOF -> throw error(ErrorKind.UNTERMINATED_BLOCK_STRING);
        default -> eat();
      }
    }
  }

  private TokenKind number() {
    if (ch == '-') {
      eat();
    }
    switch (ch) {
      case '0' -> {
        eat();
        if (isDigit(ch)) {
          throw numberError();
        }
      }
      case '1', '2', '3', '4', '5', '6', '7', '8', '9' -> readDigits();
      default -> throw numberError();
    }
    boolean isFloat = false;
    if (ch == '.') {
      eat();
      if (!isDigit(ch)) {
        throw numberError();
      }
      readDigits();
      isFloat = true;
    }
    if (ch == 'e' || ch == 'E') {
      eat();
      if (ch == '+' || ch == '-') {
        eat();
      }
      if (!isDigit(ch)) {
        throw numberError();
      }
      readDigits();
      isFloat = true;
    }
    if (ch == '.' || isNameStart(ch)) {
      throw numberError();
    }
    return isFloat ? TokenKind.FLOAT_VALUE : TokenKind.INT_VALUE;
  }

  private void readDigits() {
    do {
      eat();
    } while (isDigit(ch));
  }

  /**
   * Skips the input that caused the most recent lexical error. Afterwards the text between
   * {@link #position()} and {@link #cursor()} is the unlexable input, and it is never empty unless
   * the error occurred at the end of the input.
   */
  public void recover(ErrorKind kind) {
    switch (kind) {
      case INVALID_ESCAPE -> skipRestOfString();
      case INVALID_NUMBER -> {
        while (ch == '.' || isNamePart(ch)) {
          eat();
        }
      }
      case UNTERMINATED_STRING, UNTERMINATED_BLOCK_STRING -> {
        // already at the line terminator or the end of input
      }
      default -> skipCodePoint();
    }
    if (idx == position && ch != EOF) {
      skipCodePoint();
    }
  }

  private void skipRestOfString() {
    while (true) {
      switch (ch) {
        case '"' -> {
          eat();
          return;
        }
        case '\n', '\r', EOF -> {
          return;
        }
        case '\\' -> {
          eat();
          if (ch == '"' || ch == '\\') {
            eat();
          }
        }
        default -> eat();
      }
    }
  }

  private void skipCodePoint() {
    if (ch == EOF) {
      return;
    }
    boolean surrogatePair =
        Character.isHighSurrogate((char) ch)
            && idx + 1 < input.length()
            && Character.isLowSurrogate(input.charAt(idx + 1));
    eat();
    if (surrogatePair) {
      eat();
    }
  }

  private static boolean isWhitespace(int ch) {
    return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\uFEFF';
  }

  private static boolean isNameStart(int ch) {
    return ('a' <= ch && ch <= 'z') || ('A' <= ch && ch <= 'Z') || ch == '_';
  }

  private static boolean isNamePart(int ch) {
    return isNameStart(ch) || isDigit(ch);
  }

  private static boolean isDigit(int ch) {
    return '0' <= ch && ch <= '9';
  }

  private static boolean isHexDigit(int ch) {
    return isDigit(ch) || ('a' <= ch && ch <= 'f') || ('A' <= ch && ch <= 'F');
  }

  private SdlError numberError() {
    return error(ErrorKind.INVALID_NUMBER, input.substring(position, min(idx + 1, input.length())));
  }

  private SdlError inputError() {
    int codePoint = input.codePointAt(idx);
    return error(
        ErrorKind.UNEXPECTED_INPUT,
        Character.isBmpCodePoint(codePoint)
            ? Character.toString((char) codePoint)
            : String.format("U+%X", codePoint));
  }

  private SdlError error(ErrorKind kind, Object... args) {
    return SdlError.format(source, idx, min(idx + 1, input.length()), kind, args);
  }
}
