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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.sdl.tree.Node;
import com.google.sdl.tree.SyntaxToken;
import com.google.sdl.tree.TokenKind;
import com.google.sdl.tree.Trees;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/** Decodes the values of literal tokens. */
public final class Literals {

  private static final Splitter LINES = Splitter.onPattern("\r\n|\n|\r");
  private static final CharMatcher INDENT = CharMatcher.anyOf(" \t");

  /** The value of the first string literal under the given node, e.g. a description. */
  public static String stringValue(Node node) {
    for (SyntaxToken token : Trees.leaves(node)) {
      if (Recovery.isString(token.kind())) {
        return stringValue(token);
      }
    }
    throw new IllegalArgumentException("no string literal in " + node.kind());
  }

  /** The value of a string or block string literal. */
  public static String stringValue(SyntaxToken token) {
    String text = token.text();
    switch (token.kind()) {
      case STRING_VALUE:
        return unescape(text.substring(1, text.length() - 1));
      case BLOCK_STRING_VALUE:
        return blockStringValue(text.substring(3, text.length() - 3).replace("\\\"\"\"", "\"\"\""));
      default:
        throw new IllegalArgumentException(token.toString());
    }
  }

  public static BigInteger intValue(SyntaxToken token) {
    checkArgument(token.kind() == TokenKind.INT_VALUE, token);
    return new BigInteger(token.text());
  }

  public static double floatValue(SyntaxToken token) {
    checkArgument(token.kind() == TokenKind.FLOAT_VALUE, token);
    return Double.parseDouble(token.text());
  }

  public static boolean booleanValue(SyntaxToken token) {
    checkArgument(
        token.kind() == TokenKind.NAME
            && (token.text().equals(Keywords.TRUE) || token.text().equals(Keywords.FALSE)),
        token);
    return token.text().equals(Keywords.TRUE);
  }

  private static String unescape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      checkArgument(i + 1 < value.length(), "invalid escape in %s", value);
      char escaped = value.charAt(++i);
      switch (escaped) {
        case '"', '\\', '/' -> sb.append(escaped);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          checkArgument(i + 4 < value.length(), "invalid escape in %s", value);
          sb.append((char) Integer.parseInt(value.substring(i + 1, i + 5), 16));
          i += 4;
        }
        default -> throw new IllegalArgumentException("invalid escape in " + value);
      }
    }
    return sb.toString();
  }

  /**
   * Removes the indentation common to all lines but the first, and then any leading and trailing
   * blank lines.
   */
  static String blockStringValue(String raw) {
    List<String> lines = new ArrayList<>(LINES.splitToList(raw));
    int common = Integer.MAX_VALUE;
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i);
      int indent = leadingIndent(line);
      if (indent < line.length()) {
        common = Math.min(common, indent);
      }
    }
    if (common != Integer.MAX_VALUE) {
      for (int i = 1; i < lines.size(); i++) {
        String line = lines.get(i);
        lines.set(i, line.length() < common ? "" : line.substring(common));
      }
    }
    while (!lines.isEmpty() && isBlank(lines.get(0))) {
      lines.remove(0);
    }
    while (!lines.isEmpty() && isBlank(lines.get(lines.size() - 1))) {
      lines.remove(lines.size() - 1);
    }
    return Joiner.on('\n').join(ImmutableList.copyOf(lines));
  }

  private static int leadingIndent(String line) {
    int indent = INDENT.negate().indexIn(line);
    return indent == -1 ? line.length() : indent;
  }

  private static boolean isBlank(String line) {
    return INDENT.matchesAllOf(line);
  }

  private Literals() {}
}
