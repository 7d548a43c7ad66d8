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

package com.google.sdl.diag;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Utf8;
import com.google.common.primitives.ImmutableIntArray;

/**
 * Converts source positions to line and column information, for diagnostic formatting and for
 * the spans attached to syntax tree nodes.
 *
 * <p>Positions range over {@code [0, source.length()]}: the end of input is a valid position, so
 * that the zero-width end-of-file token and the end of a span can be mapped.
 */
public class LineMap {

  private final String source;

  /** The start offset of every line, in increasing order. */
  private final ImmutableIntArray lineStarts;

  private LineMap(String source, ImmutableIntArray lineStarts) {
    this.source = source;
    this.lineStarts = lineStarts;
  }

  public static LineMap create(String source) {
    ImmutableIntArray.Builder lineStarts = ImmutableIntArray.builder();
    lineStarts.add(0);
    for (int idx = 0; idx < source.length(); idx++) {
      char ch = source.charAt(idx);
      switch (ch) {
        case '\r':
          if (idx + 1 < source.length() && source.charAt(idx + 1) == '\n') {
            idx++;
          }
          // falls through
        case '\n':
          lineStarts.add(idx + 1);
          break;
        default:
          break;
      }
    }
    return new LineMap(source, lineStarts.build());
  }

  /** The zero-indexed column number of the given source position. */
  public int column(int position) {
    return position - lineStarts.get(lineIndex(position));
  }

  /** The one-indexed line number of the given source position. */
  public int lineNumber(int position) {
    return lineIndex(position) + 1;
  }

  /** The one-indexed line of the given source position, including its line terminator. */
  public String line(int position) {
    int index = lineIndex(position);
    int start = lineStarts.get(index);
    int end = index + 1 < lineStarts.length() ? lineStarts.get(index + 1) : source.length();
    return source.substring(start, end);
  }

  /** The number of UTF-8 bytes that precede the given source position. */
  public int utf8Offset(int position) {
    checkPosition(position);
    return Utf8.encodedLength(source.subSequence(0, position));
  }

  /** Creates a {@link Span} for the given start and end positions. */
  public Span span(int start, int end) {
    return new Span(start, end, lineNumber(start), column(start), lineNumber(end), column(end));
  }

  private int lineIndex(int position) {
    checkPosition(position);
    int lo = 0;
    int hi = lineStarts.length() - 1;
    // find the last line that starts at or before the position
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (lineStarts.get(mid) <= position) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }

  private void checkPosition(int position) {
    checkArgument(0 <= position && position <= source.length(), "%s", position);
  }
}
