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

/**
 * A half-open range of source positions.
 *
 * @param start the offset of the first character, in UTF-16 code units
 * @param end the offset one past the last character
 * @param startLine the one-indexed line of {@code start}
 * @param startColumn the zero-indexed column of {@code start}
 * @param endLine the one-indexed line of {@code end}
 * @param endColumn the zero-indexed column of {@code end}
 */
public record Span(
    int start, int end, int startLine, int startColumn, int endLine, int endColumn) {

  public Span {
    checkArgument(0 <= start && start <= end, "invalid span [%s, %s)", start, end);
  }

  /** The number of characters covered. */
  public int length() {
    return end - start;
  }

  /** Returns true if the given offset is inside this span. */
  public boolean contains(int offset) {
    return start <= offset && offset < end;
  }

  /** Returns true if the given span is nested inside this span. */
  public boolean encloses(Span other) {
    return start <= other.start && other.end <= end;
  }

  @Override
  public String toString() {
    return String.format("%d:%d-%d:%d", startLine, startColumn, endLine, endColumn);
  }
}
