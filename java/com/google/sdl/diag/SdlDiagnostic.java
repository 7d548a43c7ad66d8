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

import static com.google.common.base.MoreObjects.firstNonNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.SdlError.Category;
import com.google.sdl.diag.SdlError.ErrorKind;
import java.util.Objects;

/** A parse diagnostic. */
public class SdlDiagnostic {

  /** How serious a diagnostic is. */
  public enum Severity {
    ERROR,
    WARNING
  }

  private final ErrorKind kind;
  private final Severity severity;
  private final Span span;
  private final String message;
  private final String diagnostic;
  private final ImmutableList<Object> args;

  private SdlDiagnostic(
      ErrorKind kind,
      Severity severity,
      Span span,
      String message,
      String diagnostic,
      ImmutableList<Object> args) {
    this.kind = requireNonNull(kind);
    this.severity = requireNonNull(severity);
    this.span = requireNonNull(span);
    this.message = requireNonNull(message);
    this.diagnostic = requireNonNull(diagnostic);
    this.args = requireNonNull(args);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic category. */
  public Category category() {
    return kind.category();
  }

  /** The diagnostic severity. */
  public Severity severity() {
    return severity;
  }

  /** The source range the diagnostic applies to. */
  public Span span() {
    return span;
  }

  /** The diagnostic message, without position information. */
  public String message() {
    return message;
  }

  /** The formatted diagnostic, with the path, line number, source line and a caret. */
  public String diagnostic() {
    return diagnostic;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param start the start position of the offending input
   * @param end the end position of the offending input
   * @param severity the diagnostic severity
   * @param kind the error kind
   * @param args format args
   */
  public static SdlDiagnostic format(
      SourceFile source, int start, int end, Severity severity, ErrorKind kind, Object... args) {
    String path = firstNonNull(source.path(), "<>");
    LineMap lineMap = source.lineMap();
    Span span = lineMap.span(start, end);
    String message = kind.format(args).trim();

    StringBuilder sb = new StringBuilder(path).append(":");
    sb.append(span.startLine()).append(": ");
    sb.append(Ascii.toLowerCase(severity.name())).append(": ");
    sb.append(message).append(System.lineSeparator());
    sb.append(CharMatcher.breakingWhitespace().trimTrailingFrom(lineMap.line(start)))
        .append(System.lineSeparator());
    sb.append(Strings.repeat(" ", span.startColumn())).append('^');
    String diagnostic = sb.toString();
    return new SdlDiagnostic(kind, severity, span, message, diagnostic, ImmutableList.copyOf(args));
  }

  @Override
  public int hashCode() {
    return Objects.hash(diagnostic, kind, severity, span);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SdlDiagnostic)) {
      return false;
    }
    SdlDiagnostic that = (SdlDiagnostic) obj;
    return diagnostic.equals(that.diagnostic)
        && kind.equals(that.kind)
        && severity.equals(that.severity)
        && span.equals(that.span);
  }

  @Override
  public String toString() {
    return diagnostic;
  }
}
