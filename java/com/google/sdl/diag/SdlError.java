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
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.SdlDiagnostic.Severity;

/** A parse error. */
public class SdlError extends Error {

  /** The broad class of a diagnostic. */
  public enum Category {
    /** A malformed token. */
    LEXICAL,
    /** A token stream that does not match the grammar. */
    SYNTACTIC,
    /** A parse that the caller aborted. */
    CANCELLATION
  }

  /** A diagnostic kind. */
  public enum ErrorKind {
    UNEXPECTED_INPUT(Category.LEXICAL, "unexpected input: %s"),
    UNTERMINATED_STRING(Category.LEXICAL, "unterminated string literal"),
    UNTERMINATED_BLOCK_STRING(Category.LEXICAL, "unterminated block string literal"),
    INVALID_ESCAPE(Category.LEXICAL, "invalid escape sequence: %s"),
    INVALID_NUMBER(Category.LEXICAL, "invalid number literal: %s"),
    UNEXPECTED_TOKEN(Category.SYNTACTIC, "unexpected token: %s"),
    EXPECTED_TOKEN(Category.SYNTACTIC, "expected %s, found %s"),
    EXPECTED_KEYWORD(Category.SYNTACTIC, "expected '%s', found %s"),
    EXPECTED_DEFINITION(Category.SYNTACTIC, "expected a definition, found %s"),
    EXPECTED_EXTENSION_TARGET(Category.SYNTACTIC, "cannot extend %s"),
    EXTENSION_DESCRIPTION(Category.SYNTACTIC, "extensions cannot have a description"),
    EMPTY_SCHEMA_EXTENSION(Category.SYNTACTIC, "schema extension must add directives or types"),
    UNKNOWN_OPERATION_TYPE(Category.SYNTACTIC, "unknown operation type '%s'"),
    UNKNOWN_DIRECTIVE_LOCATION(Category.SYNTACTIC, "unknown directive location '%s'"),
    DOUBLE_NON_NULL(Category.SYNTACTIC, "a non-null type cannot be marked non-null again"),
    NESTING_TOO_DEEP(Category.SYNTACTIC, "nesting exceeds the maximum depth of %s"),
    TRAILING_INPUT(Category.SYNTACTIC, "unexpected input after %s: %s"),
    EMPTY_FIELDS_DEFINITION(Category.SYNTACTIC, "fields definition declares no fields"),
    SCALAR_EXTENSION_WITHOUT_DIRECTIVES(
        Category.SYNTACTIC, "scalar extension does not add any directives"),
    CANCELLED(Category.CANCELLATION, "parse cancelled");

    private final Category category;
    private final String message;

    ErrorKind(Category category, String message) {
      this.category = category;
      this.message = message;
    }

    /** The category that diagnostics of this kind belong to. */
    public Category category() {
      return category;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param start the start position of the offending input
   * @param end the end position of the offending input
   * @param kind the error kind
   * @param args format args
   */
  public static SdlError format(
      SourceFile source, int start, int end, ErrorKind kind, Object... args) {
    return new SdlError(
        ImmutableList.of(SdlDiagnostic.format(source, start, end, Severity.ERROR, kind, args)));
  }

  private final ImmutableList<SdlDiagnostic> diagnostics;

  public SdlError(ImmutableList<SdlDiagnostic> diagnostics) {
    super(
        Joiner.on(System.lineSeparator())
            .join(diagnostics.stream().map(SdlDiagnostic::diagnostic).collect(toImmutableList())));
    checkArgument(!diagnostics.isEmpty());
    this.diagnostics = diagnostics;
  }

  /** The kind of the first diagnostic. */
  public ErrorKind kind() {
    return diagnostics.get(0).kind();
  }

  /** The diagnostics. */
  public ImmutableList<SdlDiagnostic> diagnostics() {
    return diagnostics;
  }
}
