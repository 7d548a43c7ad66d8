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

import static java.util.Objects.requireNonNull;

import com.google.sdl.diag.SdlError.ErrorKind;
import com.google.sdl.diag.Span;

/**
 * A construct the grammar accepts although GraphQL forbids it, recorded so that a later
 * validation pass (or the strict parser profile) can report it.
 */
public record ToleratedLooseness(Kind kind, Span span) {

  public ToleratedLooseness {
    requireNonNull(kind);
    requireNonNull(span);
  }

  /** The tolerated constructs. */
  public enum Kind {
    /**
     * A fields block with no fields, {@code type Empty {}}. Parsing it as one empty block avoids
     * a cascade of errors at the closing brace.
     */
    EMPTY_FIELDS_DEFINITION(ErrorKind.EMPTY_FIELDS_DEFINITION),
    /** {@code extend scalar Money}, which adds nothing. */
    SCALAR_EXTENSION_WITHOUT_DIRECTIVES(ErrorKind.SCALAR_EXTENSION_WITHOUT_DIRECTIVES);

    private final ErrorKind errorKind;

    Kind(ErrorKind errorKind) {
      this.errorKind = errorKind;
    }

    /** The diagnostic reported for this construct by the strict profile. */
    public ErrorKind errorKind() {
      return errorKind;
    }
  }
}
