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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.SdlDiagnostic;
import com.google.sdl.diag.SdlDiagnostic.Severity;
import com.google.sdl.diag.SourceFile;
import com.google.sdl.tree.Node;

/**
 * The outcome of a parse: always a document, possibly partial, and the diagnostics in source
 * order.
 *
 * @param source The parsed source.
 * @param document The root node. Its leaves spell out the source exactly.
 * @param diagnostics Lexical, syntactic and cancellation diagnostics, ordered by position.
 * @param toleratedLooseness Accepted constructs that a validator may want to reject.
 */
public record ParseResult(
    SourceFile source,
    Node document,
    ImmutableList<SdlDiagnostic> diagnostics,
    ImmutableList<ToleratedLooseness> toleratedLooseness) {

  public ParseResult {
    requireNonNull(source);
    requireNonNull(document);
    requireNonNull(diagnostics);
    requireNonNull(toleratedLooseness);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
  }

  public ImmutableList<SdlDiagnostic> errors() {
    return diagnostics.stream()
        .filter(d -> d.severity() == Severity.ERROR)
        .collect(toImmutableList());
  }
}
