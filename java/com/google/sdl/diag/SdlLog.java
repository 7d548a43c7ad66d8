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

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.SdlDiagnostic.Severity;
import com.google.sdl.diag.SdlError.ErrorKind;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A log that collects the diagnostics of a single source file. */
public class SdlLog {

  private static final Logger logger = LoggerFactory.getLogger(SdlLog.class);

  private static final Comparator<SdlDiagnostic> BY_POSITION =
      Comparator.comparingInt((SdlDiagnostic d) -> d.span().start())
          .thenComparingInt(d -> d.span().end());

  private final SourceFile source;
  private final Set<SdlDiagnostic> diagnostics = new LinkedHashSet<>();

  public SdlLog(SourceFile source) {
    this.source = source;
  }

  public void error(int start, int end, ErrorKind kind, Object... args) {
    add(SdlDiagnostic.format(source, start, end, Severity.ERROR, kind, args));
  }

  public void warning(int start, int end, ErrorKind kind, Object... args) {
    add(SdlDiagnostic.format(source, start, end, Severity.WARNING, kind, args));
  }

  /** Records the diagnostics carried by an error that was thrown and caught during parsing. */
  public void report(SdlError error) {
    error.diagnostics().forEach(this::add);
  }

  private void add(SdlDiagnostic diagnostic) {
    if (diagnostics.add(diagnostic)) {
      logger.debug("{}", diagnostic.diagnostic());
    }
  }

  /** Returns true if any error (as opposed to a warning) was reported. */
  public boolean anyErrors() {
    return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
  }

  /** The diagnostics reported so far, ordered by source position. */
  public ImmutableList<SdlDiagnostic> diagnostics() {
    return ImmutableList.sortedCopyOf(BY_POSITION, diagnostics);
  }

  public void maybeThrow() {
    if (anyErrors()) {
      throw new SdlError(diagnostics());
    }
  }
}
