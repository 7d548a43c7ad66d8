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

package com.google.sdl.options;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;

/**
 * Parser options.
 *
 * @param cancellation Polled between top-level definitions to abort the parse.
 * @param strict Report the tolerated grammar loosenesses (an empty fields block, a scalar
 *     extension without directives) as warnings.
 * @param maxNestingDepth The deepest list type, list value or object value nesting accepted
 *     before reporting a syntax error.
 */
public record ParserOptions(Cancellation cancellation, boolean strict, int maxNestingDepth) {

  public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

  public ParserOptions {
    requireNonNull(cancellation, "cancellation");
    checkArgument(maxNestingDepth > 0, "maxNestingDepth must be positive: %s", maxNestingDepth);
  }

  /** The default options: lenient, never cancelled. */
  public static ParserOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoBuilder_ParserOptions_Builder()
        .setCancellation(Cancellation.never())
        .setStrict(false)
        .setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH);
  }

  /** A {@link Builder} for {@link ParserOptions}. */
  @AutoBuilder
  public abstract static class Builder {

    public abstract Builder setCancellation(Cancellation cancellation);

    public abstract Builder setStrict(boolean strict);

    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    public abstract ParserOptions build();
  }
}
