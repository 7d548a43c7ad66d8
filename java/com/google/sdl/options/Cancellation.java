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

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import java.time.Duration;

/**
 * A caller-controlled abort signal. The parser polls it between top-level definitions, and a
 * cancelled parse returns the definitions completed so far.
 */
@FunctionalInterface
public interface Cancellation {

  boolean isCancelled();

  /** A cancellation that never fires. */
  static Cancellation never() {
    return () -> false;
  }

  /** A cancellation that fires once {@code timeout} has elapsed since this method was called. */
  static Cancellation afterTimeout(Duration timeout) {
    return afterTimeout(timeout, Ticker.systemTicker());
  }

  /** As {@link #afterTimeout(Duration)}, measuring time with the given ticker. */
  static Cancellation afterTimeout(Duration timeout, Ticker ticker) {
    checkArgument(!timeout.isNegative(), "negative timeout: %s", timeout);
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    return () -> stopwatch.elapsed().compareTo(timeout) >= 0;
  }
}
