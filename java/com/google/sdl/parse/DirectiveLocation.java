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

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * The places a directive can be declared to apply to. Executable and type system locations may be
 * mixed in one declaration; whether a directive is used in a legal place is not checked here.
 */
public enum DirectiveLocation {
  QUERY(true),
  MUTATION(true),
  SUBSCRIPTION(true),
  FIELD(true),
  FRAGMENT_DEFINITION(true),
  FRAGMENT_SPREAD(true),
  INLINE_FRAGMENT(true),
  VARIABLE_DEFINITION(true),
  SCHEMA(false),
  SCALAR(false),
  OBJECT(false),
  FIELD_DEFINITION(false),
  ARGUMENT_DEFINITION(false),
  INTERFACE(false),
  UNION(false),
  ENUM(false),
  ENUM_VALUE(false),
  INPUT_OBJECT(false),
  INPUT_FIELD_DEFINITION(false);

  private static final ImmutableMap<String, DirectiveLocation> BY_NAME =
      Arrays.stream(values()).collect(toImmutableMap(DirectiveLocation::name, Function.identity()));

  private final boolean executable;

  DirectiveLocation(boolean executable) {
    this.executable = executable;
  }

  /** Returns true for locations in operations, false for locations in type system documents. */
  public boolean isExecutable() {
    return executable;
  }

  /** Looks up a location by its exact (upper case) spelling. */
  public static Optional<DirectiveLocation> fromName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
