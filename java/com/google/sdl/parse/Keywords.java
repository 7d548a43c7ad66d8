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

import com.google.common.collect.ImmutableSet;

/**
 * Keyword spellings. GraphQL has no reserved words: these are ordinary names that the parser
 * compares against only at the positions where the grammar expects them.
 */
final class Keywords {

  static final String SCHEMA = "schema";
  static final String SCALAR = "scalar";
  static final String TYPE = "type";
  static final String INTERFACE = "interface";
  static final String UNION = "union";
  static final String ENUM = "enum";
  static final String INPUT = "input";
  static final String DIRECTIVE = "directive";
  static final String EXTEND = "extend";
  static final String IMPLEMENTS = "implements";
  static final String REPEATABLE = "repeatable";
  static final String ON = "on";
  static final String TRUE = "true";
  static final String FALSE = "false";
  static final String NULL = "null";

  /** The keywords that may follow {@code extend}. */
  static final ImmutableSet<String> EXTENSION_TARGETS =
      ImmutableSet.of(SCHEMA, SCALAR, TYPE, INTERFACE, UNION, ENUM, INPUT);

  static final ImmutableSet<String> OPERATION_TYPES =
      ImmutableSet.of("query", "mutation", "subscription");

  private Keywords() {}
}
