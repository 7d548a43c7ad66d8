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

package com.google.sdl.tree;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/** Syntax tree node kinds, one per grammar rule. */
public enum NodeKind {
  DOCUMENT,
  SCHEMA_DEFINITION,
  SCHEMA_EXTENSION,
  ROOT_OPERATION_TYPE_DEFINITION,
  OPERATION_TYPE,
  SCALAR_TYPE_DEFINITION,
  SCALAR_TYPE_EXTENSION,
  OBJECT_TYPE_DEFINITION,
  OBJECT_TYPE_EXTENSION,
  INTERFACE_TYPE_DEFINITION,
  INTERFACE_TYPE_EXTENSION,
  UNION_TYPE_DEFINITION,
  UNION_TYPE_EXTENSION,
  ENUM_TYPE_DEFINITION,
  ENUM_TYPE_EXTENSION,
  INPUT_OBJECT_TYPE_DEFINITION,
  INPUT_OBJECT_TYPE_EXTENSION,
  IMPLEMENTS_INTERFACES,
  FIELDS_DEFINITION,
  FIELD_DEFINITION,
  ARGUMENTS_DEFINITION,
  INPUT_VALUE_DEFINITION,
  INPUT_FIELDS_DEFINITION,
  ENUM_VALUES_DEFINITION,
  ENUM_VALUE_DEFINITION,
  UNION_MEMBER_TYPES,
  DIRECTIVE_DEFINITION,
  DIRECTIVE_LOCATIONS,
  DIRECTIVE_LOCATION,
  DIRECTIVES,
  DIRECTIVE,
  ARGUMENTS,
  ARGUMENT,
  DEFAULT_VALUE,
  VARIABLE_DEFINITIONS,
  VARIABLE_DEFINITION,
  TYPE_CONDITION,
  VALUE,
  VARIABLE,
  STRING_VALUE,
  INT_VALUE,
  FLOAT_VALUE,
  BOOLEAN_VALUE,
  NULL_VALUE,
  ENUM_VALUE,
  LIST_VALUE,
  OBJECT_VALUE,
  OBJECT_FIELD,
  TYPE,
  NAMED_TYPE,
  LIST_TYPE,
  NON_NULL_TYPE,
  NAME,
  DESCRIPTION,
  /** Input skipped while recovering from a syntax error. */
  ERROR;

  private static final ImmutableSet<NodeKind> TYPE_DEFINITIONS =
      Sets.immutableEnumSet(
          SCALAR_TYPE_DEFINITION,
          OBJECT_TYPE_DEFINITION,
          INTERFACE_TYPE_DEFINITION,
          UNION_TYPE_DEFINITION,
          ENUM_TYPE_DEFINITION,
          INPUT_OBJECT_TYPE_DEFINITION);

  private static final ImmutableSet<NodeKind> TYPE_EXTENSIONS =
      Sets.immutableEnumSet(
          SCALAR_TYPE_EXTENSION,
          OBJECT_TYPE_EXTENSION,
          INTERFACE_TYPE_EXTENSION,
          UNION_TYPE_EXTENSION,
          ENUM_TYPE_EXTENSION,
          INPUT_OBJECT_TYPE_EXTENSION);

  private final String ruleName = Ascii.toLowerCase(name());

  /** The grammar rule name, e.g. {@code object_type_definition}. */
  public String ruleName() {
    return ruleName;
  }

  public boolean isTypeDefinition() {
    return TYPE_DEFINITIONS.contains(this);
  }

  public boolean isTypeExtension() {
    return TYPE_EXTENSIONS.contains(this);
  }

  /** Returns true for the kinds that may appear as top-level items of a document. */
  public boolean isItem() {
    return isTypeDefinition()
        || isTypeExtension()
        || this == SCHEMA_DEFINITION
        || this == SCHEMA_EXTENSION
        || this == DIRECTIVE_DEFINITION;
  }

  @Override
  public String toString() {
    return ruleName;
  }
}
