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
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.sdl.diag.SdlDiagnostic;
import com.google.sdl.diag.SdlDiagnostic.Severity;
import com.google.sdl.diag.SdlError.Category;
import com.google.sdl.diag.SdlError.ErrorKind;
import com.google.sdl.diag.SourceFile;
import com.google.sdl.diag.Span;
import com.google.sdl.options.Cancellation;
import com.google.sdl.options.ParserOptions;
import com.google.sdl.tree.Node;
import com.google.sdl.tree.NodeKind;
import com.google.sdl.tree.Trees;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserTest {

  @Test
  public void objectType() {
    ParseResult result = Parser.parse("type User { id: ID! name: String }");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (object_type_definition (name User) (fields_definition"
                + " (field_definition (name id) (type (non_null_type (named_type (name ID)))))"
                + " (field_definition (name name) (type (named_type (name String)))))))");
  }

  @Test
  public void scalarWithDirective() {
    ParseResult result = Parser.parse("scalar DateTime @specifiedBy(url: \"iso8601\")");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (scalar_type_definition (name DateTime) (directives (directive"
                + " (name specifiedBy) (arguments (argument (name url)"
                + " (value (string_value \"iso8601\"))))))))");
  }

  @Test
  public void directiveDefinition() {
    ParseResult result =
        Parser.parse("directive @cacheControl(maxAge: Int) repeatable on FIELD | OBJECT");

    assertThat(result.diagnostics()).isEmpty();
    Node definition = result.document().childNodes().get(0);
    assertThat(definition.toString())
        .isEqualTo(
            "(directive_definition (name cacheControl) (arguments_definition"
                + " (input_value_definition (name maxAge) (type (named_type (name Int)))))"
                + " (directive_locations (directive_location FIELD)"
                + " (directive_location OBJECT)))");
    assertThat(definition.tokens().stream().anyMatch(t -> t.text().equals("repeatable")))
        .isTrue();
  }

  @Test
  public void directiveDefinitionNotRepeatable() {
    Node definition = Parser.parseOrThrow("directive @d on FIELD").childNodes().get(0);

    assertThat(definition.tokens().stream().anyMatch(t -> t.text().equals("repeatable")))
        .isFalse();
  }

  @Test
  public void directiveLocationsLeadingPipe() {
    assertThat(Parser.parseOrThrow("directive @d on | FIELD | SCHEMA").toString())
        .isEqualTo(Parser.parseOrThrow("directive @d on FIELD | SCHEMA").toString());
  }

  @Test
  public void directiveLocations() {
    assertThat(DirectiveLocation.fromName("FIELD").get().isExecutable()).isTrue();
    assertThat(DirectiveLocation.fromName("OBJECT").get().isExecutable()).isFalse();
    assertThat(DirectiveLocation.fromName("field")).isEmpty();
    assertThat(DirectiveLocation.values()).hasLength(19);
  }

  @Test
  public void unknownDirectiveLocation() {
    ParseResult result = Parser.parse("directive @d on FIELD | FOO");

    assertThat(messages(result)).containsExactly("unknown directive location 'FOO'");
  }

  @Test
  public void blockStringDescription() {
    ParseResult result = Parser.parse("\"\"\"A user.\"\"\"\ntype A { f: Int }");

    assertThat(result.diagnostics()).isEmpty();
    Node type = result.document().childNodes().get(0);
    assertThat(type.kind()).isEqualTo(NodeKind.OBJECT_TYPE_DEFINITION);
    assertThat(Trees.nameOf(type)).hasValue("A");
    Node description = type.childOfKind(NodeKind.DESCRIPTION).get();
    assertThat(Literals.stringValue(description)).isEqualTo("A user.");
  }

  @Test
  public void fieldDescription() {
    ParseResult result = Parser.parse("type A { \"the id\" id: ID }");

    assertThat(result.document().toString())
        .isEqualTo(
            "(document (object_type_definition (name A) (fields_definition (field_definition"
                + " (description \"the id\") (name id) (type (named_type (name ID)))))))");
  }

  @Test
  public void scalarExtensionWithoutDirectives() {
    ParseResult result = Parser.parse("extend scalar Money");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo("(document (scalar_type_extension (name Money)))");
    assertThat(result.toleratedLooseness())
        .containsExactly(
            new ToleratedLooseness(
                ToleratedLooseness.Kind.SCALAR_EXTENSION_WITHOUT_DIRECTIVES,
                new Span(0, 19, 1, 0, 1, 19)));
  }

  @Test
  public void scalarExtensionWithDirectives() {
    ParseResult result = Parser.parse("extend scalar Money @currency");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.toleratedLooseness()).isEmpty();
  }

  @Test
  public void missingNameRecovers() {
    ParseResult result = Parser.parse("type {}\ntype B { x: Int }");

    assertThat(result.diagnostics()).hasSize(1);
    SdlDiagnostic diagnostic = result.diagnostics().get(0);
    assertThat(diagnostic.category()).isEqualTo(Category.SYNTACTIC);
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
    assertThat(diagnostic.span().start()).isEqualTo(5);
    assertThat(diagnostic.message()).isEqualTo("expected name, found '{'");
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (error type { }) (object_type_definition (name B) (fields_definition"
                + " (field_definition (name x) (type (named_type (name Int)))))))");
  }

  @Test
  public void doubleNonNull() {
    ParseResult result = Parser.parseType("Int!!");

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.errors().get(0).kind()).isEqualTo(ErrorKind.DOUBLE_NON_NULL);
    for (Node node : Trees.preorder(result.document())) {
      assertThat(node.kind()).isNotEqualTo(NodeKind.NON_NULL_TYPE);
    }
    assertThat(result.document().text()).isEqualTo("Int!!");
  }

  @Test
  public void doubleNonNullInField() {
    ParseResult result = Parser.parse("type A { f: Int!! g: Int }");

    assertThat(result.errors().stream().map(SdlDiagnostic::kind).collect(toImmutableList()))
        .containsExactly(ErrorKind.DOUBLE_NON_NULL);
    assertThat(result.document().text()).isEqualTo("type A { f: Int!! g: Int }");
  }

  @Test
  public void nestedTypes() {
    ParseResult result = Parser.parseType("[[Int!]!]");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (type (list_type (type (non_null_type (list_type (type (non_null_type"
                + " (named_type (name Int))))))))))");
  }

  @Test
  public void nonNullNeverWrapsNonNull() {
    Node document = Parser.parseOrThrow("type A { f: [[Int!]!]! g(a: [ID!]!): ID! }");

    for (Node node : Trees.preorder(document)) {
      if (node.kind() == NodeKind.NON_NULL_TYPE) {
        assertThat(node.childNodes()).hasSize(1);
        assertThat(node.childNodes().get(0).kind())
            .isAnyOf(NodeKind.NAMED_TYPE, NodeKind.LIST_TYPE);
      }
    }
  }

  @Test
  public void unionLeadingPipe() {
    ParseResult plain = Parser.parse("union R = Human | Droid");
    ParseResult leading = Parser.parse("union R = | Human | Droid");

    assertThat(plain.diagnostics()).isEmpty();
    assertThat(leading.diagnostics()).isEmpty();
    assertThat(plain.document().toString())
        .isEqualTo(
            "(document (union_type_definition (name R) (union_member_types"
                + " (named_type (name Human)) (named_type (name Droid)))))");
    assertThat(leading.document().toString()).isEqualTo(plain.document().toString());
  }

  @Test
  public void extensionBodyAttaches() {
    ParseResult result = Parser.parse("extend type User { age: Int }");

    assertThat(result.diagnostics()).isEmpty();
    Node document = result.document();
    assertThat(document.childNodes()).hasSize(1);
    Node extension = document.childNodes().get(0);
    assertThat(extension.kind()).isEqualTo(NodeKind.OBJECT_TYPE_EXTENSION);
    Node fields = extension.childOfKind(NodeKind.FIELDS_DEFINITION).get();
    assertThat(fields.childrenOfKind(NodeKind.FIELD_DEFINITION)).hasSize(1);
  }

  @Test
  public void extensionWithoutBody() {
    ParseResult result = Parser.parse("extend type User @key\nextend interface Node");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (object_type_extension (name User) (directives (directive (name key))))"
                + " (interface_type_extension (name Node)))");
  }

  @Test
  public void extensions() {
    ParseResult result =
        Parser.parse(
            """
            extend union U = | A | B
            extend enum E { C }
            extend input I @d { f: Int }
            extend interface J implements K { g: Int }
            """);

    assertThat(result.diagnostics()).isEmpty();
    assertThat(
            result.document().childNodes().stream().map(Node::kind).collect(toImmutableList()))
        .containsExactly(
            NodeKind.UNION_TYPE_EXTENSION,
            NodeKind.ENUM_TYPE_EXTENSION,
            NodeKind.INPUT_OBJECT_TYPE_EXTENSION,
            NodeKind.INTERFACE_TYPE_EXTENSION)
        .inOrder();
    for (Node extension : result.document().childNodes()) {
      assertThat(extension.kind().isTypeExtension()).isTrue();
    }
  }

  @Test
  public void emptyFieldsTolerated() {
    ParseResult result = Parser.parse("type Empty {}");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo("(document (object_type_definition (name Empty) (fields_definition)))");
    assertThat(result.toleratedLooseness())
        .containsExactly(
            new ToleratedLooseness(
                ToleratedLooseness.Kind.EMPTY_FIELDS_DEFINITION, new Span(11, 13, 1, 11, 1, 13)));
  }

  @Test
  public void strictReportsLooseness() {
    ParseResult result =
        Parser.parse(
            new SourceFile("strict.graphql", "type Empty {}\nextend scalar S"),
            ParserOptions.builder().setStrict(true).build());

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.diagnostics().stream().map(SdlDiagnostic::severity).distinct().toList())
        .containsExactly(Severity.WARNING);
    assertThat(result.diagnostics().stream().map(SdlDiagnostic::kind).collect(toImmutableList()))
        .containsExactly(
            ErrorKind.EMPTY_FIELDS_DEFINITION, ErrorKind.SCALAR_EXTENSION_WITHOUT_DIRECTIVES)
        .inOrder();
  }

  @Test
  public void emptyBlocksOtherThanFieldsAreErrors() {
    assertThat(kinds(Parser.parse("enum E {}"))).containsExactly(ErrorKind.EXPECTED_TOKEN);
    assertThat(kinds(Parser.parse("input I {}"))).containsExactly(ErrorKind.EXPECTED_TOKEN);
    assertThat(kinds(Parser.parse("type A { f(): Int }")))
        .containsExactly(ErrorKind.EXPECTED_TOKEN);
    assertThat(messages(Parser.parse("enum E {}")))
        .containsExactly("expected enum value, found '}'");
  }

  @Test
  public void directivesNeverEmpty() {
    Node document =
        Parser.parseOrThrow(
            """
            schema @a { query: Q }
            type T @b @c(x: 1) { f(a: Int @d): Int @e }
            enum E @f { V @g }
            """);

    int count = 0;
    for (Node node : Trees.preorder(document)) {
      if (node.kind() == NodeKind.DIRECTIVES) {
        assertThat(node.childrenOfKind(NodeKind.DIRECTIVE)).isNotEmpty();
        count++;
      }
    }
    assertThat(count).isEqualTo(6);
  }

  @Test
  public void reconstruction() {
    ImmutableList<String> inputs =
        ImmutableList.of(
            "",
            "\uFEFF# only a comment\n",
            "type User { id: ID!, name: String } # trailing\n",
            "\"\"\"\n  Doc\n\"\"\"\r\nscalar Date @a(b: [1, 2.0, \"s\", {c: d}])\r\n",
            "type {}\ntype B { x: Int }",
            "type A { f: Int!! g: ? }\n}}} extend foo",
            "union U = | A | B, directive @d(a: Int = 1) repeatable on FIELD",
            "\"unterminated\ntype A",
            "schema { query: Q mutation: M }\nextend schema @x");
    for (String input : inputs) {
      assertThat(Parser.parse(input).document().text()).isEqualTo(input);
    }
  }

  @Test
  public void schemaDefinition() {
    ParseResult result = Parser.parse("schema { query: Query mutation: Mutation }");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (schema_definition (root_operation_type_definition (operation_type query)"
                + " (named_type (name Query))) (root_operation_type_definition"
                + " (operation_type mutation) (named_type (name Mutation)))))");
  }

  @Test
  public void unknownOperationType() {
    assertThat(messages(Parser.parse("schema { foo: Q }")))
        .containsExactly("unknown operation type 'foo'");
  }

  @Test
  public void schemaExtension() {
    assertThat(Parser.parseOrThrow("extend schema @foo").toString())
        .isEqualTo("(document (schema_extension (directives (directive (name foo)))))");
    assertThat(Parser.parseOrThrow("extend schema { subscription: S }").toString())
        .isEqualTo(
            "(document (schema_extension (root_operation_type_definition"
                + " (operation_type subscription) (named_type (name S)))))");
    assertThat(kinds(Parser.parse("extend schema")))
        .containsExactly(ErrorKind.EMPTY_SCHEMA_EXTENSION);
  }

  @Test
  public void extensionDescription() {
    ParseResult result = Parser.parse("\"doc\" extend type A");

    assertThat(kinds(result)).containsExactly(ErrorKind.EXTENSION_DESCRIPTION);
    assertThat(result.document().toString())
        .isEqualTo("(document (error \"doc\") (object_type_extension (name A)))");
  }

  @Test
  public void badExtensionTarget() {
    assertThat(messages(Parser.parse("extend foo X"))).containsExactly("cannot extend 'foo'");
  }

  @Test
  public void implementsInterfaces() {
    String expected =
        "(implements_interfaces (named_type (name B)) (named_type (name C)))";
    for (String input :
        ImmutableList.of(
            "type A implements B & C { f: Int }",
            "type A implements & B & C { f: Int }",
            "interface A implements B & C")) {
      Node document = Parser.parseOrThrow(input);
      Node type = document.childNodes().get(0);
      assertThat(type.childOfKind(NodeKind.IMPLEMENTS_INTERFACES).get().toString())
          .isEqualTo(expected);
    }
  }

  @Test
  public void enumDefinition() {
    assertThat(Parser.parseOrThrow("enum Color { RED GREEN @deprecated }").toString())
        .isEqualTo(
            "(document (enum_type_definition (name Color) (enum_values_definition"
                + " (enum_value_definition (enum_value (name RED)))"
                + " (enum_value_definition (enum_value (name GREEN))"
                + " (directives (directive (name deprecated)))))))");
  }

  @Test
  public void inputObjectDefinition() {
    assertThat(Parser.parseOrThrow("input P { x: Int = 1 @d }").toString())
        .isEqualTo(
            "(document (input_object_type_definition (name P) (input_fields_definition"
                + " (input_value_definition (name x) (type (named_type (name Int)))"
                + " (default_value (value (int_value 1))) (directives (directive (name d)))))))");
  }

  @Test
  public void keywordsAsNames() {
    assertThat(Parser.parseOrThrow("type type { type: type input: input }").toString())
        .isEqualTo(
            "(document (object_type_definition (name type) (fields_definition"
                + " (field_definition (name type) (type (named_type (name type))))"
                + " (field_definition (name input) (type (named_type (name input)))))))");
  }

  @Test
  public void values() {
    ParseResult result =
        Parser.parseValue("{a: [1, 2.5, \"s\", true, null, RED, $v], b: {}}");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (value (object_value (object_field (name a) (value (list_value"
                + " (value (int_value 1)) (value (float_value 2.5)) (value (string_value \"s\"))"
                + " (value (boolean_value true)) (value (null_value null))"
                + " (value (enum_value (name RED))) (value (variable (name v))))))"
                + " (object_field (name b) (value (object_value))))))");
  }

  @Test
  public void trailingInput() {
    ParseResult result = Parser.parseValue("1 2");

    assertThat(messages(result)).containsExactly("unexpected input after value: number 2");
    assertThat(result.document().toString())
        .isEqualTo("(document (value (int_value 1)) (error 2))");
  }

  @Test
  public void emptyFragment() {
    ParseResult result = Parser.parseValue("");

    assertThat(messages(result)).containsExactly("expected value, found end of input");
    assertThat(result.document().toString()).isEqualTo("(document)");
  }

  @Test
  public void variableDefinitions() {
    ParseResult result = Parser.parseVariableDefinitions("($id: ID! = 1 @d, $n: [Int])");

    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.document().toString())
        .isEqualTo(
            "(document (variable_definitions (variable_definition (variable (name id))"
                + " (type (non_null_type (named_type (name ID)))) (default_value (value"
                + " (int_value 1))) (directives (directive (name d)))) (variable_definition"
                + " (variable (name n)) (type (list_type (type (named_type (name Int))))))))");
  }

  @Test
  public void typeCondition() {
    assertThat(Parser.parseTypeCondition("on User").document().toString())
        .isEqualTo("(document (type_condition (named_type (name User))))");
    assertThat(kinds(Parser.parseTypeCondition("User")))
        .containsExactly(ErrorKind.EXPECTED_KEYWORD);
  }

  @Test
  public void nestingLimit() {
    ParseResult result =
        Parser.parse(
            new SourceFile(null, "type A { f: [[[[Int]]]] }\ntype B { g: [[Int]] }"),
            ParserOptions.builder().setMaxNestingDepth(3).build());

    assertThat(messages(result)).containsExactly("nesting exceeds the maximum depth of 3");
    assertThat(result.document().childNodes().stream().map(Trees::nameOf).toList())
        .containsExactly(Optional.of("A"), Optional.of("B"))
        .inOrder();
  }

  @Test
  public void deepValueDoesNotOverflow() {
    String input = "[".repeat(10_000) + "]".repeat(10_000);
    ParseResult result = Parser.parseValue(input);

    assertThat(kinds(result)).containsExactly(ErrorKind.NESTING_TOO_DEEP);
    assertThat(result.document().text()).isEqualTo(input);
  }

  @Test
  public void spans() {
    Node document = Parser.parseOrThrow("# c\ntype A {\n  id: ID\n}\n");
    Node type = document.childNodes().get(0);
    Node field =
        Trees.findDescendant(document, n -> n.kind() == NodeKind.FIELD_DEFINITION).get();

    assertThat(type.span()).isEqualTo(new Span(4, 23, 2, 0, 4, 1));
    assertThat(type.text()).isEqualTo("type A {\n  id: ID\n}");
    assertThat(field.span()).isEqualTo(new Span(15, 21, 3, 2, 3, 8));
    assertThat(document.span().start()).isEqualTo(0);
    assertThat(document.span().end()).isEqualTo(24);
  }

  @Test
  public void cancellation() {
    AtomicInteger polls = new AtomicInteger();
    ParserOptions options =
        ParserOptions.builder().setCancellation(() -> polls.incrementAndGet() > 1).build();
    String input = "scalar A\nscalar B\nscalar C";
    ParseResult result = Parser.parse(new SourceFile(null, input), options);

    assertThat(result.document().toString())
        .isEqualTo("(document (scalar_type_definition (name A)))");
    assertThat(result.document().text()).isEqualTo(input);
    assertThat(result.diagnostics()).hasSize(1);
    SdlDiagnostic diagnostic = result.diagnostics().get(0);
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.CANCELLED);
    assertThat(diagnostic.category()).isEqualTo(Category.CANCELLATION);
    assertThat(diagnostic.span().start()).isEqualTo(9);
    assertThat(diagnostic.span().length()).isEqualTo(0);
  }

  @Test
  public void cancelledBeforeStart() {
    ParserOptions options =
        ParserOptions.builder().setCancellation(Cancellation.afterTimeout(Duration.ZERO)).build();
    ParseResult result = Parser.parse(new SourceFile(null, "scalar A"), options);

    assertThat(kinds(result)).containsExactly(ErrorKind.CANCELLED);
    assertThat(result.document().childNodes()).isEmpty();
  }

  @Test(timeout = 20_000)
  public void manyNonNullFields() {
    int n = 50_000;
    StringBuilder sb = new StringBuilder("type A {\n");
    for (int i = 0; i < n; i++) {
      sb.append("  f").append(i).append(": [Int!]!\n");
    }
    sb.append("}\n");
    ParseResult result = Parser.parse(sb.toString());

    assertThat(result.diagnostics()).isEmpty();
    Node fields =
        result.document().childNodes().get(0).childOfKind(NodeKind.FIELDS_DEFINITION).get();
    ImmutableList<Node> definitions = fields.childrenOfKind(NodeKind.FIELD_DEFINITION);
    assertThat(definitions).hasSize(n);
    assertThat(definitions.get(n - 1).toString())
        .isEqualTo(
            "(field_definition (name f49999) (type (non_null_type (list_type (type"
                + " (non_null_type (named_type (name Int))))))))");
  }

  private static ImmutableList<ErrorKind> kinds(ParseResult result) {
    return result.diagnostics().stream().map(SdlDiagnostic::kind).collect(toImmutableList());
  }

  private static ImmutableList<String> messages(ParseResult result) {
    return result.diagnostics().stream().map(SdlDiagnostic::message).collect(toImmutableList());
  }
}
