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

import static com.google.common.base.MoreObjects.firstNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.sdl.diag.SdlError;
import com.google.sdl.diag.SdlError.ErrorKind;
import com.google.sdl.diag.SdlLog;
import com.google.sdl.diag.SourceFile;
import com.google.sdl.diag.Span;
import com.google.sdl.options.ParserOptions;
import com.google.sdl.parse.EventSink.Marker;
import com.google.sdl.tree.Node;
import com.google.sdl.tree.NodeKind;
import com.google.sdl.tree.SyntaxToken;
import com.google.sdl.tree.TokenKind;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A recursive descent parser for GraphQL type system documents.
 *
 * <p>The parser never throws for malformed input: syntax errors are reported as diagnostics, and
 * the input skipped while recovering is kept in the tree as {@link NodeKind#ERROR} nodes.
 */
public class Parser {

  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  /** Parses a document with the default options. */
  public static ParseResult parse(String source) {
    return parse(new SourceFile(null, source), ParserOptions.defaults());
  }

  public static ParseResult parse(SourceFile source, ParserOptions options) {
    Parser parser = new Parser(source, options);
    parser.document();
    return parser.result();
  }

  /** Parses a document, and throws an {@link SdlError} carrying every error if it is invalid. */
  public static Node parseOrThrow(String source) {
    ParseResult result = parse(source);
    if (result.hasErrors()) {
      throw new SdlError(result.errors());
    }
    return result.document();
  }

  /** Parses a single value, e.g. a default value or a directive argument. */
  public static ParseResult parseValue(String source) {
    Parser parser = new Parser(new SourceFile(null, source), ParserOptions.defaults());
    parser.fragment(parser::value, "value");
    return parser.result();
  }

  /** Parses a single type reference, e.g. {@code [String!]!}. */
  public static ParseResult parseType(String source) {
    Parser parser = new Parser(new SourceFile(null, source), ParserOptions.defaults());
    parser.fragment(parser::type, "type");
    return parser.result();
  }

  /** Parses a parenthesized list of variable definitions, e.g. {@code ($id: ID!)}. */
  public static ParseResult parseVariableDefinitions(String source) {
    Parser parser = new Parser(new SourceFile(null, source), ParserOptions.defaults());
    parser.fragment(parser::variableDefinitions, "variable definitions");
    return parser.result();
  }

  /** Parses a type condition, e.g. {@code on User}. */
  public static ParseResult parseTypeCondition(String source) {
    Parser parser = new Parser(new SourceFile(null, source), ParserOptions.defaults());
    parser.fragment(parser::typeCondition, "type condition");
    return parser.result();
  }

  private final SourceFile source;
  private final ParserOptions options;
  private final SdlLog log;
  private final TokenCursor cursor;
  private final EventSink events;
  private final AmbiguityResolver resolver;
  private final Recovery recovery;
  private final List<ToleratedLooseness> tolerated = new ArrayList<>();

  /** The current nesting depth of list types, list values and object values. */
  private int depth = 0;

  private Parser(SourceFile source, ParserOptions options) {
    this.source = source;
    this.options = options;
    this.log = new SdlLog(source);
    this.cursor = new TokenCursor(Tokenizer.tokenize(source, log));
    this.events = new EventSink(cursor);
    this.resolver = new AmbiguityResolver(cursor);
    this.recovery = new Recovery(cursor);
  }

  private void document() {
    Marker document = events.start(0);
    int items = 0;
    while (!cursor.atEof()) {
      if (options.cancellation().isCancelled()) {
        SyntaxToken token = cursor.current();
        log.error(token.span().start(), token.span().start(), ErrorKind.CANCELLED);
        logger.info(
            "parse of {} cancelled at line {} after {} definitions",
            firstNonNull(source.path(), "<>"),
            token.span().startLine(),
            items);
        break;
      }
      int itemStart = cursor.index();
      int checkpoint = events.checkpoint();
      int toleratedCount = tolerated.size();
      try {
        item();
      } catch (SdlError e) {
        events.rollback(checkpoint);
        tolerated.subList(toleratedCount, tolerated.size()).clear();
        log.report(e);
        Marker error = events.start(itemStart);
        recovery.skipToItemBoundary(itemStart);
        error.done(NodeKind.ERROR);
      }
      items++;
    }
    document.done(NodeKind.DOCUMENT, cursor.tokens().size());
  }

  private void fragment(Runnable production, String what) {
    Marker document = events.start(0);
    int start = cursor.index();
    int checkpoint = events.checkpoint();
    try {
      production.run();
      if (!cursor.atEof()) {
        SyntaxToken token = cursor.current();
        log.error(
            token.span().start(),
            token.span().end(),
            ErrorKind.TRAILING_INPUT,
            what,
            describe(token));
        start = cursor.index();
        skipToEnd(start);
      }
    } catch (SdlError e) {
      events.rollback(checkpoint);
      log.report(e);
      skipToEnd(start);
    }
    document.done(NodeKind.DOCUMENT, cursor.tokens().size());
  }

  private void skipToEnd(int start) {
    Marker error = events.start(start);
    while (!cursor.atEof()) {
      cursor.advance();
    }
    error.done(NodeKind.ERROR);
  }

  private ParseResult result() {
    Node document = events.build();
    if (options.strict()) {
      for (ToleratedLooseness looseness : tolerated) {
        Span span = looseness.span();
        log.warning(span.start(), span.end(), looseness.kind().errorKind());
      }
    }
    return new ParseResult(source, document, log.diagnostics(), ImmutableList.copyOf(tolerated));
  }

  private void item() {
    Marker item = events.start();
    @Nullable SyntaxToken description = null;
    if (Recovery.isString(cursor.kind())) {
      description = cursor.current();
      description();
    }
    if (!cursor.at(TokenKind.NAME)) {
      throw error(ErrorKind.EXPECTED_DEFINITION, describe(cursor.current()));
    }
    NodeKind kind;
    switch (cursor.text()) {
      case Keywords.SCHEMA:
        kind = schemaDefinition();
        break;
      case Keywords.DIRECTIVE:
        kind = directiveDefinition();
        break;
      case Keywords.EXTEND:
        if (description != null) {
          throw SdlError.format(
              source,
              description.span().start(),
              description.span().end(),
              ErrorKind.EXTENSION_DESCRIPTION);
        }
        kind = extension();
        break;
      case Keywords.SCALAR:
      case Keywords.TYPE:
      case Keywords.INTERFACE:
      case Keywords.UNION:
      case Keywords.ENUM:
      case Keywords.INPUT:
        kind = typeDefinition(definitionKind(cursor.text()));
        break;
      default:
        throw error(ErrorKind.EXPECTED_DEFINITION, describe(cursor.current()));
    }
    item.done(kind);
  }

  private static NodeKind definitionKind(String keyword) {
    return switch (keyword) {
      case Keywords.SCALAR -> NodeKind.SCALAR_TYPE_DEFINITION;
      case Keywords.TYPE -> NodeKind.OBJECT_TYPE_DEFINITION;
      case Keywords.INTERFACE -> NodeKind.INTERFACE_TYPE_DEFINITION;
      case Keywords.UNION -> NodeKind.UNION_TYPE_DEFINITION;
      case Keywords.ENUM -> NodeKind.ENUM_TYPE_DEFINITION;
      case Keywords.INPUT -> NodeKind.INPUT_OBJECT_TYPE_DEFINITION;
      default -> throw new AssertionError(keyword);
    };
  }

  private static NodeKind extensionKind(String keyword) {
    return switch (keyword) {
      case Keywords.SCALAR -> NodeKind.SCALAR_TYPE_EXTENSION;
      case Keywords.TYPE -> NodeKind.OBJECT_TYPE_EXTENSION;
      case Keywords.INTERFACE -> NodeKind.INTERFACE_TYPE_EXTENSION;
      case Keywords.UNION -> NodeKind.UNION_TYPE_EXTENSION;
      case Keywords.ENUM -> NodeKind.ENUM_TYPE_EXTENSION;
      case Keywords.INPUT -> NodeKind.INPUT_OBJECT_TYPE_EXTENSION;
      default -> throw new AssertionError(keyword);
    };
  }

  private NodeKind schemaDefinition() {
    cursor.advance();
    maybeDirectives();
    expect(TokenKind.LBRACE);
    blockMembers(this::rootOperationTypeDefinition, "operation type", true);
    closeBlock();
    return NodeKind.SCHEMA_DEFINITION;
  }

  private NodeKind extension() {
    int start = cursor.current().span().start();
    cursor.advance();
    if (!cursor.at(TokenKind.NAME) || !Keywords.EXTENSION_TARGETS.contains(cursor.text())) {
      throw error(ErrorKind.EXPECTED_EXTENSION_TARGET, describe(cursor.current()));
    }
    if (cursor.atName(Keywords.SCHEMA)) {
      cursor.advance();
      boolean directives = maybeDirectives();
      if (cursor.at(TokenKind.LBRACE)) {
        cursor.advance();
        blockMembers(this::rootOperationTypeDefinition, "operation type", true);
        closeBlock();
      } else if (!directives) {
        log.error(start, cursor.endOfLastConsumed(), ErrorKind.EMPTY_SCHEMA_EXTENSION);
      }
      return NodeKind.SCHEMA_EXTENSION;
    }
    NodeKind kind = extensionKind(cursor.text());
    boolean directives = typeDefinitionRest(kind);
    if (kind == NodeKind.SCALAR_TYPE_EXTENSION && !directives) {
      // Accepted although it adds nothing; a validator decides whether to reject it.
      tolerate(ToleratedLooseness.Kind.SCALAR_EXTENSION_WITHOUT_DIRECTIVES, start);
    }
    return kind;
  }

  private NodeKind typeDefinition(NodeKind kind) {
    typeDefinitionRest(kind);
    return kind;
  }

  /**
   * Parses a type definition or extension from its keyword onwards, and returns whether it
   * carried directives.
   */
  @CanIgnoreReturnValue
  private boolean typeDefinitionRest(NodeKind kind) {
    cursor.advance();
    name();
    if (cursor.atName(Keywords.IMPLEMENTS) && acceptsInterfaces(kind)) {
      implementsInterfaces();
    }
    boolean directives = maybeDirectives();
    if (resolver.bodyFollows(kind)) {
      switch (kind) {
        case OBJECT_TYPE_DEFINITION,
            OBJECT_TYPE_EXTENSION,
            INTERFACE_TYPE_DEFINITION,
            INTERFACE_TYPE_EXTENSION -> fieldsDefinition();
        case UNION_TYPE_DEFINITION, UNION_TYPE_EXTENSION -> unionMemberTypes();
        case ENUM_TYPE_DEFINITION, ENUM_TYPE_EXTENSION -> enumValuesDefinition();
        case INPUT_OBJECT_TYPE_DEFINITION, INPUT_OBJECT_TYPE_EXTENSION -> inputFieldsDefinition();
        default -> throw new AssertionError(kind);
      }
    }
    return directives;
  }

  private static boolean acceptsInterfaces(NodeKind kind) {
    return switch (kind) {
      case OBJECT_TYPE_DEFINITION,
          OBJECT_TYPE_EXTENSION,
          INTERFACE_TYPE_DEFINITION,
          INTERFACE_TYPE_EXTENSION -> true;
      default -> false;
    };
  }

  private void implementsInterfaces() {
    Marker m = events.start();
    cursor.advance();
    resolver.skipLeadingSeparator(TokenKind.AMP);
    do {
      namedType();
    } while (resolver.anotherElementFollows(TokenKind.AMP));
    m.done(NodeKind.IMPLEMENTS_INTERFACES);
  }

  private void fieldsDefinition() {
    Marker m = events.start();
    int start = cursor.current().span().start();
    expect(TokenKind.LBRACE);
    int fields = blockMembers(this::fieldDefinition, "field definition", false);
    closeBlock();
    m.done(NodeKind.FIELDS_DEFINITION);
    if (fields == 0) {
      // `type Empty {}` is one empty block rather than an error at the closing brace.
      tolerate(ToleratedLooseness.Kind.EMPTY_FIELDS_DEFINITION, start);
    }
  }

  private void fieldDefinition() {
    Marker m = events.start();
    maybeDescription();
    name();
    if (cursor.at(TokenKind.LPAREN)) {
      argumentsDefinition();
    }
    expect(TokenKind.COLON);
    type();
    maybeDirectives();
    m.done(NodeKind.FIELD_DEFINITION);
  }

  private void argumentsDefinition() {
    Marker m = events.start();
    expect(TokenKind.LPAREN);
    do {
      inputValueDefinition();
    } while (!cursor.at(TokenKind.RPAREN));
    cursor.advance();
    m.done(NodeKind.ARGUMENTS_DEFINITION);
  }

  private void inputValueDefinition() {
    Marker m = events.start();
    maybeDescription();
    name();
    expect(TokenKind.COLON);
    type();
    if (cursor.at(TokenKind.EQ)) {
      defaultValue();
    }
    maybeDirectives();
    m.done(NodeKind.INPUT_VALUE_DEFINITION);
  }

  private void inputFieldsDefinition() {
    Marker m = events.start();
    expect(TokenKind.LBRACE);
    blockMembers(this::inputValueDefinition, "input value definition", true);
    closeBlock();
    m.done(NodeKind.INPUT_FIELDS_DEFINITION);
  }

  private void enumValuesDefinition() {
    Marker m = events.start();
    expect(TokenKind.LBRACE);
    blockMembers(this::enumValueDefinition, "enum value", true);
    closeBlock();
    m.done(NodeKind.ENUM_VALUES_DEFINITION);
  }

  private void enumValueDefinition() {
    Marker m = events.start();
    maybeDescription();
    Marker value = events.start();
    name();
    value.done(NodeKind.ENUM_VALUE);
    maybeDirectives();
    m.done(NodeKind.ENUM_VALUE_DEFINITION);
  }

  private void unionMemberTypes() {
    Marker m = events.start();
    expect(TokenKind.EQ);
    resolver.skipLeadingSeparator(TokenKind.PIPE);
    do {
      namedType();
    } while (resolver.anotherElementFollows(TokenKind.PIPE));
    m.done(NodeKind.UNION_MEMBER_TYPES);
  }

  private void rootOperationTypeDefinition() {
    Marker m = events.start();
    if (!cursor.at(TokenKind.NAME)) {
      throw expected("operation type");
    }
    if (!Keywords.OPERATION_TYPES.contains(cursor.text())) {
      throw error(ErrorKind.UNKNOWN_OPERATION_TYPE, cursor.text());
    }
    Marker operation = events.start();
    cursor.advance();
    operation.done(NodeKind.OPERATION_TYPE);
    expect(TokenKind.COLON);
    namedType();
    m.done(NodeKind.ROOT_OPERATION_TYPE_DEFINITION);
  }

  private NodeKind directiveDefinition() {
    cursor.advance();
    expect(TokenKind.AT);
    name();
    if (cursor.at(TokenKind.LPAREN)) {
      argumentsDefinition();
    }
    if (cursor.atName(Keywords.REPEATABLE)) {
      cursor.advance();
    }
    expectKeyword(Keywords.ON);
    directiveLocations();
    return NodeKind.DIRECTIVE_DEFINITION;
  }

  private void directiveLocations() {
    Marker m = events.start();
    resolver.skipLeadingSeparator(TokenKind.PIPE);
    do {
      directiveLocation();
    } while (resolver.anotherElementFollows(TokenKind.PIPE));
    m.done(NodeKind.DIRECTIVE_LOCATIONS);
  }

  private void directiveLocation() {
    if (!cursor.at(TokenKind.NAME)) {
      throw expected("directive location");
    }
    if (DirectiveLocation.fromName(cursor.text()).isEmpty()) {
      throw error(ErrorKind.UNKNOWN_DIRECTIVE_LOCATION, cursor.text());
    }
    Marker m = events.start();
    cursor.advance();
    m.done(NodeKind.DIRECTIVE_LOCATION);
  }

  /** Parses a non-empty list of directives, if one starts here. */
  @CanIgnoreReturnValue
  private boolean maybeDirectives() {
    if (!cursor.at(TokenKind.AT)) {
      return false;
    }
    Marker m = events.start();
    do {
      directive();
    } while (cursor.at(TokenKind.AT));
    m.done(NodeKind.DIRECTIVES);
    return true;
  }

  private void directive() {
    Marker m = events.start();
    expect(TokenKind.AT);
    name();
    if (cursor.at(TokenKind.LPAREN)) {
      arguments();
    }
    m.done(NodeKind.DIRECTIVE);
  }

  private void arguments() {
    Marker m = events.start();
    expect(TokenKind.LPAREN);
    do {
      argument();
    } while (!cursor.at(TokenKind.RPAREN));
    cursor.advance();
    m.done(NodeKind.ARGUMENTS);
  }

  private void argument() {
    Marker m = events.start();
    name();
    expect(TokenKind.COLON);
    value();
    m.done(NodeKind.ARGUMENT);
  }

  private void defaultValue() {
    Marker m = events.start();
    expect(TokenKind.EQ);
    value();
    m.done(NodeKind.DEFAULT_VALUE);
  }

  private void variableDefinitions() {
    Marker m = events.start();
    expect(TokenKind.LPAREN);
    do {
      variableDefinition();
    } while (!cursor.at(TokenKind.RPAREN));
    cursor.advance();
    m.done(NodeKind.VARIABLE_DEFINITIONS);
  }

  private void variableDefinition() {
    Marker m = events.start();
    variable();
    expect(TokenKind.COLON);
    type();
    if (cursor.at(TokenKind.EQ)) {
      defaultValue();
    }
    maybeDirectives();
    m.done(NodeKind.VARIABLE_DEFINITION);
  }

  private void variable() {
    Marker m = events.start();
    expect(TokenKind.DOLLAR);
    name();
    m.done(NodeKind.VARIABLE);
  }

  private void typeCondition() {
    Marker m = events.start();
    expectKeyword(Keywords.ON);
    namedType();
    m.done(NodeKind.TYPE_CONDITION);
  }

  private void type() {
    Marker type = events.start();
    Marker inner = events.start();
    switch (cursor.kind()) {
      case NAME -> {
        name();
        inner.done(NodeKind.NAMED_TYPE);
      }
      case LBRACK -> {
        try {
          enterNesting();
          cursor.advance();
          type();
          expect(TokenKind.RBRACK);
        } finally {
          depth--;
        }
        inner.done(NodeKind.LIST_TYPE);
      }
      default -> throw expected("type");
    }
    if (cursor.at(TokenKind.BANG)) {
      Marker nonNull = inner.precede();
      cursor.advance();
      nonNull.done(NodeKind.NON_NULL_TYPE);
      if (cursor.at(TokenKind.BANG)) {
        throw error(ErrorKind.DOUBLE_NON_NULL);
      }
    }
    type.done(NodeKind.TYPE);
  }

  private void namedType() {
    Marker m = events.start();
    name();
    m.done(NodeKind.NAMED_TYPE);
  }

  private void value() {
    Marker value = events.start();
    NodeKind kind;
    switch (cursor.kind()) {
      case DOLLAR -> {
        variable();
        value.done(NodeKind.VALUE);
        return;
      }
      case STRING_VALUE, BLOCK_STRING_VALUE -> kind = NodeKind.STRING_VALUE;
      case INT_VALUE -> kind = NodeKind.INT_VALUE;
      case FLOAT_VALUE -> kind = NodeKind.FLOAT_VALUE;
      case LBRACK -> {
        listValue();
        value.done(NodeKind.VALUE);
        return;
      }
      case LBRACE -> {
        objectValue();
        value.done(NodeKind.VALUE);
        return;
      }
      case NAME -> {
        switch (cursor.text()) {
          case Keywords.TRUE, Keywords.FALSE -> kind = NodeKind.BOOLEAN_VALUE;
          case Keywords.NULL -> kind = NodeKind.NULL_VALUE;
          default -> {
            Marker m = events.start();
            name();
            m.done(NodeKind.ENUM_VALUE);
            value.done(NodeKind.VALUE);
            return;
          }
        }
      }
      default -> throw expected("value");
    }
    Marker m = events.start();
    cursor.advance();
    m.done(kind);
    value.done(NodeKind.VALUE);
  }

  private void listValue() {
    Marker m = events.start();
    try {
      enterNesting();
      cursor.advance();
      while (!cursor.at(TokenKind.RBRACK)) {
        value();
      }
      cursor.advance();
    } finally {
      depth--;
    }
    m.done(NodeKind.LIST_VALUE);
  }

  private void objectValue() {
    Marker m = events.start();
    try {
      enterNesting();
      cursor.advance();
      while (!cursor.at(TokenKind.RBRACE)) {
        objectField();
      }
      cursor.advance();
    } finally {
      depth--;
    }
    m.done(NodeKind.OBJECT_VALUE);
  }

  private void objectField() {
    Marker m = events.start();
    name();
    expect(TokenKind.COLON);
    value();
    m.done(NodeKind.OBJECT_FIELD);
  }

  /**
   * Increments the nesting depth. The caller decrements it in a {@code finally} block, which also
   * runs when this method throws.
   */
  private void enterNesting() {
    depth++;
    if (depth > options.maxNestingDepth()) {
      throw error(ErrorKind.NESTING_TOO_DEEP, options.maxNestingDepth());
    }
  }

  private void name() {
    Marker m = events.start();
    expect(TokenKind.NAME);
    m.done(NodeKind.NAME);
  }

  private void description() {
    Marker m = events.start();
    cursor.advance();
    m.done(NodeKind.DESCRIPTION);
  }

  private void maybeDescription() {
    if (Recovery.isString(cursor.kind())) {
      description();
    }
  }

  /**
   * Parses the members of a brace-delimited block, after its opening brace. A malformed member
   * and the tokens after it, up to the end of the block, become an error node. Returns the number
   * of members, including malformed ones.
   *
   * <p>A member that looks like the start of a definition is still parsed as a member first,
   * since {@code input} or {@code type} may be an enum value or a field name. Only if that fails
   * is the block taken to be missing its closing brace.
   */
  @CanIgnoreReturnValue
  private int blockMembers(Runnable member, String memberName, boolean requireOne) {
    int count = 0;
    while (!cursor.at(TokenKind.RBRACE) && !cursor.atEof()) {
      int memberStart = cursor.index();
      int mark = cursor.mark();
      boolean definitionStart = recovery.definitionStartsHere();
      int checkpoint = events.checkpoint();
      try {
        member.run();
        count++;
      } catch (SdlError e) {
        events.rollback(checkpoint);
        if (definitionStart) {
          // the closing brace is missing
          cursor.reset(mark);
          break;
        }
        count++;
        log.report(e);
        Marker error = events.start(memberStart);
        recovery.skipToBlockEnd(TokenKind.RBRACE, memberStart);
        error.done(NodeKind.ERROR);
      }
    }
    if (count == 0 && requireOne) {
      SyntaxToken token = cursor.current();
      log.error(
          token.span().start(),
          token.span().end(),
          ErrorKind.EXPECTED_TOKEN,
          memberName,
          describe(token));
    }
    return count;
  }

  /** Consumes the closing brace of a block. A missing brace is reported, and parsing goes on. */
  private void closeBlock() {
    if (cursor.at(TokenKind.RBRACE)) {
      cursor.advance();
      return;
    }
    SyntaxToken token = cursor.current();
    log.error(
        token.span().start(),
        token.span().end(),
        ErrorKind.EXPECTED_TOKEN,
        expectedDescription(TokenKind.RBRACE),
        describe(token));
  }

  private void tolerate(ToleratedLooseness.Kind kind, int start) {
    Span span = source.lineMap().span(start, cursor.endOfLastConsumed());
    tolerated.add(new ToleratedLooseness(kind, span));
  }

  private void expect(TokenKind kind) {
    if (!cursor.at(kind)) {
      throw expected(expectedDescription(kind));
    }
    cursor.advance();
  }

  private void expectKeyword(String keyword) {
    if (!cursor.atName(keyword)) {
      throw error(ErrorKind.EXPECTED_KEYWORD, keyword, describe(cursor.current()));
    }
    cursor.advance();
  }

  private SdlError expected(String what) {
    return error(ErrorKind.EXPECTED_TOKEN, what, describe(cursor.current()));
  }

  /** Creates an error at the current token. */
  private SdlError error(ErrorKind kind, Object... args) {
    Span span = cursor.current().span();
    return SdlError.format(source, span.start(), span.end(), kind, args);
  }

  private static String expectedDescription(TokenKind kind) {
    if (kind.punctuator() != null) {
      return "'" + kind.punctuator() + "'";
    }
    return kind == TokenKind.NAME ? "name" : kind.name();
  }

  private static String describe(SyntaxToken token) {
    return switch (token.kind()) {
      case EOF -> "end of input";
      case STRING_VALUE, BLOCK_STRING_VALUE -> "string";
      case INT_VALUE, FLOAT_VALUE -> "number " + token.text();
      default -> "'" + token.text() + "'";
    };
  }
}
