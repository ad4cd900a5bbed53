/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.tsdown.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.ast.Token;
import com.google.tsdown.parsing.Scanner.ScannedToken;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Recursive descent parser for TypeScript. Type syntax is consumed and dropped; declarations that
 * only exist at the type level are kept as childless INTERFACE, TYPE_ALIAS and DECLARE nodes so
 * that later passes can see where they were.
 *
 * <p>The parser keeps exactly one token of lookahead. Ambiguous prefixes (arrow function heads,
 * type arguments on calls) are resolved by speculation: the parser saves its state, tries one
 * reading, and restores the state if that reading fails.
 */
final class Parser {

  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
          "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
          "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this",
          "throw", "true", "try", "typeof", "var", "void", "while", "with");

  private static final ImmutableSet<String> MEMBER_MODIFIERS =
      ImmutableSet.of(
          "public", "private", "protected", "readonly", "static", "abstract", "override",
          "declare");

  private static final ImmutableSet<String> PARAMETER_MODIFIERS =
      ImmutableSet.of("public", "private", "protected", "readonly", "override");

  private static final int RELATIONAL_PRECEDENCE = 7;

  /** Everything needed to rewind the parser to an earlier token. */
  private record State(
      ScannedToken current,
      ScannedToken previous,
      int position,
      boolean inAsync,
      boolean inGenerator,
      boolean noIn) {}

  /** A property name in an object literal, class body or pattern. */
  private record PropertyKey(@Nullable String name, @Nullable ParseTree computed, boolean quoted) {}

  private final Scanner scanner;
  private ScannedToken current;
  private ScannedToken previous;
  private boolean inAsync;
  private boolean inGenerator;
  private boolean noIn;

  Parser(SourceFile sourceFile) {
    this.scanner = new Scanner(sourceFile.getCode());
    this.current = scanner.next();
    this.previous = new ScannedToken(TokenType.END_OF_FILE, "", 0, 0, false);
  }

  ParseTree parseScript() {
    ParseTree script = new ParseTree(Token.SCRIPT, 0, 0);
    while (!peek(TokenType.END_OF_FILE)) {
      script.add(parseStatement());
    }
    script.end = scanner.getSource().length();
    return script;
  }

  // Token handling.

  private ScannedToken next() {
    previous = current;
    current = scanner.next();
    return previous;
  }

  private boolean peek(TokenType type) {
    return current.is(type);
  }

  private boolean peekWord(String word) {
    return current.isWord(word);
  }

  /** Returns the token after the current one without consuming anything. */
  private ScannedToken peekAhead() {
    int position = scanner.getPosition();
    ScannedToken token = scanner.next();
    scanner.setPosition(position);
    return token;
  }

  private boolean nextIsIdentifierOnSameLine() {
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.IDENTIFIER) && !ahead.newlineBefore();
  }

  @CanIgnoreReturnValue
  private ScannedToken eat(TokenType type) {
    if (!current.is(type)) {
      throw expected("'" + type + "'");
    }
    return next();
  }

  private boolean eatOpt(TokenType type) {
    if (current.is(type)) {
      next();
      return true;
    }
    return false;
  }

  private void eatWord(String word) {
    if (!current.isWord(word)) {
      throw expected("'" + word + "'");
    }
    next();
  }

  private boolean eatWordOpt(String word) {
    if (current.isWord(word)) {
      next();
      return true;
    }
    return false;
  }

  /** Consumes a statement terminator, inserting one where the grammar allows. */
  private void eatSemi() {
    if (eatOpt(TokenType.SEMI_COLON)) {
      return;
    }
    if (peek(TokenType.CLOSE_CURLY)
        || peek(TokenType.END_OF_FILE)
        || current.newlineBefore()) {
      return;
    }
    throw expected("';'");
  }

  private ParseException expected(String what) {
    return new ParseException(
        "expected " + what + " but found '" + describe(current) + "'", current.start());
  }

  private ParseException unexpected() {
    return new ParseException("unexpected token '" + describe(current) + "'", current.start());
  }

  private static String describe(ScannedToken token) {
    return token.is(TokenType.IDENTIFIER) ? token.value() : token.type().toString();
  }

  private State save() {
    return new State(current, previous, scanner.getPosition(), inAsync, inGenerator, noIn);
  }

  private void restore(State state) {
    current = state.current();
    previous = state.previous();
    scanner.setPosition(state.position());
    inAsync = state.inAsync();
    inGenerator = state.inGenerator();
    noIn = state.noIn();
  }

  private boolean setNoIn(boolean value) {
    boolean old = noIn;
    noIn = value;
    return old;
  }

  // Tree construction.

  private ParseTree start(Token token, int start) {
    return new ParseTree(token, start, start);
  }

  private ParseTree finish(ParseTree tree) {
    tree.end = Math.max(tree.start, previous.end());
    return tree;
  }

  private static ParseTree leaf(Token token, ScannedToken source) {
    return new ParseTree(token, source.start(), source.end());
  }

  private static ParseTree empty(int position) {
    return new ParseTree(Token.EMPTY, position, position);
  }

  private String parseIdentifierName() {
    if (!peek(TokenType.IDENTIFIER)) {
      throw expected("identifier");
    }
    return next().value();
  }

  private ParseTree parseBindingIdentifier() {
    if (!peek(TokenType.IDENTIFIER) || RESERVED_WORDS.contains(current.value())) {
      throw expected("identifier");
    }
    ScannedToken name = next();
    return leaf(Token.NAME, name).setString(name.value());
  }

  private ParseTree parseStringLiteral() {
    if (!peek(TokenType.STRING)) {
      throw expected("string literal");
    }
    ScannedToken token = next();
    ParseTree string = leaf(Token.STRINGLIT, token).setString(token.value());
    if (scanner.getSource().charAt(token.start()) == '\'') {
      string.addFlag(Node.SINGLE_QUOTED);
    }
    return string;
  }

  // Statements.

  private ParseTree parseStatement() {
    int start = current.start();
    switch (current.type()) {
      case OPEN_CURLY:
        return parseBlock();
      case SEMI_COLON:
        next();
        return finish(start(Token.EMPTY, start));
      case AT:
        return parseDecoratedStatement();
      case IDENTIFIER:
        break;
      default:
        return parseExpressionStatement();
    }
    String word = current.value();
    switch (word) {
      case "var":
        return parseVariableStatement(Token.VAR);
      case "let":
        if (isLetDeclaration()) {
          return parseVariableStatement(Token.LET);
        }
        break;
      case "const":
        if (peekAhead().isWord("enum")) {
          return parseEnum(start);
        }
        return parseVariableStatement(Token.CONST);
      case "function":
        return parseFunctionDeclaration(start, false, false);
      case "async":
        if (isAsyncFunction()) {
          next();
          return parseFunctionDeclaration(start, true, false);
        }
        break;
      case "class":
        return parseClass(start, ImmutableList.of(), false);
      case "abstract":
        if (peekAhead().isWord("class") && !peekAhead().newlineBefore()) {
          next();
          return parseClass(start, ImmutableList.of(), false);
        }
        break;
      case "if":
        return parseIf();
      case "for":
        return parseFor();
      case "while":
        return parseWhile();
      case "do":
        return parseDoWhile();
      case "return":
        return parseReturn();
      case "break":
        return parseBreakOrContinue(Token.BREAK);
      case "continue":
        return parseBreakOrContinue(Token.CONTINUE);
      case "throw":
        return parseThrow();
      case "try":
        return parseTry();
      case "switch":
        return parseSwitch();
      case "debugger":
        next();
        eatSemi();
        return finish(start(Token.DEBUGGER, start));
      case "import":
        if (peekAhead().is(TokenType.OPEN_PAREN) || peekAhead().is(TokenType.PERIOD)) {
          throw new ParseException("dynamic import and import.meta are not supported", start);
        }
        return parseImport();
      case "export":
        return parseExport(start, ImmutableList.of());
      case "interface":
        if (nextIsIdentifierOnSameLine()) {
          return parseInterface(start);
        }
        break;
      case "type":
        if (nextIsIdentifierOnSameLine()) {
          return parseTypeAlias(start);
        }
        break;
      case "enum":
        return parseEnum(start);
      case "declare":
        if (nextIsIdentifierOnSameLine()) {
          return parseDeclare(start);
        }
        break;
      case "namespace":
      case "module":
        if (nextIsIdentifierOnSameLine()) {
          next();
          return parseNamespace(start);
        }
        if (word.equals("module")
            && peekAhead().is(TokenType.STRING)
            && !peekAhead().newlineBefore()) {
          // An ambient module declaration without `declare`.
          next();
          next();
          skipBracedBlock();
          return finish(start(Token.DECLARE, start));
        }
        break;
      case "with":
        throw new ParseException("'with' statements are not supported", start);
      default:
        break;
    }
    if (!RESERVED_WORDS.contains(word) && peekAhead().is(TokenType.COLON)) {
      return parseLabeledStatement();
    }
    return parseExpressionStatement();
  }

  private boolean isLetDeclaration() {
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.IDENTIFIER)
        || ahead.is(TokenType.OPEN_SQUARE)
        || ahead.is(TokenType.OPEN_CURLY);
  }

  private boolean isAsyncFunction() {
    ScannedToken ahead = peekAhead();
    return ahead.isWord("function") && !ahead.newlineBefore();
  }

  private ParseTree parseBlock() {
    ParseTree block = start(Token.BLOCK, current.start());
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      if (peek(TokenType.END_OF_FILE)) {
        throw expected("'}'");
      }
      block.add(parseStatement());
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(block);
  }

  private ParseTree parseFunctionBody() {
    boolean oldNoIn = setNoIn(false);
    ParseTree body = parseBlock();
    noIn = oldNoIn;
    return body;
  }

  private ParseTree parseExpressionStatement() {
    ParseTree statement = start(Token.EXPR_RESULT, current.start());
    statement.add(parseExpression());
    eatSemi();
    return finish(statement);
  }

  private ParseTree parseLabeledStatement() {
    ParseTree label = start(Token.LABEL, current.start());
    label.setString(next().value());
    eat(TokenType.COLON);
    label.add(parseStatement());
    return finish(label);
  }

  private ParseTree parseVariableStatement(Token kind) {
    int start = current.start();
    next();
    ParseTree declaration = parseVariableDeclarations(kind, start);
    eatSemi();
    return finish(declaration);
  }

  /** Parses the declarators after {@code var}, {@code let} or {@code const}. */
  private ParseTree parseVariableDeclarations(Token kind, int start) {
    ParseTree declaration = start(kind, start);
    do {
      int declaratorStart = current.start();
      ParseTree target = parseBindingTarget();
      eatOpt(TokenType.BANG);
      if (eatOpt(TokenType.COLON)) {
        skipType();
      }
      ParseTree initializer = null;
      if (eatOpt(TokenType.EQUAL)) {
        initializer = parseAssignment();
      }
      if (target.is(Token.NAME)) {
        if (initializer != null) {
          target.add(initializer);
        }
        declaration.add(finish(target));
      } else {
        ParseTree lhs = start(Token.DESTRUCTURING_LHS, declaratorStart).add(target);
        if (initializer != null) {
          lhs.add(initializer);
        }
        declaration.add(finish(lhs));
      }
    } while (eatOpt(TokenType.COMMA));
    return finish(declaration);
  }

  private ParseTree parseIf() {
    ParseTree node = start(Token.IF, current.start());
    eatWord("if");
    eat(TokenType.OPEN_PAREN);
    node.add(parseExpression());
    eat(TokenType.CLOSE_PAREN);
    node.add(parseStatement());
    if (eatWordOpt("else")) {
      node.add(parseStatement());
    }
    return finish(node);
  }

  private ParseTree parseWhile() {
    ParseTree node = start(Token.WHILE, current.start());
    eatWord("while");
    eat(TokenType.OPEN_PAREN);
    node.add(parseExpression());
    eat(TokenType.CLOSE_PAREN);
    node.add(parseStatement());
    return finish(node);
  }

  private ParseTree parseDoWhile() {
    ParseTree node = start(Token.DO, current.start());
    eatWord("do");
    node.add(parseStatement());
    eatWord("while");
    eat(TokenType.OPEN_PAREN);
    node.add(parseExpression());
    eat(TokenType.CLOSE_PAREN);
    eatOpt(TokenType.SEMI_COLON);
    return finish(node);
  }

  private ParseTree parseFor() {
    int start = current.start();
    eatWord("for");
    boolean isAwait = false;
    if (peekWord("await")) {
      if (!inAsync) {
        throw unexpected();
      }
      next();
      isAwait = true;
    }
    eat(TokenType.OPEN_PAREN);

    ParseTree init;
    boolean oldNoIn = setNoIn(true);
    if (peek(TokenType.SEMI_COLON)) {
      init = empty(current.start());
    } else if (peekWord("var") || peekWord("const") || (peekWord("let") && isLetDeclaration())) {
      int declarationStart = current.start();
      Token kind =
          switch (next().value()) {
            case "var" -> Token.VAR;
            case "let" -> Token.LET;
            default -> Token.CONST;
          };
      init = parseVariableDeclarations(kind, declarationStart);
    } else {
      init = parseExpression();
    }
    noIn = oldNoIn;

    if (peekWord("of") || peekWord("in")) {
      boolean isOf = peekWord("of");
      next();
      if (!init.token.isDeclaration()) {
        init = toAssignmentTarget(init);
      }
      ParseTree node = start(isOf ? Token.FOR_OF : Token.FOR_IN, start).add(init);
      node.add(isOf ? parseAssignment() : parseExpression());
      eat(TokenType.CLOSE_PAREN);
      node.add(parseStatement());
      if (isAwait) {
        node.addFlag(Node.FOR_AWAIT);
      }
      return finish(node);
    }
    if (isAwait) {
      throw expected("'of'");
    }
    ParseTree node = start(Token.FOR, start).add(init);
    eat(TokenType.SEMI_COLON);
    node.add(peek(TokenType.SEMI_COLON) ? empty(current.start()) : parseExpression());
    eat(TokenType.SEMI_COLON);
    node.add(peek(TokenType.CLOSE_PAREN) ? empty(current.start()) : parseExpression());
    eat(TokenType.CLOSE_PAREN);
    node.add(parseStatement());
    return finish(node);
  }

  private ParseTree parseReturn() {
    ParseTree node = start(Token.RETURN, current.start());
    eatWord("return");
    if (!peek(TokenType.SEMI_COLON)
        && !peek(TokenType.CLOSE_CURLY)
        && !peek(TokenType.END_OF_FILE)
        && !current.newlineBefore()) {
      node.add(parseExpression());
    }
    eatSemi();
    return finish(node);
  }

  private ParseTree parseBreakOrContinue(Token token) {
    ParseTree node = start(token, current.start());
    next();
    if (peek(TokenType.IDENTIFIER) && !current.newlineBefore()) {
      node.setString(next().value());
    }
    eatSemi();
    return finish(node);
  }

  private ParseTree parseThrow() {
    ParseTree node = start(Token.THROW, current.start());
    eatWord("throw");
    node.add(parseExpression());
    eatSemi();
    return finish(node);
  }

  private ParseTree parseTry() {
    ParseTree node = start(Token.TRY, current.start());
    eatWord("try");
    node.add(parseBlock());
    boolean hasHandler = false;
    if (peekWord("catch")) {
      hasHandler = true;
      ParseTree handler = start(Token.CATCH, current.start());
      next();
      if (eatOpt(TokenType.OPEN_PAREN)) {
        handler.add(parseBindingTarget());
        if (eatOpt(TokenType.COLON)) {
          skipType();
        }
        eat(TokenType.CLOSE_PAREN);
      } else {
        handler.add(empty(current.start()));
      }
      handler.add(parseBlock());
      node.add(finish(handler));
    } else {
      node.add(empty(current.start()));
    }
    if (eatWordOpt("finally")) {
      hasHandler = true;
      node.add(parseBlock());
    }
    if (!hasHandler) {
      throw expected("'catch' or 'finally'");
    }
    return finish(node);
  }

  private ParseTree parseSwitch() {
    ParseTree node = start(Token.SWITCH, current.start());
    eatWord("switch");
    eat(TokenType.OPEN_PAREN);
    node.add(parseExpression());
    eat(TokenType.CLOSE_PAREN);
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      int caseStart = current.start();
      ParseTree clause;
      if (eatWordOpt("case")) {
        clause = start(Token.CASE, caseStart).add(parseExpression());
      } else {
        eatWord("default");
        clause = start(Token.DEFAULT_CASE, caseStart);
      }
      eat(TokenType.COLON);
      while (!peekWord("case") && !peekWord("default") && !peek(TokenType.CLOSE_CURLY)) {
        if (peek(TokenType.END_OF_FILE)) {
          throw expected("'}'");
        }
        clause.add(parseStatement());
      }
      node.add(finish(clause));
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(node);
  }

  private ParseTree parseDecoratedStatement() {
    int start = current.start();
    List<ParseTree> decorators = parseDecorators();
    if (peekWord("export")) {
      return parseExport(start, decorators);
    }
    eatWordOpt("abstract");
    if (!peekWord("class")) {
      throw expected("'class'");
    }
    return parseClass(start, decorators, false);
  }

  // Functions.

  private ParseTree parseFunctionDeclaration(int start, boolean isAsync, boolean nameOptional) {
    eatWord("function");
    int flags = isAsync ? Node.ASYNC : 0;
    if (eatOpt(TokenType.STAR)) {
      flags |= Node.GENERATOR;
    }
    ParseTree name =
        nameOptional && !peek(TokenType.IDENTIFIER)
            ? empty(current.start())
            : parseBindingIdentifier();
    return parseFunctionRest(start, flags, name, false, true);
  }

  private ParseTree parseFunctionExpression(int start, boolean isAsync) {
    eatWord("function");
    int flags = isAsync ? Node.ASYNC : 0;
    if (eatOpt(TokenType.STAR)) {
      flags |= Node.GENERATOR;
    }
    ParseTree name =
        peek(TokenType.IDENTIFIER) ? parseBindingIdentifier() : empty(current.start());
    return parseFunctionRest(start, flags, name, false, false);
  }

  /**
   * Parses type parameters, parameters, return type and body. A function without a body is an
   * overload signature or ambient declaration and is flagged {@link Node#AMBIENT}.
   */
  private ParseTree parseFunctionRest(
      int start, int flags, ParseTree name, boolean allowParameterModifiers, boolean allowNoBody) {
    ParseTree function = start(Token.FUNCTION, start).addFlag(flags).add(name);
    skipTypeParametersOpt();
    boolean oldAsync = inAsync;
    boolean oldGenerator = inGenerator;
    inAsync = (flags & Node.ASYNC) != 0;
    inGenerator = (flags & Node.GENERATOR) != 0;
    try {
      function.add(parseFormalParameters(allowParameterModifiers));
      if (eatOpt(TokenType.COLON)) {
        skipType();
      }
      if (peek(TokenType.OPEN_CURLY)) {
        function.add(parseFunctionBody());
      } else if (allowNoBody) {
        eatSemi();
        function.add(empty(previous.end()));
        function.addFlag(Node.AMBIENT);
      } else {
        throw expected("'{'");
      }
    } finally {
      inAsync = oldAsync;
      inGenerator = oldGenerator;
    }
    return finish(function);
  }

  private ParseTree parseFormalParameters(boolean allowModifiers) {
    ParseTree list = start(Token.PARAM_LIST, current.start());
    eat(TokenType.OPEN_PAREN);
    boolean oldNoIn = setNoIn(false);
    while (!peek(TokenType.CLOSE_PAREN)) {
      if (peek(TokenType.AT)) {
        throw new ParseException("parameter decorators are not supported", current.start());
      }
      int start = current.start();
      int flags = 0;
      while (allowModifiers && isParameterModifier()) {
        next();
        flags |= Node.PARAM_PROPERTY;
      }
      ParseTree param;
      if (peek(TokenType.SPREAD)) {
        next();
        ParseTree target = parseBindingTarget();
        eatOpt(TokenType.QUESTION);
        if (eatOpt(TokenType.COLON)) {
          skipType();
        }
        param = finish(start(Token.ITER_REST, start).add(target));
      } else if (peekWord("this") && isThisParameter()) {
        // A `this` parameter only declares the type of `this`.
        next();
        if (eatOpt(TokenType.COLON)) {
          skipType();
        }
        if (!peek(TokenType.CLOSE_PAREN)) {
          eat(TokenType.COMMA);
        }
        continue;
      } else {
        ParseTree target = parseBindingTarget();
        eatOpt(TokenType.QUESTION);
        if (eatOpt(TokenType.COLON)) {
          skipType();
        }
        if (eatOpt(TokenType.EQUAL)) {
          ParseTree initializer = parseAssignment();
          param = finish(start(Token.DEFAULT_VALUE, start).add(target).add(initializer));
        } else {
          param = target;
        }
      }
      list.add(param.addFlag(flags));
      if (!peek(TokenType.CLOSE_PAREN)) {
        eat(TokenType.COMMA);
      }
    }
    noIn = oldNoIn;
    eat(TokenType.CLOSE_PAREN);
    return finish(list);
  }

  private boolean isParameterModifier() {
    if (!peek(TokenType.IDENTIFIER) || !PARAMETER_MODIFIERS.contains(current.value())) {
      return false;
    }
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.IDENTIFIER)
        || ahead.is(TokenType.OPEN_SQUARE)
        || ahead.is(TokenType.OPEN_CURLY);
  }

  private boolean isThisParameter() {
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.COLON)
        || ahead.is(TokenType.COMMA)
        || ahead.is(TokenType.CLOSE_PAREN);
  }

  /**
   * Parses an arrow function head up to and including {@code =>}, or returns null and leaves the
   * parser untouched when the tokens ahead are not one.
   */
  private @Nullable ParseTree tryParseArrowHead(int start, boolean isAsync) {
    State state = save();
    try {
      if (isAsync) {
        eatWord("async");
      }
      ParseTree function =
          start(Token.FUNCTION, start).addFlag(Node.ARROW | (isAsync ? Node.ASYNC : 0));
      function.add(empty(start));
      inAsync = isAsync;
      inGenerator = false;
      ParseTree params;
      if (peek(TokenType.IDENTIFIER)) {
        int paramStart = current.start();
        params = start(Token.PARAM_LIST, paramStart).add(parseBindingIdentifier());
        finish(params);
      } else {
        skipTypeParametersOpt();
        params = parseFormalParameters(false);
        if (eatOpt(TokenType.COLON)) {
          skipType();
        }
      }
      if (!peek(TokenType.ARROW) || current.newlineBefore()) {
        throw expected("'=>'");
      }
      next();
      inAsync = state.inAsync();
      inGenerator = state.inGenerator();
      return function.add(params);
    } catch (ParseException e) {
      restore(state);
      return null;
    }
  }

  private ParseTree parseArrowBody(ParseTree function) {
    boolean oldAsync = inAsync;
    boolean oldGenerator = inGenerator;
    inAsync = function.hasFlag(Node.ASYNC);
    inGenerator = false;
    try {
      if (peek(TokenType.OPEN_CURLY)) {
        function.add(parseFunctionBody());
      } else {
        function.addFlag(Node.EXPRESSION_BODY);
        function.add(parseAssignment());
      }
    } finally {
      inAsync = oldAsync;
      inGenerator = oldGenerator;
    }
    return finish(function);
  }

  private @Nullable ParseTree maybeParseArrowFunction() {
    int start = current.start();
    ParseTree head = null;
    if (peek(TokenType.IDENTIFIER)) {
      ScannedToken ahead = peekAhead();
      if (peekWord("async")
          && !ahead.newlineBefore()
          && (ahead.is(TokenType.IDENTIFIER)
              || ahead.is(TokenType.OPEN_PAREN)
              || ahead.is(TokenType.OPEN_ANGLE))) {
        head = tryParseArrowHead(start, true);
      } else if (ahead.is(TokenType.ARROW)) {
        head = tryParseArrowHead(start, false);
      }
    } else if (peek(TokenType.OPEN_PAREN) || peek(TokenType.OPEN_ANGLE)) {
      head = tryParseArrowHead(start, false);
    }
    return head == null ? null : parseArrowBody(head);
  }

  // Patterns.

  private ParseTree parseBindingTarget() {
    return switch (current.type()) {
      case OPEN_SQUARE -> parseArrayBindingPattern();
      case OPEN_CURLY -> parseObjectBindingPattern();
      default -> parseBindingIdentifier();
    };
  }

  private ParseTree parseBindingElement() {
    int start = current.start();
    ParseTree target = parseBindingTarget();
    if (eatOpt(TokenType.EQUAL)) {
      ParseTree initializer = parseAssignment();
      return finish(start(Token.DEFAULT_VALUE, start).add(target).add(initializer));
    }
    return target;
  }

  private ParseTree parseArrayBindingPattern() {
    ParseTree pattern = start(Token.ARRAY_PATTERN, current.start());
    eat(TokenType.OPEN_SQUARE);
    while (!peek(TokenType.CLOSE_SQUARE)) {
      if (peek(TokenType.COMMA)) {
        pattern.add(empty(current.start()));
        next();
        continue;
      }
      if (peek(TokenType.SPREAD)) {
        int start = current.start();
        next();
        pattern.add(finish(start(Token.ITER_REST, start).add(parseBindingTarget())));
      } else {
        pattern.add(parseBindingElement());
      }
      if (!peek(TokenType.CLOSE_SQUARE)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_SQUARE);
    return finish(pattern);
  }

  private ParseTree parseObjectBindingPattern() {
    ParseTree pattern = start(Token.OBJECT_PATTERN, current.start());
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      int start = current.start();
      if (peek(TokenType.SPREAD)) {
        next();
        pattern.add(finish(start(Token.OBJECT_REST, start).add(parseBindingIdentifier())));
      } else {
        PropertyKey key = parsePropertyKey();
        if (eatOpt(TokenType.COLON)) {
          pattern.add(propertyNode(Token.STRING_KEY, key, parseBindingElement(), start));
        } else {
          pattern.add(shorthandProperty(key, start));
        }
      }
      if (!peek(TokenType.CLOSE_CURLY)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(pattern);
  }

  /** A shorthand {@code {a}} or cover-grammar {@code {a = 1}} property. */
  private ParseTree shorthandProperty(PropertyKey key, int start) {
    if (key.name() == null || key.quoted()) {
      throw expected("':'");
    }
    ParseTree name = new ParseTree(Token.NAME, start, previous.end()).setString(key.name());
    ParseTree value = name;
    if (eatOpt(TokenType.EQUAL)) {
      ParseTree initializer = parseAssignment();
      value = finish(start(Token.DEFAULT_VALUE, start).add(name).add(initializer));
    }
    return finish(
        start(Token.STRING_KEY, start)
            .setString(key.name())
            .addFlag(Node.SHORTHAND)
            .add(value));
  }

  private ParseTree toAssignmentTarget(ParseTree tree) {
    if (tree.is(Token.ARRAYLIT) || tree.is(Token.OBJECTLIT)) {
      return toPattern(tree);
    }
    checkSimpleTarget(tree);
    return tree;
  }

  /** Reinterprets an array or object literal as the pattern it turned out to be. */
  private ParseTree toPattern(ParseTree tree) {
    switch (tree.token) {
      case ARRAYLIT -> {
        tree.token = Token.ARRAY_PATTERN;
        for (int i = 0; i < tree.children.size(); i++) {
          ParseTree element = tree.child(i);
          if (element.is(Token.ITER_SPREAD)) {
            element.token = Token.ITER_REST;
            element.children.set(0, toPattern(element.child(0)));
          } else if (!element.is(Token.EMPTY)) {
            tree.children.set(i, toPatternElement(element));
          }
        }
      }
      case OBJECTLIT -> {
        tree.token = Token.OBJECT_PATTERN;
        for (ParseTree property : tree.children) {
          switch (property.token) {
            case STRING_KEY -> property.children.set(0, toPatternElement(property.child(0)));
            case COMPUTED_PROP -> {
              if (property.flags != 0) {
                throw new ParseException("invalid destructuring target", property.start);
              }
              property.children.set(1, toPatternElement(property.child(1)));
            }
            case OBJECT_SPREAD -> {
              property.token = Token.OBJECT_REST;
              property.children.set(0, toPattern(property.child(0)));
            }
            default -> throw new ParseException("invalid destructuring target", property.start);
          }
        }
      }
      case DEFAULT_VALUE -> {}
      default -> checkSimpleTarget(tree);
    }
    return tree;
  }

  private ParseTree toPatternElement(ParseTree tree) {
    if (tree.is(Token.ASSIGN)) {
      tree.token = Token.DEFAULT_VALUE;
      tree.children.set(0, toPattern(tree.child(0)));
      return tree;
    }
    return toPattern(tree);
  }

  private static void checkSimpleTarget(ParseTree tree) {
    switch (tree.token) {
      case NAME, CAST, NON_NULL -> {}
      case GETPROP, GETELEM -> {
        if (tree.hasFlag(Node.IN_OPTIONAL_CHAIN)) {
          throw new ParseException("invalid assignment target", tree.start);
        }
      }
      default -> throw new ParseException("invalid assignment target", tree.start);
    }
  }

  // Expressions.

  private ParseTree parseExpression() {
    ParseTree expression = parseAssignment();
    while (peek(TokenType.COMMA)) {
      next();
      ParseTree right = parseAssignment();
      expression = finish(start(Token.COMMA, expression.start).add(expression).add(right));
    }
    return expression;
  }

  private ParseTree parseAssignment() {
    if (peekWord("yield") && inGenerator) {
      return parseYield();
    }
    ParseTree arrow = maybeParseArrowFunction();
    if (arrow != null) {
      return arrow;
    }
    ParseTree left = parseConditional();
    Token op = assignmentOperator(current.type());
    if (op == null) {
      return left;
    }
    if (op == Token.ASSIGN && (left.is(Token.ARRAYLIT) || left.is(Token.OBJECTLIT))) {
      left = toPattern(left);
    } else {
      checkSimpleTarget(left);
    }
    next();
    ParseTree right = parseAssignment();
    return finish(start(op, left.start).add(left).add(right));
  }

  private ParseTree parseYield() {
    ParseTree node = start(Token.YIELD, current.start());
    eatWord("yield");
    if (eatOpt(TokenType.STAR)) {
      node.addFlag(Node.YIELD_STAR);
      node.add(parseAssignment());
    } else if (!current.newlineBefore() && startsExpression()) {
      node.add(parseAssignment());
    }
    return finish(node);
  }

  private boolean startsExpression() {
    switch (current.type()) {
      case CLOSE_PAREN:
      case CLOSE_SQUARE:
      case CLOSE_CURLY:
      case COMMA:
      case SEMI_COLON:
      case COLON:
      case END_OF_FILE:
        return false;
      default:
        return !peekWord("in") && !peekWord("of");
    }
  }

  private ParseTree parseConditional() {
    ParseTree condition = parseBinary(1);
    if (!peek(TokenType.QUESTION)) {
      return condition;
    }
    next();
    boolean oldNoIn = setNoIn(false);
    ParseTree then = parseAssignment();
    noIn = oldNoIn;
    eat(TokenType.COLON);
    ParseTree otherwise = parseAssignment();
    return finish(start(Token.HOOK, condition.start).add(condition).add(then).add(otherwise));
  }

  private ParseTree parseBinary(int minPrecedence) {
    ParseTree left = parseUnary();
    while (true) {
      if (peek(TokenType.CLOSE_ANGLE)) {
        current = scanner.rescanGreater(current);
      }
      if ((peekWord("as") || peekWord("satisfies"))
          && !current.newlineBefore()
          && RELATIONAL_PRECEDENCE >= minPrecedence) {
        next();
        skipType();
        left = finish(start(Token.CAST, left.start).add(left));
        continue;
      }
      Token op = binaryOperator();
      if (op == null || (op == Token.IN && noIn)) {
        break;
      }
      int precedence = precedence(op);
      if (precedence < minPrecedence) {
        break;
      }
      next();
      // Exponentiation is right associative.
      ParseTree right = parseBinary(op == Token.EXPONENT ? precedence : precedence + 1);
      left = finish(start(op, left.start).add(left).add(right));
    }
    return left;
  }

  private @Nullable Token binaryOperator() {
    return switch (current.type()) {
      case OR -> Token.OR;
      case QUESTION_QUESTION -> Token.COALESCE;
      case AND -> Token.AND;
      case BAR -> Token.BITOR;
      case CARET -> Token.BITXOR;
      case AMPERSAND -> Token.BITAND;
      case EQUAL_EQUAL -> Token.EQ;
      case NOT_EQUAL -> Token.NE;
      case EQUAL_EQUAL_EQUAL -> Token.SHEQ;
      case NOT_EQUAL_EQUAL -> Token.SHNE;
      case OPEN_ANGLE -> Token.LT;
      case CLOSE_ANGLE -> Token.GT;
      case LESS_EQUAL -> Token.LE;
      case GREATER_EQUAL -> Token.GE;
      case LEFT_SHIFT -> Token.LSH;
      case RIGHT_SHIFT -> Token.RSH;
      case UNSIGNED_RIGHT_SHIFT -> Token.URSH;
      case PLUS -> Token.ADD;
      case MINUS -> Token.SUB;
      case STAR -> Token.MUL;
      case SLASH -> Token.DIV;
      case PERCENT -> Token.MOD;
      case STAR_STAR -> Token.EXPONENT;
      case IDENTIFIER ->
          peekWord("instanceof") ? Token.INSTANCEOF : peekWord("in") ? Token.IN : null;
      default -> null;
    };
  }

  private static int precedence(Token op) {
    return switch (op) {
      case OR, COALESCE -> 1;
      case AND -> 2;
      case BITOR -> 3;
      case BITXOR -> 4;
      case BITAND -> 5;
      case EQ, NE, SHEQ, SHNE -> 6;
      case LT, GT, LE, GE, INSTANCEOF, IN -> RELATIONAL_PRECEDENCE;
      case LSH, RSH, URSH -> 8;
      case ADD, SUB -> 9;
      case MUL, DIV, MOD -> 10;
      case EXPONENT -> 11;
      default -> throw new IllegalArgumentException("not a binary operator: " + op);
    };
  }

  private static @Nullable Token assignmentOperator(TokenType type) {
    return switch (type) {
      case EQUAL -> Token.ASSIGN;
      case BAR_EQUAL -> Token.ASSIGN_BITOR;
      case CARET_EQUAL -> Token.ASSIGN_BITXOR;
      case AMPERSAND_EQUAL -> Token.ASSIGN_BITAND;
      case LEFT_SHIFT_EQUAL -> Token.ASSIGN_LSH;
      case RIGHT_SHIFT_EQUAL -> Token.ASSIGN_RSH;
      case UNSIGNED_RIGHT_SHIFT_EQUAL -> Token.ASSIGN_URSH;
      case PLUS_EQUAL -> Token.ASSIGN_ADD;
      case MINUS_EQUAL -> Token.ASSIGN_SUB;
      case STAR_EQUAL -> Token.ASSIGN_MUL;
      case SLASH_EQUAL -> Token.ASSIGN_DIV;
      case PERCENT_EQUAL -> Token.ASSIGN_MOD;
      case STAR_STAR_EQUAL -> Token.ASSIGN_EXPONENT;
      case OR_EQUAL -> Token.ASSIGN_OR;
      case AND_EQUAL -> Token.ASSIGN_AND;
      case QUESTION_QUESTION_EQUAL -> Token.ASSIGN_COALESCE;
      default -> null;
    };
  }

  private @Nullable Token unaryOperator() {
    return switch (current.type()) {
      case BANG -> Token.NOT;
      case TILDE -> Token.BITNOT;
      case PLUS -> Token.POS;
      case MINUS -> Token.NEG;
      case IDENTIFIER ->
          switch (current.value()) {
            case "typeof" -> Token.TYPEOF;
            case "void" -> Token.VOID;
            case "delete" -> Token.DELPROP;
            default -> null;
          };
      default -> null;
    };
  }

  private ParseTree parseUnary() {
    int start = current.start();
    Token op = unaryOperator();
    if (op != null) {
      next();
      ParseTree operand = parseUnary();
      return finish(start(op, start).add(operand));
    }
    if (peek(TokenType.PLUS_PLUS) || peek(TokenType.MINUS_MINUS)) {
      Token token = peek(TokenType.PLUS_PLUS) ? Token.INC : Token.DEC;
      next();
      ParseTree operand = parseUnary();
      checkSimpleTarget(operand);
      return finish(start(token, start).add(operand));
    }
    if (peekWord("await") && inAsync) {
      next();
      ParseTree operand = parseUnary();
      return finish(start(Token.AWAIT, start).add(operand));
    }
    if (peek(TokenType.OPEN_ANGLE)) {
      // <T>expr
      next();
      skipType();
      eat(TokenType.CLOSE_ANGLE);
      ParseTree operand = parseUnary();
      return finish(start(Token.CAST, start).add(operand));
    }
    ParseTree expression = parseLeftHandSide();
    if ((peek(TokenType.PLUS_PLUS) || peek(TokenType.MINUS_MINUS)) && !current.newlineBefore()) {
      checkSimpleTarget(expression);
      Token token = peek(TokenType.PLUS_PLUS) ? Token.INC : Token.DEC;
      next();
      return finish(start(token, start).add(expression).addFlag(Node.POSTFIX));
    }
    return expression;
  }

  private ParseTree parseLeftHandSide() {
    int start = current.start();
    ParseTree expression;
    if (peekWord("new")) {
      expression = parseNewExpression();
    } else if (peekWord("super")) {
      expression = parseSuper();
    } else if (peekWord("import")) {
      throw new ParseException("dynamic import and import.meta are not supported", start);
    } else {
      expression = parsePrimary();
    }
    return parseCallTail(expression, start, true);
  }

  private ParseTree parseSuper() {
    ParseTree node = leaf(Token.SUPER, next());
    if (!peek(TokenType.OPEN_PAREN) && !peek(TokenType.PERIOD) && !peek(TokenType.OPEN_SQUARE)) {
      throw unexpected();
    }
    return node;
  }

  private ParseTree parseNewExpression() {
    int start = current.start();
    eatWord("new");
    if (peek(TokenType.PERIOD)) {
      throw new ParseException("new.target is not supported", start);
    }
    ParseTree callee;
    if (peekWord("new")) {
      callee = parseNewExpression();
    } else {
      int calleeStart = current.start();
      callee =
          parseCallTail(peekWord("super") ? parseSuper() : parsePrimary(), calleeStart, false);
    }
    ParseTree node = start(Token.NEW, start).add(callee);
    if (peek(TokenType.OPEN_PAREN)) {
      parseArguments(node);
    }
    return finish(node);
  }

  /** Parses member accesses, calls, tagged templates and non-null assertions after {@code expr}. */
  private ParseTree parseCallTail(ParseTree expression, int start, boolean allowCall) {
    boolean inChain = false;
    while (true) {
      int chainFlags = inChain ? Node.IN_OPTIONAL_CHAIN : 0;
      switch (current.type()) {
        case PERIOD -> {
          next();
          String property = parseIdentifierName();
          expression =
              finish(
                  start(Token.GETPROP, start)
                      .setString(property)
                      .addFlag(chainFlags)
                      .add(expression));
        }
        case QUESTION_DOT -> {
          if (!allowCall) {
            return expression;
          }
          next();
          inChain = true;
          int flags = Node.OPTIONAL_CHAIN_START | Node.IN_OPTIONAL_CHAIN;
          if (peek(TokenType.OPEN_ANGLE)) {
            skipTypeArguments();
          }
          if (peek(TokenType.OPEN_PAREN)) {
            expression = parseArguments(start(Token.CALL, start).addFlag(flags).add(expression));
          } else if (peek(TokenType.OPEN_SQUARE)) {
            expression = parseElementAccess(expression, start, flags);
          } else {
            String property = parseIdentifierName();
            expression =
                finish(
                    start(Token.GETPROP, start).setString(property).addFlag(flags).add(expression));
          }
        }
        case OPEN_SQUARE -> expression = parseElementAccess(expression, start, chainFlags);
        case OPEN_PAREN -> {
          if (!allowCall) {
            return expression;
          }
          expression =
              parseArguments(start(Token.CALL, start).addFlag(chainFlags).add(expression));
        }
        case NO_SUBSTITUTION_TEMPLATE, TEMPLATE_HEAD -> {
          if (inChain) {
            throw new ParseException("tagged template in optional chain", current.start());
          }
          ParseTree template = parseTemplateLiteral();
          expression =
              finish(start(Token.TAGGED_TEMPLATELIT, start).add(expression).add(template));
        }
        case BANG -> {
          if (current.newlineBefore()) {
            return expression;
          }
          next();
          expression = finish(start(Token.NON_NULL, start).add(expression));
        }
        case OPEN_ANGLE -> {
          if (!tryParseTypeArgumentsOfCall() || !allowCall) {
            return expression;
          }
        }
        default -> {
          return expression;
        }
      }
    }
  }

  private ParseTree parseElementAccess(ParseTree object, int start, int flags) {
    eat(TokenType.OPEN_SQUARE);
    boolean oldNoIn = setNoIn(false);
    ParseTree key = parseExpression();
    noIn = oldNoIn;
    eat(TokenType.CLOSE_SQUARE);
    return finish(start(Token.GETELEM, start).addFlag(flags).add(object).add(key));
  }

  /** Skips {@code <T>} before a call's arguments; restores the parser if they are not that. */
  private boolean tryParseTypeArgumentsOfCall() {
    State state = save();
    try {
      skipTypeArguments();
      if (peek(TokenType.OPEN_PAREN)
          || peek(TokenType.NO_SUBSTITUTION_TEMPLATE)
          || peek(TokenType.TEMPLATE_HEAD)) {
        return true;
      }
    } catch (ParseException e) {
      // Not type arguments; rewind below.
    }
    restore(state);
    return false;
  }

  private ParseTree parseArguments(ParseTree call) {
    eat(TokenType.OPEN_PAREN);
    boolean oldNoIn = setNoIn(false);
    while (!peek(TokenType.CLOSE_PAREN)) {
      if (peek(TokenType.SPREAD)) {
        int start = current.start();
        next();
        call.add(finish(start(Token.ITER_SPREAD, start).add(parseAssignment())));
      } else {
        call.add(parseAssignment());
      }
      if (!peek(TokenType.CLOSE_PAREN)) {
        eat(TokenType.COMMA);
      }
    }
    noIn = oldNoIn;
    eat(TokenType.CLOSE_PAREN);
    return finish(call);
  }

  private ParseTree parsePrimary() {
    int start = current.start();
    switch (current.type()) {
      case NUMBER: {
        ScannedToken token = next();
        ParseTree number = leaf(Token.NUMBER, token).setString(token.value());
        number.number = Scanner.parseNumber(token.value(), token.start());
        return number;
      }
      case STRING:
        return parseStringLiteral();
      case NO_SUBSTITUTION_TEMPLATE:
      case TEMPLATE_HEAD:
        return parseTemplateLiteral();
      case SLASH:
      case SLASH_EQUAL: {
        current = scanner.rescanRegExp(current);
        ScannedToken token = next();
        return leaf(Token.REGEXP, token).setString(token.value());
      }
      case OPEN_SQUARE:
        return parseArrayLiteral();
      case OPEN_CURLY:
        return parseObjectLiteral();
      case OPEN_PAREN: {
        next();
        boolean oldNoIn = setNoIn(false);
        ParseTree expression = parseExpression();
        noIn = oldNoIn;
        eat(TokenType.CLOSE_PAREN);
        return expression;
      }
      case IDENTIFIER:
        break;
      default:
        throw unexpected();
    }
    switch (current.value()) {
      case "this":
        return leaf(Token.THIS, next());
      case "null":
        return leaf(Token.NULL, next());
      case "true":
        return leaf(Token.TRUE, next());
      case "false":
        return leaf(Token.FALSE, next());
      case "function":
        return parseFunctionExpression(start, false);
      case "class":
        return parseClass(start, ImmutableList.of(), true);
      case "async":
        if (isAsyncFunction()) {
          next();
          return parseFunctionExpression(start, true);
        }
        break;
      default:
        break;
    }
    if (RESERVED_WORDS.contains(current.value())) {
      throw unexpected();
    }
    ScannedToken name = next();
    return leaf(Token.NAME, name).setString(name.value());
  }

  private ParseTree parseTemplateLiteral() {
    ParseTree template = start(Token.TEMPLATELIT, current.start());
    if (peek(TokenType.NO_SUBSTITUTION_TEMPLATE)) {
      template.add(templateString(next()));
      return finish(template);
    }
    template.add(templateString(eat(TokenType.TEMPLATE_HEAD)));
    boolean oldNoIn = setNoIn(false);
    while (true) {
      template.add(parseExpression());
      if (!peek(TokenType.CLOSE_CURLY)) {
        throw expected("'}'");
      }
      current = scanner.rescanTemplateContinuation(current);
      boolean tail = peek(TokenType.TEMPLATE_TAIL);
      template.add(templateString(next()));
      if (tail) {
        break;
      }
    }
    noIn = oldNoIn;
    return finish(template);
  }

  private static ParseTree templateString(ScannedToken token) {
    return leaf(Token.TEMPLATELIT_STRING, token).setString(token.value());
  }

  private ParseTree parseArrayLiteral() {
    ParseTree array = start(Token.ARRAYLIT, current.start());
    eat(TokenType.OPEN_SQUARE);
    boolean oldNoIn = setNoIn(false);
    while (!peek(TokenType.CLOSE_SQUARE)) {
      if (peek(TokenType.COMMA)) {
        array.add(empty(current.start()));
        next();
        continue;
      }
      if (peek(TokenType.SPREAD)) {
        int start = current.start();
        next();
        array.add(finish(start(Token.ITER_SPREAD, start).add(parseAssignment())));
      } else {
        array.add(parseAssignment());
      }
      if (!peek(TokenType.CLOSE_SQUARE)) {
        eat(TokenType.COMMA);
      }
    }
    noIn = oldNoIn;
    eat(TokenType.CLOSE_SQUARE);
    return finish(array);
  }

  private ParseTree parseObjectLiteral() {
    ParseTree object = start(Token.OBJECTLIT, current.start());
    eat(TokenType.OPEN_CURLY);
    boolean oldNoIn = setNoIn(false);
    while (!peek(TokenType.CLOSE_CURLY)) {
      int start = current.start();
      if (peek(TokenType.SPREAD)) {
        next();
        object.add(finish(start(Token.OBJECT_SPREAD, start).add(parseAssignment())));
      } else {
        object.add(parseObjectMember(start));
      }
      if (!peek(TokenType.CLOSE_CURLY)) {
        eat(TokenType.COMMA);
      }
    }
    noIn = oldNoIn;
    eat(TokenType.CLOSE_CURLY);
    return finish(object);
  }

  private ParseTree parseObjectMember(int start) {
    int functionFlags = 0;
    Token kind = Token.MEMBER_FUNCTION_DEF;
    if (peekWord("async") && isMemberPrefix(true)) {
      next();
      functionFlags |= Node.ASYNC;
    }
    if (eatOpt(TokenType.STAR)) {
      functionFlags |= Node.GENERATOR;
    }
    boolean isAccessor = false;
    if ((peekWord("get") || peekWord("set")) && isMemberPrefix(false)) {
      kind = next().value().equals("get") ? Token.GETTER_DEF : Token.SETTER_DEF;
      isAccessor = true;
    }
    PropertyKey key = parsePropertyKey();
    if (functionFlags != 0
        || isAccessor
        || peek(TokenType.OPEN_PAREN)
        || peek(TokenType.OPEN_ANGLE)) {
      ParseTree function =
          parseFunctionRest(
              current.start(), functionFlags, empty(current.start()), false, false);
      return propertyNode(kind, key, function, start);
    }
    if (eatOpt(TokenType.COLON)) {
      return propertyNode(Token.STRING_KEY, key, parseAssignment(), start);
    }
    return shorthandProperty(key, start);
  }

  /** Whether the current word is a modifier of the property name that follows it. */
  private boolean isMemberPrefix(boolean isAsync) {
    ScannedToken ahead = peekAhead();
    if (isAsync && ahead.newlineBefore()) {
      return false;
    }
    return ahead.is(TokenType.IDENTIFIER)
        || ahead.is(TokenType.STRING)
        || ahead.is(TokenType.NUMBER)
        || ahead.is(TokenType.OPEN_SQUARE)
        || (isAsync && ahead.is(TokenType.STAR));
  }

  private PropertyKey parsePropertyKey() {
    switch (current.type()) {
      case OPEN_SQUARE: {
        next();
        boolean oldNoIn = setNoIn(false);
        ParseTree computed = parseAssignment();
        noIn = oldNoIn;
        eat(TokenType.CLOSE_SQUARE);
        return new PropertyKey(null, computed, false);
      }
      case STRING:
        return new PropertyKey(next().value(), null, true);
      case NUMBER: {
        ScannedToken token = next();
        return new PropertyKey(
            canonicalNumber(Scanner.parseNumber(token.value(), token.start())), null, false);
      }
      case IDENTIFIER:
        return new PropertyKey(next().value(), null, false);
      default:
        throw expected("property name");
    }
  }

  private static String canonicalNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e21) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  /**
   * Builds a property of {@code kind} named by {@code key}, or the equivalent COMPUTED_PROP when
   * the key is computed.
   */
  private ParseTree propertyNode(Token kind, PropertyKey key, ParseTree value, int start) {
    ParseTree node;
    if (key.computed() != null) {
      int flags =
          switch (kind) {
            case MEMBER_FUNCTION_DEF -> Node.COMPUTED_METHOD;
            case GETTER_DEF -> Node.COMPUTED_GETTER;
            case SETTER_DEF -> Node.COMPUTED_SETTER;
            case MEMBER_FIELD_DEF -> Node.COMPUTED_FIELD;
            default -> 0;
          };
      node = start(Token.COMPUTED_PROP, start).addFlag(flags).add(key.computed()).add(value);
    } else {
      node = start(kind, start).setString(key.name()).add(value);
      if (key.quoted()) {
        node.addFlag(Node.QUOTED);
      }
    }
    return finish(node);
  }

  // Classes.

  private List<ParseTree> parseDecorators() {
    List<ParseTree> decorators = new ArrayList<>();
    while (peek(TokenType.AT)) {
      decorators.add(parseDecorator());
    }
    return decorators;
  }

  private ParseTree parseDecorator() {
    ParseTree decorator = start(Token.DECORATOR, current.start());
    eat(TokenType.AT);
    ParseTree expression;
    if (eatOpt(TokenType.OPEN_PAREN)) {
      expression = parseExpression();
      eat(TokenType.CLOSE_PAREN);
    } else {
      int start = current.start();
      expression = parseBindingIdentifier();
      while (peek(TokenType.PERIOD)) {
        next();
        String property = parseIdentifierName();
        expression = finish(start(Token.GETPROP, start).setString(property).add(expression));
      }
      if (peek(TokenType.OPEN_ANGLE)) {
        skipTypeArguments();
      }
      if (peek(TokenType.OPEN_PAREN)) {
        expression = parseArguments(start(Token.CALL, start).add(expression));
      }
    }
    return finish(decorator.add(expression));
  }

  /** Parses a class; {@code abstract} has already been consumed when present. */
  private ParseTree parseClass(int start, List<ParseTree> decorators, boolean nameOptional) {
    ParseTree node = start(Token.CLASS, start);
    eatWord("class");
    if (peek(TokenType.IDENTIFIER) && !peekWord("extends") && !peekWord("implements")) {
      node.add(parseBindingIdentifier());
    } else if (nameOptional) {
      node.add(empty(current.start()));
    } else {
      throw expected("class name");
    }
    skipTypeParametersOpt();
    if (eatWordOpt("extends")) {
      node.add(parseLeftHandSide());
      if (peek(TokenType.OPEN_ANGLE)) {
        skipTypeArguments();
      }
    } else {
      node.add(empty(current.start()));
    }
    if (eatWordOpt("implements")) {
      do {
        skipType();
      } while (eatOpt(TokenType.COMMA));
    }
    node.add(parseClassMembers());
    for (ParseTree decorator : decorators) {
      node.add(decorator);
    }
    return finish(node);
  }

  private ParseTree parseClassMembers() {
    ParseTree members = start(Token.CLASS_MEMBERS, current.start());
    eat(TokenType.OPEN_CURLY);
    boolean oldAsync = inAsync;
    boolean oldGenerator = inGenerator;
    inAsync = false;
    inGenerator = false;
    while (!peek(TokenType.CLOSE_CURLY)) {
      if (peek(TokenType.END_OF_FILE)) {
        throw expected("'}'");
      }
      if (eatOpt(TokenType.SEMI_COLON)) {
        continue;
      }
      ParseTree member = parseClassMember();
      if (member != null) {
        members.add(member);
      }
    }
    inAsync = oldAsync;
    inGenerator = oldGenerator;
    eat(TokenType.CLOSE_CURLY);
    return finish(members);
  }

  /** Returns the member, or null for index signatures. */
  private @Nullable ParseTree parseClassMember() {
    int start = current.start();
    List<ParseTree> decorators = parseDecorators();
    int memberFlags = 0;
    boolean isAbstract = false;
    boolean isDeclare = false;
    while (peek(TokenType.IDENTIFIER)
        && MEMBER_MODIFIERS.contains(current.value())
        && isModifier()) {
      switch (next().value()) {
        case "static" -> memberFlags |= Node.STATIC;
        case "abstract" -> isAbstract = true;
        case "declare" -> isDeclare = true;
        default -> {}
      }
    }
    if (peek(TokenType.OPEN_CURLY)) {
      throw new ParseException("static blocks are not supported", current.start());
    }
    if (isIndexSignature()) {
      skipIndexSignature();
      return null;
    }

    int functionFlags = 0;
    Token kind = Token.MEMBER_FUNCTION_DEF;
    if (peekWord("async") && isMemberPrefix(true)) {
      next();
      functionFlags |= Node.ASYNC;
    }
    if (eatOpt(TokenType.STAR)) {
      functionFlags |= Node.GENERATOR;
    }
    boolean isAccessor = false;
    if ((peekWord("get") || peekWord("set")) && isMemberPrefix(false)) {
      kind = next().value().equals("get") ? Token.GETTER_DEF : Token.SETTER_DEF;
      isAccessor = true;
    }
    PropertyKey key = parsePropertyKey();
    eatOpt(TokenType.QUESTION);
    eatOpt(TokenType.BANG);

    ParseTree member;
    if (functionFlags != 0
        || isAccessor
        || peek(TokenType.OPEN_PAREN)
        || peek(TokenType.OPEN_ANGLE)) {
      boolean isConstructor =
          key.computed() == null
              && "constructor".equals(key.name())
              && (memberFlags & Node.STATIC) == 0;
      ParseTree function =
          parseFunctionRest(
              current.start(), functionFlags, empty(current.start()), isConstructor, true);
      member = propertyNode(kind, key, function, start);
      if (isAbstract || function.hasFlag(Node.AMBIENT)) {
        member.addFlag(Node.AMBIENT);
      }
    } else {
      if (eatOpt(TokenType.COLON)) {
        skipType();
      }
      ParseTree initializer = empty(previous.end());
      if (eatOpt(TokenType.EQUAL)) {
        initializer = parseAssignment();
      }
      eatSemi();
      member = propertyNode(Token.MEMBER_FIELD_DEF, key, initializer, start);
      if (isAbstract) {
        member.addFlag(Node.AMBIENT);
      }
      if (isDeclare) {
        member.addFlag(Node.DECLARED_FIELD);
      }
    }
    member.addFlag(memberFlags);
    for (ParseTree decorator : decorators) {
      member.add(decorator);
    }
    return finish(member);
  }

  private boolean isModifier() {
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.IDENTIFIER)
        || ahead.is(TokenType.STRING)
        || ahead.is(TokenType.NUMBER)
        || ahead.is(TokenType.OPEN_SQUARE)
        || ahead.is(TokenType.STAR)
        || (current.isWord("static") && ahead.is(TokenType.OPEN_CURLY));
  }

  private boolean isIndexSignature() {
    if (!peek(TokenType.OPEN_SQUARE)) {
      return false;
    }
    State state = save();
    next();
    boolean result = peek(TokenType.IDENTIFIER) && peekAhead().is(TokenType.COLON);
    restore(state);
    return result;
  }

  private void skipIndexSignature() {
    eat(TokenType.OPEN_SQUARE);
    parseIdentifierName();
    eat(TokenType.COLON);
    skipType();
    eat(TokenType.CLOSE_SQUARE);
    if (eatOpt(TokenType.COLON)) {
      skipType();
    }
    eatSemi();
  }

  // Modules.

  private ParseTree parseImport() {
    ParseTree node = start(Token.IMPORT, current.start());
    eatWord("import");
    if (peek(TokenType.STRING)) {
      node.add(empty(current.start())).add(empty(current.start())).add(parseStringLiteral());
      eatSemi();
      return finish(node);
    }
    if (peekWord("type") && isTypeOnlyImportClause()) {
      next();
      node.addFlag(Node.TYPE_ONLY);
    }
    ParseTree defaultName = empty(current.start());
    ParseTree bindings = null;
    if (peek(TokenType.IDENTIFIER)) {
      defaultName = parseBindingIdentifier();
      if (peek(TokenType.EQUAL)) {
        throw new ParseException("import assignments are not supported", node.start);
      }
      if (!eatOpt(TokenType.COMMA)) {
        bindings = empty(current.start());
      }
    }
    if (bindings == null) {
      if (peek(TokenType.STAR)) {
        ParseTree star = start(Token.IMPORT_STAR, current.start());
        next();
        eatWord("as");
        star.setString(parseBindingIdentifier().string);
        bindings = finish(star);
      } else {
        bindings = parseImportSpecs();
      }
    }
    eatWord("from");
    node.add(defaultName).add(bindings).add(parseStringLiteral());
    skipImportAttributes();
    eatSemi();
    return finish(node);
  }

  private boolean isTypeOnlyImportClause() {
    ScannedToken ahead = peekAhead();
    return ahead.is(TokenType.OPEN_CURLY)
        || ahead.is(TokenType.STAR)
        || (ahead.is(TokenType.IDENTIFIER) && !ahead.value().equals("from"));
  }

  private void skipImportAttributes() {
    if ((peekWord("assert") || peekWord("with")) && !current.newlineBefore()) {
      next();
      skipBracedBlock();
    }
  }

  private ParseTree parseImportSpecs() {
    ParseTree specs = start(Token.IMPORT_SPECS, current.start());
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      ParseTree spec = start(Token.IMPORT_SPEC, current.start());
      if (peekWord("type") && isTypeOnlySpecifier()) {
        next();
        spec.addFlag(Node.TYPE_ONLY);
      }
      ParseTree imported = parseModuleExportName();
      ParseTree local;
      if (eatWordOpt("as")) {
        local = parseBindingIdentifier();
      } else {
        local = new ParseTree(Token.NAME, imported.start, imported.end).setString(imported.string);
      }
      specs.add(finish(spec.add(imported).add(local)));
      if (!peek(TokenType.CLOSE_CURLY)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(specs);
  }

  private boolean isTypeOnlySpecifier() {
    ScannedToken ahead = peekAhead();
    return (ahead.is(TokenType.IDENTIFIER) || ahead.is(TokenType.STRING))
        && !ahead.value().equals("as");
  }

  private ParseTree parseModuleExportName() {
    if (peek(TokenType.STRING)) {
      ScannedToken token = next();
      return leaf(Token.NAME, token).setString(token.value()).addFlag(Node.QUOTED);
    }
    ScannedToken token = current;
    return leaf(Token.NAME, token).setString(parseIdentifierName());
  }

  private ParseTree parseExport(int start, List<ParseTree> decorators) {
    ParseTree node = start(Token.EXPORT, start);
    eatWord("export");
    if (peek(TokenType.EQUAL) || peekWord("import")) {
      throw new ParseException("export assignments are not supported", start);
    }
    if (peekWord("as")) {
      // export as namespace X;
      next();
      eatWord("namespace");
      parseIdentifierName();
      eatSemi();
      return finish(start(Token.DECLARE, start));
    }
    if (eatWordOpt("default")) {
      node.addFlag(Node.DEFAULT);
      node.add(parseExportDefaultValue(decorators));
      return finish(node);
    }
    if (peekWord("type")
        && (peekAhead().is(TokenType.OPEN_CURLY) || peekAhead().is(TokenType.STAR))) {
      next();
      node.addFlag(Node.TYPE_ONLY);
    }
    if (peek(TokenType.STAR)) {
      next();
      ParseTree exportAll = start(Token.EXPORT_ALL, start).addFlag(node.flags);
      if (eatWordOpt("as")) {
        exportAll.setString(parseModuleExportName().string);
      }
      eatWord("from");
      exportAll.add(parseStringLiteral());
      skipImportAttributes();
      eatSemi();
      return finish(exportAll);
    }
    if (peek(TokenType.OPEN_CURLY)) {
      node.add(parseExportSpecs());
      if (eatWordOpt("from")) {
        node.add(parseStringLiteral());
        skipImportAttributes();
      } else {
        node.add(empty(previous.end()));
      }
      eatSemi();
      return finish(node);
    }
    if (peek(TokenType.AT)) {
      List<ParseTree> all = new ArrayList<>(decorators);
      all.addAll(parseDecorators());
      decorators = all;
    }
    if (!decorators.isEmpty()) {
      eatWordOpt("abstract");
      node.add(parseClass(start, decorators, false));
    } else {
      node.add(parseStatement());
    }
    return finish(node);
  }

  private ParseTree parseExportDefaultValue(List<ParseTree> decorators) {
    int start = current.start();
    if (peekWord("function")) {
      return parseFunctionDeclaration(start, false, true);
    }
    if (peekWord("async") && isAsyncFunction()) {
      next();
      return parseFunctionDeclaration(start, true, true);
    }
    if (peek(TokenType.AT)) {
      List<ParseTree> all = new ArrayList<>(decorators);
      all.addAll(parseDecorators());
      decorators = all;
    }
    if (peekWord("abstract") && peekAhead().isWord("class")) {
      next();
    }
    if (peekWord("class")) {
      return parseClass(decorators.isEmpty() ? start : decorators.get(0).start, decorators, true);
    }
    if (peekWord("interface") && nextIsIdentifierOnSameLine()) {
      return parseInterface(start);
    }
    ParseTree value = parseAssignment();
    eatSemi();
    return value;
  }

  private ParseTree parseExportSpecs() {
    ParseTree specs = start(Token.EXPORT_SPECS, current.start());
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      ParseTree spec = start(Token.EXPORT_SPEC, current.start());
      if (peekWord("type") && isTypeOnlySpecifier()) {
        next();
        spec.addFlag(Node.TYPE_ONLY);
      }
      ParseTree local = parseModuleExportName();
      ParseTree exported;
      if (eatWordOpt("as")) {
        exported = parseModuleExportName();
      } else {
        exported =
            new ParseTree(Token.NAME, local.start, local.end)
                .setString(local.string)
                .addFlag(local.flags);
      }
      specs.add(finish(spec.add(local).add(exported)));
      if (!peek(TokenType.CLOSE_CURLY)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(specs);
  }

  // TypeScript declarations.

  private ParseTree parseInterface(int start) {
    ParseTree node = start(Token.INTERFACE, start);
    eatWord("interface");
    node.setString(parseIdentifierName());
    skipTypeParametersOpt();
    if (eatWordOpt("extends")) {
      do {
        skipType();
      } while (eatOpt(TokenType.COMMA));
    }
    skipBracedBlock();
    return finish(node);
  }

  private ParseTree parseTypeAlias(int start) {
    ParseTree node = start(Token.TYPE_ALIAS, start);
    eatWord("type");
    node.setString(parseIdentifierName());
    skipTypeParametersOpt();
    eat(TokenType.EQUAL);
    skipType();
    eatSemi();
    return finish(node);
  }

  private ParseTree parseEnum(int start) {
    ParseTree node = start(Token.ENUM, start);
    if (eatWordOpt("const")) {
      node.addFlag(Node.CONST_ENUM);
    }
    eatWord("enum");
    node.add(parseBindingIdentifier());
    eat(TokenType.OPEN_CURLY);
    while (!peek(TokenType.CLOSE_CURLY)) {
      ParseTree member = start(Token.ENUM_MEMBER, current.start());
      if (peek(TokenType.STRING)) {
        member.setString(next().value()).addFlag(Node.QUOTED);
      } else {
        member.setString(parseIdentifierName());
      }
      if (eatOpt(TokenType.EQUAL)) {
        member.add(parseAssignment());
      }
      node.add(finish(member));
      if (!peek(TokenType.CLOSE_CURLY)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_CURLY);
    return finish(node);
  }

  /**
   * Parses the rest of {@code namespace A.B { ... }}. A dotted name declares nested namespaces,
   * each inner one exported from the one enclosing it.
   */
  private ParseTree parseNamespace(int start) {
    ParseTree node = start(Token.NAMESPACE, start);
    node.setString(parseIdentifierName());
    if (peek(TokenType.PERIOD)) {
      int innerStart = next().end();
      ParseTree block = start(Token.BLOCK, innerStart);
      ParseTree export = start(Token.EXPORT, innerStart);
      export.add(parseNamespace(current.start()));
      block.add(finish(export));
      node.add(finish(block));
    } else {
      node.add(parseBlock());
    }
    return finish(node);
  }

  /** Parses and drops an ambient declaration. */
  private ParseTree parseDeclare(int start) {
    eatWord("declare");
    if (eatWordOpt("global")) {
      skipBracedBlock();
    } else if (peekWord("module") || peekWord("namespace")) {
      next();
      if (!eatOpt(TokenType.STRING)) {
        do {
          parseIdentifierName();
        } while (eatOpt(TokenType.PERIOD));
      }
      if (peek(TokenType.OPEN_CURLY)) {
        skipBracedBlock();
      } else {
        eatSemi();
      }
    } else {
      parseStatement();
    }
    return finish(start(Token.DECLARE, start));
  }

  // Types. Everything below consumes type syntax without building trees.

  private void skipTypeParametersOpt() {
    if (peek(TokenType.OPEN_ANGLE)) {
      skipTypeParameters();
    }
  }

  private void skipTypeParameters() {
    eat(TokenType.OPEN_ANGLE);
    while (!peek(TokenType.CLOSE_ANGLE)) {
      while ((peekWord("in") || peekWord("out") || peekWord("const"))
          && peekAhead().is(TokenType.IDENTIFIER)) {
        next();
      }
      parseIdentifierName();
      if (eatWordOpt("extends")) {
        skipType();
      }
      if (eatOpt(TokenType.EQUAL)) {
        skipType();
      }
      if (!peek(TokenType.CLOSE_ANGLE)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_ANGLE);
  }

  private void skipTypeArguments() {
    eat(TokenType.OPEN_ANGLE);
    while (!peek(TokenType.CLOSE_ANGLE)) {
      skipType();
      if (!peek(TokenType.CLOSE_ANGLE)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_ANGLE);
  }

  private void skipType() {
    if (isStartOfFunctionType()) {
      skipFunctionType();
      return;
    }
    skipUnionType();
    if (peekWord("extends") && !current.newlineBefore()) {
      // Conditional type.
      next();
      if (isStartOfFunctionType()) {
        skipFunctionType();
      } else {
        skipUnionType();
      }
      eat(TokenType.QUESTION);
      skipType();
      eat(TokenType.COLON);
      skipType();
    }
  }

  private boolean isStartOfFunctionType() {
    if (peek(TokenType.OPEN_ANGLE) || peekWord("new")) {
      return true;
    }
    if (peekWord("abstract") && peekAhead().isWord("new")) {
      return true;
    }
    if (!peek(TokenType.OPEN_PAREN)) {
      return false;
    }
    State state = save();
    try {
      skipParens();
      return peek(TokenType.ARROW);
    } catch (ParseException e) {
      return false;
    } finally {
      restore(state);
    }
  }

  private void skipFunctionType() {
    eatWordOpt("abstract");
    eatWordOpt("new");
    skipTypeParametersOpt();
    skipParens();
    eat(TokenType.ARROW);
    skipType();
  }

  private void skipParens() {
    eat(TokenType.OPEN_PAREN);
    int depth = 1;
    while (depth > 0) {
      switch (current.type()) {
        case END_OF_FILE -> throw expected("')'");
        case OPEN_PAREN -> depth++;
        case CLOSE_PAREN -> depth--;
        default -> {}
      }
      next();
    }
  }

  private void skipUnionType() {
    if (peek(TokenType.BAR) || peek(TokenType.AMPERSAND)) {
      next();
    }
    skipTypeOperand();
    while (peek(TokenType.BAR) || peek(TokenType.AMPERSAND)) {
      next();
      skipTypeOperand();
    }
  }

  private void skipTypeOperand() {
    if (isStartOfFunctionType()) {
      skipFunctionType();
      return;
    }
    if ((peekWord("keyof") || peekWord("unique") || peekWord("readonly"))
        && startsTypeOnSameLine(peekAhead())) {
      next();
      skipTypeOperand();
      return;
    }
    if (peekWord("infer") && nextIsIdentifierOnSameLine()) {
      next();
      parseIdentifierName();
      return;
    }
    skipPrimaryType();
    while (peek(TokenType.OPEN_SQUARE) && !current.newlineBefore()) {
      next();
      if (!peek(TokenType.CLOSE_SQUARE)) {
        skipType();
      }
      eat(TokenType.CLOSE_SQUARE);
    }
  }

  private static boolean startsTypeOnSameLine(ScannedToken token) {
    if (token.newlineBefore()) {
      return false;
    }
    return switch (token.type()) {
      case IDENTIFIER, OPEN_PAREN, OPEN_SQUARE, OPEN_CURLY, STRING, NUMBER -> true;
      default -> false;
    };
  }

  private void skipPrimaryType() {
    switch (current.type()) {
      case OPEN_PAREN -> {
        next();
        skipType();
        eat(TokenType.CLOSE_PAREN);
      }
      case OPEN_CURLY -> skipBracedBlock();
      case OPEN_SQUARE -> skipTupleType();
      case STRING, NUMBER, NO_SUBSTITUTION_TEMPLATE, STAR, QUESTION -> next();
      case TEMPLATE_HEAD -> skipTemplateLiteralType();
      case MINUS -> {
        next();
        eat(TokenType.NUMBER);
      }
      case IDENTIFIER -> skipTypeReference();
      default -> throw expected("type");
    }
  }

  private void skipTypeReference() {
    if (peekWord("typeof")) {
      next();
      if (peekWord("import")) {
        skipImportType();
      } else {
        skipEntityName();
      }
      if (peek(TokenType.OPEN_ANGLE) && !current.newlineBefore()) {
        skipTypeArguments();
      }
      return;
    }
    if (peekWord("import") && peekAhead().is(TokenType.OPEN_PAREN)) {
      skipImportType();
      return;
    }
    if (peekWord("asserts") && nextIsIdentifierOnSameLine()) {
      next();
      parseIdentifierName();
      if (eatWordOpt("is")) {
        skipType();
      }
      return;
    }
    skipEntityName();
    if (peek(TokenType.OPEN_ANGLE) && !current.newlineBefore()) {
      skipTypeArguments();
    }
    if (peekWord("is") && !current.newlineBefore()) {
      // Type predicate.
      next();
      skipType();
    }
  }

  private void skipEntityName() {
    parseIdentifierName();
    while (eatOpt(TokenType.PERIOD)) {
      parseIdentifierName();
    }
  }

  private void skipImportType() {
    eatWord("import");
    eat(TokenType.OPEN_PAREN);
    eat(TokenType.STRING);
    eat(TokenType.CLOSE_PAREN);
    while (eatOpt(TokenType.PERIOD)) {
      parseIdentifierName();
    }
    if (peek(TokenType.OPEN_ANGLE)) {
      skipTypeArguments();
    }
  }

  private void skipTupleType() {
    eat(TokenType.OPEN_SQUARE);
    while (!peek(TokenType.CLOSE_SQUARE)) {
      eatOpt(TokenType.SPREAD);
      if (isLabeledTupleElement()) {
        next();
        eatOpt(TokenType.QUESTION);
        eat(TokenType.COLON);
      }
      skipType();
      eatOpt(TokenType.QUESTION);
      if (!peek(TokenType.CLOSE_SQUARE)) {
        eat(TokenType.COMMA);
      }
    }
    eat(TokenType.CLOSE_SQUARE);
  }

  private boolean isLabeledTupleElement() {
    if (!peek(TokenType.IDENTIFIER)) {
      return false;
    }
    State state = save();
    next();
    eatOpt(TokenType.QUESTION);
    boolean result = peek(TokenType.COLON);
    restore(state);
    return result;
  }

  private void skipTemplateLiteralType() {
    eat(TokenType.TEMPLATE_HEAD);
    while (true) {
      skipType();
      if (!peek(TokenType.CLOSE_CURLY)) {
        throw expected("'}'");
      }
      current = scanner.rescanTemplateContinuation(current);
      boolean tail = peek(TokenType.TEMPLATE_TAIL);
      next();
      if (tail) {
        return;
      }
    }
  }

  /** Skips a balanced {@code {...}}, including any template literals inside it. */
  private void skipBracedBlock() {
    eat(TokenType.OPEN_CURLY);
    Deque<TokenType> open = new ArrayDeque<>();
    open.push(TokenType.OPEN_CURLY);
    while (!open.isEmpty()) {
      switch (current.type()) {
        case END_OF_FILE -> throw expected("'}'");
        case OPEN_CURLY, TEMPLATE_HEAD -> open.push(current.type());
        case CLOSE_CURLY -> {
          if (open.peek() == TokenType.TEMPLATE_HEAD) {
            current = scanner.rescanTemplateContinuation(current);
            if (peek(TokenType.TEMPLATE_TAIL)) {
              open.pop();
            }
          } else {
            open.pop();
          }
        }
        default -> {}
      }
      next();
    }
  }
}
