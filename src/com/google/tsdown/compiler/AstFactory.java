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

package com.google.tsdown.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Creates synthesized nodes in a {@link TransformRecord}. Methods taking an {@code origin} make
 * the new node stand in for that node when mapping output back to the source.
 */
final class AstFactory {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final TransformRecord record;

  AstFactory(TransformRecord record) {
    this.record = record;
  }

  TransformRecord getRecord() {
    return record;
  }

  private Node node(Token token, @Nullable Node origin, Node... children) {
    return record.newNode(token, Arrays.asList(children), null, 0, 0, origin);
  }

  private Node node(Token token, @Nullable Node origin, List<Node> children) {
    return record.newNode(token, children, null, 0, 0, origin);
  }

  // Statements.

  /** Wraps {@code expr} in an EXPR_RESULT that maps to wherever {@code expr} maps. */
  Node exprResult(Node expr) {
    return node(Token.EXPR_RESULT, expr, expr);
  }

  Node createEmpty() {
    return node(Token.EMPTY, null);
  }

  Node createBlock(Node... statements) {
    return node(Token.BLOCK, null, statements);
  }

  Node createBlock(List<Node> statements) {
    return node(Token.BLOCK, null, statements);
  }

  Node createIf(Node cond, Node then) {
    return node(Token.IF, null, cond, then);
  }

  Node createIf(Node cond, Node then, Node elseBody) {
    return node(Token.IF, null, cond, then, elseBody);
  }

  Node createFor(Node init, Node cond, Node incr, Node body) {
    return node(Token.FOR, null, init, cond, incr, body);
  }

  Node createWhile(Node cond, Node body) {
    return node(Token.WHILE, null, cond, body);
  }

  Node createBreak() {
    return node(Token.BREAK, null);
  }

  Node createBreak(@Nullable String label, @Nullable Node origin) {
    return record.newNode(Token.BREAK, ImmutableList.of(), label, 0, 0, origin);
  }

  Node createContinue(@Nullable String label, @Nullable Node origin) {
    return record.newNode(Token.CONTINUE, ImmutableList.of(), label, 0, 0, origin);
  }

  Node createLabel(String label, Node statement) {
    return record.newNode(Token.LABEL, ImmutableList.of(statement), label, 0, 0, null);
  }

  Node createCatch(Node binding, Node block) {
    return node(Token.CATCH, null, binding, block);
  }

  Node createTryFinally(Node tryBody, Node finallyBody) {
    return node(Token.TRY, null, tryBody, createEmpty(), finallyBody);
  }

  Node createTryCatchFinally(Node tryBody, Node catchNode, @Nullable Node finallyBody) {
    return finallyBody == null
        ? node(Token.TRY, null, tryBody, catchNode)
        : node(Token.TRY, null, tryBody, catchNode, finallyBody);
  }

  Node createThrow(Node value) {
    return node(Token.THROW, null, value);
  }

  Node createThrow(Node value, @Nullable Node origin) {
    return node(Token.THROW, origin, value);
  }

  Node createReturn() {
    return node(Token.RETURN, null);
  }

  Node createReturn(Node value) {
    return node(Token.RETURN, null, value);
  }

  Node createReturn(@Nullable Node value, @Nullable Node origin) {
    return value == null ? node(Token.RETURN, origin) : node(Token.RETURN, origin, value);
  }

  Node createYield(Node value) {
    return node(Token.YIELD, null, value);
  }

  Node createAwait(Node value) {
    return node(Token.AWAIT, null, value);
  }

  /** Declares {@code name} with {@code var}, initialized to {@code value} if present. */
  Node createSingleVarNameDeclaration(String name, @Nullable Node value) {
    return createVar(ImmutableList.of(createDeclarator(name, value, null)));
  }

  Node createSingleVarNameDeclaration(String name, @Nullable Node value, @Nullable Node origin) {
    return node(Token.VAR, origin, createDeclarator(name, value, origin));
  }

  /** A NAME declarator for a VAR, LET or CONST, holding its initializer as its child. */
  Node createDeclarator(String name, @Nullable Node value, @Nullable Node origin) {
    return record.newNode(
        Token.NAME,
        value == null ? ImmutableList.of() : ImmutableList.of(value),
        name,
        0,
        0,
        origin);
  }

  Node createVar(List<Node> declarators) {
    return node(Token.VAR, null, declarators);
  }

  Node createVar(List<Node> declarators, @Nullable Node origin) {
    return node(Token.VAR, origin, declarators);
  }

  // Literals.

  Node createString(String value) {
    return record.newNode(Token.STRINGLIT, ImmutableList.of(), value, 0, 0, null);
  }

  Node createString(String value, @Nullable Node origin) {
    return record.newNode(Token.STRINGLIT, ImmutableList.of(), value, 0, 0, origin);
  }

  Node createNumber(double value) {
    return record.newNode(Token.NUMBER, ImmutableList.of(), null, value, 0, null);
  }

  Node createNumber(double value, @Nullable Node origin) {
    return record.newNode(Token.NUMBER, ImmutableList.of(), null, value, 0, origin);
  }

  /** A numeric instruction for the generator runtime, printed with a comment naming it. */
  Node createOpcode(int opcode, String comment) {
    return record.newNode(
        Token.NUMBER, ImmutableList.of(), opcode + " /*" + comment + "*/", opcode, 0, null);
  }

  Node createBoolean(boolean value) {
    return node(value ? Token.TRUE : Token.FALSE, null);
  }

  Node createNull() {
    return node(Token.NULL, null);
  }

  /** Returns {@code void 0}. */
  Node createVoid(Node value) {
    return node(Token.VOID, null, value);
  }

  Node createUndefinedValue() {
    return createVoid(createNumber(0));
  }

  Node createRegExp(String raw, @Nullable Node origin) {
    return record.newNode(Token.REGEXP, ImmutableList.of(), raw, 0, 0, origin);
  }

  Node createThis() {
    return node(Token.THIS, null);
  }

  Node createThis(@Nullable Node origin) {
    return node(Token.THIS, origin);
  }

  Node createSuper(@Nullable Node origin) {
    return node(Token.SUPER, origin);
  }

  Node createName(String name) {
    return record.newNode(Token.NAME, ImmutableList.of(), name, 0, 0, null);
  }

  /** A reference to {@code name} that maps to {@code origin}, and is named after it. */
  Node createName(String name, @Nullable Node origin) {
    return record.newNode(Token.NAME, ImmutableList.of(), name, 0, 0, origin);
  }

  /** Creates a property access chain such as {@code Object.defineProperty}. */
  Node createQName(String qname) {
    List<String> parts = DOT_SPLITTER.splitToList(qname);
    Node result = createName(parts.get(0));
    for (int i = 1; i < parts.size(); i++) {
      result = createGetProp(result, parts.get(i));
    }
    return result;
  }

  Node createPrototypeAccess(Node constructor) {
    return createGetProp(constructor, "prototype");
  }

  // Property access and calls.

  Node createGetProp(Node receiver, String property) {
    return record.newNode(Token.GETPROP, ImmutableList.of(receiver), property, 0, 0, null);
  }

  Node createGetProp(Node receiver, String property, @Nullable Node origin) {
    return record.newNode(Token.GETPROP, ImmutableList.of(receiver), property, 0, 0, origin);
  }

  Node createGetElem(Node receiver, Node key) {
    return node(Token.GETELEM, null, receiver, key);
  }

  Node createGetElem(Node receiver, Node key, @Nullable Node origin) {
    return node(Token.GETELEM, origin, receiver, key);
  }

  Node createDelProp(Node target) {
    return node(Token.DELPROP, null, target);
  }

  Node createCall(Node callee, Node... args) {
    return createCall(callee, Arrays.asList(args));
  }

  Node createCall(Node callee, List<Node> args) {
    List<Node> children = new ArrayList<>(args.size() + 1);
    children.add(callee);
    children.addAll(args);
    return node(Token.CALL, null, children);
  }

  Node createCall(Node callee, List<Node> args, @Nullable Node origin) {
    List<Node> children = new ArrayList<>(args.size() + 1);
    children.add(callee);
    children.addAll(args);
    return node(Token.CALL, origin, children);
  }

  Node createNewNode(Node target, List<Node> args) {
    List<Node> children = new ArrayList<>(args.size() + 1);
    children.add(target);
    children.addAll(args);
    return node(Token.NEW, null, children);
  }

  /** Calls a runtime helper and records that the output needs its declaration. */
  Node createHelperCall(RuntimeHelper helper, Node... args) {
    return createHelperCall(helper, Arrays.asList(args));
  }

  Node createHelperCall(RuntimeHelper helper, List<Node> args) {
    record.requireHelper(helper);
    return createCall(createName(helper.getName()), args);
  }

  /** The verbatim declaration of a runtime helper. */
  Node createHelperText(RuntimeHelper helper) {
    return record.newNode(Token.HELPER_TEXT, ImmutableList.of(), helper.getText(), 0, 0, null);
  }

  // Operators.

  Node createBinary(Token op, Node left, Node right) {
    checkArgument(op.isBinaryOperator() || op.isAssign(), op);
    return node(op, null, left, right);
  }

  Node createBinary(Token op, Node left, Node right, @Nullable Node origin) {
    checkArgument(op.isBinaryOperator() || op.isAssign(), op);
    return node(op, origin, left, right);
  }

  Node createUnary(Token op, Node operand) {
    return node(op, null, operand);
  }

  Node createNot(Node value) {
    return node(Token.NOT, null, value);
  }

  Node createTypeof(Node value) {
    return node(Token.TYPEOF, null, value);
  }

  Node createIn(Node key, Node object) {
    return node(Token.IN, null, key, object);
  }

  Node createComma(Node left, Node right) {
    return node(Token.COMMA, null, left, right);
  }

  /** Joins the expressions with commas; a single expression is returned as is. */
  Node createCommas(List<Node> expressions) {
    checkArgument(!expressions.isEmpty());
    Node result = expressions.get(0);
    for (int i = 1; i < expressions.size(); i++) {
      result = createComma(result, expressions.get(i));
    }
    return result;
  }

  Node createAnd(Node left, Node right) {
    return node(Token.AND, null, left, right);
  }

  Node createOr(Node left, Node right) {
    return node(Token.OR, null, left, right);
  }

  Node createAdd(Node left, Node right) {
    return node(Token.ADD, null, left, right);
  }

  Node createSub(Node left, Node right) {
    return node(Token.SUB, null, left, right);
  }

  /** Returns {@code ++operand}, or {@code operand++} when {@code isPost}. */
  Node createInc(Node operand, boolean isPost) {
    return record.newNode(
        Token.INC, ImmutableList.of(operand), null, 0, isPost ? Node.POSTFIX : 0, null);
  }

  Node createLessThan(Node left, Node right) {
    return node(Token.LT, null, left, right);
  }

  Node createSheq(Node left, Node right) {
    return node(Token.SHEQ, null, left, right);
  }

  Node createShne(Node left, Node right) {
    return node(Token.SHNE, null, left, right);
  }

  Node createEq(Node left, Node right) {
    return node(Token.EQ, null, left, right);
  }

  Node createNe(Node left, Node right) {
    return node(Token.NE, null, left, right);
  }

  Node createHook(Node cond, Node then, Node elseValue) {
    return node(Token.HOOK, null, cond, then, elseValue);
  }

  Node createHook(Node cond, Node then, Node elseValue, @Nullable Node origin) {
    return node(Token.HOOK, origin, cond, then, elseValue);
  }

  Node createAssign(Node target, Node value) {
    return node(Token.ASSIGN, null, target, value);
  }

  Node createAssign(Node target, Node value, @Nullable Node origin) {
    return node(Token.ASSIGN, origin, target, value);
  }

  Node createAssign(String name, Node value) {
    return createAssign(createName(name), value);
  }

  Node createAssignStatement(Node target, Node value) {
    return exprResult(createAssign(target, value));
  }

  // Object and array literals.

  Node createObjectLit(Node... properties) {
    return node(Token.OBJECTLIT, null, properties);
  }

  Node createObjectLit(List<Node> properties) {
    return node(Token.OBJECTLIT, null, properties);
  }

  Node createStringKey(String key, Node value) {
    return record.newNode(Token.STRING_KEY, ImmutableList.of(value), key, 0, 0, null);
  }

  Node createStringKey(String key, Node value, @Nullable Node origin) {
    return record.newNode(Token.STRING_KEY, ImmutableList.of(value), key, 0, 0, origin);
  }

  Node createQuotedStringKey(String key, Node value) {
    return record.newNode(Token.STRING_KEY, ImmutableList.of(value), key, 0, Node.QUOTED, null);
  }

  Node createComputedProperty(Node key, Node value) {
    return node(Token.COMPUTED_PROP, null, key, value);
  }

  Node createArraylit(Node... elements) {
    return node(Token.ARRAYLIT, null, elements);
  }

  Node createArraylit(List<Node> elements) {
    return node(Token.ARRAYLIT, null, elements);
  }

  // Functions.

  Node createParamList(String... names) {
    List<Node> params = new ArrayList<>();
    for (String name : names) {
      params.add(createName(name));
    }
    return node(Token.PARAM_LIST, null, params);
  }

  Node createParamList(List<Node> params) {
    return node(Token.PARAM_LIST, null, params);
  }

  /** Creates a function expression or declaration; {@code name} null makes it anonymous. */
  Node createFunction(@Nullable String name, Node paramList, Node body, int flags) {
    Node nameNode = name == null ? createEmpty() : createName(name);
    return record.newNode(
        Token.FUNCTION, ImmutableList.of(nameNode, paramList, body), null, 0, flags, null);
  }

  Node createFunction(
      @Nullable String name, Node paramList, Node body, int flags, @Nullable Node origin) {
    Node nameNode = name == null ? createEmpty() : createName(name);
    return record.newNode(
        Token.FUNCTION, ImmutableList.of(nameNode, paramList, body), null, 0, flags, origin);
  }

  Node createEmptyFunction() {
    return createFunction(null, createParamList(), createBlock(), 0);
  }

  Node createZeroArgFunction(@Nullable String name, Node body) {
    return createFunction(name, createParamList(), body, 0);
  }

  Node createMemberFunctionDef(String name, Node function) {
    return record.newNode(
        Token.MEMBER_FUNCTION_DEF, ImmutableList.of(function), name, 0, 0, null);
  }
}
