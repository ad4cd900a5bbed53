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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.NodeArena;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  private NodeArena arena;

  @Test
  public void testIdsAreAssignedChildrenFirst() {
    parse("let x = 1; f(x);");
    assertThat(arena.getRoot().getId()).isEqualTo(arena.size() - 1);
    assertThat(arena.getRoot().getToken()).isEqualTo(Token.SCRIPT);
    for (Node child : children(arena.getRoot())) {
      assertThat(child.getId()).isLessThan(arena.getRoot().getId());
    }
  }

  @Test
  public void testDeclarationWithTypeAnnotation() {
    Node let = parseStatement("let x: Array<number> = 1;");
    assertThat(let.getToken()).isEqualTo(Token.LET);
    Node name = child(let, 0);
    assertThat(name.getToken()).isEqualTo(Token.NAME);
    assertThat(name.getString()).isEqualTo("x");
    assertThat(child(name, 0).getDouble()).isEqualTo(1.0);
  }

  @Test
  public void testPositions() {
    Node statement = parseStatement("  foo(bar);");
    Node call = child(statement, 0);
    Node callee = child(call, 0);
    assertThat(callee.getStart()).isEqualTo(2);
    assertThat(callee.getEnd()).isEqualTo(5);
    assertThat(call.getEnd()).isEqualTo(10);
  }

  @Test
  public void testAwaitOnlyInAsyncFunctions() {
    Node async = parseStatement("async function f() { await g(); }");
    assertThat(async.isAsync()).isTrue();
    Node body = child(async, 2);
    assertThat(child(child(body, 0), 0).getToken()).isEqualTo(Token.AWAIT);

    Node plain = parseStatement("function f() { await(1); }");
    Node call = child(child(child(plain, 2), 0), 0);
    assertThat(call.getToken()).isEqualTo(Token.CALL);
    assertThat(child(call, 0).getString()).isEqualTo("await");
  }

  @Test
  public void testArrowWithExpressionBody() {
    Node arrow = child(parseStatement("(a: number) => a;"), 0);
    assertThat(arrow.getToken()).isEqualTo(Token.FUNCTION);
    assertThat(arrow.isArrow()).isTrue();
    assertThat(arrow.hasFlag(Node.EXPRESSION_BODY)).isTrue();
    assertThat(child(arrow, 2).getToken()).isEqualTo(Token.NAME);
  }

  @Test
  public void testTypeAssertions() {
    assertThat(child(parseStatement("x as any;"), 0).getToken()).isEqualTo(Token.CAST);
    assertThat(child(parseStatement("<string>y;"), 0).getToken()).isEqualTo(Token.CAST);
    assertThat(child(parseStatement("z!;"), 0).getToken()).isEqualTo(Token.NON_NULL);
  }

  @Test
  public void testGenericCallIsACall() {
    Node call = child(parseStatement("f<T>(x);"), 0);
    assertThat(call.getToken()).isEqualTo(Token.CALL);
    assertThat(children(call)).hasSize(2);
  }

  @Test
  public void testTypeDeclarations() {
    Node iface = parseStatement("interface I { x: number; }");
    assertThat(iface.getToken()).isEqualTo(Token.INTERFACE);
    assertThat(iface.getString()).isEqualTo("I");
    assertThat(parseStatement("type T = string | number;").getToken())
        .isEqualTo(Token.TYPE_ALIAS);
    assertThat(parseStatement("declare const x: number;").getToken()).isEqualTo(Token.DECLARE);
  }

  @Test
  public void testConstEnum() {
    Node e = parseStatement("const enum C { A, B = 2 }");
    assertThat(e.getToken()).isEqualTo(Token.ENUM);
    assertThat(e.hasFlag(Node.CONST_ENUM)).isTrue();
    ImmutableList<Node> members = children(e);
    assertThat(members).hasSize(3);
    assertThat(members.get(1).getString()).isEqualTo("A");
    assertThat(children(members.get(1))).isEmpty();
    assertThat(child(members.get(2), 0).getDouble()).isEqualTo(2.0);
  }

  @Test
  public void testTypeOnlyImport() {
    Node n = parseStatement("import type { T } from \"m\";");
    assertThat(n.getToken()).isEqualTo(Token.IMPORT);
    assertThat(n.hasFlag(Node.TYPE_ONLY)).isTrue();
  }

  @Test
  public void testParameterProperties() {
    Node classNode = parseStatement("class A { constructor(private x, public y = 1) {} }");
    Node constructor = child(child(classNode, 2), 0);
    assertThat(constructor.getString()).isEqualTo("constructor");
    ImmutableList<Node> params = children(child(child(constructor, 0), 1));
    assertThat(params.get(0).getToken()).isEqualTo(Token.NAME);
    assertThat(params.get(0).hasFlag(Node.PARAM_PROPERTY)).isTrue();
    assertThat(params.get(1).getToken()).isEqualTo(Token.DEFAULT_VALUE);
    assertThat(params.get(1).hasFlag(Node.PARAM_PROPERTY)).isTrue();
  }

  @Test
  public void testOptionalChain() {
    Node outer = child(parseStatement("a?.b.c;"), 0);
    assertThat(outer.getToken()).isEqualTo(Token.GETPROP);
    assertThat(outer.getString()).isEqualTo("c");
    assertThat(outer.hasFlag(Node.IN_OPTIONAL_CHAIN)).isTrue();
    assertThat(outer.hasFlag(Node.OPTIONAL_CHAIN_START)).isFalse();
    Node inner = child(outer, 0);
    assertThat(inner.getString()).isEqualTo("b");
    assertThat(inner.hasFlag(Node.OPTIONAL_CHAIN_START)).isTrue();
  }

  @Test
  public void testTemplateLiteral() {
    Node template = child(parseStatement("`a${b}c`;"), 0);
    assertThat(template.getToken()).isEqualTo(Token.TEMPLATELIT);
    ImmutableList<Node> parts = children(template);
    assertThat(parts).hasSize(3);
    assertThat(parts.get(0).getString()).isEqualTo("a");
    assertThat(parts.get(1).getString()).isEqualTo("b");
    assertThat(parts.get(2).getString()).isEqualTo("c");
  }

  @Test
  public void testForAwait() {
    Node function = parseStatement("async function f() { for await (const x of y) {} }");
    Node loop = child(child(function, 2), 0);
    assertThat(loop.getToken()).isEqualTo(Token.FOR_OF);
    assertThat(loop.hasFlag(Node.FOR_AWAIT)).isTrue();
  }

  @Test
  public void testDottedNamespace() {
    Node outer = parseStatement("namespace A.B { let x = 1; }");
    assertThat(outer.getToken()).isEqualTo(Token.NAMESPACE);
    assertThat(outer.getString()).isEqualTo("A");
    Node export = child(child(outer, 0), 0);
    assertThat(export.getToken()).isEqualTo(Token.EXPORT);
    Node inner = child(export, 0);
    assertThat(inner.getToken()).isEqualTo(Token.NAMESPACE);
    assertThat(inner.getString()).isEqualTo("B");
    assertThat(child(child(inner, 0), 0).getToken()).isEqualTo(Token.LET);

    assertThat(parseStatement("module M {}").getToken()).isEqualTo(Token.NAMESPACE);
    assertThat(parseStatement("module \"m\" {}").getToken()).isEqualTo(Token.DECLARE);
    assertThat(child(parseStatement("namespace(1);"), 0).getToken()).isEqualTo(Token.CALL);
  }

  @Test
  public void testSyntaxError() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> ParserRunner.parse(SourceFile.fromCode("bad.ts", "function (")));
    assertThat(e.getOffset()).isAtLeast(0);
  }

  @Test
  public void testCookTemplateString() {
    assertThat(ParserRunner.cookTemplateString("a\\tb\\u0041\\x42\\u{43}")).isEqualTo("a\tbABC");
    assertThat(ParserRunner.cookTemplateString("x\r\ny")).isEqualTo("x\ny");
    assertThrows(ParseException.class, () -> ParserRunner.cookTemplateString("\\unicode"));
  }

  @Test
  public void testIsIdentifierName() {
    assertThat(ParserRunner.isIdentifierName("foo")).isTrue();
    assertThat(ParserRunner.isIdentifierName("$_a1")).isTrue();
    assertThat(ParserRunner.isIdentifierName("default")).isTrue();
    assertThat(ParserRunner.isIdentifierName("1a")).isFalse();
    assertThat(ParserRunner.isIdentifierName("a-b")).isFalse();
    assertThat(ParserRunner.isIdentifierName("")).isFalse();
  }

  private void parse(String code) {
    arena = ParserRunner.parse(SourceFile.fromCode("input.ts", code));
  }

  private Node parseStatement(String code) {
    parse(code);
    ImmutableList<Node> statements = children(arena.getRoot());
    assertThat(statements).hasSize(1);
    return statements.get(0);
  }

  private ImmutableList<Node> children(Node n) {
    return arena.getChildren(n);
  }

  private Node child(Node n, int index) {
    return arena.getChildren(n).get(index);
  }
}
