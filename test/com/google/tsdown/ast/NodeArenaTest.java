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

package com.google.tsdown.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeArenaTest {

  private static final SourceFile FILE = SourceFile.fromCode("a.ts", "f(x);");

  @Test
  public void testBuildBottomUp() {
    NodeArena.Builder builder = NodeArena.builder(FILE);
    int callee = builder.add(Token.NAME, 0, 1, ImmutableList.of(), "f", 0, 0);
    int arg = builder.add(Token.NAME, 2, 3, ImmutableList.of(), "x", 0, 0);
    int call = builder.add(Token.CALL, 0, 4, ImmutableList.of(callee, arg), null, 0, 0);
    int statement = builder.add(Token.EXPR_RESULT, 0, 5, ImmutableList.of(call), null, 0, 0);
    int root = builder.add(Token.SCRIPT, 0, 5, ImmutableList.of(statement), null, 0, 0);
    NodeArena arena = builder.build(root);

    assertThat(arena.size()).isEqualTo(5);
    assertThat(arena.getRoot().getId()).isEqualTo(root);
    assertThat(arena.getSourceFile()).isSameInstanceAs(FILE);
    Node callNode = arena.getNode(call);
    assertThat(arena.getChildren(callNode).stream().map(Node::getString))
        .containsExactly("f", "x")
        .inOrder();
    assertThat(arena.contains(root)).isTrue();
    assertThat(arena.contains(root + 1)).isFalse();
  }

  @Test
  public void testChildMustBeAddedFirst() {
    NodeArena.Builder builder = NodeArena.builder(FILE);
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.add(Token.EXPR_RESULT, 0, 5, ImmutableList.of(0), null, 0, 0));
  }

  @Test
  public void testChildSpanMustBeContained() {
    NodeArena.Builder builder = NodeArena.builder(FILE);
    int name = builder.add(Token.NAME, 0, 5, ImmutableList.of(), "f", 0, 0);
    int statement = builder.add(Token.EXPR_RESULT, 1, 4, ImmutableList.of(name), null, 0, 0);
    assertThrows(IllegalStateException.class, () -> builder.build(statement));
  }

  @Test
  public void testSharedChildIsRejected() {
    NodeArena.Builder builder = NodeArena.builder(FILE);
    int name = builder.add(Token.NAME, 0, 1, ImmutableList.of(), "f", 0, 0);
    int a = builder.add(Token.EXPR_RESULT, 0, 2, ImmutableList.of(name), null, 0, 0);
    int b = builder.add(Token.EXPR_RESULT, 0, 2, ImmutableList.of(name), null, 0, 0);
    int root = builder.add(Token.SCRIPT, 0, 5, ImmutableList.of(a, b), null, 0, 0);
    assertThrows(IllegalStateException.class, () -> builder.build(root));
  }
}
