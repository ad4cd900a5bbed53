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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.SourceFile;
import com.google.tsdown.ast.Token;
import com.google.tsdown.parsing.ParserRunner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TransformRecordTest {

  private TransformRecord record;
  private Node root;

  @Before
  public void setUp() {
    record = new TransformRecord(ParserRunner.parse(SourceFile.fromCode("input.ts", "f(); g();")));
    root = record.getRoot();
  }

  private Node call(String name) {
    Node callee = record.newNode(Token.NAME, ImmutableList.of(), name, 0, 0, null);
    Node call = record.newNode(Token.CALL, ImmutableList.of(callee), null, 0, 0, null);
    return record.newNode(Token.EXPR_RESULT, ImmutableList.of(call), null, 0, 0, null);
  }

  private String print() {
    return new CodePrinter.Builder(record).build().replaceAll("\\s+", " ").trim();
  }

  @Test
  public void testInsertions() {
    ImmutableList<Node> statements = record.getChildren(root);
    record.insertBefore(statements.get(1), call("h"));
    record.insertAfter(statements.get(1), call("i"));
    assertThat(record.getChildren(root)).hasSize(4);
    assertThat(print()).isEqualTo("f(); h(); g(); i();");
  }

  @Test
  public void testRebuiltParentEmitsInsertionsOnce() {
    Node g = record.getChildren(root).get(1);
    record.insertBefore(g, call("h"));

    List<Node> statements = new ArrayList<>(record.getChildren(root));
    statements.add(call("j"));
    record.replace(root, record.withChildren(root, statements));

    assertThat(print()).isEqualTo("f(); h(); g(); j();");
    assertThat(record.getActions(g)).isEmpty();
  }

  @Test
  public void testInsertionsStayWithAnAnchorMovedAlone() {
    ImmutableList<Node> statements = record.getChildren(root);
    Node g = statements.get(1);
    record.insertBefore(g, call("h"));

    record.replace(root, record.withChildren(root, ImmutableList.of(g, statements.get(0))));

    assertThat(print()).isEqualTo("h(); g(); f();");
  }

  @Test
  public void testElidedNodeKeepsInsertions() {
    Node f = record.getChildren(root).get(0);
    record.elide(f);
    record.insertAfter(f, call("k"));
    assertThat(print()).isEqualTo("k(); g();");
  }

  @Test
  public void testTemporariesAreACopy() {
    record.declareTemporary(root, "_a");
    assertThat(record.getTemporaries().get(root.getId())).containsExactly("_a");
    record.declareTemporary(root, "_b");
    assertThat(record.getTemporaries().get(root.getId())).containsExactly("_a", "_b").inOrder();
  }
}
