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

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import com.google.tsdown.compiler.CompilerOptions.LanguageMode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites {@code for (x of arr)} into an indexed loop over an array-like, the way TypeScript does
 * when it does not assume iterators.
 *
 * <pre>
 * for (const x of items) { use(x); }
 * </pre>
 *
 * becomes
 *
 * <pre>
 * for (var _i = 0, items_1 = items; _i &lt; items_1.length; _i++) {
 *   const x = items_1[_i];
 *   use(x);
 * }
 * </pre>
 */
final class RewriteForOf extends NodeTraversal.AbstractPostOrderCallback implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewriteForOf;
  private final boolean rewriteForAwait;

  RewriteForOf(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewriteForOf = compiler.needsLowering(LanguageMode.ECMASCRIPT_2015);
    this.rewriteForAwait = compiler.needsLowering(LanguageMode.ECMASCRIPT_2018);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.is(Token.FOR_OF)) {
      return;
    }
    if (n.hasFlag(Node.FOR_AWAIT)) {
      if (rewriteForAwait) {
        TranspilationUtil.markIncompletelyLowered(compiler, n, "for await...of");
      }
      return;
    }
    if (rewriteForOf) {
      rewriteForOf(n);
    }
  }

  private void rewriteForOf(Node n) {
    Node target = record.getChild(n, 0);
    Node iterable = record.getChild(n, 1);
    Node body = record.getChild(n, 2);

    String index = nameGenerator.uniqueName("_i");
    String array =
        iterable.is(Token.NAME)
            ? nameGenerator.numberedName(iterable.getNonNullString())
            : nameGenerator.newTemporary();

    Node init =
        astFactory.createVar(
            ImmutableList.of(
                astFactory.createDeclarator(index, astFactory.createNumber(0), null),
                astFactory.createDeclarator(array, iterable, iterable)));
    Node cond =
        astFactory.createLessThan(
            astFactory.createName(index),
            astFactory.createGetProp(astFactory.createName(array), "length"));
    Node incr = astFactory.createInc(astFactory.createName(index), true);

    Node element =
        astFactory.createGetElem(astFactory.createName(array), astFactory.createName(index));
    Node binding;
    if (NodeUtil.isNameDeclaration(target)) {
      Node name = record.getChild(target, 0);
      binding =
          record.newNode(
              target.getToken(),
              ImmutableList.of(
                  astFactory.createDeclarator(name.getNonNullString(), element, name)),
              null,
              0,
              0,
              target);
    } else {
      binding = astFactory.exprResult(astFactory.createAssign(target, element, target));
    }

    List<Node> statements = new ArrayList<>();
    statements.add(binding);
    if (body.is(Token.BLOCK)) {
      statements.addAll(record.getChildren(body));
    } else {
      statements.add(body);
    }
    Node newBody =
        body.is(Token.BLOCK)
            ? record.withChildren(body, statements)
            : astFactory.createBlock(statements);

    record.replace(
        n,
        record.newNode(
            Token.FOR, ImmutableList.of(init, cond, incr, newBody), null, 0, 0, n));
  }
}
