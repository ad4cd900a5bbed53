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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts arrow functions to function expressions. The {@code this} and {@code arguments} an
 * arrow sees are captured in {@code _this} and {@code _arguments} variables of the enclosing
 * function.
 */
final class RewriteArrowFunctions implements NodeTraversal.Callback, CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final Deque<ThisAndArgumentsContext> contextStack = new ArrayDeque<>();

  /** The function or script whose {@code this} and {@code arguments} arrows capture. */
  private static final class ThisAndArgumentsContext {
    final Node scopeRoot;
    boolean needsThisVar = false;
    boolean needsArgumentsVar = false;

    ThisAndArgumentsContext(Node scopeRoot) {
      this.scopeRoot = scopeRoot;
    }
  }

  RewriteArrowFunctions(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.is(Token.SCRIPT) || (n.is(Token.FUNCTION) && !n.isArrow())) {
      contextStack.push(new ThisAndArgumentsContext(n));
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    ThisAndArgumentsContext context = checkNotNull(contextStack.peek());
    switch (n.getToken()) {
      case THIS:
        if (isInArrow(t)) {
          context.needsThisVar = true;
          record.replace(n, astFactory.createName(nameGenerator.sharedName("_this"), n));
        }
        break;
      case NAME:
        if ("arguments".equals(n.getString()) && isInArrow(t)) {
          context.needsArgumentsVar = true;
          record.replace(n, astFactory.createName(nameGenerator.sharedName("_arguments"), n));
        }
        break;
      case FUNCTION:
        if (n.isArrow()) {
          visitArrowFunction(n);
        } else {
          contextStack.pop();
          addVarDeclarations(context, NodeUtil.getFunctionBody(record, n));
        }
        break;
      case SCRIPT:
        contextStack.pop();
        addVarDeclarations(context, n);
        break;
      default:
        break;
    }
  }

  /** Whether the current node is in an arrow function before any other function. */
  private static boolean isInArrow(NodeTraversal t) {
    for (Node ancestor : t.getAncestors()) {
      if (ancestor.is(Token.FUNCTION)) {
        return ancestor.isArrow();
      }
    }
    return false;
  }

  private void visitArrowFunction(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node body = children.get(2);
    if (!body.is(Token.BLOCK)) {
      body = astFactory.createBlock(astFactory.createReturn(body, body));
    }
    int flags = n.getFlags() & ~(Node.ARROW | Node.EXPRESSION_BODY);
    record.replace(
        n, record.withFlags(n, flags, ImmutableList.of(children.get(0), children.get(1), body)));
  }

  /** Declares {@code var _this = this;} and {@code var _arguments = arguments;} as needed. */
  private void addVarDeclarations(ThisAndArgumentsContext context, Node body) {
    List<Node> declarations = new ArrayList<>();
    if (context.needsThisVar) {
      declarations.add(
          astFactory.createSingleVarNameDeclaration(
              nameGenerator.sharedName("_this"), astFactory.createThis()));
    }
    if (context.needsArgumentsVar) {
      declarations.add(
          astFactory.createSingleVarNameDeclaration(
              nameGenerator.sharedName("_arguments"), astFactory.createName("arguments")));
    }
    if (!declarations.isEmpty()) {
      NodeUtil.addStatementsAfterDirectives(record, body, declarations);
    }
  }
}
