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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts spread in array literals, calls and {@code new} expressions to {@code __spreadArray}
 * and {@code Function.prototype.apply}.
 *
 * <pre>
 * [a, ...b]       becomes  __spreadArray([a], b, true)
 * o.f(a, ...b)    becomes  o.f.apply(o, __spreadArray([a], b, false))
 * new C(...args)  becomes  new (C.bind.apply(C, __spreadArray([void 0], args, false)))()
 * </pre>
 */
final class RewriteSpread extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;

  RewriteSpread(AbstractCompiler compiler) {
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
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case ARRAYLIT:
        if (hasSpread(record.getChildren(n))) {
          record.replace(n, createSpreadArray(ImmutableList.of(), record.getChildren(n), true));
        }
        break;
      case CALL:
      case NEW:
        {
          ImmutableList<Node> children = record.getChildren(n);
          ImmutableList<Node> args = children.subList(1, children.size());
          if (!hasSpread(args)) {
            break;
          }
          if (n.hasFlag(Node.IN_OPTIONAL_CHAIN)) {
            TranspilationUtil.markIncompletelyLowered(
                compiler, n, "Spread in an optional call");
            break;
          }
          if (n.is(Token.CALL)) {
            visitCall(t, n, children.get(0), args);
          } else {
            visitNew(t, n, children.get(0), args);
          }
          break;
        }
      default:
        break;
    }
  }

  private static boolean hasSpread(List<Node> elements) {
    for (Node element : elements) {
      if (element.is(Token.ITER_SPREAD)) {
        return true;
      }
    }
    return false;
  }

  private void visitCall(NodeTraversal t, Node n, Node callee, List<Node> args) {
    Node thisValue;
    Node function;
    if (callee.is(Token.GETPROP) || callee.is(Token.GETELEM)) {
      ImmutableList<Node> calleeChildren = record.getChildren(callee);
      Node receiver = calleeChildren.get(0);
      if (NodeUtil.isSimpleOperand(receiver)) {
        thisValue = record.deepCopy(receiver);
        function = callee;
      } else {
        String temp = declareTemporary(t);
        List<Node> newChildren = new ArrayList<>(calleeChildren);
        newChildren.set(0, astFactory.createAssign(astFactory.createName(temp), receiver));
        thisValue = astFactory.createName(temp);
        function = record.withChildren(callee, newChildren);
      }
    } else {
      thisValue = astFactory.createUndefinedValue();
      function = callee;
    }
    Node apply = astFactory.createGetProp(function, "apply");
    record.replace(
        n,
        astFactory.createCall(
            apply,
            ImmutableList.of(thisValue, createSpreadArray(ImmutableList.of(), args, false)),
            n));
  }

  private void visitNew(NodeTraversal t, Node n, Node callee, List<Node> args) {
    Node constructor;
    Node constructorRef;
    if (NodeUtil.isSimpleOperand(callee)) {
      constructor = callee;
      constructorRef = record.deepCopy(callee);
    } else {
      String temp = declareTemporary(t);
      constructor = astFactory.createAssign(astFactory.createName(temp), callee);
      constructorRef = astFactory.createName(temp);
    }
    Node bind =
        astFactory.createCall(
            astFactory.createGetProp(astFactory.createGetProp(constructor, "bind"), "apply"),
            constructorRef,
            createSpreadArray(ImmutableList.of(astFactory.createUndefinedValue()), args, false));
    record.replace(n, record.newNode(Token.NEW, ImmutableList.of(bind), null, 0, 0, n));
  }

  private String declareTemporary(NodeTraversal t) {
    String temp = nameGenerator.newTemporary();
    record.declareTemporary(t.getClosestHoistScope(), temp);
    return temp;
  }

  /**
   * Builds an array of {@code prefix} followed by {@code elements}, where spread elements are
   * appended with {@code __spreadArray}. A lone spread of a call's arguments is passed as is.
   */
  private Node createSpreadArray(List<Node> prefix, List<Node> elements, boolean packSpreads) {
    if (prefix.isEmpty() && !packSpreads && elements.size() == 1) {
      return record.getChild(elements.get(0), 0);
    }
    List<Node> segments = new ArrayList<>();
    List<Boolean> isSpread = new ArrayList<>();
    List<Node> pending = new ArrayList<>(prefix);
    boolean first = true;
    for (Node element : elements) {
      if (element.is(Token.ITER_SPREAD)) {
        if (!pending.isEmpty() || first) {
          segments.add(astFactory.createArraylit(pending));
          isSpread.add(false);
          pending = new ArrayList<>();
        }
        segments.add(record.getChild(element, 0));
        isSpread.add(true);
      } else {
        pending.add(element);
      }
      first = false;
    }
    if (!pending.isEmpty()) {
      segments.add(astFactory.createArraylit(pending));
      isSpread.add(false);
    }
    Node result = segments.get(0);
    for (int i = 1; i < segments.size(); i++) {
      result =
          astFactory.createHelperCall(
              RuntimeHelper.SPREAD_ARRAY,
              result,
              segments.get(i),
              astFactory.createBoolean(isSpread.get(i) && packSpreads));
    }
    return result;
  }
}
