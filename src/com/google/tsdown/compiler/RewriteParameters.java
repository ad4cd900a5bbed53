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
 * Converts default and rest parameters into statements at the start of the function body.
 *
 * <pre>
 * function f(a, b = 1, ...rest) {}
 * </pre>
 *
 * becomes
 *
 * <pre>
 * function f(a, b) {
 *     if (b === void 0) { b = 1; }
 *     var rest = [];
 *     for (var _i = 2; _i < arguments.length; _i++) {
 *         rest[_i - 2] = arguments[_i];
 *     }
 * }
 * </pre>
 *
 * A destructuring parameter with a default is bound to a temporary and destructured by a
 * declaration, which {@link RewriteDestructuring} lowers in turn.
 */
final class RewriteParameters extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;

  RewriteParameters(AbstractCompiler compiler) {
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
    if (n.is(Token.FUNCTION)) {
      visitFunction(n);
    }
  }

  private void visitFunction(Node function) {
    Node paramList = NodeUtil.getFunctionParameters(record, function);
    ImmutableList<Node> params = record.getChildren(paramList);
    List<Node> newParams = new ArrayList<>();
    List<Node> statements = new ArrayList<>();
    boolean changed = false;
    for (int i = 0; i < params.size(); i++) {
      Node param = params.get(i);
      switch (param.getToken()) {
        case DEFAULT_VALUE:
          {
            changed = true;
            Node target = record.getChild(param, 0);
            Node defaultValue = record.getChild(param, 1);
            if (target.is(Token.NAME)) {
              newParams.add(target);
              statements.add(createDefaultCheck(target.getNonNullString(), defaultValue, param));
            } else {
              // f({ a } = {}) becomes f(_a) { var { a } = _a === void 0 ? {} : _a; }
              String temp = nameGenerator.newTemporary();
              newParams.add(astFactory.createName(temp, target));
              Node value =
                  astFactory.createHook(
                      astFactory.createSheq(
                          astFactory.createName(temp), astFactory.createUndefinedValue()),
                      defaultValue,
                      astFactory.createName(temp));
              statements.add(createPatternDeclaration(target, value, param));
            }
            break;
          }
        case ITER_REST:
          {
            changed = true;
            Node target = record.getChild(param, 0);
            String restName;
            if (target.is(Token.NAME)) {
              restName = target.getNonNullString();
            } else {
              restName = nameGenerator.newTemporary();
            }
            statements.addAll(createRestCopy(restName, i, param));
            if (!target.is(Token.NAME)) {
              statements.add(
                  createPatternDeclaration(target, astFactory.createName(restName), param));
            }
            break;
          }
        default:
          newParams.add(param);
          break;
      }
    }
    if (!changed) {
      return;
    }
    record.replace(paramList, record.withChildren(paramList, newParams));
    NodeUtil.addStatementsAfterDirectives(
        record, NodeUtil.getFunctionBody(record, function), statements);
  }

  /** {@code if (a === void 0) { a = value; }} */
  private Node createDefaultCheck(String name, Node value, Node origin) {
    Node check =
        astFactory.createSheq(astFactory.createName(name), astFactory.createUndefinedValue());
    Node assign =
        astFactory.exprResult(astFactory.createAssign(astFactory.createName(name), value, origin));
    return astFactory.createIf(check, astFactory.createBlock(assign));
  }

  private Node createPatternDeclaration(Node pattern, Node value, Node origin) {
    Node declarator =
        record.newNode(
            Token.DESTRUCTURING_LHS, ImmutableList.of(pattern, value), null, 0, 0, origin);
    return astFactory.createVar(ImmutableList.of(declarator), origin);
  }

  /** Copies the arguments from position {@code index} on into an array named {@code name}. */
  private ImmutableList<Node> createRestCopy(String name, int index, Node origin) {
    String counter = nameGenerator.sharedName("_i");
    Node declaration =
        astFactory.createSingleVarNameDeclaration(name, astFactory.createArraylit(), origin);
    Node init =
        astFactory.createSingleVarNameDeclaration(counter, astFactory.createNumber(index));
    Node cond =
        astFactory.createLessThan(
            astFactory.createName(counter),
            astFactory.createGetProp(astFactory.createName("arguments"), "length"));
    Node update = astFactory.createInc(astFactory.createName(counter), true);
    Node targetIndex =
        index == 0
            ? astFactory.createName(counter)
            : astFactory.createSub(astFactory.createName(counter), astFactory.createNumber(index));
    Node copy =
        astFactory.createAssignStatement(
            astFactory.createGetElem(astFactory.createName(name), targetIndex),
            astFactory.createGetElem(
                astFactory.createName("arguments"), astFactory.createName(counter)));
    return ImmutableList.of(
        declaration, astFactory.createFor(init, cond, update, astFactory.createBlock(copy)));
  }
}
