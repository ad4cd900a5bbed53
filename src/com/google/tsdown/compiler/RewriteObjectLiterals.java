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
 * Lowers object literal syntax. For ES5, shorthand properties and methods become plain
 * properties and computed properties are assigned to a temporary:
 *
 * <pre>
 * (_a = { a: 1 }, _a[key] = 2, _a)
 * </pre>
 *
 * Below ES2018, object spread becomes {@code __assign} calls.
 */
final class RewriteObjectLiterals extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewriteEs5;
  private final boolean rewriteSpread;

  RewriteObjectLiterals(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewriteEs5 = compiler.needsLowering(LanguageMode.ECMASCRIPT_2015);
    this.rewriteSpread = compiler.needsLowering(LanguageMode.ECMASCRIPT_2018);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    boolean inObjectLit = parent != null && parent.is(Token.OBJECTLIT);
    switch (n.getToken()) {
      case STRING_KEY:
        if (rewriteEs5 && inObjectLit && n.hasFlag(Node.SHORTHAND)) {
          // { a } becomes { a: a }
          record.replace(
              n, record.withFlags(n, n.getFlags() & ~Node.SHORTHAND, record.getChildren(n)));
        }
        break;
      case MEMBER_FUNCTION_DEF:
        if (rewriteEs5 && inObjectLit) {
          // { m() {} } becomes { m: function () {} }
          record.replace(
              n,
              record.newNode(
                  Token.STRING_KEY,
                  ImmutableList.of(record.getChild(n, 0)),
                  n.getString(),
                  0,
                  n.getFlags() & Node.QUOTED,
                  n));
        }
        break;
      case OBJECTLIT:
        visitObjectLit(t, n);
        break;
      default:
        break;
    }
  }

  private void visitObjectLit(NodeTraversal t, Node n) {
    ImmutableList<Node> properties = record.getChildren(n);
    boolean hasSpread = false;
    boolean hasComputed = false;
    for (Node property : properties) {
      hasSpread |= property.is(Token.OBJECT_SPREAD);
      hasComputed |= property.is(Token.COMPUTED_PROP);
    }
    if (rewriteSpread && hasSpread) {
      record.replace(n, createAssignCalls(t, n, properties));
    } else if (rewriteEs5 && hasComputed) {
      record.replace(n, createLiteral(t, n, properties));
    }
  }

  /**
   * {@code { a: 1, ...b, c: 2 }} becomes {@code __assign(__assign({ a: 1 }, b), { c: 2 })}.
   */
  private Node createAssignCalls(NodeTraversal t, Node n, List<Node> properties) {
    List<Node> segments = new ArrayList<>();
    List<Node> pending = new ArrayList<>();
    for (Node property : properties) {
      if (property.is(Token.OBJECT_SPREAD)) {
        if (!pending.isEmpty()) {
          segments.add(createLiteral(t, n, pending));
          pending = new ArrayList<>();
        }
        segments.add(record.getChild(property, 0));
      } else {
        pending.add(property);
      }
    }
    if (!pending.isEmpty()) {
      segments.add(createLiteral(t, n, pending));
    }
    Node result;
    int next;
    if (properties.get(0).is(Token.OBJECT_SPREAD)) {
      result = astFactory.createObjectLit();
      next = 0;
    } else {
      result = segments.get(0);
      next = 1;
    }
    for (Node segment : segments.subList(next, segments.size())) {
      result = astFactory.createHelperCall(RuntimeHelper.ASSIGN, result, segment);
    }
    return result;
  }

  /**
   * Returns an object literal with {@code properties}. From the first computed property on,
   * properties are assigned to a temporary holding the object instead.
   */
  private Node createLiteral(NodeTraversal t, Node origin, List<Node> properties) {
    int firstComputed = -1;
    for (int i = 0; i < properties.size(); i++) {
      if (properties.get(i).is(Token.COMPUTED_PROP)) {
        firstComputed = i;
        break;
      }
    }
    if (!rewriteEs5 || firstComputed < 0) {
      return record.withChildren(origin, properties);
    }
    String temp = nameGenerator.newTemporary();
    record.declareTemporary(t.getClosestHoistScope(), temp);
    List<Node> expressions = new ArrayList<>();
    expressions.add(
        astFactory.createAssign(
            astFactory.createName(temp),
            record.withChildren(origin, properties.subList(0, firstComputed)),
            origin));
    for (Node property : properties.subList(firstComputed, properties.size())) {
      expressions.add(createPropertyDefinition(temp, property));
    }
    expressions.add(astFactory.createName(temp));
    return astFactory.createCommas(expressions);
  }

  private Node createPropertyDefinition(String temp, Node property) {
    ImmutableList<Node> children = record.getChildren(property);
    Node key;
    if (property.is(Token.COMPUTED_PROP)) {
      key = children.get(0);
    } else {
      key = astFactory.createString(property.getNonNullString());
    }
    boolean isGetter =
        property.is(Token.GETTER_DEF) || property.hasFlag(Node.COMPUTED_GETTER);
    boolean isSetter =
        property.is(Token.SETTER_DEF) || property.hasFlag(Node.COMPUTED_SETTER);
    Node value = property.is(Token.COMPUTED_PROP) ? children.get(1) : children.get(0);
    if (isGetter || isSetter) {
      Node descriptor =
          astFactory.createObjectLit(
              astFactory.createStringKey(isGetter ? "get" : "set", value),
              astFactory.createStringKey("enumerable", astFactory.createBoolean(true)),
              astFactory.createStringKey("configurable", astFactory.createBoolean(true)));
      return astFactory.createCall(
          astFactory.createQName("Object.defineProperty"),
          ImmutableList.of(astFactory.createName(temp), key, descriptor),
          property);
    }
    Node target;
    if (property.is(Token.STRING_KEY)
        && !property.hasFlag(Node.QUOTED)
        && NodeUtil.isValidPropertyName(property.getNonNullString())) {
      target = astFactory.createGetProp(astFactory.createName(temp), property.getNonNullString());
    } else {
      target = astFactory.createGetElem(astFactory.createName(temp), key);
    }
    return astFactory.createAssign(target, value, property);
  }
}
