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
 * Rewrites operators the output language lacks: exponentiation, nullish coalescing, optional
 * chaining and the logical assignment operators.
 */
final class RewriteOperators extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private static final int CHAIN_FLAGS = Node.OPTIONAL_CHAIN_START | Node.IN_OPTIONAL_CHAIN;

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewriteExponent;
  private final boolean rewriteNullish;
  private final boolean rewriteLogicalAssignment;

  private @Nullable Node scope;

  RewriteOperators(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewriteExponent = compiler.needsLowering(LanguageMode.ECMASCRIPT_2016);
    this.rewriteNullish = compiler.needsLowering(LanguageMode.ECMASCRIPT_2020);
    this.rewriteLogicalAssignment = compiler.needsLowering(LanguageMode.ECMASCRIPT_2021);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    scope = n.is(Token.FUNCTION) || n.is(Token.SCRIPT) ? n : t.getClosestHoistScope();
    switch (n.getToken()) {
      case EXPONENT:
        if (rewriteExponent) {
          record.replace(
              n, createPow(record.getChild(n, 0), record.getChild(n, 1), n));
        }
        break;
      case ASSIGN_EXPONENT:
        if (rewriteExponent) {
          visitExponentAssignment(n);
        }
        break;
      case COALESCE:
        if (rewriteNullish) {
          visitCoalesce(n);
        }
        break;
      case ASSIGN_OR:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
        if (rewriteLogicalAssignment) {
          visitLogicalAssignment(n);
        }
        break;
      case DELPROP:
        if (rewriteNullish && isInChain(record.getChild(n, 0))) {
          record.replace(
              n,
              lowerChain(
                  record.getChild(n, 0),
                  astFactory.createBoolean(true),
                  access -> record.withChildren(n, ImmutableList.of(access))));
        }
        break;
      case GETPROP:
      case GETELEM:
      case CALL:
        if (rewriteNullish && isChainTop(n, parent)) {
          record.replace(n, lowerChain(n, astFactory.createUndefinedValue(), access -> access));
        }
        break;
      default:
        break;
    }
  }

  private Node createPow(Node base, Node exponent, @Nullable Node origin) {
    return astFactory.createCall(
        astFactory.createQName("Math.pow"), ImmutableList.of(base, exponent), origin);
  }

  /** {@code a **= b} becomes {@code a = Math.pow(a, b)}. */
  private void visitExponentAssignment(Node n) {
    ReusableTarget target = new ReusableTarget(record.getChild(n, 0));
    Node value = record.getChild(n, 1);
    Node read = target.read();
    record.replace(n, astFactory.createAssign(read, createPow(target.reference(), value, n), n));
  }

  /**
   * {@code a ?? b} becomes {@code a !== null && a !== void 0 ? a : b}, reading {@code a} from a
   * temporary unless it is a name.
   */
  private void visitCoalesce(Node n) {
    Node left = record.getChild(n, 0);
    Node right = record.getChild(n, 1);
    NullCheck check = new NullCheck(left);
    record.replace(
        n, astFactory.createHook(check.isNotNullish(), check.reference(), right, n));
  }

  /**
   * {@code a ||= b} becomes {@code a || (a = b)}, {@code a &&= b} becomes {@code a && (a = b)}
   * and {@code a ??= b} becomes {@code a ?? (a = b)}, further lowered when the output has no
   * {@code ??} either.
   */
  private void visitLogicalAssignment(Node n) {
    ReusableTarget target = new ReusableTarget(record.getChild(n, 0));
    Node value = record.getChild(n, 1);
    Node replacement;
    switch (n.getToken()) {
      case ASSIGN_OR:
        {
          Node read = target.read();
          replacement =
              astFactory.createBinary(
                  Token.OR, read, astFactory.createAssign(target.reference(), value), n);
          break;
        }
      case ASSIGN_AND:
        {
          Node read = target.read();
          replacement =
              astFactory.createBinary(
                  Token.AND, read, astFactory.createAssign(target.reference(), value), n);
          break;
        }
      case ASSIGN_COALESCE:
        if (rewriteNullish) {
          NullCheck check = new NullCheck(target.read());
          Node isNotNullish = check.isNotNullish();
          replacement =
              astFactory.createHook(
                  isNotNullish,
                  check.reference(),
                  astFactory.createAssign(target.reference(), value),
                  n);
        } else {
          Node read = target.read();
          replacement =
              astFactory.createBinary(
                  Token.COALESCE, read, astFactory.createAssign(target.reference(), value), n);
        }
        break;
      default:
        throw new IllegalStateException("Unexpected logical assignment: " + n);
    }
    record.replace(n, replacement);
  }

  private String declareTemporary() {
    String temp = nameGenerator.newTemporary();
    record.declareTemporary(checkScope(), temp);
    return temp;
  }

  private Node checkScope() {
    if (scope == null) {
      throw new IllegalStateException("no scope");
    }
    return scope;
  }

  /**
   * An assignment target that is read and then assigned. The parts of its address that could
   * have side effects are stored in temporaries on the read, and reused by the assignment.
   */
  private final class ReusableTarget {
    private final Node target;
    private @Nullable Node object;
    private @Nullable Node key;

    ReusableTarget(Node target) {
      this.target = target;
    }

    /** The target as read first. Must be called before {@link #reference}. */
    Node read() {
      switch (target.getToken()) {
        case GETPROP:
          {
            Node receiver = record.getChild(target, 0);
            object = stashIfNeeded(receiver);
            Node first =
                receiver == object ? record.deepCopy(receiver) : assignTo(object, receiver);
            return astFactory.createGetProp(first, target.getNonNullString(), target);
          }
        case GETELEM:
          {
            Node receiver = record.getChild(target, 0);
            Node property = record.getChild(target, 1);
            object = stashIfNeeded(receiver);
            key = stashIfNeeded(property);
            Node firstObject =
                receiver == object ? record.deepCopy(receiver) : assignTo(object, receiver);
            Node firstKey =
                property == key ? record.deepCopy(property) : assignTo(key, property);
            return astFactory.createGetElem(firstObject, firstKey, target);
          }
        default:
          return record.deepCopy(target);
      }
    }

    /** The target as assigned. */
    Node reference() {
      switch (target.getToken()) {
        case GETPROP:
          return astFactory.createGetProp(
              record.deepCopy(checkNotNull(object)), target.getNonNullString(), target);
        case GETELEM:
          return astFactory.createGetElem(
              record.deepCopy(checkNotNull(object)), record.deepCopy(checkNotNull(key)), target);
        default:
          return target;
      }
    }

    /** Returns {@code value} if it can be evaluated twice, or a name for a new temporary. */
    private Node stashIfNeeded(Node value) {
      return NodeUtil.isSimpleOperand(value) ? value : astFactory.createName(declareTemporary());
    }

    private Node assignTo(Node temp, Node value) {
      return astFactory.createAssign(record.deepCopy(temp), value);
    }
  }

  private static Node checkNotNull(@Nullable Node n) {
    if (n == null) {
      throw new IllegalStateException("target was not read");
    }
    return n;
  }

  /**
   * Tests a value for {@code null} and {@code undefined}, storing it in a temporary unless it
   * is a name or {@code this}.
   */
  private final class NullCheck {
    private final Node first;
    private final Node reference;

    NullCheck(Node value) {
      if (value.is(Token.NAME) || value.is(Token.THIS)) {
        first = value;
        reference = value;
      } else {
        Node temp = astFactory.createName(declareTemporary());
        first = astFactory.createAssign(temp, value);
        reference = temp;
      }
    }

    /** Checks {@code first}, an expression that also stores the value in {@code reference}. */
    NullCheck(Node first, Node reference) {
      this.first = first;
      this.reference = reference;
    }

    /** {@code v === null || v === void 0} */
    Node isNullish() {
      return astFactory.createOr(
          astFactory.createSheq(first, astFactory.createNull()),
          astFactory.createSheq(record.deepCopy(reference), astFactory.createUndefinedValue()));
    }

    /** {@code v !== null && v !== void 0} */
    Node isNotNullish() {
      return astFactory.createAnd(
          astFactory.createShne(first, astFactory.createNull()),
          astFactory.createShne(record.deepCopy(reference), astFactory.createUndefinedValue()));
    }

    Node reference() {
      return record.deepCopy(reference);
    }
  }

  // Optional chains.

  private static boolean isInChain(Node n) {
    return n.hasFlag(Node.IN_OPTIONAL_CHAIN);
  }

  /** Whether {@code n} is the outermost access or call of an optional chain. */
  private boolean isChainTop(Node n, @Nullable Node parent) {
    if (!isInChain(n)) {
      return false;
    }
    if (parent == null) {
      return true;
    }
    if (parent.is(Token.DELPROP)) {
      return false;
    }
    return !isInChain(parent) || record.getChild(parent, 0).getId() != n.getId();
  }

  /** Finishes a lowered chain; wraps the access for {@code delete}. */
  private interface ChainEnd {
    Node wrap(Node access);
  }

  /**
   * Lowers the optional chain ending at {@code top}. The last {@code ?.} link in the chain guards
   * everything after it: {@code a.b?.c.d} becomes {@code (_a = a.b) === null || _a === void 0 ?
   * void 0 : _a.c.d}. Links before it belong to the receiver, which is lowered first.
   */
  private Node lowerChain(Node top, Node shortCircuitValue, ChainEnd end) {
    List<Node> path = new ArrayList<>();
    Node start = top;
    while (!start.hasFlag(Node.OPTIONAL_CHAIN_START)) {
      path.add(start);
      start = record.getChild(start, 0);
    }
    Node check;
    Node guarded;
    if (start.is(Token.CALL) && isMemberAccess(record.getChild(start, 0))) {
      Node callee = record.getChild(start, 0);
      Node object = lowerChainPart(record.getChild(callee, 0));
      Node thisValue;
      Node firstObject;
      if (object.is(Token.NAME) || object.is(Token.THIS)) {
        thisValue = object;
        firstObject = record.deepCopy(object);
      } else {
        thisValue = astFactory.createName(declareTemporary());
        firstObject = astFactory.createAssign(record.deepCopy(thisValue), object);
      }
      Node function;
      if (callee.hasFlag(Node.OPTIONAL_CHAIN_START)) {
        NullCheck objectCheck = new NullCheck(firstObject, thisValue);
        function =
            astFactory.createHook(
                objectCheck.isNullish(),
                astFactory.createUndefinedValue(),
                withObject(callee, objectCheck.reference()));
      } else {
        function = withObject(callee, firstObject);
      }
      NullCheck functionCheck = new NullCheck(function);
      check = functionCheck.isNullish();
      List<Node> args = new ArrayList<>();
      args.add(record.deepCopy(thisValue));
      ImmutableList<Node> children = record.getChildren(start);
      args.addAll(children.subList(1, children.size()));
      guarded =
          astFactory.createCall(
              astFactory.createGetProp(functionCheck.reference(), "call"), args, start);
    } else {
      Node receiver = lowerChainPart(record.getChild(start, 0));
      NullCheck receiverCheck = new NullCheck(receiver);
      check = receiverCheck.isNullish();
      guarded = withObject(start, receiverCheck.reference());
    }
    for (int i = path.size() - 1; i >= 0; i--) {
      guarded = withObject(path.get(i), guarded);
    }
    return astFactory.createHook(check, shortCircuitValue, end.wrap(guarded), top);
  }

  /** Lowers {@code n} if it ends an earlier optional chain, the receiver of a later link. */
  private Node lowerChainPart(Node n) {
    return isInChain(n) ? lowerChain(n, astFactory.createUndefinedValue(), access -> access) : n;
  }

  private static boolean isMemberAccess(Node n) {
    return n.is(Token.GETPROP) || n.is(Token.GETELEM);
  }

  /** Copies an access or call with a new receiver or callee, outside of any optional chain. */
  private Node withObject(Node n, Node object) {
    ImmutableList<Node> children = record.getChildren(n);
    List<Node> newChildren = new ArrayList<>(children.size());
    newChildren.add(object);
    newChildren.addAll(children.subList(1, children.size()));
    return record.withFlags(n, n.getFlags() & ~CHAIN_FLAGS, newChildren);
  }
}
