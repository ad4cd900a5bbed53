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
 * Rewrites destructuring patterns into sequences of simple declarations or assignments, and gives
 * optional catch bindings a name.
 *
 * <pre>
 * var { a, b: [c = 1], ...rest } = obj;
 * </pre>
 *
 * becomes
 *
 * <pre>
 * var a = obj.a, _a = obj.b[0], c = _a === void 0 ? 1 : _a, rest = __rest(obj, ["a", "b"]);
 * </pre>
 */
final class RewriteDestructuring extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewritePatterns;
  private final boolean rewriteOptionalCatchBinding;

  RewriteDestructuring(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewritePatterns = compiler.needsLowering(LanguageMode.ECMASCRIPT_2015);
    this.rewriteOptionalCatchBinding = compiler.needsLowering(LanguageMode.ECMASCRIPT_2019);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case CATCH:
        visitCatch(n);
        break;
      case VAR:
      case LET:
      case CONST:
        if (rewritePatterns && !isForInOrOfHead(parent)) {
          visitDeclaration(n);
        }
        break;
      case ASSIGN:
        if (rewritePatterns && NodeUtil.isPattern(record.getChild(n, 0))) {
          visitAssignment(t, n, parent);
        }
        break;
      case FUNCTION:
        if (rewritePatterns) {
          visitParameters(n);
        }
        break;
      case FOR_IN:
      case FOR_OF:
        if (rewritePatterns) {
          visitForInOrOfHead(t, n);
        }
        break;
      default:
        break;
    }
  }

  private static boolean isForInOrOfHead(@Nullable Node parent) {
    return parent != null && (parent.is(Token.FOR_IN) || parent.is(Token.FOR_OF));
  }

  /**
   * Receives the simple bindings a pattern breaks down into: declarators of a declaration, or
   * the assignments of an assignment expression.
   */
  private interface BindingSink {
    /** Binds {@code target}, a NAME or property access, to {@code value}. */
    void bind(Node target, Node value);

    /** Stores {@code value} in a fresh temporary and returns its name. */
    String stash(Node value);
  }

  /** Collects the declarators of a {@code var}, {@code let} or {@code const}. */
  private final class DeclarationSink implements BindingSink {
    final List<Node> declarators = new ArrayList<>();

    @Override
    public void bind(Node target, Node value) {
      declarators.add(astFactory.createDeclarator(target.getNonNullString(), value, target));
    }

    @Override
    public String stash(Node value) {
      String temp = nameGenerator.newTemporary();
      declarators.add(astFactory.createDeclarator(temp, value, null));
      return temp;
    }
  }

  /** Collects assignments, declaring the temporaries in the enclosing function. */
  private final class AssignmentSink implements BindingSink {
    final List<Node> assignments = new ArrayList<>();
    final Node scope;

    AssignmentSink(Node scope) {
      this.scope = scope;
    }

    @Override
    public void bind(Node target, Node value) {
      assignments.add(astFactory.createAssign(target, value, target));
    }

    @Override
    public String stash(Node value) {
      String temp = nameGenerator.newTemporary();
      record.declareTemporary(scope, temp);
      assignments.add(astFactory.createAssign(astFactory.createName(temp), value));
      return temp;
    }
  }

  /**
   * Breaks {@code target = value} down into simple bindings. {@code value} is read once; a
   * pattern that reads it more than once reads it from a temporary unless it is a name.
   */
  private void destructure(Node target, Node value, BindingSink sink) {
    switch (target.getToken()) {
      case DEFAULT_VALUE:
        {
          Node defaultValue = record.getChild(target, 1);
          String temp = sink.stash(value);
          Node withDefault =
              astFactory.createHook(
                  astFactory.createSheq(
                      astFactory.createName(temp), astFactory.createUndefinedValue()),
                  defaultValue,
                  astFactory.createName(temp));
          destructure(record.getChild(target, 0), withDefault, sink);
          break;
        }
      case OBJECT_PATTERN:
        destructureObject(target, value, sink);
        break;
      case ARRAY_PATTERN:
        destructureArray(target, value, sink);
        break;
      default:
        sink.bind(target, value);
        break;
    }
  }

  private void destructureObject(Node pattern, Node value, BindingSink sink) {
    ImmutableList<Node> properties = record.getChildren(pattern);
    boolean hasRest =
        !properties.isEmpty() && properties.get(properties.size() - 1).is(Token.OBJECT_REST);
    ValueReference ref = createReference(value, properties.size() != 1 || hasRest, sink);
    List<Node> excludedKeys = new ArrayList<>();
    for (Node property : properties) {
      switch (property.getToken()) {
        case STRING_KEY:
          {
            String key = property.getNonNullString();
            if (hasRest) {
              excludedKeys.add(astFactory.createString(key));
            }
            Node access =
                NodeUtil.isValidPropertyName(key) && !property.hasFlag(Node.QUOTED)
                    ? astFactory.createGetProp(ref.get(), key, property)
                    : astFactory.createGetElem(ref.get(), astFactory.createString(key), property);
            destructure(record.getChild(property, 0), access, sink);
            break;
          }
        case COMPUTED_PROP:
          {
            Node key = record.getChild(property, 0);
            if (hasRest && !NodeUtil.isImmutableValue(key)) {
              String keyTemp = sink.stash(key);
              key = astFactory.createName(keyTemp);
              excludedKeys.add(astFactory.createName(keyTemp));
            } else if (hasRest) {
              excludedKeys.add(record.deepCopy(key));
            }
            destructure(
                record.getChild(property, 1),
                astFactory.createGetElem(ref.get(), key, property),
                sink);
            break;
          }
        case OBJECT_REST:
          {
            Node rest =
                astFactory.createHelperCall(
                    RuntimeHelper.REST, ref.get(), astFactory.createArraylit(excludedKeys));
            destructure(record.getChild(property, 0), rest, sink);
            break;
          }
        default:
          throw new IllegalStateException("Unexpected object pattern property: " + property);
      }
    }
    if (properties.isEmpty()) {
      sink.stash(value);
    }
  }

  private void destructureArray(Node pattern, Node value, BindingSink sink) {
    ImmutableList<Node> elements = record.getChildren(pattern);
    int used = 0;
    for (Node element : elements) {
      if (!element.is(Token.EMPTY)) {
        used++;
      }
    }
    ValueReference ref = createReference(value, used != 1, sink);
    for (int i = 0; i < elements.size(); i++) {
      Node element = elements.get(i);
      if (element.is(Token.EMPTY)) {
        continue;
      }
      if (element.is(Token.ITER_REST)) {
        Node slice =
            astFactory.createCall(
                astFactory.createGetProp(ref.get(), "slice"),
                ImmutableList.of(astFactory.createNumber(i)),
                element);
        destructure(record.getChild(element, 0), slice, sink);
      } else {
        destructure(
            element,
            astFactory.createGetElem(ref.get(), astFactory.createNumber(i), element),
            sink);
      }
    }
    if (used == 0) {
      sink.stash(value);
    }
  }

  /** A value a pattern reads: the original expression when it is read once, else a name. */
  private final class ValueReference {
    private final Node value;
    private final @Nullable String name;
    private boolean used = false;

    ValueReference(Node value, @Nullable String name) {
      this.value = value;
      this.name = name;
    }

    Node get() {
      if (name != null) {
        return astFactory.createName(name, value);
      }
      if (used) {
        return record.deepCopy(value);
      }
      used = true;
      return value;
    }
  }

  private ValueReference createReference(Node value, boolean readsMoreThanOnce, BindingSink sink) {
    if (value.is(Token.NAME)) {
      return new ValueReference(value, value.getNonNullString());
    }
    if (!readsMoreThanOnce) {
      return new ValueReference(value, null);
    }
    return new ValueReference(value, sink.stash(value));
  }

  // Declarations.

  private void visitDeclaration(Node n) {
    ImmutableList<Node> declarators = record.getChildren(n);
    boolean hasPattern = false;
    for (Node declarator : declarators) {
      hasPattern |= declarator.is(Token.DESTRUCTURING_LHS);
    }
    if (!hasPattern) {
      return;
    }
    DeclarationSink sink = new DeclarationSink();
    for (Node declarator : declarators) {
      if (declarator.is(Token.DESTRUCTURING_LHS)) {
        Node value = NodeUtil.getDeclaratorValue(record, declarator);
        if (value == null) {
          TranspilationUtil.cannotConvert(
              compiler, declarator, "A destructuring declaration needs an initializer.");
          return;
        }
        destructure(record.getChild(declarator, 0), value, sink);
      } else {
        sink.declarators.add(declarator);
      }
    }
    record.replace(n, record.withChildren(n, sink.declarators));
  }

  /** Returns {@code var <pattern> = value} lowered to simple declarators. */
  private Node createDeclaration(Token kind, Node pattern, Node value, @Nullable Node origin) {
    DeclarationSink sink = new DeclarationSink();
    destructure(pattern, value, sink);
    return record.newNode(kind, sink.declarators, null, 0, 0, origin);
  }

  // Assignments.

  private void visitAssignment(NodeTraversal t, Node n, @Nullable Node parent) {
    Node pattern = record.getChild(n, 0);
    Node value = record.getChild(n, 1);
    AssignmentSink sink = new AssignmentSink(t.getClosestHoistScope());
    boolean resultUsed = parent == null || !parent.is(Token.EXPR_RESULT);
    if (resultUsed && !value.is(Token.NAME)) {
      value = astFactory.createName(sink.stash(value));
    }
    destructure(pattern, value, sink);
    if (resultUsed) {
      sink.assignments.add(record.deepCopy(value));
    }
    record.replace(n, astFactory.createCommas(sink.assignments));
  }

  // Parameters, catch bindings and loop heads.

  private void visitParameters(Node function) {
    Node paramList = NodeUtil.getFunctionParameters(record, function);
    List<Node> newParams = new ArrayList<>();
    List<Node> declarations = new ArrayList<>();
    for (Node param : record.getChildren(paramList)) {
      if (NodeUtil.isPattern(param)) {
        String temp = nameGenerator.newTemporary();
        newParams.add(astFactory.createName(temp, param));
        declarations.add(
            createDeclaration(Token.VAR, param, astFactory.createName(temp), param));
      } else {
        newParams.add(param);
      }
    }
    if (declarations.isEmpty()) {
      return;
    }
    record.replace(paramList, record.withChildren(paramList, newParams));
    NodeUtil.addStatementsAfterDirectives(
        record, NodeUtil.getFunctionBody(record, function), declarations);
  }

  private void visitCatch(Node n) {
    Node binding = record.getChild(n, 0);
    if (binding.is(Token.EMPTY)) {
      if (rewriteOptionalCatchBinding) {
        record.replace(binding, astFactory.createName(nameGenerator.newTemporary()));
      }
      return;
    }
    if (rewritePatterns && NodeUtil.isPattern(binding)) {
      String temp = nameGenerator.newTemporary();
      record.replace(binding, astFactory.createName(temp, binding));
      Node declaration =
          createDeclaration(Token.VAR, binding, astFactory.createName(temp), binding);
      NodeUtil.addStatementsAfterDirectives(
          record, record.getChild(n, 1), ImmutableList.of(declaration));
    }
  }

  /**
   * {@code for (var [k, v] of pairs) body} becomes {@code for (var _a of pairs) { var k = _a[0],
   * v = _a[1]; body }}.
   */
  private void visitForInOrOfHead(NodeTraversal t, Node n) {
    Node head = record.getChild(n, 0);
    Node statement;
    if (NodeUtil.isNameDeclaration(head)) {
      Node declarator = record.getChild(head, 0);
      if (!declarator.is(Token.DESTRUCTURING_LHS)) {
        return;
      }
      String temp = nameGenerator.newTemporary();
      Node pattern = record.getChild(declarator, 0);
      record.replace(
          head,
          record.newNode(
              head.getToken(),
              ImmutableList.of(astFactory.createDeclarator(temp, null, pattern)),
              null,
              0,
              0,
              head));
      statement =
          createDeclaration(head.getToken(), pattern, astFactory.createName(temp), pattern);
    } else if (NodeUtil.isPattern(head)) {
      String temp = nameGenerator.newTemporary();
      AssignmentSink sink = new AssignmentSink(t.getClosestHoistScope());
      record.declareTemporary(t.getClosestHoistScope(), temp);
      destructure(head, astFactory.createName(temp), sink);
      record.replace(head, astFactory.createName(temp, head));
      statement = astFactory.exprResult(astFactory.createCommas(sink.assignments));
    } else {
      return;
    }
    Node body = record.getChild(n, 2);
    if (body.is(Token.BLOCK)) {
      List<Node> statements = new ArrayList<>();
      statements.add(statement);
      statements.addAll(record.getChildren(body));
      record.replace(body, record.withChildren(body, statements));
    } else {
      record.replace(body, astFactory.createBlock(statement, record.copy(body)));
    }
  }
}
