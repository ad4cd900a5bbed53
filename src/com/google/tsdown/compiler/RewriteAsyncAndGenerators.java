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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lowers async functions and generators.
 *
 * <p>Below ES2017, an async function runs its body as a generator driven by {@code __awaiter}:
 *
 * <pre>
 * async function f() { await g(); }
 * function f() { return __awaiter(this, void 0, void 0, function* () { yield g(); }); }
 * </pre>
 *
 * <p>For ES5, where generators are not available either, the generator body is flattened by
 * {@link StateMachineBuilder} into a function driven by {@code __generator}. Async generators
 * are left as they are.
 */
final class RewriteAsyncAndGenerators extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private static final Logger logger =
      Logger.getLogger(RewriteAsyncAndGenerators.class.getName());

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final boolean rewriteAsync;
  private final boolean rewriteGenerators;
  private final boolean rewriteAsyncGenerators;
  private int functionCount = 0;

  RewriteAsyncAndGenerators(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.rewriteAsync = compiler.needsLowering(LanguageMode.ECMASCRIPT_2017);
    this.rewriteGenerators = compiler.needsLowering(LanguageMode.ECMASCRIPT_2015);
    this.rewriteAsyncGenerators = compiler.needsLowering(LanguageMode.ECMASCRIPT_2018);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
    logger.fine(() -> "Lowered " + functionCount + " async functions and generators");
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.is(Token.FUNCTION)) {
      return;
    }
    if (n.isAsync() && n.isGenerator()) {
      if (rewriteAsyncGenerators) {
        TranspilationUtil.markIncompletelyLowered(compiler, n, "An async generator function");
      }
    } else if (n.isAsync() && rewriteAsync) {
      if (rewriteGenerators) {
        lowerToStateMachine(n);
      } else {
        lowerToGenerator(n);
      }
    } else if (n.isGenerator() && rewriteGenerators) {
      lowerToStateMachine(n);
    }
  }

  // ES2015 and ES2016.

  /** Moves the body into a generator passed to {@code __awaiter}. */
  private void lowerToGenerator(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node body = children.get(2);
    if (NodeUtil.has(record, body, node -> node.is(Token.SUPER), NodeUtil.MATCH_NOT_THIS_BINDING)) {
      TranspilationUtil.markIncompletelyLowered(
          compiler, n, "An async function referring to super");
      return;
    }
    boolean usesArguments = NodeUtil.referencesArguments(record, body);
    if (n.isArrow() && usesArguments) {
      TranspilationUtil.markIncompletelyLowered(
          compiler, n, "An async arrow function referring to arguments");
      return;
    }
    replaceAwaits(body);
    functionCount++;

    List<Node> directives = new ArrayList<>();
    List<Node> statements = new ArrayList<>();
    if (body.is(Token.BLOCK)) {
      ImmutableList<Node> bodyStatements = record.getChildren(body);
      int directiveCount = NodeUtil.getDirectiveCount(record, bodyStatements);
      directives.addAll(bodyStatements.subList(0, directiveCount));
      statements.addAll(bodyStatements.subList(directiveCount, bodyStatements.size()));
    } else {
      statements.add(astFactory.createReturn(body, body));
    }
    Node generator =
        astFactory.createFunction(
            null, astFactory.createParamList(), astFactory.createBlock(statements), Node.GENERATOR);
    Node awaiterCall =
        createAwaiterCall(
            usesArguments ? astFactory.createName("arguments") : astFactory.createUndefinedValue(),
            generator);

    Node newBody;
    if (body.is(Token.BLOCK)) {
      directives.add(astFactory.createReturn(awaiterCall, body));
      newBody = record.withChildren(body, directives);
    } else {
      newBody = awaiterCall;
    }
    replaceFunction(n, children, newBody);
  }

  /** Replaces the {@code await}s of one function with {@code yield}s. */
  private void replaceAwaits(Node n) {
    if (n.is(Token.FUNCTION)) {
      return;
    }
    for (Node child : record.getChildren(n)) {
      replaceAwaits(child);
    }
    if (n.is(Token.AWAIT)) {
      record.replace(n, record.newNode(Token.YIELD, record.getChildren(n), null, 0, 0, n));
    }
  }

  // ES5.

  /**
   * Flattens the body into a state machine:
   *
   * <pre>
   * function f() {
   *   return __awaiter(this, void 0, void 0, function () {
   *     var x;
   *     return __generator(this, function (_a) {
   *       switch (_a.label) {
   *         case 0: return [4, g()];
   *         case 1: x = _a.sent(); return [2, x];
   *       }
   *     });
   *   });
   * }
   * </pre>
   */
  private void lowerToStateMachine(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node body = children.get(2);
    ImmutableList<Node> bodyStatements = record.getChildren(body);
    int directiveCount = NodeUtil.getDirectiveCount(record, bodyStatements);
    functionCount++;

    String stateName = nameGenerator.newTemporary();
    String argumentsAlias =
        NodeUtil.referencesArguments(record, body) ? nameGenerator.uniqueName("_arguments") : null;
    StateDescriptor descriptor =
        new StateMachineBuilder(compiler, stateName, argumentsAlias)
            .build(bodyStatements.subList(directiveCount, bodyStatements.size()));

    Node generatorBody =
        astFactory.createFunction(
            null,
            astFactory.createParamList(stateName),
            astFactory.createBlock(descriptor.createGeneratorBody(astFactory, stateName)),
            0);
    List<Node> statements = new ArrayList<>();
    Node declarations = createHoistedDeclarations(children.get(1), descriptor, argumentsAlias);
    if (declarations != null) {
      statements.add(declarations);
    }
    statements.addAll(descriptor.getHoistedFunctions());
    statements.add(
        astFactory.createReturn(
            astFactory.createHelperCall(
                RuntimeHelper.GENERATOR, astFactory.createThis(), generatorBody),
            body));

    List<Node> newStatements = new ArrayList<>(bodyStatements.subList(0, directiveCount));
    if (n.isAsync()) {
      Node awaiterCall =
          createAwaiterCall(
              argumentsAlias != null
                  ? astFactory.createName("arguments")
                  : astFactory.createUndefinedValue(),
              astFactory.createFunction(
                  null, astFactory.createParamList(), astFactory.createBlock(statements), 0));
      newStatements.add(astFactory.createReturn(awaiterCall, body));
    } else {
      newStatements.addAll(statements);
    }
    replaceFunction(n, children, record.withChildren(body, newStatements));
  }

  /**
   * Declares the alias of {@code arguments} and the body's variables. Parameters are not
   * redeclared: the declaration may end up in a nested function, where it would shadow them.
   */
  private @Nullable Node createHoistedDeclarations(
      Node params, StateDescriptor descriptor, @Nullable String argumentsAlias) {
    Set<String> parameterNames = new HashSet<>();
    List<Node> names = new ArrayList<>();
    for (Node param : record.getChildren(params)) {
      NodeUtil.collectTargetNames(record, param, names);
    }
    for (Node name : names) {
      parameterNames.add(name.getNonNullString());
    }
    List<Node> declarators = new ArrayList<>();
    if (argumentsAlias != null) {
      declarators.add(
          astFactory.createDeclarator(argumentsAlias, astFactory.createName("arguments"), null));
    }
    for (String name : descriptor.getHoistedNames()) {
      if (!parameterNames.contains(name)) {
        declarators.add(astFactory.createDeclarator(name, null, null));
      }
    }
    return declarators.isEmpty() ? null : astFactory.createVar(declarators);
  }

  private Node createAwaiterCall(Node arguments, Node generator) {
    return astFactory.createHelperCall(
        RuntimeHelper.AWAITER,
        astFactory.createThis(),
        arguments,
        astFactory.createUndefinedValue(),
        generator);
  }

  private void replaceFunction(Node n, ImmutableList<Node> children, Node newBody) {
    int flags = n.getFlags() & ~(Node.ASYNC | Node.GENERATOR);
    record.replace(
        n, record.withFlags(n, flags, ImmutableList.of(children.get(0), children.get(1), newBody)));
  }
}
