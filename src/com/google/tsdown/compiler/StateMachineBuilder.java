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
import com.google.common.collect.ImmutableSet;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import com.google.tsdown.compiler.StateDescriptor.LabelReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Flattens the body of an async function or generator into a {@link StateDescriptor}.
 *
 * <p>Statements without suspension points are kept as they are, apart from hoisting their
 * {@code var} declarations and turning {@code return}, and jumps out to flattened statements,
 * into runtime instructions. A statement that suspends is split: control structures become
 * labeled blocks joined by jumps, and an expression is evaluated left to right with everything
 * before a suspension stored in temporaries, so that it can be rebuilt around {@code _a.sent()}
 * when the runtime resumes.
 */
final class StateMachineBuilder {

  /** Where {@code break} and {@code continue} inside a flattened statement go. */
  private static final class JumpTarget {
    final ImmutableSet<String> labels;
    final Label breakLabel;
    final @Nullable Label continueLabel;
    final boolean acceptsUnlabeledBreak;

    JumpTarget(
        ImmutableSet<String> labels,
        Label breakLabel,
        @Nullable Label continueLabel,
        boolean acceptsUnlabeledBreak) {
      this.labels = labels;
      this.breakLabel = breakLabel;
      this.continueLabel = continueLabel;
      this.acceptsUnlabeledBreak = acceptsUnlabeledBreak;
    }
  }

  /** The jump targets defined inside the statement being kept as is. */
  private record LeafContext(ImmutableSet<String> labels, boolean inLoop, boolean inBreakable) {
    static final LeafContext TOP = new LeafContext(ImmutableSet.of(), false, false);

    LeafContext withLabel(String label) {
      return new LeafContext(
          ImmutableSet.<String>builder().addAll(labels).add(label).build(), inLoop, inBreakable);
    }

    LeafContext enterLoop() {
      return new LeafContext(labels, true, true);
    }

    LeafContext enterSwitch() {
      return new LeafContext(labels, inLoop, true);
    }
  }

  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;
  private final String stateName;
  private final @Nullable String argumentsAlias;

  private final List<StateBlock> blocks = new ArrayList<>();
  private StateBlock current;
  private final List<ProtectedRegion> regions = new ArrayList<>();
  private final Set<String> hoistedNames = new LinkedHashSet<>();
  private final List<Node> hoistedFunctions = new ArrayList<>();
  private final List<LabelReference> labelReferences = new ArrayList<>();
  private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();

  /**
   * @param stateName the parameter of the generator body, the runtime's state object
   * @param argumentsAlias the name {@code arguments} is read through, or null when the body does
   *     not use it
   */
  StateMachineBuilder(
      AbstractCompiler compiler, String stateName, @Nullable String argumentsAlias) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
    this.stateName = stateName;
    this.argumentsAlias = argumentsAlias;
    this.current = new StateBlock(0);
    blocks.add(current);
  }

  /** Flattens the statements of a function body, directives excluded. */
  StateDescriptor build(List<Node> statements) {
    for (Node statement : statements) {
      collectVarNames(statement);
    }
    for (Node statement : statements) {
      transformStatement(statement);
    }
    if (!current.isTerminated()) {
      current.setTerminal(Terminal.returnValue(null, null));
    }
    return new StateDescriptor(
        blocks,
        regions,
        ImmutableList.copyOf(hoistedNames),
        hoistedFunctions,
        labelReferences);
  }

  private void collectVarNames(Node n) {
    if (n.is(Token.FUNCTION)) {
      return;
    }
    if (n.is(Token.VAR)) {
      for (Node name : NodeUtil.getDeclaredNames(record, n)) {
        hoistedNames.add(name.getNonNullString());
      }
    }
    for (Node child : record.getChildren(n)) {
      collectVarNames(child);
    }
  }

  private boolean containsSuspension(Node n) {
    return NodeUtil.has(
        record,
        n,
        node -> node.is(Token.AWAIT) || node.is(Token.YIELD),
        NodeUtil.MATCH_NOT_FUNCTION);
  }

  // Layout.

  /** Starts the block {@code label} names, unless the current block is still empty. */
  private void markLabel(Label label) {
    if (!current.isEmpty()) {
      if (!current.isTerminated()) {
        current.setTerminal(Terminal.fallthrough());
      }
      current = new StateBlock(blocks.size());
      blocks.add(current);
    }
    label.bind(current.getNumber());
  }

  /** Adds a statement to the current block. Statements after a terminal are unreachable. */
  private void emitStatement(Node statement) {
    if (!current.isTerminated()) {
      current.addStatement(statement);
    }
  }

  private void emitTerminal(Terminal terminal) {
    if (current.isTerminated()) {
      return;
    }
    current.setTerminal(terminal);
    if (terminal.resumesAtNextBlock()) {
      markLabel(new Label());
    }
  }

  private void emitConditionalJump(Node condition, boolean whenTrue, Label target, Node origin) {
    Node test = whenTrue ? condition : astFactory.createNot(condition);
    emitStatement(astFactory.createIf(test, createJump(target, origin)));
  }

  private void emitAssignment(String name, Node value) {
    emitStatement(astFactory.exprResult(astFactory.createAssign(name, value)));
  }

  /** Returns {@code return [3, label];}, the number filled in once blocks are numbered. */
  private Node createJump(Label target, @Nullable Node origin) {
    Node placeholder = astFactory.createNumber(-1);
    labelReferences.add(new LabelReference(target, placeholder));
    return StateDescriptor.createInstruction(
        astFactory, StateDescriptor.OP_BREAK, "break", placeholder, origin);
  }

  private Node createLabelReference(Label label) {
    Node placeholder = astFactory.createNumber(-1);
    labelReferences.add(new LabelReference(label, placeholder));
    return placeholder;
  }

  /** {@code _a.sent()}: the value the runtime resumed with. */
  private Node createSent(Node origin) {
    return astFactory.createCall(
        astFactory.createGetProp(astFactory.createName(stateName), "sent"),
        ImmutableList.of(),
        origin);
  }

  private String newTemporary() {
    String name = nameGenerator.newTemporary();
    hoistedNames.add(name);
    return name;
  }

  /**
   * Stores {@code value} in a temporary so that a later suspension cannot change it. Values no
   * code can change are returned as they are.
   */
  private Node stash(Node value) {
    if (NodeUtil.isImmutableValue(value)
        || value.is(Token.THIS)
        || value.is(Token.EMPTY)
        || value.is(Token.FUNCTION)) {
      return value;
    }
    return stashAlways(value);
  }

  private Node stashAlways(Node value) {
    String temp = newTemporary();
    emitAssignment(temp, value);
    return astFactory.createName(temp);
  }

  // Statements.

  private void transformStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        hoistedFunctions.add(n);
        return;
      case VAR:
        transformVar(n);
        return;
      case EMPTY:
        return;
      default:
        break;
    }
    if (!containsSuspension(n)) {
      transformLeafStatement(n);
      return;
    }
    switch (n.getToken()) {
      case BLOCK:
        for (Node child : record.getChildren(n)) {
          transformStatement(child);
        }
        break;
      case EXPR_RESULT:
        {
          Node expr = transformExpression(record.getChild(n, 0));
          if (!expr.is(Token.NAME)) {
            emitStatement(record.withChildren(n, ImmutableList.of(expr)));
          }
          break;
        }
      case RETURN:
        {
          ImmutableList<Node> children = record.getChildren(n);
          Node value = children.isEmpty() ? null : transformExpression(children.get(0));
          emitTerminal(Terminal.returnValue(value, n));
          break;
        }
      case THROW:
        emitTerminal(Terminal.throwValue(transformExpression(record.getChild(n, 0)), n));
        break;
      case IF:
        transformIf(n);
        break;
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
        transformLoop(n, ImmutableSet.of());
        break;
      case LABEL:
        transformLabel(n);
        break;
      case SWITCH:
        transformSwitch(n, ImmutableSet.of());
        break;
      case TRY:
        transformTry(n);
        break;
      default:
        TranspilationUtil.markIncompletelyLowered(
            compiler, n, "A " + n.getToken() + " statement containing a suspension point");
        rewriteLeaf(n, LeafContext.TOP);
        emitStatement(n);
        break;
    }
  }

  /** Keeps a statement without suspension points, ending the block if it always exits. */
  private void transformLeafStatement(Node n) {
    switch (n.getToken()) {
      case RETURN:
        {
          ImmutableList<Node> children = record.getChildren(n);
          Node value = children.isEmpty() ? null : children.get(0);
          if (value != null) {
            rewriteLeaf(value, LeafContext.TOP);
          }
          emitTerminal(Terminal.returnValue(value, n));
          return;
        }
      case THROW:
        {
          Node value = record.getChild(n, 0);
          rewriteLeaf(value, LeafContext.TOP);
          emitTerminal(Terminal.throwValue(value, n));
          return;
        }
      case BREAK:
      case CONTINUE:
        {
          Label target = resolveJump(n, LeafContext.TOP);
          if (target != null) {
            emitTerminal(Terminal.jump(target, n));
            return;
          }
          break;
        }
      default:
        break;
    }
    rewriteLeaf(n, LeafContext.TOP);
    emitStatement(n);
  }

  /** Turns a {@code var} into assignments to the hoisted names. */
  private void transformVar(Node n) {
    List<Node> assignments = new ArrayList<>();
    for (Node declarator : record.getChildren(n)) {
      Node value = NodeUtil.getDeclaratorValue(record, declarator);
      if (value == null) {
        continue;
      }
      if (containsSuspension(value)) {
        flushAssignments(assignments);
        value = transformExpression(value);
      } else {
        rewriteLeaf(value, LeafContext.TOP);
      }
      assignments.add(
          astFactory.createAssign(
              astFactory.createName(declarator.getNonNullString(), declarator),
              value,
              declarator));
    }
    flushAssignments(assignments);
  }

  private void flushAssignments(List<Node> assignments) {
    if (!assignments.isEmpty()) {
      emitStatement(astFactory.exprResult(astFactory.createCommas(assignments)));
      assignments.clear();
    }
  }

  private void transformIf(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node thenBranch = children.get(1);
    Node elseBranch = children.size() > 2 ? children.get(2) : null;
    Node condition = transformExpression(children.get(0));
    if (!containsSuspension(thenBranch)
        && (elseBranch == null || !containsSuspension(elseBranch))) {
      rewriteLeaf(thenBranch, LeafContext.TOP);
      List<Node> newChildren = new ArrayList<>();
      newChildren.add(condition);
      newChildren.add(thenBranch);
      if (elseBranch != null) {
        rewriteLeaf(elseBranch, LeafContext.TOP);
        newChildren.add(elseBranch);
      }
      emitStatement(record.withChildren(n, newChildren));
      return;
    }
    Label end = new Label();
    Label elseLabel = elseBranch != null ? new Label() : end;
    emitConditionalJump(condition, false, elseLabel, n);
    transformStatement(thenBranch);
    if (elseBranch != null) {
      emitTerminal(Terminal.jump(end, null));
      markLabel(elseLabel);
      transformStatement(elseBranch);
    }
    markLabel(end);
  }

  private void transformLabel(Node n) {
    Set<String> labels = new LinkedHashSet<>();
    Node statement = n;
    while (statement.is(Token.LABEL)) {
      labels.add(statement.getNonNullString());
      statement = record.getChild(statement, 0);
    }
    ImmutableSet<String> labelSet = ImmutableSet.copyOf(labels);
    if (NodeUtil.isLoopStructure(statement) && !statement.is(Token.FOR_OF)) {
      transformLoop(statement, labelSet);
    } else if (statement.is(Token.SWITCH)) {
      transformSwitch(statement, labelSet);
    } else {
      Label end = new Label();
      jumpTargets.push(new JumpTarget(labelSet, end, null, false));
      transformStatement(statement);
      jumpTargets.pop();
      markLabel(end);
    }
  }

  private void transformLoop(Node n, ImmutableSet<String> labels) {
    switch (n.getToken()) {
      case WHILE:
        transformWhile(n, labels);
        break;
      case DO:
        transformDo(n, labels);
        break;
      case FOR:
        transformFor(n, labels);
        break;
      case FOR_IN:
        transformForIn(n, labels);
        break;
      default:
        throw new IllegalStateException("Unexpected loop: " + n);
    }
  }

  private void transformLoopBody(
      Node body, ImmutableSet<String> labels, Label breakLabel, Label continueLabel) {
    jumpTargets.push(new JumpTarget(labels, breakLabel, continueLabel, true));
    transformStatement(body);
    jumpTargets.pop();
  }

  private void transformWhile(Node n, ImmutableSet<String> labels) {
    Label loop = new Label();
    Label end = new Label();
    markLabel(loop);
    Node condition = transformExpression(record.getChild(n, 0));
    emitConditionalJump(condition, false, end, n);
    transformLoopBody(record.getChild(n, 1), labels, end, loop);
    emitTerminal(Terminal.jump(loop, null));
    markLabel(end);
  }

  private void transformDo(Node n, ImmutableSet<String> labels) {
    Label loop = new Label();
    Label condition = new Label();
    Label end = new Label();
    markLabel(loop);
    transformLoopBody(record.getChild(n, 0), labels, end, condition);
    markLabel(condition);
    emitConditionalJump(transformExpression(record.getChild(n, 1)), true, loop, n);
    markLabel(end);
  }

  /**
   * The condition is evaluated at the top of each iteration and the update at the end, each in
   * a block of its own, so that either can suspend.
   */
  private void transformFor(Node n, ImmutableSet<String> labels) {
    ImmutableList<Node> children = record.getChildren(n);
    Node init = children.get(0);
    Node condition = children.get(1);
    Node update = children.get(2);
    if (init.is(Token.VAR)) {
      transformVar(init);
    } else if (!init.is(Token.EMPTY)) {
      emitExpressionStatement(init);
    }
    Label conditionLabel = new Label();
    Label updateLabel = new Label();
    Label end = new Label();
    markLabel(conditionLabel);
    if (!condition.is(Token.EMPTY)) {
      emitConditionalJump(transformExpression(condition), false, end, n);
    }
    transformLoopBody(children.get(3), labels, end, updateLabel);
    markLabel(updateLabel);
    if (!update.is(Token.EMPTY)) {
      emitExpressionStatement(update);
    }
    emitTerminal(Terminal.jump(conditionLabel, null));
    markLabel(end);
  }

  private void emitExpressionStatement(Node expr) {
    Node value = transformExpression(expr);
    if (!value.is(Token.NAME)) {
      emitStatement(astFactory.exprResult(value));
    }
  }

  /**
   * Iterates over a snapshot of the object's keys, skipping keys deleted before they are
   * reached:
   *
   * <pre>
   * _b = obj; _c = []; for (_d in _b) _c.push(_d); _e = 0;
   * case 1: if (!(_e &lt; _c.length)) return [3, 4]; _d = _c[_e];
   *         if (!(_d in _b)) return [3, 3]; key = _d; ...
   * case 3: _e++; return [3, 1];
   * </pre>
   */
  private void transformForIn(Node n, ImmutableSet<String> labels) {
    ImmutableList<Node> children = record.getChildren(n);
    Node target = children.get(0);
    Node object = stashAlways(transformExpression(children.get(1)));
    String keys = newTemporary();
    String key = newTemporary();
    String index = newTemporary();
    emitAssignment(keys, astFactory.createArraylit());
    emitStatement(
        record.newNode(
            Token.FOR_IN,
            ImmutableList.of(
                astFactory.createName(key),
                record.deepCopy(object),
                astFactory.exprResult(
                    astFactory.createCall(
                        astFactory.createGetProp(astFactory.createName(keys), "push"),
                        astFactory.createName(key)))),
            null,
            0,
            0,
            null));
    emitAssignment(index, astFactory.createNumber(0));

    Label loop = new Label();
    Label next = new Label();
    Label end = new Label();
    markLabel(loop);
    emitConditionalJump(
        astFactory.createLessThan(
            astFactory.createName(index),
            astFactory.createGetProp(astFactory.createName(keys), "length")),
        false,
        end,
        n);
    emitAssignment(
        key,
        astFactory.createGetElem(astFactory.createName(keys), astFactory.createName(index)));
    emitConditionalJump(
        astFactory.createIn(astFactory.createName(key), record.deepCopy(object)), false, next, n);
    Node targetRef;
    if (target.is(Token.VAR)) {
      Node name = record.getChild(target, 0);
      targetRef = astFactory.createName(name.getNonNullString(), name);
    } else {
      targetRef = transformExpression(target);
    }
    emitStatement(
        astFactory.exprResult(
            astFactory.createAssign(targetRef, astFactory.createName(key), target)));
    transformLoopBody(children.get(2), labels, end, next);
    markLabel(next);
    emitStatement(astFactory.exprResult(astFactory.createInc(astFactory.createName(index), true)));
    emitTerminal(Terminal.jump(loop, null));
    markLabel(end);
  }

  /**
   * Case tests without suspension points dispatch through a {@code switch} of jumps; otherwise
   * the tests are evaluated one after another and compared with {@code ===}.
   */
  private void transformSwitch(Node n, ImmutableSet<String> labels) {
    ImmutableList<Node> children = record.getChildren(n);
    ImmutableList<Node> clauses = children.subList(1, children.size());
    Node discriminant = transformExpression(children.get(0));
    boolean testsSuspend = false;
    for (Node clause : clauses) {
      testsSuspend |= clause.is(Token.CASE) && containsSuspension(record.getChild(clause, 0));
    }

    Label end = new Label();
    Label defaultLabel = null;
    List<Label> clauseLabels = new ArrayList<>();
    for (Node clause : clauses) {
      Label label = new Label();
      clauseLabels.add(label);
      if (clause.is(Token.DEFAULT_CASE)) {
        defaultLabel = label;
      }
    }

    if (testsSuspend) {
      Node value = stash(discriminant);
      for (int i = 0; i < clauses.size(); i++) {
        Node clause = clauses.get(i);
        if (clause.is(Token.CASE)) {
          Node test = transformExpression(record.getChild(clause, 0));
          emitConditionalJump(
              astFactory.createSheq(record.deepCopy(value), test),
              true,
              clauseLabels.get(i),
              clause);
        }
      }
    } else {
      List<Node> dispatch = new ArrayList<>();
      dispatch.add(discriminant);
      for (int i = 0; i < clauses.size(); i++) {
        Node clause = clauses.get(i);
        if (clause.is(Token.CASE)) {
          Node test = record.getChild(clause, 0);
          rewriteLeaf(test, LeafContext.TOP);
          dispatch.add(
              record.newNode(
                  Token.CASE,
                  ImmutableList.of(test, createJump(clauseLabels.get(i), clause)),
                  null,
                  0,
                  0,
                  null));
        }
      }
      emitStatement(record.newNode(Token.SWITCH, dispatch, null, 0, 0, n));
    }
    emitTerminal(Terminal.jump(defaultLabel != null ? defaultLabel : end, n));

    jumpTargets.push(new JumpTarget(labels, end, null, true));
    for (int i = 0; i < clauses.size(); i++) {
      Node clause = clauses.get(i);
      markLabel(clauseLabels.get(i));
      ImmutableList<Node> statements = record.getChildren(clause);
      for (Node statement : clause.is(Token.CASE) ? statements.subList(1, statements.size())
          : statements) {
        transformStatement(statement);
      }
    }
    jumpTargets.pop();
    markLabel(end);
  }

  /**
   * Registers a protected region with the runtime. The try and catch blocks end by jumping to
   * the end label, which the runtime routes through the finally block; the finally block ends
   * with {@code [7]} to resume whatever completion was pending.
   */
  private void transformTry(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node catchNode = children.get(1).is(Token.CATCH) ? children.get(1) : null;
    Node finallyBlock = children.size() > 2 ? children.get(2) : null;

    Label tryLabel = new Label();
    Label catchLabel = catchNode != null ? new Label() : null;
    Label finallyLabel = finallyBlock != null ? new Label() : null;
    Label end = new Label();
    markLabel(tryLabel);
    regions.add(
        ProtectedRegion.create(
            tryLabel, Optional.ofNullable(catchLabel), Optional.ofNullable(finallyLabel), end));
    Node region =
        astFactory.createArraylit(
            createLabelReference(tryLabel),
            catchLabel != null ? createLabelReference(catchLabel) : astFactory.createEmpty(),
            finallyLabel != null ? createLabelReference(finallyLabel) : astFactory.createEmpty(),
            createLabelReference(end));
    emitStatement(
        astFactory.exprResult(
            astFactory.createCall(
                astFactory.createGetProp(
                    astFactory.createGetProp(astFactory.createName(stateName), "trys"), "push"),
                region)));

    transformStatement(children.get(0));
    emitTerminal(Terminal.jump(end, null));

    if (catchNode != null) {
      markLabel(catchLabel);
      Node binding = record.getChild(catchNode, 0);
      Node block = record.getChild(catchNode, 1);
      if (binding.is(Token.NAME)) {
        String oldName = binding.getNonNullString();
        String newName = nameGenerator.numberedName(oldName);
        hoistedNames.add(newName);
        renameReferences(block, oldName, newName);
        emitStatement(
            astFactory.exprResult(
                astFactory.createAssign(
                    astFactory.createName(newName, binding), createSent(binding), catchNode)));
      } else {
        emitStatement(astFactory.exprResult(createSent(catchNode)));
      }
      transformStatement(block);
      emitTerminal(Terminal.jump(end, null));
    }
    if (finallyBlock != null) {
      markLabel(finallyLabel);
      transformStatement(finallyBlock);
      emitTerminal(Terminal.endFinally());
    }
    markLabel(end);
  }

  /** Renames references to a catch variable, which is hoisted out of its block. */
  private void renameReferences(Node n, String oldName, String newName) {
    if (n.is(Token.FUNCTION) && NodeUtil.getScopeDeclaredNames(record, n).contains(oldName)) {
      return;
    }
    if (n.is(Token.NAME) && oldName.equals(n.getString())) {
      record.replace(
          n,
          record.newNode(Token.NAME, record.getChildren(n), newName, 0, n.getFlags(), n));
      return;
    }
    for (Node child : record.getChildren(n)) {
      renameReferences(child, oldName, newName);
    }
  }

  // Statements kept as they are.

  /**
   * Prepares a statement or expression without suspension points to run inside the generator
   * body: {@code var} declarations become assignments, {@code return} and jumps out of the
   * statement become runtime instructions, and {@code arguments} is read through its alias.
   */
  private void rewriteLeaf(Node n, LeafContext context) {
    switch (n.getToken()) {
      case FUNCTION:
        return;
      case NAME:
        if (argumentsAlias != null && "arguments".equals(n.getString())) {
          record.replace(n, astFactory.createName(argumentsAlias, n));
        }
        return;
      case VAR:
        rewriteLeafChildren(n, context);
        return;
      case RETURN:
        {
          rewriteLeafChildren(n, context);
          ImmutableList<Node> children = record.getChildren(n);
          record.replace(
              n,
              StateDescriptor.createInstruction(
                  astFactory,
                  StateDescriptor.OP_RETURN,
                  "return",
                  children.isEmpty() ? null : children.get(0),
                  n));
          return;
        }
      case BREAK:
      case CONTINUE:
        rewriteJump(n, context);
        return;
      case LABEL:
        rewriteLeafChildren(n, context.withLabel(n.getNonNullString()));
        return;
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case WHILE:
      case DO:
        rewriteLeafChildren(n, context.enterLoop());
        return;
      case SWITCH:
        rewriteLeafChildren(n, context.enterSwitch());
        return;
      default:
        rewriteLeafChildren(n, context);
        return;
    }
  }

  private void rewriteLeafChildren(Node n, LeafContext context) {
    ImmutableList<Node> children = record.getChildren(n);
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      if (child.is(Token.VAR)) {
        rewriteLeafVar(child, n, i, context);
      } else {
        rewriteLeaf(child, context);
      }
    }
  }

  /** Replaces a {@code var} whose names are hoisted, according to where it appears. */
  private void rewriteLeafVar(Node n, Node parent, int index, LeafContext context) {
    List<Node> assignments = new ArrayList<>();
    Node lastName = null;
    for (Node declarator : record.getChildren(n)) {
      lastName = declarator;
      Node value = NodeUtil.getDeclaratorValue(record, declarator);
      if (value != null) {
        rewriteLeaf(value, context);
        assignments.add(
            astFactory.createAssign(
                astFactory.createName(declarator.getNonNullString(), declarator),
                value,
                declarator));
      }
    }
    boolean isLoopHead = index == 0 && NodeUtil.isLoopStructure(parent);
    if (isLoopHead && !parent.is(Token.FOR)) {
      record.replace(n, astFactory.createName(lastName.getNonNullString(), lastName));
    } else if (isLoopHead) {
      record.replace(
          n,
          assignments.isEmpty() ? astFactory.createEmpty() : astFactory.createCommas(assignments));
    } else if (assignments.isEmpty()) {
      if (NodeUtil.isStatementList(parent)) {
        record.elide(n);
      } else {
        record.replace(n, astFactory.createEmpty());
      }
    } else {
      record.replace(n, astFactory.exprResult(astFactory.createCommas(assignments)));
    }
  }

  private void rewriteJump(Node n, LeafContext context) {
    Label target = resolveJump(n, context);
    if (target != null) {
      record.replace(n, createJump(target, n));
    }
  }

  /**
   * Returns the label a {@code break} or {@code continue} jumps to, or null when it stays inside
   * the statement being kept.
   */
  private @Nullable Label resolveJump(Node n, LeafContext context) {
    String label = n.getString();
    boolean isBreak = n.is(Token.BREAK);
    boolean isLocal =
        label != null
            ? context.labels().contains(label)
            : isBreak ? context.inBreakable() : context.inLoop();
    if (isLocal) {
      return null;
    }
    for (JumpTarget target : jumpTargets) {
      if (label != null) {
        if (target.labels.contains(label)) {
          return isBreak ? target.breakLabel : target.continueLabel;
        }
      } else if (isBreak ? target.acceptsUnlabeledBreak : target.continueLabel != null) {
        return isBreak ? target.breakLabel : target.continueLabel;
      }
    }
    return null;
  }

  // Expressions.

  /**
   * Emits whatever must run before the value of {@code n} is known, and returns an expression
   * that computes it in the current block.
   */
  private Node transformExpression(Node n) {
    if (!containsSuspension(n)) {
      rewriteLeaf(n, LeafContext.TOP);
      return n;
    }
    switch (n.getToken()) {
      case AWAIT:
        {
          Node value = transformExpression(record.getChild(n, 0));
          emitTerminal(Terminal.suspend(value, n));
          return createSent(n);
        }
      case YIELD:
        {
          ImmutableList<Node> children = record.getChildren(n);
          Node value = children.isEmpty() ? null : transformExpression(children.get(0));
          if (n.hasFlag(Node.YIELD_STAR) && value != null) {
            emitTerminal(Terminal.delegate(value, n));
          } else {
            emitTerminal(Terminal.suspend(value, n));
          }
          return createSent(n);
        }
      case AND:
      case OR:
      case COALESCE:
        if (containsSuspension(record.getChild(n, 1))) {
          return transformLogical(n);
        }
        break;
      case HOOK:
        if (containsSuspension(record.getChild(n, 1))
            || containsSuspension(record.getChild(n, 2))) {
          return transformConditional(n);
        }
        break;
      case COMMA:
        emitExpressionStatement(record.getChild(n, 0));
        return transformExpression(record.getChild(n, 1));
      case CALL:
        return transformCall(n);
      case OBJECTLIT:
        return transformObjectLiteral(n);
      default:
        if (n.getToken().isAssign()) {
          return transformAssignment(n);
        }
        break;
    }
    return transformOperands(n, record.getChildren(n));
  }

  /**
   * Evaluates the operands of {@code n} in order. Operands before the last one that suspends are
   * stored in temporaries; later operands run after it, unchanged.
   */
  private Node transformOperands(Node n, List<Node> operands) {
    return record.withChildren(n, transformInOrder(operands));
  }

  private List<Node> transformInOrder(List<Node> operands) {
    int last = -1;
    for (int i = 0; i < operands.size(); i++) {
      if (containsSuspension(operands.get(i))) {
        last = i;
      }
    }
    List<Node> values = new ArrayList<>(operands.size());
    for (int i = 0; i < operands.size(); i++) {
      Node operand = operands.get(i);
      if (i < last) {
        values.add(stash(transformExpression(operand)));
      } else if (i == last) {
        values.add(transformExpression(operand));
      } else {
        rewriteLeaf(operand, LeafContext.TOP);
        values.add(operand);
      }
    }
    return values;
  }

  /** {@code a && await b} evaluates {@code b} only when {@code a} is truthy. */
  private Node transformLogical(Node n) {
    String result = newTemporary();
    emitAssignment(result, transformExpression(record.getChild(n, 0)));
    Label end = new Label();
    switch (n.getToken()) {
      case AND:
        emitConditionalJump(astFactory.createName(result), false, end, n);
        break;
      case OR:
        emitConditionalJump(astFactory.createName(result), true, end, n);
        break;
      default:
        emitConditionalJump(
            astFactory.createAnd(
                astFactory.createShne(astFactory.createName(result), astFactory.createNull()),
                astFactory.createShne(
                    astFactory.createName(result), astFactory.createUndefinedValue())),
            true,
            end,
            n);
        break;
    }
    emitAssignment(result, transformExpression(record.getChild(n, 1)));
    markLabel(end);
    return astFactory.createName(result);
  }

  private Node transformConditional(Node n) {
    String result = newTemporary();
    Label whenFalse = new Label();
    Label end = new Label();
    emitConditionalJump(transformExpression(record.getChild(n, 0)), false, whenFalse, n);
    emitAssignment(result, transformExpression(record.getChild(n, 1)));
    emitTerminal(Terminal.jump(end, null));
    markLabel(whenFalse);
    emitAssignment(result, transformExpression(record.getChild(n, 2)));
    markLabel(end);
    return astFactory.createName(result);
  }

  /**
   * A method call whose arguments suspend reads the method first, and calls it with the receiver
   * it was read from: {@code o.m(await x)} becomes {@code _b = o; _c = _b.m; return [4, x];
   * case 1: _c.call(_b, _a.sent())}.
   */
  private Node transformCall(Node n) {
    ImmutableList<Node> children = record.getChildren(n);
    Node callee = children.get(0);
    int last = -1;
    for (int i = 0; i < children.size(); i++) {
      if (containsSuspension(children.get(i))) {
        last = i;
      }
    }
    boolean isMethodCall =
        (callee.is(Token.GETPROP) || callee.is(Token.GETELEM))
            && !record.getChild(callee, 0).is(Token.SUPER);
    if (last <= 0 || !isMethodCall) {
      return transformOperands(n, children);
    }
    Node receiver = stash(transformExpression(record.getChild(callee, 0)));
    Node function;
    if (callee.is(Token.GETPROP)) {
      function =
          astFactory.createGetProp(record.deepCopy(receiver), callee.getNonNullString(), callee);
    } else {
      Node key = stash(transformExpression(record.getChild(callee, 1)));
      function = astFactory.createGetElem(record.deepCopy(receiver), key, callee);
    }
    Node functionRef = stashAlways(function);
    List<Node> args = new ArrayList<>();
    args.add(record.deepCopy(receiver));
    args.addAll(transformInOrder(children.subList(1, children.size())));
    return astFactory.createCall(astFactory.createGetProp(functionRef, "call"), args, n);
  }

  /**
   * Assignments evaluate the target's object and key before the value. A compound assignment
   * also reads the target's old value first.
   */
  private Node transformAssignment(Node n) {
    Node target = record.getChild(n, 0);
    Node value = record.getChild(n, 1);
    Token binaryOp = getBinaryOperator(n.getToken());
    if (n.getToken().isCompoundAssign() && binaryOp == null) {
      TranspilationUtil.markIncompletelyLowered(
          compiler, n, "A logical assignment containing a suspension point");
      return transformOperands(n, record.getChildren(n));
    }
    if (target.is(Token.NAME)) {
      if (binaryOp == null) {
        return record.withChildren(n, ImmutableList.of(target, transformExpression(value)));
      }
      Node oldValue = stashAlways(record.deepCopy(target));
      Node newValue = astFactory.createBinary(binaryOp, oldValue, transformExpression(value));
      return astFactory.createAssign(target, newValue, n);
    }
    if (!target.is(Token.GETPROP) && !target.is(Token.GETELEM)) {
      return transformOperands(n, record.getChildren(n));
    }
    Node object = stash(transformExpression(record.getChild(target, 0)));
    Node key =
        target.is(Token.GETELEM) ? stash(transformExpression(record.getChild(target, 1))) : null;
    Node newValue;
    if (binaryOp == null) {
      newValue = transformExpression(value);
    } else {
      Node oldValue = stashAlways(createAccess(target, object, key));
      newValue = astFactory.createBinary(binaryOp, oldValue, transformExpression(value));
    }
    return astFactory.createAssign(createAccess(target, object, key), newValue, n);
  }

  private Node createAccess(Node target, Node object, @Nullable Node key) {
    return key == null
        ? astFactory.createGetProp(record.deepCopy(object), target.getNonNullString(), target)
        : astFactory.createGetElem(record.deepCopy(object), record.deepCopy(key), target);
  }

  private static @Nullable Token getBinaryOperator(Token assignOp) {
    switch (assignOp) {
      case ASSIGN_BITOR:
        return Token.BITOR;
      case ASSIGN_BITXOR:
        return Token.BITXOR;
      case ASSIGN_BITAND:
        return Token.BITAND;
      case ASSIGN_LSH:
        return Token.LSH;
      case ASSIGN_RSH:
        return Token.RSH;
      case ASSIGN_URSH:
        return Token.URSH;
      case ASSIGN_ADD:
        return Token.ADD;
      case ASSIGN_SUB:
        return Token.SUB;
      case ASSIGN_MUL:
        return Token.MUL;
      case ASSIGN_DIV:
        return Token.DIV;
      case ASSIGN_MOD:
        return Token.MOD;
      case ASSIGN_EXPONENT:
        return Token.EXPONENT;
      default:
        return null;
    }
  }

  /**
   * Property values and computed keys are operands evaluated in order; methods and accessors are
   * not evaluated.
   */
  private Node transformObjectLiteral(Node n) {
    ImmutableList<Node> properties = record.getChildren(n);
    List<Node> operands = new ArrayList<>();
    List<int[]> positions = new ArrayList<>();
    for (int i = 0; i < properties.size(); i++) {
      Node property = properties.get(i);
      ImmutableList<Node> children = record.getChildren(property);
      switch (property.getToken()) {
        case STRING_KEY:
        case OBJECT_SPREAD:
          operands.add(children.get(0));
          positions.add(new int[] {i, 0});
          break;
        case COMPUTED_PROP:
          operands.add(children.get(0));
          positions.add(new int[] {i, 0});
          if (!children.get(1).is(Token.FUNCTION)) {
            operands.add(children.get(1));
            positions.add(new int[] {i, 1});
          }
          break;
        default:
          break;
      }
    }
    List<Node> values = transformInOrder(operands);
    List<List<Node>> newChildren = new ArrayList<>();
    for (Node property : properties) {
      newChildren.add(new ArrayList<>(record.getChildren(property)));
    }
    for (int i = 0; i < positions.size(); i++) {
      int[] position = positions.get(i);
      newChildren.get(position[0]).set(position[1], values.get(i));
    }
    List<Node> newProperties = new ArrayList<>();
    for (int i = 0; i < properties.size(); i++) {
      Node property = properties.get(i);
      newProperties.add(
          newChildren.get(i).equals(record.getChildren(property))
              ? property
              : record.withChildren(property, newChildren.get(i)));
    }
    return record.withChildren(n, newProperties);
  }
}
