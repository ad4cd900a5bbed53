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

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.tsdown.ast.Node;
import com.google.tsdown.ast.Token;
import com.google.tsdown.parsing.ParserRunner;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Returns the source offset {@code n} maps to: its own start, or else the start of the nearest
   * node along its origin chain that was parsed. Returns -1 when there is none.
   */
  public static int getOriginalOffset(TransformRecord record, Node n) {
    Node original = getOriginalNode(record, n);
    return original == null ? -1 : original.getStart();
  }

  /** Returns the first node with a source position along {@code n}'s origin chain. */
  public static @Nullable Node getOriginalNode(TransformRecord record, Node n) {
    Node current = n;
    while (true) {
      if (current.hasPosition()) {
        return current;
      }
      if (current.getOrigin() == Node.NO_ORIGIN) {
        return null;
      }
      current = record.getNode(current.getOrigin());
    }
  }

  /**
   * Returns the identifier an emitted NAME should be recorded under in the names table: the
   * spelling of the NAME or THIS it stands in for.
   */
  public static @Nullable String getOriginalName(TransformRecord record, Node name) {
    Node original = getOriginalNode(record, name);
    if (original == null) {
      return null;
    }
    if (original.is(Token.NAME)) {
      return original.getString();
    }
    if (original.is(Token.THIS)) {
      return "this";
    }
    return null;
  }

  /** Whether nodes of this kind hold a list of statements. */
  static boolean isStatementBlock(Node n) {
    return n.is(Token.SCRIPT) || n.is(Token.BLOCK);
  }

  /** Whether {@code n} is a statement when it appears directly in a statement list. */
  static boolean isStatement(Token token) {
    switch (token) {
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case RETURN:
      case THROW:
      case BREAK:
      case CONTINUE:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case SWITCH:
      case TRY:
      case LABEL:
      case DEBUGGER:
      case BLOCK:
      case EXPORT:
      case EXPORT_ALL:
      case IMPORT:
        return true;
      default:
        return false;
    }
  }

  /** Whether the children of {@code parent} form a list of statements of variable length. */
  static boolean isStatementList(Node parent) {
    switch (parent.getToken()) {
      case SCRIPT:
      case BLOCK:
      case CASE:
      case DEFAULT_CASE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Emits {@code replacements} in place of {@code statement}. Where the parent holds a single
   * statement, such as the body of an {@code if}, they are wrapped in a block.
   */
  static void replaceWithStatements(
      AstFactory factory, Node parent, Node statement, List<Node> replacements) {
    TransformRecord record = factory.getRecord();
    if (!isStatementList(parent)) {
      record.replace(statement, factory.createBlock(replacements));
    } else if (replacements.isEmpty()) {
      record.elide(statement);
    } else {
      record.replace(statement, replacements.get(0));
      record.insertAfter(statement, replacements.subList(1, replacements.size()));
    }
  }

  /** Adds {@code statements} to a block or script, after its directives. */
  static void addStatementsAfterDirectives(
      TransformRecord record, Node block, List<Node> statements) {
    ImmutableList<Node> existing = record.getChildren(block);
    int directives = getDirectiveCount(record, existing);
    if (directives < existing.size()) {
      record.insertBefore(existing.get(directives), statements);
    } else {
      List<Node> newStatements = new ArrayList<>(existing);
      newStatements.addAll(statements);
      record.replace(block, record.withChildren(block, newStatements));
    }
  }

  static boolean isLoopStructure(Node n) {
    switch (n.getToken()) {
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case WHILE:
      case DO:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n}, a child of {@code parent}, is in a position that holds statements. */
  static boolean isStatementContext(Node parent, int index) {
    switch (parent.getToken()) {
      case SCRIPT:
      case BLOCK:
      case DEFAULT_CASE:
      case LABEL:
        return true;
      case CASE:
        return index > 0;
      case IF:
        return index > 0;
      case WHILE:
      case FOR_IN:
      case FOR_OF:
        return index == parent.getChildCount() - 1;
      case FOR:
        return index == 3;
      case DO:
        return index == 0;
      case EXPORT:
        return true;
      default:
        return false;
    }
  }

  public static boolean isNameDeclaration(Node n) {
    return n.getToken().isDeclaration();
  }

  /** Whether {@code n} is a function declared as a statement, not an expression. */
  static boolean isFunctionDeclaration(TransformRecord record, Node n, @Nullable Node parent) {
    return n.is(Token.FUNCTION)
        && !n.isArrow()
        && parent != null
        && (isStatementBlock(parent) || parent.is(Token.EXPORT) || parent.is(Token.LABEL))
        && record.getChild(n, 0).is(Token.NAME);
  }

  /** Whether {@code n} is a class declared as a statement, not an expression. */
  static boolean isClassDeclaration(TransformRecord record, Node n, @Nullable Node parent) {
    return n.is(Token.CLASS)
        && parent != null
        && (isStatementBlock(parent) || parent.is(Token.EXPORT))
        && record.getChild(n, 0).is(Token.NAME);
  }

  static Node getFunctionName(TransformRecord record, Node function) {
    return record.getChild(function, 0);
  }

  static Node getFunctionParameters(TransformRecord record, Node function) {
    return record.getChild(function, 1);
  }

  static Node getFunctionBody(TransformRecord record, Node function) {
    return record.getChild(function, 2);
  }

  /** Whether {@code n} is one of the nodes a class body holds. */
  static boolean isClassMember(Node n) {
    switch (n.getToken()) {
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
      case MEMBER_FIELD_DEF:
      case COMPUTED_PROP:
        return true;
      default:
        return false;
    }
  }

  /** Whether a class member node is a field rather than a method or accessor. */
  static boolean isField(Node member) {
    return member.is(Token.MEMBER_FIELD_DEF)
        || (member.is(Token.COMPUTED_PROP) && member.hasFlag(Node.COMPUTED_FIELD));
  }

  /** Whether the expression has no side effects and can be evaluated twice with the same result. */
  static boolean isImmutableValue(Node n) {
    switch (n.getToken()) {
      case NUMBER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether the expression can be evaluated again without side effects, and without its value
   * changing in between as long as no assignment intervenes.
   */
  static boolean isSimpleOperand(Node n) {
    return n.is(Token.NAME) || n.is(Token.THIS) || isImmutableValue(n);
  }

  /** Whether {@code stmt} is a directive such as {@code "use strict"}. */
  static boolean isDirective(TransformRecord record, Node stmt) {
    return stmt.is(Token.EXPR_RESULT)
        && stmt.hasPosition()
        && record.getChild(stmt, 0).is(Token.STRINGLIT)
        && record.getChild(stmt, 0).hasPosition();
  }

  /** Returns the number of leading directives in a statement list. */
  static int getDirectiveCount(TransformRecord record, List<Node> statements) {
    int count = 0;
    while (count < statements.size() && isDirective(record, statements.get(count))) {
      count++;
    }
    return count;
  }

  /**
   * Whether the effective subtree of {@code n} contains a node matching {@code pred}, descending
   * only into children whose parent matches {@code traverseChildrenPred}.
   */
  static boolean has(
      TransformRecord record,
      Node n,
      Predicate<Node> pred,
      Predicate<Node> traverseChildrenPred) {
    if (pred.apply(n)) {
      return true;
    }
    if (!traverseChildrenPred.apply(n)) {
      return false;
    }
    for (Node child : record.getChildren(n)) {
      if (has(record, child, pred, traverseChildrenPred)) {
        return true;
      }
    }
    return false;
  }

  /** Matches everything but non-arrow functions: the nodes that share {@code this}. */
  static final Predicate<Node> MATCH_NOT_THIS_BINDING =
      n -> !n.is(Token.FUNCTION) || n.isArrow();

  /** Matches everything but functions. */
  static final Predicate<Node> MATCH_NOT_FUNCTION = n -> !n.is(Token.FUNCTION);

  /**
   * Whether {@code n} refers to {@code this} of the function it is in, looking into arrow
   * functions but not into other functions.
   */
  static boolean referencesThis(TransformRecord record, Node n) {
    return has(record, n, node -> node.is(Token.THIS), MATCH_NOT_THIS_BINDING);
  }

  /** Whether {@code n} refers to {@code arguments} of its enclosing non-arrow function. */
  static boolean referencesArguments(TransformRecord record, Node n) {
    return has(
        record,
        n,
        node -> node.is(Token.NAME) && "arguments".equals(node.getString()),
        MATCH_NOT_THIS_BINDING);
  }

  /** Appends the NAME nodes a binding target declares or assigns, in source order. */
  static void collectTargetNames(TransformRecord record, Node target, List<Node> names) {
    switch (target.getToken()) {
      case NAME:
        names.add(target);
        break;
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        for (Node child : record.getChildren(target)) {
          collectTargetNames(record, child, names);
        }
        break;
      case DEFAULT_VALUE:
      case ITER_REST:
      case OBJECT_REST:
      case STRING_KEY:
        collectTargetNames(record, record.getChild(target, 0), names);
        break;
      case COMPUTED_PROP:
        collectTargetNames(record, record.getChild(target, 1), names);
        break;
      case DESTRUCTURING_LHS:
        collectTargetNames(record, record.getChild(target, 0), names);
        break;
      default:
        break;
    }
  }

  /** Returns the NAME nodes declared by a VAR, LET or CONST. */
  static ImmutableList<Node> getDeclaredNames(TransformRecord record, Node declaration) {
    List<Node> names = new ArrayList<>();
    for (Node declarator : record.getChildren(declaration)) {
      collectTargetNames(record, declarator, names);
    }
    return ImmutableList.copyOf(names);
  }

  /**
   * Returns the names a scope-creating node declares: a function's parameters, its name when it
   * is an expression, and every {@code var} in its body; the lexical declarations directly in a
   * block or script; a loop head's declaration; a catch binding.
   */
  static Set<String> getScopeDeclaredNames(TransformRecord record, Node scopeRoot) {
    Set<String> names = new LinkedHashSet<>();
    List<Node> targets = new ArrayList<>();
    switch (scopeRoot.getToken()) {
      case FUNCTION:
        {
          Node name = getFunctionName(record, scopeRoot);
          if (name.is(Token.NAME)) {
            names.add(name.getNonNullString());
          }
          for (Node param : record.getChildren(getFunctionParameters(record, scopeRoot))) {
            collectTargetNames(record, param, targets);
          }
          Node body = getFunctionBody(record, scopeRoot);
          if (body.is(Token.BLOCK)) {
            collectHoistedNames(record, body, targets);
            collectLexicalNames(record, body, targets, names);
          }
          break;
        }
      case SCRIPT:
      case BLOCK:
        collectLexicalNames(record, scopeRoot, targets, names);
        break;
      case FOR:
      case FOR_IN:
      case FOR_OF:
        {
          Node init = record.getChild(scopeRoot, 0);
          if (isNameDeclaration(init)) {
            targets.addAll(getDeclaredNames(record, init));
          }
          break;
        }
      case CATCH:
        collectTargetNames(record, record.getChild(scopeRoot, 0), targets);
        break;
      default:
        break;
    }
    for (Node target : targets) {
      names.add(target.getNonNullString());
    }
    return names;
  }

  private static void collectLexicalNames(
      TransformRecord record, Node block, List<Node> targets, Set<String> names) {
    for (Node statement : record.getChildren(block)) {
      Node declaration = statement;
      if (statement.is(Token.EXPORT) && !record.getChildren(statement).isEmpty()) {
        declaration = record.getChild(statement, 0);
      }
      if (declaration.is(Token.LET) || declaration.is(Token.CONST)) {
        targets.addAll(getDeclaredNames(record, declaration));
      } else if (declaration.is(Token.FUNCTION) || declaration.is(Token.CLASS)) {
        Node name = record.getChild(declaration, 0);
        if (name.is(Token.NAME)) {
          names.add(name.getNonNullString());
        }
      }
    }
  }

  /** Collects the targets of {@code var} declarations, not looking into nested functions. */
  private static void collectHoistedNames(TransformRecord record, Node n, List<Node> targets) {
    for (Node child : record.getChildren(n)) {
      if (child.is(Token.FUNCTION) || child.is(Token.CLASS)) {
        continue;
      }
      if (child.is(Token.VAR)) {
        targets.addAll(getDeclaredNames(record, child));
      }
      collectHoistedNames(record, child, targets);
    }
  }

  /** Returns the initializer of a NAME declarator or DESTRUCTURING_LHS, or null. */
  static @Nullable Node getDeclaratorValue(TransformRecord record, Node declarator) {
    ImmutableList<Node> children = record.getChildren(declarator);
    if (declarator.is(Token.NAME)) {
      return children.isEmpty() ? null : children.get(0);
    }
    return children.size() > 1 ? children.get(1) : null;
  }

  static boolean isPattern(Node n) {
    return n.is(Token.ARRAY_PATTERN) || n.is(Token.OBJECT_PATTERN);
  }

  static boolean isEmptyBlock(TransformRecord record, Node block) {
    return record.getChildren(block).isEmpty();
  }

  /** Whether {@code n} is a string that can be printed as an identifier-named property. */
  static boolean isValidPropertyName(String name) {
    return ParserRunner.isIdentifierName(name);
  }
}
