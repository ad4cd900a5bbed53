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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites {@code let} and {@code const} to {@code var}. A block-scoped name that would collide
 * with another binding once hoisted to the function is renamed, along with its references.
 *
 * <p>Per-iteration bindings are not emulated: a loop variable captured by a closure is reported
 * as incompletely lowered.
 */
final class RewriteBlockScoping implements NodeTraversal.Callback, CompilerPass {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final AstFactory astFactory;
  private final UniqueNameGenerator nameGenerator;

  /** Names in effect, innermost scope first. A name maps to what it is emitted as. */
  private final Deque<Map<String, String>> scopes = new ArrayDeque<>();

  /** Names already declared in each enclosing function once blocks are flattened. */
  private final Deque<Set<String>> hoistedNames = new ArrayDeque<>();

  /** The nodes that pushed an entry onto {@link #scopes}, innermost first. */
  private final Deque<Node> scopeRoots = new ArrayDeque<>();

  RewriteBlockScoping(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.astFactory = compiler.createAstFactory();
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    if (compiler.needsLowering(LanguageMode.ECMASCRIPT_2015)) {
      NodeTraversal.traverse(compiler, root, this);
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case SCRIPT:
      case FUNCTION:
        enterFunction(n);
        break;
      case CATCH:
        enterScope(n, NodeUtil.getScopeDeclaredNames(record, n), /* blockScoped= */ false, t);
        break;
      case BLOCK:
        if (parent != null && !parent.is(Token.FUNCTION)) {
          enterScope(n, getBlockScopedNames(n), /* blockScoped= */ true, t);
        }
        break;
      case FOR:
      case FOR_IN:
      case FOR_OF:
        enterScope(n, getBlockScopedNames(n), /* blockScoped= */ true, t);
        break;
      case SWITCH:
        enterScope(n, getBlockScopedNames(n), /* blockScoped= */ true, t);
        break;
      default:
        break;
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case NAME:
        visitName(n);
        break;
      case LET:
      case CONST:
        visitDeclaration(t, n, parent);
        break;
      default:
        break;
    }
    if (!scopeRoots.isEmpty() && scopeRoots.peek().getId() == n.getId()) {
      scopeRoots.pop();
      scopes.pop();
      if (n.is(Token.FUNCTION) || n.is(Token.SCRIPT)) {
        hoistedNames.pop();
      }
    }
  }

  private void enterFunction(Node n) {
    Set<String> declared = NodeUtil.getScopeDeclaredNames(record, n);
    Map<String, String> scope = new HashMap<>();
    for (String name : declared) {
      scope.put(name, name);
    }
    scopes.push(scope);
    scopeRoots.push(n);
    hoistedNames.push(new HashSet<>(declared));
  }

  /**
   * Enters a scope declaring {@code names}. Block-scoped names that would collide with a binding
   * of the enclosing function, or with a reference outside the block, get a fresh name.
   */
  private void enterScope(Node n, Set<String> names, boolean blockScoped, NodeTraversal t) {
    Map<String, String> scope = new HashMap<>();
    Set<String> hoisted = hoistedNames.peek();
    for (String name : names) {
      String emittedName = name;
      if (blockScoped) {
        if (hoisted.contains(name) || isReferencedOutside(name, n, t.getClosestHoistScope())) {
          emittedName = nameGenerator.numberedName(name);
        }
        hoisted.add(emittedName);
      }
      scope.put(name, emittedName);
    }
    scopes.push(scope);
    scopeRoots.push(n);
  }

  /** Whether {@code name} occurs in {@code function} outside of {@code block}. */
  private boolean isReferencedOutside(String name, Node block, Node function) {
    return countNames(name, function) > countNames(name, block);
  }

  private int countNames(String name, Node n) {
    int count = n.is(Token.NAME) && name.equals(n.getString()) ? 1 : 0;
    for (Node child : record.getChildren(n)) {
      count += countNames(name, child);
    }
    return count;
  }

  /** The names a block, loop head or switch declares with {@code let} or {@code const}. */
  private Set<String> getBlockScopedNames(Node n) {
    List<Node> declarations = new ArrayList<>();
    switch (n.getToken()) {
      case BLOCK:
        declarations.addAll(record.getChildren(n));
        break;
      case FOR:
      case FOR_IN:
      case FOR_OF:
        declarations.add(record.getChild(n, 0));
        break;
      case SWITCH:
        for (Node clause : record.getChildren(n)) {
          if (clause.is(Token.CASE) || clause.is(Token.DEFAULT_CASE)) {
            declarations.addAll(record.getChildren(clause));
          }
        }
        break;
      default:
        break;
    }
    Set<String> names = new LinkedHashSet<>();
    for (Node declaration : declarations) {
      if (declaration.is(Token.LET) || declaration.is(Token.CONST)) {
        for (Node name : NodeUtil.getDeclaredNames(record, declaration)) {
          names.add(name.getNonNullString());
        }
      }
    }
    return names;
  }

  private void visitName(Node n) {
    String name = n.getString();
    if (name == null) {
      return;
    }
    for (Map<String, String> scope : scopes) {
      String emittedName = scope.get(name);
      if (emittedName != null) {
        if (!emittedName.equals(name)) {
          record.replace(
              n,
              record.newNode(
                  Token.NAME, record.getChildren(n), emittedName, 0, n.getFlags(), n));
        }
        return;
      }
    }
  }

  private void visitDeclaration(NodeTraversal t, Node n, @Nullable Node parent) {
    Node loop = getEnclosingLoop(t);
    boolean isLoopHead = parent != null && NodeUtil.isLoopStructure(parent);
    List<Node> declarators = new ArrayList<>();
    for (Node declarator : record.getChildren(n)) {
      if (loop != null
          && n.is(Token.LET)
          && !isLoopHead
          && declarator.is(Token.NAME)
          && record.getChildren(declarator).isEmpty()) {
        declarator =
            record.withChildren(declarator, ImmutableList.of(astFactory.createUndefinedValue()));
      }
      declarators.add(declarator);
    }
    if (loop != null) {
      for (Node name : NodeUtil.getDeclaredNames(record, n)) {
        if (isCapturedInLoop(name.getNonNullString(), loop)) {
          TranspilationUtil.markIncompletelyLowered(
              compiler, name, "A block-scoped loop variable captured by a closure");
        }
      }
    }
    record.replace(n, astFactory.createVar(declarators, n));
  }

  /** The innermost loop around the current node within its function, or null. */
  private static @Nullable Node getEnclosingLoop(NodeTraversal t) {
    for (Node ancestor : t.getAncestors()) {
      if (ancestor.is(Token.FUNCTION)) {
        return null;
      }
      if (NodeUtil.isLoopStructure(ancestor)) {
        return ancestor;
      }
    }
    return null;
  }

  private boolean isCapturedInLoop(String name, Node loop) {
    return NodeUtil.has(
        record,
        loop,
        n -> n.is(Token.FUNCTION) && countNames(name, n) > 0,
        n -> !n.is(Token.FUNCTION));
  }
}
