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
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes of the effective tree, and facilitates the
 * lowering passes that record changes into the {@link TransformRecord}.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final TransformRecord record;
  private final Callback callback;

  /** Strict ancestors of the node being visited, innermost first. */
  private final Deque<Node> ancestors = new ArrayDeque<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its
     * children should be traversed.
     *
     * <p>Implementations can record changes for {@code n} or its descendants. Children are read
     * after this method returns, so replacing a child here means the replacement is traversed.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The effective parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). Siblings are always visited left-to-right,
     * in the order they had when the parent was entered.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /** Abstract callback that does not descend into function bodies other than the root's. */
  public abstract static class AbstractShallowCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return parent == null || !n.is(Token.FUNCTION) || n == t.root;
    }
  }

  private @Nullable Node root;

  private NodeTraversal(AbstractCompiler compiler, Callback callback) {
    this.compiler = compiler;
    this.record = compiler.getRecord();
    this.callback = callback;
  }

  /** Traverses the effective tree under {@code root}. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    NodeTraversal t = new NodeTraversal(compiler, cb);
    t.root = root;
    t.traverseBranch(root, null);
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    ImmutableList<Node> children = record.getChildren(n);
    ancestors.push(n);
    for (Node child : children) {
      traverseBranch(child, n);
    }
    ancestors.pop();
    callback.visit(this, n, parent);
  }

  public AbstractCompiler getCompiler() {
    return compiler;
  }

  public TransformRecord getRecord() {
    return record;
  }

  /** The strict ancestors of the current node, innermost first. */
  public Iterable<Node> getAncestors() {
    return ancestors;
  }

  /** Returns the innermost enclosing FUNCTION, or null at top level. */
  public @Nullable Node getEnclosingFunction() {
    for (Node ancestor : ancestors) {
      if (ancestor.is(Token.FUNCTION)) {
        return ancestor;
      }
    }
    return null;
  }

  /** Returns the innermost enclosing non-arrow FUNCTION, or null when there is none. */
  public @Nullable Node getEnclosingNonArrowFunction() {
    for (Node ancestor : ancestors) {
      if (ancestor.is(Token.FUNCTION) && !ancestor.isArrow()) {
        return ancestor;
      }
    }
    return null;
  }

  /** The FUNCTION or SCRIPT whose {@code var} declarations the current node would belong to. */
  public Node getClosestHoistScope() {
    for (Node ancestor : ancestors) {
      if (ancestor.is(Token.FUNCTION) || ancestor.is(Token.SCRIPT)) {
        return ancestor;
      }
    }
    throw new IllegalStateException("no enclosing scope");
  }

  /** Whether the current node is nested in a function (not counting the node itself). */
  public boolean inFunction() {
    return getEnclosingFunction() != null;
  }

  /** Reports a diagnostic at {@code n}. */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    compiler.report(n, diagnosticType, arguments);
  }
}
